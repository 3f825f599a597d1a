package com.ryuqq.bridge.testkit.contract;

import com.ryuqq.bridge.core.failure.FailureType;
import com.ryuqq.bridge.core.model.Request;
import com.ryuqq.bridge.core.model.Result;
import com.ryuqq.bridge.core.spi.BackendHandler;

import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.Queue;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentLinkedQueue;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Function;

/**
 * Backend handler whose next responses are scripted by the test.
 *
 * <p>Scripted steps are consumed in order, one per invocation. Once the script is
 * empty the handler falls back to its default response, which echoes the request
 * content with confidence {@value #DEFAULT_CONFIDENCE}.</p>
 *
 * <p><strong>Usage:</strong></p>
 * <pre>
 * backend.failNext(3);          // three exceptional completions
 * backend.hangNext(1);          // one future that never completes on its own
 * backend.reportFailureNext(1); // one result with success = false
 * </pre>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public final class ScriptedBackendHandler implements BackendHandler {

    public static final double DEFAULT_CONFIDENCE = 0.9;
    public static final String ECHO_PREFIX = "echo: ";

    private final Queue<Function<Request, CompletableFuture<Result>>> script = new ConcurrentLinkedQueue<>();
    private final List<Request> invocations = new CopyOnWriteArrayList<>();
    private final List<CompletableFuture<Result>> hung = new CopyOnWriteArrayList<>();
    private final AtomicInteger failures = new AtomicInteger();

    private volatile Function<Request, Result> defaultResponse = request -> Result.success(
        ECHO_PREFIX + request.content(), DEFAULT_CONFIDENCE, Duration.ofMillis(1), List.of("backend")
    );

    @Override
    public CompletableFuture<Result> handle(Request request) {
        invocations.add(request);
        Function<Request, CompletableFuture<Result>> step = script.poll();
        if (step != null) {
            return step.apply(request);
        }
        return CompletableFuture.completedFuture(defaultResponse.apply(request));
    }

    @Override
    public Map<String, Object> getMetrics() {
        return Map.of("invocations", invocations.size(), "failures", failures.get());
    }

    /**
     * Replaces the response used when the script is empty.
     *
     * @param response maps a request to its result
     */
    public void respondWith(Function<Request, Result> response) {
        if (response == null) {
            throw new IllegalArgumentException("response cannot be null");
        }
        this.defaultResponse = response;
    }

    /**
     * Scripts the next invocations to complete exceptionally.
     *
     * @param times number of invocations
     */
    public void failNext(int times) {
        for (int i = 0; i < times; i++) {
            script.add(request -> {
                failures.incrementAndGet();
                return CompletableFuture.failedFuture(new IllegalStateException("scripted backend failure"));
            });
        }
    }

    /**
     * Scripts the next invocations to return a result with {@code success = false}.
     *
     * @param times number of invocations
     */
    public void reportFailureNext(int times) {
        for (int i = 0; i < times; i++) {
            script.add(request -> {
                failures.incrementAndGet();
                return CompletableFuture.completedFuture(
                    Result.failure(FailureType.BACKEND_FAILURE, "scripted failure result", Duration.ZERO, List.of())
                );
            });
        }
    }

    /**
     * Scripts the next invocations to return futures that never complete by themselves.
     *
     * @param times number of invocations
     * @see #releaseHung()
     */
    public void hangNext(int times) {
        for (int i = 0; i < times; i++) {
            script.add(request -> {
                CompletableFuture<Result> future = new CompletableFuture<>();
                hung.add(future);
                return future;
            });
        }
    }

    /**
     * Completes every hung future with the default response.
     *
     * @return number of futures completed by this call
     */
    public int releaseHung() {
        int released = 0;
        for (CompletableFuture<Result> future : hung) {
            if (future.complete(defaultResponse.apply(Request.of("released")))) {
                released++;
            }
        }
        hung.clear();
        return released;
    }

    public int invocationCount() {
        return invocations.size();
    }

    /**
     * Requests received so far, in arrival order.
     *
     * @return an immutable snapshot
     */
    public List<Request> invocations() {
        return List.copyOf(invocations);
    }
}
