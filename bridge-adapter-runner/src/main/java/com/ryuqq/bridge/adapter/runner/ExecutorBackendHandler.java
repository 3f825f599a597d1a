package com.ryuqq.bridge.adapter.runner;

import com.ryuqq.bridge.core.model.Request;
import com.ryuqq.bridge.core.model.Result;
import com.ryuqq.bridge.core.spi.BackendHandler;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicLong;
import java.util.function.Function;

/**
 * 블로킹 함수를 {@link BackendHandler}로 변환하는 어댑터.
 *
 * <p>처리 함수를 {@link ExecutorService}에서 실행하여, 느린 백엔드 작업이
 * Bridge 호출 스레드를 블로킹하지 않도록 합니다.</p>
 *
 * <p><strong>상태:</strong> {@link #shutdown()} 전에는 {@value #STATUS_READY},
 * 이후에는 {@value #STATUS_STOPPED}. 종료 후 요청은 {@link RejectedExecutionException}으로 실패합니다.</p>
 *
 * <p><strong>타임아웃/취소:</strong> 반환된 future가 함수 완료 전에 외부에서 완료되면
 * (Bridge의 타임아웃, 호출자의 취소) 실행 중인 작업을 인터럽트하여 풀 스레드를 회수합니다.
 * 인터럽트에 반응하지 않는 함수는 끝날 때까지 스레드를 점유합니다. 이렇게 버려진 호출 수는
 * {@code abandoned} 지표로 집계됩니다.</p>
 *
 * <p><strong>사용 예시:</strong></p>
 * <pre>{@code
 * ExecutorBackendHandler backend = new ExecutorBackendHandler(
 *     request -> Result.success(answer(request.content()), 0.9, Duration.ofMillis(40), List.of("backend")),
 *     4
 * );
 * Bridge bridge = new ResilientBridge(backend, new BridgeConfig());
 * }</pre>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public final class ExecutorBackendHandler implements BackendHandler {

    private static final Logger log = LoggerFactory.getLogger(ExecutorBackendHandler.class);

    public static final String STATUS_READY = "ready";
    public static final String STATUS_STOPPED = "stopped";

    private static final long SHUTDOWN_TIMEOUT_SECONDS = 60;

    private final Function<Request, Result> function;
    private final ExecutorService executor;
    private final AtomicLong invocations = new AtomicLong();
    private final AtomicLong failures = new AtomicLong();
    private final AtomicLong abandoned = new AtomicLong();

    /**
     * 생성자 (고정 크기 스레드 풀 생성).
     *
     * @param function 요청 처리 함수
     * @param threads 스레드 수 (양수여야 함)
     * @throws IllegalArgumentException function이 null이거나 threads가 양수가 아닌 경우
     */
    public ExecutorBackendHandler(Function<Request, Result> function, int threads) {
        this(function, newPool(threads));
    }

    /**
     * 생성자 (ExecutorService 주입).
     *
     * @param function 요청 처리 함수
     * @param executor 실행할 ExecutorService
     * @throws IllegalArgumentException 인자가 null인 경우
     */
    public ExecutorBackendHandler(Function<Request, Result> function, ExecutorService executor) {
        if (function == null) {
            throw new IllegalArgumentException("function cannot be null");
        }
        if (executor == null) {
            throw new IllegalArgumentException("executor cannot be null");
        }
        this.function = function;
        this.executor = executor;
    }

    @Override
    public CompletableFuture<Result> handle(Request request) {
        invocations.incrementAndGet();
        CompletableFuture<Result> result = new CompletableFuture<>();
        AtomicBoolean finished = new AtomicBoolean();
        Future<?> task;
        try {
            task = executor.submit(() -> run(request, result, finished));
        } catch (RejectedExecutionException e) {
            failures.incrementAndGet();
            return CompletableFuture.failedFuture(e);
        }
        result.whenComplete((value, error) -> {
            if (error != null && !finished.get()) {
                abandoned.incrementAndGet();
                task.cancel(true);
            }
        });
        return result;
    }

    @Override
    public String getStatus() {
        return executor.isShutdown() ? STATUS_STOPPED : STATUS_READY;
    }

    @Override
    public Map<String, Object> getMetrics() {
        Map<String, Object> metrics = new LinkedHashMap<>();
        metrics.put("invocations", invocations.get());
        metrics.put("failures", failures.get());
        metrics.put("abandoned", abandoned.get());
        return metrics;
    }

    /**
     * 백엔드 종료 (리소스 정리).
     *
     * <p>ExecutorService를 graceful shutdown하여 진행 중인 작업이 완료되도록
     * 최대 60초 대기하고, 그래도 남아 있으면 강제 종료합니다.</p>
     *
     * @throws InterruptedException shutdown 대기 중 인터럽트 발생 시
     */
    public void shutdown() throws InterruptedException {
        executor.shutdown();
        if (!executor.awaitTermination(SHUTDOWN_TIMEOUT_SECONDS, TimeUnit.SECONDS)) {
            log.warn("Backend executor did not terminate within {}s, forcing shutdown", SHUTDOWN_TIMEOUT_SECONDS);
            executor.shutdownNow();
        }
    }

    // 실패 집계와 finished 표시는 future 완료 전에 수행
    private void run(Request request, CompletableFuture<Result> result, AtomicBoolean finished) {
        Result value;
        try {
            value = function.apply(request);
        } catch (RuntimeException | Error e) {
            failures.incrementAndGet();
            finished.set(true);
            result.completeExceptionally(e);
            return;
        }
        if (value == null || !value.success()) {
            failures.incrementAndGet();
        }
        finished.set(true);
        result.complete(value);
    }

    private static ExecutorService newPool(int threads) {
        if (threads <= 0) {
            throw new IllegalArgumentException("threads must be positive (current: " + threads + ")");
        }
        return Executors.newFixedThreadPool(threads);
    }
}
