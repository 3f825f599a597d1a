package com.ryuqq.bridge.adapter.runner;

import com.ryuqq.bridge.adapter.inmemory.cache.TtlResultCache;
import com.ryuqq.bridge.adapter.protection.ConsecutiveFailureCircuitBreaker;
import com.ryuqq.bridge.adapter.protection.FixedTimeoutPolicy;
import com.ryuqq.bridge.adapter.protection.TokenBucketRateLimiter;
import com.ryuqq.bridge.application.bridge.Bridge;
import com.ryuqq.bridge.application.health.HealthReporter;
import com.ryuqq.bridge.core.cache.ResultCache;
import com.ryuqq.bridge.core.failure.BackendFailureException;
import com.ryuqq.bridge.core.failure.CircuitBreakerOpenException;
import com.ryuqq.bridge.core.failure.FailureType;
import com.ryuqq.bridge.core.model.Fingerprint;
import com.ryuqq.bridge.core.model.Request;
import com.ryuqq.bridge.core.model.Result;
import com.ryuqq.bridge.core.protection.CircuitBreaker;
import com.ryuqq.bridge.core.protection.RateLimiter;
import com.ryuqq.bridge.core.protection.TimeoutPolicy;
import com.ryuqq.bridge.core.protection.noop.NoOpTimeoutPolicy;
import com.ryuqq.bridge.core.spi.BackendHandler;
import com.ryuqq.bridge.core.telemetry.LoggingTelemetrySink;
import com.ryuqq.bridge.core.telemetry.TelemetryRecorder;
import com.ryuqq.bridge.core.telemetry.TelemetrySink;
import com.ryuqq.bridge.core.trace.LoggingTraceSink;
import com.ryuqq.bridge.core.trace.Trace;
import com.ryuqq.bridge.core.trace.TraceOutcome;
import com.ryuqq.bridge.core.trace.TraceSink;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Resilient Bridge 구현체.
 *
 * <p>백엔드 앞단에서 요청마다 다음 단계를 순서대로 수행하며, 앞 단계에서 결론이 나면 즉시 반환합니다.</p>
 *
 * <p><strong>동작 방식:</strong></p>
 * <ol>
 *   <li>Admission: 토큰이 없으면 ADMISSION_REJECTED (백엔드/Circuit Breaker 미관여)</li>
 *   <li>Cache: 유효한 캐시 결과가 있으면 그대로 반환</li>
 *   <li>Circuit Breaker + Backend: 타임아웃을 적용해 백엔드 호출.
 *       거부 시 BREAKER_OPEN, 타임아웃/취소 시 BACKEND_TIMEOUT, 그 외 실패는 BACKEND_FAILURE</li>
 *   <li>Cache 저장 → Telemetry 기록 → 백엔드 결과 반환</li>
 * </ol>
 *
 * <p>요청마다 {@link Trace}를 시작하고, 결과가 정해지면 같은 Trace를 {@link TraceOutcome}과 함께
 * 종료합니다.</p>
 *
 * <p>모든 경로에서 {@link TelemetryRecorder#recordRequest(boolean, Duration)}가 호출되며,
 * 반환 future는 예외로 완료되지 않습니다. 예상하지 못한 내부 예외는 INTERNAL_ERROR 결과가 됩니다.</p>
 *
 * <p><strong>동시성:</strong> 각 구성 요소는 자체 락으로 보호되며, 이 클래스는 한 번에
 * 하나의 구성 요소만 호출합니다. 백엔드 future를 기다리는 동안 어떤 락도 보유하지 않습니다.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public final class ResilientBridge implements Bridge {

    private static final Logger log = LoggerFactory.getLogger(ResilientBridge.class);

    static final String STAGE_ADMISSION = "admission";
    static final String STAGE_CACHE = "cache";
    static final String STAGE_CIRCUIT_BREAKER = "circuit-breaker";
    static final String STAGE_BACKEND = "backend";

    private static final List<String> ADMISSION_STAGES = List.of(STAGE_ADMISSION);
    private static final List<String> BREAKER_STAGES = List.of(STAGE_ADMISSION, STAGE_CACHE, STAGE_CIRCUIT_BREAKER);
    private static final List<String> BACKEND_STAGES =
        List.of(STAGE_ADMISSION, STAGE_CACHE, STAGE_CIRCUIT_BREAKER, STAGE_BACKEND);

    private static final int PREVIEW_LENGTH = 20;

    private final BackendHandler backend;
    private final RateLimiter rateLimiter;
    private final CircuitBreaker circuitBreaker;
    private final ResultCache cache;
    private final TelemetryRecorder telemetry;
    private final TraceSink traceSink;
    private final TimeoutPolicy timeoutPolicy;
    private final CacheScope cacheScope;
    private final Clock clock;
    private final BridgeHealthReporter reporter;

    /**
     * 생성자 (기본 구성 요소, 로그 Sink, 시스템 시계).
     *
     * @param backend 보호할 백엔드
     * @param config Bridge 설정
     * @throws IllegalArgumentException 인자가 null인 경우
     */
    public ResilientBridge(BackendHandler backend, BridgeConfig config) {
        this(backend, config, new LoggingTelemetrySink(), Clock.systemUTC());
    }

    /**
     * 생성자 (기본 구성 요소, Sink/시계 지정).
     *
     * @param backend 보호할 백엔드
     * @param config Bridge 설정
     * @param sink 텔레메트리 전달 대상
     * @param clock 시간 기준 시계
     * @throws IllegalArgumentException 인자가 null인 경우
     */
    public ResilientBridge(BackendHandler backend, BridgeConfig config, TelemetrySink sink, Clock clock) {
        this(backend, config, sink, new LoggingTraceSink(), clock);
    }

    /**
     * 생성자 (기본 구성 요소, Sink/Trace Sink/시계 지정).
     *
     * @param backend 보호할 백엔드
     * @param config Bridge 설정
     * @param sink 텔레메트리 전달 대상
     * @param traceSink 요청 추적 전달 대상
     * @param clock 시간 기준 시계
     * @throws IllegalArgumentException 인자가 null인 경우
     */
    public ResilientBridge(
        BackendHandler backend,
        BridgeConfig config,
        TelemetrySink sink,
        TraceSink traceSink,
        Clock clock
    ) {
        this(
            backend,
            new TokenBucketRateLimiter(requireConfig(config).rateLimiter(), clock),
            new ConsecutiveFailureCircuitBreaker(config.circuitBreaker(), clock),
            new TtlResultCache(config.cache(), clock),
            new TelemetryRecorder(config.telemetry(), sink, clock),
            config.backendTimeoutMs() > 0 ? new FixedTimeoutPolicy(config.backendTimeoutMs()) : new NoOpTimeoutPolicy(),
            config.cacheScope(),
            traceSink,
            clock
        );
    }

    /**
     * 생성자 (모든 구성 요소 주입).
     *
     * @param backend 보호할 백엔드
     * @param rateLimiter Admission Control
     * @param circuitBreaker Circuit Breaker
     * @param cache 결과 캐시
     * @param telemetry 텔레메트리 기록기
     * @param timeoutPolicy 백엔드 타임아웃 정책
     * @param cacheScope 캐시 키 범위
     * @param clock 시간 기준 시계
     * @throws IllegalArgumentException 인자가 null인 경우
     */
    public ResilientBridge(
        BackendHandler backend,
        RateLimiter rateLimiter,
        CircuitBreaker circuitBreaker,
        ResultCache cache,
        TelemetryRecorder telemetry,
        TimeoutPolicy timeoutPolicy,
        CacheScope cacheScope,
        Clock clock
    ) {
        this(backend, rateLimiter, circuitBreaker, cache, telemetry, timeoutPolicy, cacheScope, new LoggingTraceSink(), clock);
    }

    /**
     * 생성자 (모든 구성 요소와 Trace Sink 주입).
     *
     * @param backend 보호할 백엔드
     * @param rateLimiter Admission Control
     * @param circuitBreaker Circuit Breaker
     * @param cache 결과 캐시
     * @param telemetry 텔레메트리 기록기
     * @param timeoutPolicy 백엔드 타임아웃 정책
     * @param cacheScope 캐시 키 범위
     * @param traceSink 요청 추적 전달 대상
     * @param clock 시간 기준 시계
     * @throws IllegalArgumentException 인자가 null인 경우
     */
    public ResilientBridge(
        BackendHandler backend,
        RateLimiter rateLimiter,
        CircuitBreaker circuitBreaker,
        ResultCache cache,
        TelemetryRecorder telemetry,
        TimeoutPolicy timeoutPolicy,
        CacheScope cacheScope,
        TraceSink traceSink,
        Clock clock
    ) {
        if (traceSink == null) {
            throw new IllegalArgumentException("traceSink cannot be null");
        }
        if (timeoutPolicy == null) {
            throw new IllegalArgumentException("timeoutPolicy cannot be null");
        }
        if (cacheScope == null) {
            throw new IllegalArgumentException("cacheScope cannot be null");
        }
        // 나머지 인자는 BridgeHealthReporter에서 검증
        this.reporter = new BridgeHealthReporter(backend, rateLimiter, circuitBreaker, cache, telemetry, clock);
        this.backend = backend;
        this.rateLimiter = rateLimiter;
        this.circuitBreaker = circuitBreaker;
        this.cache = cache;
        this.telemetry = telemetry;
        this.traceSink = traceSink;
        this.timeoutPolicy = timeoutPolicy;
        this.cacheScope = cacheScope;
        this.clock = clock;
    }

    @Override
    public CompletableFuture<Result> execute(Request request) {
        if (request == null) {
            throw new IllegalArgumentException("request cannot be null");
        }
        Instant startedAt = clock.instant();
        Trace trace = Trace.start(request.fingerprint(), request.requesterId(), startedAt);
        startTrace(trace);

        CompletableFuture<Result> future;
        try {
            future = process(request, startedAt)
                .exceptionally(error -> internalError(request, startedAt, error));
        } catch (RuntimeException e) {
            future = CompletableFuture.completedFuture(internalError(request, startedAt, e));
        }
        return future.thenApply(result -> endTrace(trace, result));
    }

    /**
     * Health/Metrics 조회기.
     *
     * @return 읽기 전용 HealthReporter
     */
    public HealthReporter reporter() {
        return reporter;
    }

    /**
     * 만료된 캐시 항목 일괄 제거 (주기적 스윕용).
     *
     * @return 제거된 항목 수
     */
    public int evictExpiredCache() {
        int removed = cache.evictExpired();
        if (removed > 0) {
            log.debug("Evicted {} expired cache entries", removed);
        }
        return removed;
    }

    /**
     * 버퍼에 남은 텔레메트리를 즉시 전달.
     *
     * @return 전달된 샘플 수
     */
    public int flushTelemetry() {
        return telemetry.flush();
    }

    private CompletableFuture<Result> process(Request request, Instant startedAt) {
        // 1. Admission
        if (!rateLimiter.tryAcquire()) {
            log.warn("Rate limit exceeded for requester {}", request.requesterId());
            telemetry.record("request_error", 1, Map.of("reason", FailureType.ADMISSION_REJECTED.getCode()));
            Duration elapsed = elapsedSince(startedAt);
            telemetry.recordRequest(false, elapsed);
            return CompletableFuture.completedFuture(
                Result.failure(FailureType.ADMISSION_REJECTED, elapsed, ADMISSION_STAGES)
            );
        }

        // 2. Cache
        Fingerprint cacheKey = cacheScope.keyFor(request);
        Optional<Result> cached = cache.get(cacheKey);
        if (cached.isPresent()) {
            log.debug("Cache hit for {}", cacheKey);
            telemetry.record("cache_hit", 1);
            telemetry.recordRequest(cached.get().success(), elapsedSince(startedAt));
            return CompletableFuture.completedFuture(cached.get());
        }

        // 3. Circuit Breaker + Backend
        return circuitBreaker.call(() -> invokeBackend(request))
            .handle((result, error) -> error == null
                ? onBackendSuccess(cacheKey, result, startedAt)
                : onBackendFailure(request, error, startedAt));
    }

    private CompletableFuture<Result> invokeBackend(Request request) {
        CompletableFuture<Result> future = backend.handle(request);
        if (future == null) {
            throw new IllegalStateException("backend returned null future");
        }
        long timeoutMs = timeoutPolicy.getTimeoutMs();
        if (timeoutMs > 0) {
            future = future.orTimeout(timeoutMs, TimeUnit.MILLISECONDS);
        }
        return future.thenApply(result -> {
            if (result == null) {
                throw new IllegalStateException("backend completed with null result");
            }
            if (!result.success()) {
                throw new BackendFailureException(result);
            }
            return result;
        });
    }

    // 4. Cache 저장 → Telemetry
    private Result onBackendSuccess(Fingerprint cacheKey, Result result, Instant startedAt) {
        cache.put(cacheKey, result);

        Duration elapsed = elapsedSince(startedAt);
        telemetry.record("request_success", 1);
        telemetry.record("response_time", toMillis(elapsed));
        telemetry.record("confidence", result.confidence(), Map.of("preview", preview(result.content())));
        telemetry.recordRequest(true, elapsed);
        return result;
    }

    private Result onBackendFailure(Request request, Throwable error, Instant startedAt) {
        Throwable cause = CircuitBreaker.unwrap(error);
        Duration elapsed = elapsedSince(startedAt);

        FailureType failureType;
        List<String> stages;
        if (cause instanceof CircuitBreakerOpenException) {
            failureType = FailureType.BREAKER_OPEN;
            stages = BREAKER_STAGES;
            log.debug("Circuit breaker rejected request from {}", request.requesterId());
        } else if (cause instanceof TimeoutException || cause instanceof CancellationException) {
            failureType = FailureType.BACKEND_TIMEOUT;
            stages = BACKEND_STAGES;
            timeoutPolicy.recordTimeout(elapsed.toMillis());
        } else {
            failureType = FailureType.BACKEND_FAILURE;
            stages = BACKEND_STAGES;
            log.warn("Backend failed for request {}: {}", request.fingerprint(), describe(cause));
        }

        telemetry.record("request_error", 1, Map.of("reason", failureType.getCode()));
        telemetry.recordRequest(false, elapsed);
        telemetry.record("error_rate", telemetry.errorRate());
        return Result.failure(failureType, elapsed, stages);
    }

    private Result internalError(Request request, Instant startedAt, Throwable error) {
        log.error("Unexpected error while processing request {}", request.fingerprint(), error);
        Duration elapsed = elapsedSince(startedAt);
        telemetry.record("request_error", 1, Map.of("reason", FailureType.INTERNAL_ERROR.getCode()));
        telemetry.recordRequest(false, elapsed);
        return Result.failure(FailureType.INTERNAL_ERROR, elapsed, List.of());
    }

    private void startTrace(Trace trace) {
        try {
            traceSink.onStart(trace);
        } catch (RuntimeException e) {
            log.warn("Trace sink failed to start {}: {}", trace.traceId(), describe(e));
        }
    }

    private Result endTrace(Trace trace, Result result) {
        try {
            traceSink.onEnd(trace, TraceOutcome.of(result, elapsedSince(trace.startedAt())));
        } catch (RuntimeException e) {
            log.warn("Trace sink failed to end {}: {}", trace.traceId(), describe(e));
        }
        return result;
    }

    private Duration elapsedSince(Instant startedAt) {
        Duration elapsed = Duration.between(startedAt, clock.instant());
        return elapsed.isNegative() ? Duration.ZERO : elapsed;
    }

    private static double toMillis(Duration duration) {
        return duration.toNanos() / 1_000_000.0;
    }

    private static String preview(String content) {
        return content.length() <= PREVIEW_LENGTH ? content : content.substring(0, PREVIEW_LENGTH);
    }

    private static String describe(Throwable cause) {
        return cause.getClass().getSimpleName() + ": " + cause.getMessage();
    }

    private static BridgeConfig requireConfig(BridgeConfig config) {
        if (config == null) {
            throw new IllegalArgumentException("config cannot be null");
        }
        return config;
    }
}
