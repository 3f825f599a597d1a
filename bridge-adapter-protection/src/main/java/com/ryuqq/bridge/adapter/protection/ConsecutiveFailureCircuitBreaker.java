package com.ryuqq.bridge.adapter.protection;

import com.ryuqq.bridge.core.failure.CircuitBreakerOpenException;
import com.ryuqq.bridge.core.protection.CircuitBreaker;
import com.ryuqq.bridge.core.protection.CircuitBreakerConfig;
import com.ryuqq.bridge.core.protection.CircuitBreakerState;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionStage;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Supplier;

/**
 * 연속 실패 기반 Circuit Breaker.
 *
 * <p><strong>상태 전이:</strong></p>
 * <pre>
 * CLOSED    --(연속 실패 ≥ failureThreshold)-->         OPEN
 * OPEN      --(now − lastFailure ≥ openTimeout, 호출)-->  HALF_OPEN (해당 호출이 시험 호출)
 * HALF_OPEN --(시험 호출 성공)-->                        CLOSED (카운터 0)
 * HALF_OPEN --(시험 호출 실패)-->                        OPEN (실패 시각 갱신)
 * </pre>
 *
 * <p>HALF_OPEN에서는 시험 호출 1건만 진행되며, 나머지 호출은 OPEN과 동일하게 거부됩니다.
 * CLOSED 상태에서 허용되었던 호출의 결과가 늦게 도착하면 시험 호출의 결과로 취급하지 않습니다.
 * 늦은 성공은 무시되고, 늦은 실패는 카운터와 실패 시각만 갱신합니다.</p>
 *
 * <p>시험 호출 허가에는 발급 시점의 세대(generation)가 기록됩니다. 세대는 시험 호출을 허가할 때와
 * {@link #reset()} 시 증가하며, 세대가 지난 시험 호출의 결과는 늦게 도착한 일반 호출 결과로 취급합니다.</p>
 *
 * <p>{@link #recordSuccess()}/{@link #recordFailure(Throwable)}를 직접 호출하는 경우에는
 * 현재 시험 호출의 결과로 간주합니다. 시험 호출 여부를 정확히 구분하려면 {@link #call(Supplier)}를 사용합니다.</p>
 *
 * <p><strong>동시성:</strong> 모든 상태는 단일 {@link ReentrantLock}으로 보호됩니다.
 * 보호 대상 작업은 락 밖에서 실행됩니다.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public final class ConsecutiveFailureCircuitBreaker implements CircuitBreaker {

    private static final Logger log = LoggerFactory.getLogger(ConsecutiveFailureCircuitBreaker.class);

    // 직접 기록 호출용 세대 (항상 현재 세대로 취급)
    private static final long CURRENT_GENERATION = -1;

    private final CircuitBreakerConfig config;
    private final Clock clock;
    private final ReentrantLock lock = new ReentrantLock();

    // lock 보호 대상
    private CircuitBreakerState state = CircuitBreakerState.CLOSED;
    private int failureCount;
    private Instant lastFailureAt;
    private boolean trialInFlight;
    private long generation;

    /**
     * 생성자 (시스템 시계).
     *
     * @param config Circuit Breaker 설정
     */
    public ConsecutiveFailureCircuitBreaker(CircuitBreakerConfig config) {
        this(config, Clock.systemUTC());
    }

    /**
     * 생성자.
     *
     * @param config Circuit Breaker 설정
     * @param clock openTimeout 계산 기준 시계
     * @throws IllegalArgumentException 인자가 null인 경우
     */
    public ConsecutiveFailureCircuitBreaker(CircuitBreakerConfig config, Clock clock) {
        if (config == null) {
            throw new IllegalArgumentException("config cannot be null");
        }
        if (clock == null) {
            throw new IllegalArgumentException("clock cannot be null");
        }
        this.config = config;
        this.clock = clock;
    }

    @Override
    public boolean tryAcquire() {
        return acquire().kind() != PermitKind.REJECTED;
    }

    @Override
    public void recordSuccess() {
        onSuccess(Permit.trial(CURRENT_GENERATION));
    }

    @Override
    public void recordFailure(Throwable throwable) {
        onFailure(Permit.trial(CURRENT_GENERATION), throwable);
    }

    @Override
    public CircuitBreakerState getState() {
        lock.lock();
        try {
            return state;
        } finally {
            lock.unlock();
        }
    }

    @Override
    public void reset() {
        lock.lock();
        try {
            CircuitBreakerState previous = state;
            state = CircuitBreakerState.CLOSED;
            failureCount = 0;
            lastFailureAt = null;
            trialInFlight = false;
            generation++;
            if (previous != CircuitBreakerState.CLOSED) {
                log.info("Circuit breaker reset: {} -> CLOSED", previous);
            }
        } finally {
            lock.unlock();
        }
    }

    /**
     * 시험 호출 여부를 추적하며 비동기 작업을 보호합니다.
     */
    @Override
    public <T> CompletableFuture<T> call(Supplier<? extends CompletionStage<T>> operation) {
        if (operation == null) {
            throw new IllegalArgumentException("operation cannot be null");
        }
        Permit permit = acquire();
        if (permit.kind() == PermitKind.REJECTED) {
            return CompletableFuture.failedFuture(new CircuitBreakerOpenException(getState()));
        }

        CompletionStage<T> stage;
        try {
            stage = operation.get();
        } catch (RuntimeException e) {
            onFailure(permit, e);
            return CompletableFuture.failedFuture(e);
        }
        if (stage == null) {
            NullPointerException npe = new NullPointerException("operation returned null");
            onFailure(permit, npe);
            return CompletableFuture.failedFuture(npe);
        }

        CompletableFuture<T> result = new CompletableFuture<>();
        stage.whenComplete((value, error) -> {
            if (error == null) {
                onSuccess(permit);
                result.complete(value);
            } else {
                Throwable cause = CircuitBreaker.unwrap(error);
                onFailure(permit, cause);
                result.completeExceptionally(cause);
            }
        });
        return result;
    }

    /**
     * 연속 실패 횟수 조회.
     *
     * @return 연속 실패 횟수
     */
    public int getFailureCount() {
        lock.lock();
        try {
            return failureCount;
        } finally {
            lock.unlock();
        }
    }

    /**
     * 마지막 실패 시각 조회.
     *
     * @return 마지막 실패 시각 (실패 기록이 없으면 null)
     */
    public Instant getLastFailureAt() {
        lock.lock();
        try {
            return lastFailureAt;
        } finally {
            lock.unlock();
        }
    }

    public CircuitBreakerConfig getConfig() {
        return config;
    }

    private Permit acquire() {
        lock.lock();
        try {
            switch (state) {
                case CLOSED:
                    return Permit.NORMAL;
                case OPEN:
                    if (openTimeoutElapsed()) {
                        state = CircuitBreakerState.HALF_OPEN;
                        trialInFlight = true;
                        log.info("Circuit breaker HALF_OPEN: admitting trial call after {}ms", config.openTimeoutMs());
                        return Permit.trial(++generation);
                    }
                    return Permit.REJECTED;
                case HALF_OPEN:
                    if (!trialInFlight) {
                        trialInFlight = true;
                        return Permit.trial(++generation);
                    }
                    return Permit.REJECTED;
                default:
                    throw new IllegalStateException("Unknown circuit breaker state: " + state);
            }
        } finally {
            lock.unlock();
        }
    }

    private void onSuccess(Permit permit) {
        lock.lock();
        try {
            boolean trial = isCurrentTrial(permit);
            if (state == CircuitBreakerState.CLOSED) {
                failureCount = 0;
            } else if (state == CircuitBreakerState.HALF_OPEN && trial) {
                state = CircuitBreakerState.CLOSED;
                failureCount = 0;
                trialInFlight = false;
                log.info("Circuit breaker CLOSED: trial call succeeded");
            }
        } finally {
            lock.unlock();
        }
    }

    private void onFailure(Permit permit, Throwable throwable) {
        lock.lock();
        try {
            boolean trial = isCurrentTrial(permit);
            failureCount++;
            lastFailureAt = clock.instant();

            if (state == CircuitBreakerState.CLOSED && failureCount >= config.failureThreshold()) {
                state = CircuitBreakerState.OPEN;
                log.warn("Circuit breaker OPEN after {} consecutive failures (last: {})",
                    failureCount, describe(throwable));
            } else if (state == CircuitBreakerState.HALF_OPEN && trial) {
                state = CircuitBreakerState.OPEN;
                trialInFlight = false;
                log.warn("Circuit breaker OPEN: trial call failed (failures: {}, cause: {})",
                    failureCount, describe(throwable));
            }
        } finally {
            lock.unlock();
        }
    }

    // lock 보유 상태에서만 호출
    private boolean isCurrentTrial(Permit permit) {
        if (permit.kind() != PermitKind.TRIAL) {
            return false;
        }
        return permit.generation() == CURRENT_GENERATION || permit.generation() == generation;
    }

    // lock 보유 상태에서만 호출
    private boolean openTimeoutElapsed() {
        if (lastFailureAt == null) {
            return true;
        }
        Duration elapsed = Duration.between(lastFailureAt, clock.instant());
        return elapsed.toMillis() >= config.openTimeoutMs();
    }

    private static String describe(Throwable throwable) {
        if (throwable == null) {
            return "unknown";
        }
        return throwable.getClass().getSimpleName() + ": " + throwable.getMessage();
    }

    private enum PermitKind {
        REJECTED,
        NORMAL,
        TRIAL
    }

    private record Permit(PermitKind kind, long generation) {

        static final Permit REJECTED = new Permit(PermitKind.REJECTED, 0);
        static final Permit NORMAL = new Permit(PermitKind.NORMAL, 0);

        static Permit trial(long generation) {
            return new Permit(PermitKind.TRIAL, generation);
        }
    }
}
