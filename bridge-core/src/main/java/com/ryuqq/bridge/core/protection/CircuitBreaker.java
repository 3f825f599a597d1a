package com.ryuqq.bridge.core.protection;

import com.ryuqq.bridge.core.failure.CircuitBreakerOpenException;

import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.CompletionStage;
import java.util.concurrent.ExecutionException;
import java.util.function.Supplier;

/**
 * Circuit Breaker SPI.
 *
 * <p>백엔드 호출의 연속 실패를 추적하고, 임계값 도달 시 빠르게 실패(Fail-Fast)하여
 * 비정상 백엔드에 부하가 증폭되는 것을 방지합니다.</p>
 *
 * <p><strong>Circuit Breaker 패턴:</strong></p>
 * <ul>
 *   <li>CLOSED: 정상 동작, 연속 실패 추적</li>
 *   <li>OPEN: 요청 차단, 빠른 실패</li>
 *   <li>HALF_OPEN: 시험 호출 1건으로 복구 확인</li>
 * </ul>
 *
 * <p><strong>사용 예시 (비동기 호출 보호):</strong></p>
 * <pre>{@code
 * CircuitBreaker cb = ...;
 *
 * CompletableFuture<Result> future = cb.call(() -> backend.handle(request));
 * // OPEN 상태라면 CircuitBreakerOpenException으로 즉시 실패
 * }</pre>
 *
 * <p><strong>사용 예시 (수동 기록):</strong></p>
 * <pre>{@code
 * if (!cb.tryAcquire()) {
 *     return Result.failure(FailureType.BREAKER_OPEN, elapsed, stages);
 * }
 * try {
 *     Result result = backend.call();
 *     cb.recordSuccess();
 *     return result;
 * } catch (Exception e) {
 *     cb.recordFailure(e);
 *     throw e;
 * }
 * }</pre>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public interface CircuitBreaker {

    /**
     * Circuit Breaker 통과 허용 여부 확인.
     *
     * <ul>
     *   <li>CLOSED: 항상 true</li>
     *   <li>OPEN: openTimeout 경과 전이면 false, 경과했으면 HALF_OPEN 전이 후 true (시험 호출)</li>
     *   <li>HALF_OPEN: 시험 호출이 진행 중이면 false</li>
     * </ul>
     *
     * @return true: 요청 통과 허용, false: 요청 차단
     */
    boolean tryAcquire();

    /**
     * 실행 성공 기록.
     *
     * <ul>
     *   <li>CLOSED: 연속 실패 카운터 초기화</li>
     *   <li>HALF_OPEN: CLOSED로 전이, 카운터 0</li>
     * </ul>
     */
    void recordSuccess();

    /**
     * 실행 실패 기록.
     *
     * <ul>
     *   <li>CLOSED: 카운터 증가, 임계값 도달 시 OPEN으로 전이</li>
     *   <li>HALF_OPEN: 즉시 OPEN으로 전이, 실패 시각 갱신</li>
     * </ul>
     *
     * @param throwable 발생한 예외
     */
    void recordFailure(Throwable throwable);

    /**
     * 현재 Circuit Breaker 상태 조회.
     *
     * @return CLOSED, OPEN, HALF_OPEN 중 하나
     */
    CircuitBreakerState getState();

    /**
     * Circuit Breaker를 CLOSED 상태로 강제 리셋.
     *
     * <p>수동 복구 또는 테스트 목적으로 사용됩니다.</p>
     */
    void reset();

    /**
     * 비동기 작업을 Circuit Breaker로 보호하여 실행.
     *
     * <p>허용되지 않으면 operation을 호출하지 않고 {@link CircuitBreakerOpenException}으로
     * 실패한 future를 반환합니다. 허용되면 operation 결과에 따라 성공/실패를 기록한 뒤
     * 반환 future를 완료합니다 (기록이 완료보다 먼저 일어남).</p>
     *
     * <p>operation이 동기적으로 예외를 던지거나 null을 반환해도 실패로 기록됩니다.</p>
     *
     * @param operation 보호할 비동기 작업
     * @param <T> 결과 타입
     * @return 작업 결과 future (예외는 {@link CompletionException}이 벗겨진 원인으로 전달)
     * @throws IllegalArgumentException operation이 null인 경우
     */
    default <T> CompletableFuture<T> call(Supplier<? extends CompletionStage<T>> operation) {
        if (operation == null) {
            throw new IllegalArgumentException("operation cannot be null");
        }
        if (!tryAcquire()) {
            return CompletableFuture.failedFuture(new CircuitBreakerOpenException(getState()));
        }

        CompletionStage<T> stage;
        try {
            stage = operation.get();
        } catch (RuntimeException e) {
            recordFailure(e);
            return CompletableFuture.failedFuture(e);
        }
        if (stage == null) {
            NullPointerException npe = new NullPointerException("operation returned null");
            recordFailure(npe);
            return CompletableFuture.failedFuture(npe);
        }

        CompletableFuture<T> result = new CompletableFuture<>();
        stage.whenComplete((value, error) -> {
            if (error == null) {
                recordSuccess();
                result.complete(value);
            } else {
                Throwable cause = unwrap(error);
                recordFailure(cause);
                result.completeExceptionally(cause);
            }
        });
        return result;
    }

    /**
     * {@link CompletionException}/{@link ExecutionException} 래핑 제거.
     *
     * @param error 비동기 작업에서 전달된 예외
     * @return 원인 예외
     */
    static Throwable unwrap(Throwable error) {
        Throwable current = error;
        while ((current instanceof CompletionException || current instanceof ExecutionException)
            && current.getCause() != null) {
            current = current.getCause();
        }
        return current;
    }
}
