package com.ryuqq.bridge.core.protection;

/**
 * Timeout Policy SPI.
 *
 * <p>백엔드 호출의 최대 허용 시간을 설정하여 무한 대기를 방지합니다.
 * 타임아웃은 Circuit Breaker에서 일반 실패와 동일하게 집계됩니다.</p>
 *
 * <p><strong>사용 예시:</strong></p>
 * <pre>{@code
 * TimeoutPolicy policy = ...;
 * long timeout = policy.getTimeoutMs();
 *
 * CompletableFuture<Result> future = backend.handle(request);
 * if (timeout > 0) {
 *     future = future.orTimeout(timeout, TimeUnit.MILLISECONDS);
 * }
 * }</pre>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public interface TimeoutPolicy {

    /**
     * 백엔드 호출 타임아웃 시간 조회.
     *
     * @return 타임아웃 시간 (밀리초), 0은 타임아웃 없음을 의미
     */
    long getTimeoutMs();

    /**
     * 타임아웃 발생 기록.
     *
     * <p>통계 및 모니터링에 활용합니다.</p>
     *
     * @param elapsedMs 실제 경과 시간 (밀리초)
     */
    void recordTimeout(long elapsedMs);
}
