package com.ryuqq.bridge.core.protection;

/**
 * Rate Limiter SPI (Admission Control).
 *
 * <p>요청마다 처리할 예산(토큰)이 남아 있는지 즉시 판단하여
 * 백엔드 과부하 및 내부 리소스 고갈을 방지합니다.</p>
 *
 * <p><strong>특징:</strong></p>
 * <ul>
 *   <li>비블로킹: 대기나 큐잉 없이 즉시 true/false 반환</li>
 *   <li>우선순위/공정성 없음: 호출 순서대로 판단</li>
 *   <li>거부 시 대응(빠른 실패 등)은 호출자가 결정</li>
 * </ul>
 *
 * <p><strong>사용 예시:</strong></p>
 * <pre>{@code
 * RateLimiter limiter = ...;
 *
 * if (!limiter.tryAcquire()) {
 *     // Rate Limit 초과
 *     return Result.failure(FailureType.ADMISSION_REJECTED, elapsed, stages);
 * }
 * }</pre>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public interface RateLimiter {

    /**
     * 토큰 1개로 통과 허용 여부 확인 (비블로킹).
     *
     * @return true: 요청 허용, false: Rate Limit 초과
     */
    default boolean tryAcquire() {
        return tryAcquire(1);
    }

    /**
     * 지정한 수의 토큰으로 통과 허용 여부 확인 (비블로킹).
     *
     * <p>허용되면 토큰을 차감하고, 허용되지 않으면 토큰을 변경하지 않습니다.</p>
     *
     * @param permits 소비할 토큰 수 (양수여야 함)
     * @return true: 요청 허용, false: Rate Limit 초과
     * @throws IllegalArgumentException permits가 양수가 아닌 경우
     */
    boolean tryAcquire(int permits);

    /**
     * 현재 남은 토큰 수 조회 (관측 전용, 리필하지 않음).
     *
     * @return 남은 토큰 수 (0 ~ maxBurstSize)
     */
    double getAvailableTokens();

    /**
     * Rate Limiter 설정 정보 조회.
     *
     * @return Rate Limiter 설정
     */
    RateLimiterConfig getConfig();
}
