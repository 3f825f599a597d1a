/**
 * Protection SPI의 기본 구현체.
 *
 * <ul>
 *   <li>{@link com.ryuqq.bridge.adapter.protection.TokenBucketRateLimiter} - Admission Control</li>
 *   <li>{@link com.ryuqq.bridge.adapter.protection.ConsecutiveFailureCircuitBreaker} - 연속 실패 기반 차단</li>
 *   <li>{@link com.ryuqq.bridge.adapter.protection.FixedTimeoutPolicy} - 고정 타임아웃</li>
 * </ul>
 *
 * <p>모든 구현체는 {@link java.time.Clock}을 주입받아 시간 의존 동작을 테스트할 수 있습니다.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
package com.ryuqq.bridge.adapter.protection;
