/**
 * Protection SPI (Service Provider Interface) 패키지.
 *
 * <p>Bridge가 백엔드 앞에서 적용하는 보호 메커니즘의 확장점을 정의합니다.</p>
 *
 * <h2>Protection 체인 순서</h2>
 *
 * <pre>
 * 1. RateLimiter     → 토큰 부족 시 즉시 거부 (Circuit Breaker 집계 대상 아님)
 * 2. ResultCache     → 캐시 적중 시 백엔드 호출 생략
 * 3. CircuitBreaker  → OPEN 상태 시 즉시 실패
 * 4. TimeoutPolicy   → 백엔드 호출 시간 상한 (타임아웃은 Circuit Breaker 실패로 집계)
 * 5. BackendHandler  → 실제 작업 실행
 * </pre>
 *
 * <h3>체인 순서 선정 이유</h3>
 * <ul>
 *   <li><strong>RateLimiter First:</strong> 예산 없는 요청은 어떤 상태도 건드리지 않음</li>
 *   <li><strong>Cache:</strong> 중복 작업을 백엔드 상태와 무관하게 제거</li>
 *   <li><strong>Circuit Breaker:</strong> 비정상 백엔드 보호</li>
 *   <li><strong>Timeout:</strong> 백엔드 호출 한 건의 상한</li>
 * </ul>
 *
 * <h2>구현체</h2>
 *
 * <ul>
 *   <li>{@code noop} 하위 패키지: 항상 허용하는 기본 구현</li>
 *   <li>{@code bridge-adapter-protection} 모듈: Token Bucket, 연속 실패 기반 Circuit Breaker, 고정 타임아웃</li>
 * </ul>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 * @see com.ryuqq.bridge.core.protection.CircuitBreaker
 * @see com.ryuqq.bridge.core.protection.RateLimiter
 * @see com.ryuqq.bridge.core.protection.TimeoutPolicy
 * @see com.ryuqq.bridge.core.protection.noop
 */
package com.ryuqq.bridge.core.protection;
