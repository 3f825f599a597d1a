package com.ryuqq.bridge.application.health;

/**
 * Health/Metrics 조회 계약.
 *
 * <p>Bridge 구성 요소의 상태를 읽기 전용으로 노출합니다.
 * 동시에 진행 중인 요청 처리와 함께 호출해도 안전해야 합니다.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public interface HealthReporter {

    /**
     * 집계 지표 조회.
     *
     * @return 현재 지표
     */
    BridgeMetrics metrics();

    /**
     * Health 보고서 조회.
     *
     * <p>Circuit Breaker가 OPEN이면 {@link HealthStatus#DEGRADED}, 그 외에는 HEALTHY입니다.</p>
     *
     * @return 현재 Health 보고서
     */
    HealthReport health();
}
