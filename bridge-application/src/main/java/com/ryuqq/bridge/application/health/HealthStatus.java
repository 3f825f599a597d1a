package com.ryuqq.bridge.application.health;

import java.util.Locale;

/**
 * Bridge 전체 상태.
 *
 * <ul>
 *   <li>HEALTHY: Circuit Breaker가 OPEN이 아님</li>
 *   <li>DEGRADED: Circuit Breaker가 OPEN (백엔드 호출 차단 중)</li>
 * </ul>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public enum HealthStatus {

    HEALTHY,
    DEGRADED;

    /**
     * 소문자 표기 (외부 응답용).
     *
     * @return "healthy" 또는 "degraded"
     */
    public String label() {
        return name().toLowerCase(Locale.ROOT);
    }
}
