package com.ryuqq.bridge.application.gateway;

import com.ryuqq.bridge.application.health.HealthReport;

import java.time.Duration;

/**
 * Gateway Health 응답 (Bridge Health + 가동 시간).
 *
 * @param report Bridge Health 보고서
 * @param uptime Gateway 생성 이후 경과 시간
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public record GatewayHealth(HealthReport report, Duration uptime) {

    /**
     * Compact Constructor.
     *
     * @throws IllegalArgumentException report가 null이거나 uptime이 음수인 경우
     */
    public GatewayHealth {
        if (report == null) {
            throw new IllegalArgumentException("report cannot be null");
        }
        if (uptime == null || uptime.isNegative()) {
            throw new IllegalArgumentException("uptime must be non-negative (current: " + uptime + ")");
        }
    }
}
