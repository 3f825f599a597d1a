package com.ryuqq.bridge.application.health;

import com.ryuqq.bridge.core.protection.CircuitBreakerState;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Bridge 집계 지표 (읽기 전용).
 *
 * @param requestsTotal 전체 요청 수
 * @param errorsTotal 실패 요청 수
 * @param errorRate 오류율 (0.0 ~ 1.0)
 * @param avgLatencyMs 평균 지연 시간 (밀리초)
 * @param cacheSize 캐시 항목 수
 * @param breakerState Circuit Breaker 상태
 * @param admissionTokens 남은 Admission 토큰 수
 * @param backendMetrics 백엔드 자체 지표 (불변)
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public record BridgeMetrics(
    long requestsTotal,
    long errorsTotal,
    double errorRate,
    double avgLatencyMs,
    int cacheSize,
    CircuitBreakerState breakerState,
    double admissionTokens,
    Map<String, Object> backendMetrics
) {

    /**
     * Compact Constructor.
     *
     * @throws IllegalArgumentException breakerState가 null인 경우
     */
    public BridgeMetrics {
        if (breakerState == null) {
            throw new IllegalArgumentException("breakerState cannot be null");
        }
        backendMetrics = backendMetrics == null || backendMetrics.isEmpty()
            ? Map.of()
            : Collections.unmodifiableMap(new LinkedHashMap<>(backendMetrics));
    }
}
