package com.ryuqq.bridge.core.telemetry;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * 텔레메트리 샘플 한 건.
 *
 * @param name 지표 이름 (예: request_success, response_time)
 * @param value 값
 * @param timestamp 기록 시각
 * @param labels 라벨 (불변, null이면 빈 맵)
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public record TelemetrySample(
    String name,
    double value,
    Instant timestamp,
    Map<String, String> labels
) {

    /**
     * Compact Constructor.
     *
     * @throws IllegalArgumentException name이 비어 있거나 timestamp가 null인 경우
     */
    public TelemetrySample {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("name cannot be null or blank");
        }
        if (timestamp == null) {
            throw new IllegalArgumentException("timestamp cannot be null");
        }
        labels = labels == null || labels.isEmpty()
            ? Map.of()
            : Collections.unmodifiableMap(new LinkedHashMap<>(labels));
    }
}
