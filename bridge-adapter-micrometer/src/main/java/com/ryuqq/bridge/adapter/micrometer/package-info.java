/**
 * Micrometer 연동 Adapter.
 *
 * <p>텔레메트리 샘플을 Meter로 기록하는 {@link com.ryuqq.bridge.adapter.micrometer.MicrometerTelemetrySink}와
 * Health 지표를 Gauge로 노출하는 {@link com.ryuqq.bridge.adapter.micrometer.BridgeMeterBinder}를 제공합니다.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
package com.ryuqq.bridge.adapter.micrometer;
