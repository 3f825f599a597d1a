/**
 * 텔레메트리 기록과 외부 전달.
 *
 * <p>{@link com.ryuqq.bridge.core.telemetry.TelemetryRecorder}는 Bridge가 소유하며,
 * 버퍼가 찬 샘플 묶음을 {@link com.ryuqq.bridge.core.telemetry.TelemetrySink}로 넘깁니다.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
package com.ryuqq.bridge.core.telemetry;
