package com.ryuqq.bridge.core.trace;

import com.ryuqq.bridge.core.model.Fingerprint;

import java.time.Instant;
import java.util.UUID;

/**
 * 요청 한 건의 추적 정보.
 *
 * <p>Bridge가 {@code execute} 진입 시 생성하며, 시작과 종료 시점에 같은 인스턴스로
 * {@link TraceSink}가 호출됩니다.</p>
 *
 * @param traceId 추적 ID ({@value #PREFIX} 접두사)
 * @param fingerprint 요청 내용 Fingerprint
 * @param requesterId 요청자 ID
 * @param startedAt 시작 시각
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public record Trace(
    String traceId,
    Fingerprint fingerprint,
    String requesterId,
    Instant startedAt
) {

    /** 추적 ID 접두사. */
    public static final String PREFIX = "trace-";

    /**
     * Compact Constructor.
     *
     * @throws IllegalArgumentException 인자가 null이거나 traceId가 비어 있는 경우
     */
    public Trace {
        if (traceId == null || traceId.isBlank()) {
            throw new IllegalArgumentException("traceId cannot be null or blank");
        }
        if (fingerprint == null) {
            throw new IllegalArgumentException("fingerprint cannot be null");
        }
        if (requesterId == null) {
            throw new IllegalArgumentException("requesterId cannot be null");
        }
        if (startedAt == null) {
            throw new IllegalArgumentException("startedAt cannot be null");
        }
    }

    /**
     * 새 추적 ID로 시작.
     *
     * @param fingerprint 요청 내용 Fingerprint
     * @param requesterId 요청자 ID
     * @param startedAt 시작 시각
     * @return 새 Trace
     */
    public static Trace start(Fingerprint fingerprint, String requesterId, Instant startedAt) {
        return new Trace(PREFIX + UUID.randomUUID(), fingerprint, requesterId, startedAt);
    }
}
