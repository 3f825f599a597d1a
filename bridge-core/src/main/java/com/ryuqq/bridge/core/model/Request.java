package com.ryuqq.bridge.core.model;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Bridge로 들어오는 요청.
 *
 * <p>Request는 백엔드에 전달될 본문과 요청자 정보, 임의의 메타데이터를 담고 있으며,
 * 생성 시점에 본문으로부터 {@link Fingerprint}를 계산합니다.</p>
 *
 * <p><strong>필드 구성:</strong></p>
 * <ul>
 *   <li><strong>content:</strong> 요청 본문 (null 불가, 빈 문자열 허용)</li>
 *   <li><strong>requesterId:</strong> 요청자 ID (비어 있으면 {@value #ANONYMOUS})</li>
 *   <li><strong>metadata:</strong> 불변 메타데이터 맵 (null이면 빈 맵)</li>
 *   <li><strong>receivedAt:</strong> 수신 시각</li>
 *   <li><strong>fingerprint:</strong> 본문 다이제스트</li>
 * </ul>
 *
 * <p><strong>예시:</strong></p>
 * <pre>
 * Request request = Request.of("Track my shipment #67890", "user-002");
 * </pre>
 *
 * @param content 요청 본문
 * @param requesterId 요청자 ID
 * @param metadata 메타데이터
 * @param receivedAt 수신 시각
 * @param fingerprint 본문 Fingerprint
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public record Request(
    String content,
    String requesterId,
    Map<String, String> metadata,
    Instant receivedAt,
    Fingerprint fingerprint
) {

    /** 요청자 ID가 없을 때 사용하는 값. */
    public static final String ANONYMOUS = "anonymous";

    /**
     * Compact Constructor.
     *
     * @throws IllegalArgumentException content, receivedAt 또는 fingerprint가 null인 경우
     */
    public Request {
        if (content == null) {
            throw new IllegalArgumentException("content cannot be null");
        }
        if (receivedAt == null) {
            throw new IllegalArgumentException("receivedAt cannot be null");
        }
        if (fingerprint == null) {
            throw new IllegalArgumentException("fingerprint cannot be null");
        }
        if (requesterId == null || requesterId.isBlank()) {
            requesterId = ANONYMOUS;
        }
        metadata = metadata == null || metadata.isEmpty()
            ? Map.of()
            : Collections.unmodifiableMap(new LinkedHashMap<>(metadata));
    }

    /**
     * Request 생성 (현재 시각, Fingerprint 자동 계산).
     *
     * @param content 요청 본문
     * @param requesterId 요청자 ID (null 허용)
     * @param metadata 메타데이터 (null 허용)
     * @return Request 인스턴스
     * @throws IllegalArgumentException content가 null인 경우
     */
    public static Request of(String content, String requesterId, Map<String, String> metadata) {
        return new Request(content, requesterId, metadata, Instant.now(), Fingerprint.of(content));
    }

    /**
     * 메타데이터 없이 Request 생성.
     *
     * @param content 요청 본문
     * @param requesterId 요청자 ID (null 허용)
     * @return Request 인스턴스
     * @throws IllegalArgumentException content가 null인 경우
     */
    public static Request of(String content, String requesterId) {
        return of(content, requesterId, null);
    }

    /**
     * 익명 요청 생성.
     *
     * @param content 요청 본문
     * @return Request 인스턴스
     * @throws IllegalArgumentException content가 null인 경우
     */
    public static Request of(String content) {
        return of(content, null, null);
    }
}
