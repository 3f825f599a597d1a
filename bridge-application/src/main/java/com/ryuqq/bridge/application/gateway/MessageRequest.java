package com.ryuqq.bridge.application.gateway;

import com.ryuqq.bridge.core.model.Request;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Gateway 입력 메시지.
 *
 * @param content 메시지 본문
 * @param userId 사용자 ID (null 허용, 없으면 anonymous)
 * @param metadata 메타데이터 (null 허용)
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public record MessageRequest(String content, String userId, Map<String, String> metadata) {

    /**
     * Compact Constructor.
     *
     * @throws IllegalArgumentException content가 null인 경우
     */
    public MessageRequest {
        if (content == null) {
            throw new IllegalArgumentException("content cannot be null");
        }
        metadata = metadata == null || metadata.isEmpty()
            ? Map.of()
            : Collections.unmodifiableMap(new LinkedHashMap<>(metadata));
    }

    /**
     * Bridge Request로 변환.
     *
     * @return Request
     */
    public Request toRequest() {
        return Request.of(content, userId, metadata);
    }
}
