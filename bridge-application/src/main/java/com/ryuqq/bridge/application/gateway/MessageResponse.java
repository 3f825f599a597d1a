package com.ryuqq.bridge.application.gateway;

import com.ryuqq.bridge.core.model.Result;

import java.time.Duration;
import java.time.Instant;

/**
 * Gateway 응답 메시지.
 *
 * @param response 응답 본문
 * @param confidence 신뢰도
 * @param processingTime 처리 소요 시간
 * @param success 성공 여부
 * @param errorCode 오류 코드 (성공 시 null)
 * @param timestamp 응답 시각
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public record MessageResponse(
    String response,
    double confidence,
    Duration processingTime,
    boolean success,
    String errorCode,
    Instant timestamp
) {

    /**
     * Result로부터 응답 생성.
     *
     * @param result Bridge 처리 결과
     * @param timestamp 응답 시각
     * @return MessageResponse
     * @throws IllegalArgumentException result 또는 timestamp가 null인 경우
     */
    public static MessageResponse from(Result result, Instant timestamp) {
        if (result == null) {
            throw new IllegalArgumentException("result cannot be null");
        }
        if (timestamp == null) {
            throw new IllegalArgumentException("timestamp cannot be null");
        }
        return new MessageResponse(
            result.content(),
            result.confidence(),
            result.processingTime(),
            result.success(),
            result.errorCode(),
            timestamp
        );
    }
}
