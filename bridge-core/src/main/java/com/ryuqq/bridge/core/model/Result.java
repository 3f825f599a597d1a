package com.ryuqq.bridge.core.model;

import com.ryuqq.bridge.core.failure.FailureType;

import java.time.Duration;
import java.util.List;

/**
 * 요청 처리 결과.
 *
 * <p>백엔드가 생성한 성공 결과이거나, Bridge가 실패 상황에서 합성한 실패 결과입니다.
 * 실패 결과는 항상 {@code confidence = 0}이며 {@link FailureType}을 가집니다.</p>
 *
 * <p><strong>불변식:</strong></p>
 * <ul>
 *   <li>confidence: 0.0 ~ 1.0</li>
 *   <li>processingTime: 음수 불가</li>
 *   <li>success = true ⇔ failureType == null</li>
 * </ul>
 *
 * @param content 응답 본문
 * @param confidence 신뢰도 (0.0 ~ 1.0)
 * @param processingTime 처리 소요 시간
 * @param stages 처리 과정에서 호출된 단계 (순서 유지)
 * @param success 성공 여부
 * @param failureType 실패 분류 (성공 시 null)
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public record Result(
    String content,
    double confidence,
    Duration processingTime,
    List<String> stages,
    boolean success,
    FailureType failureType
) {

    /**
     * Compact Constructor.
     *
     * @throws IllegalArgumentException 불변식을 위반한 경우
     */
    public Result {
        if (content == null) {
            throw new IllegalArgumentException("content cannot be null");
        }
        if (Double.isNaN(confidence) || confidence < 0.0 || confidence > 1.0) {
            throw new IllegalArgumentException("confidence must be between 0.0 and 1.0 (current: " + confidence + ")");
        }
        if (processingTime == null || processingTime.isNegative()) {
            throw new IllegalArgumentException("processingTime must be non-negative (current: " + processingTime + ")");
        }
        if (success && failureType != null) {
            throw new IllegalArgumentException("successful result cannot carry failureType: " + failureType);
        }
        if (!success && failureType == null) {
            throw new IllegalArgumentException("failed result must carry failureType");
        }
        stages = stages == null ? List.of() : List.copyOf(stages);
    }

    /**
     * 성공 결과 생성.
     *
     * @param content 응답 본문
     * @param confidence 신뢰도
     * @param processingTime 처리 소요 시간
     * @param stages 호출된 단계
     * @return 성공 Result
     */
    public static Result success(String content, double confidence, Duration processingTime, List<String> stages) {
        return new Result(content, confidence, processingTime, stages, true, null);
    }

    /**
     * 실패 결과 생성 (confidence = 0).
     *
     * @param failureType 실패 분류
     * @param message 사용자 메시지
     * @param processingTime 실패까지 소요 시간
     * @param stages 실패 전까지 진행된 단계
     * @return 실패 Result
     */
    public static Result failure(FailureType failureType, String message, Duration processingTime, List<String> stages) {
        if (failureType == null) {
            throw new IllegalArgumentException("failureType cannot be null");
        }
        return new Result(message, 0.0, processingTime, stages, false, failureType);
    }

    /**
     * 기본 메시지로 실패 결과 생성.
     *
     * @param failureType 실패 분류
     * @param processingTime 실패까지 소요 시간
     * @param stages 실패 전까지 진행된 단계
     * @return 실패 Result
     */
    public static Result failure(FailureType failureType, Duration processingTime, List<String> stages) {
        if (failureType == null) {
            throw new IllegalArgumentException("failureType cannot be null");
        }
        return failure(failureType, failureType.getDefaultMessage(), processingTime, stages);
    }

    /**
     * 오류 코드 조회.
     *
     * @return 오류 코드 (성공 시 null)
     */
    public String errorCode() {
        return failureType == null ? null : failureType.getCode();
    }
}
