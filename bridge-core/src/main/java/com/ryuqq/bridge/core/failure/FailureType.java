package com.ryuqq.bridge.core.failure;

/**
 * Bridge 실패 분류.
 *
 * <p>Bridge는 어떤 실패도 호출자에게 예외로 전파하지 않고,
 * 실패한 {@code Result}에 이 분류를 담아 반환합니다.</p>
 *
 * <pre>
 * ADMISSION_REJECTED  토큰 부족 (Rate Limit)
 * BREAKER_OPEN        백엔드 비정상으로 판단 (Circuit Breaker OPEN)
 * BACKEND_FAILURE     백엔드 예외 또는 실패 결과 반환
 * BACKEND_TIMEOUT     백엔드 타임아웃 또는 취소
 * INTERNAL_ERROR      Bridge 내부의 예상치 못한 예외
 * </pre>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public enum FailureType {

    ADMISSION_REJECTED("RATE-LIMIT", "Rate limit exceeded - please retry"),
    BREAKER_OPEN("CB-OPEN", "Service temporarily unavailable - circuit breaker is open"),
    BACKEND_FAILURE("BACKEND-FAIL", "I apologize, but I encountered an error. Please try again."),
    BACKEND_TIMEOUT("BACKEND-TIMEOUT", "The request took too long to process. Please try again."),
    INTERNAL_ERROR("BRIDGE-INTERNAL", "An internal error occurred. Please try again.");

    private final String code;
    private final String defaultMessage;

    FailureType(String code, String defaultMessage) {
        this.code = code;
        this.defaultMessage = defaultMessage;
    }

    /**
     * 오류 코드 조회.
     *
     * @return 오류 코드 (예: RATE-LIMIT, CB-OPEN)
     */
    public String getCode() {
        return code;
    }

    /**
     * 사용자에게 노출할 기본 메시지 조회.
     *
     * @return 기본 메시지
     */
    public String getDefaultMessage() {
        return defaultMessage;
    }
}
