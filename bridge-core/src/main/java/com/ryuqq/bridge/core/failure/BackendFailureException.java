package com.ryuqq.bridge.core.failure;

import com.ryuqq.bridge.core.model.Result;

/**
 * 백엔드가 실패 결과({@code success = false})를 반환했음을 나타내는 예외.
 *
 * <p>백엔드가 예외를 던지지 않고 실패 결과를 돌려준 경우에도
 * Circuit Breaker가 동일하게 실패로 집계할 수 있도록 이 예외로 감쌉니다.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public class BackendFailureException extends RuntimeException {

    private final transient Result result;

    /**
     * 생성자.
     *
     * @param result 백엔드가 반환한 실패 결과
     */
    public BackendFailureException(Result result) {
        super("Backend reported failure: " + (result == null ? "null result" : result.content()));
        this.result = result;
    }

    /**
     * 백엔드가 반환한 원본 결과 조회.
     *
     * @return 실패 결과 (null 가능)
     */
    public Result getResult() {
        return result;
    }
}
