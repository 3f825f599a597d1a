package com.ryuqq.bridge.core.failure;

import com.ryuqq.bridge.core.protection.CircuitBreakerState;

/**
 * Circuit Breaker가 호출을 허용하지 않을 때 발생하는 예외.
 *
 * <p>OPEN 상태이거나, HALF_OPEN 상태에서 이미 시험 호출(trial)이 진행 중인 경우
 * 백엔드를 호출하지 않고 이 예외로 즉시 실패합니다.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public class CircuitBreakerOpenException extends RuntimeException {

    private final CircuitBreakerState state;

    /**
     * 생성자.
     *
     * @param state 거부 시점의 Circuit Breaker 상태
     */
    public CircuitBreakerOpenException(CircuitBreakerState state) {
        super("Circuit breaker is " + state);
        this.state = state;
    }

    /**
     * 거부 시점의 상태 조회.
     *
     * @return OPEN 또는 HALF_OPEN
     */
    public CircuitBreakerState getState() {
        return state;
    }
}
