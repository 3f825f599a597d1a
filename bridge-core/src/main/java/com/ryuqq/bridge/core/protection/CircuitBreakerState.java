package com.ryuqq.bridge.core.protection;

/**
 * Circuit Breaker 상태.
 *
 * <p>Circuit Breaker는 백엔드 호출의 연속 실패 횟수를 추적하고,
 * 임계값에 도달하면 요청을 차단하여 장애 전파를 방지합니다.</p>
 *
 * <p><strong>상태 전이:</strong></p>
 * <pre>
 * CLOSED (정상)
 *   │
 *   ▼ (연속 실패 임계값 도달)
 * OPEN (차단)
 *   │
 *   ▼ (openTimeout 경과 후 첫 호출)
 * HALF_OPEN (반개방, 시험 호출 1건)
 *   │
 *   ├─► 성공 → CLOSED (실패 카운터 0)
 *   └─► 실패 → OPEN (실패 시각 갱신)
 * </pre>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public enum CircuitBreakerState {

    /**
     * 정상 상태 (요청 통과).
     *
     * <p>모든 요청이 백엔드로 전달되며, 연속 실패 횟수를 추적합니다.</p>
     */
    CLOSED,

    /**
     * 차단 상태 (요청 즉시 거부).
     *
     * <p>백엔드를 호출하지 않고 즉시 실패합니다.
     * 마지막 실패 이후 openTimeout이 지나면 HALF_OPEN으로 전이합니다.</p>
     */
    OPEN,

    /**
     * 반개방 상태 (시험 호출 1건만 통과).
     *
     * <p>시험 호출이 진행 중인 동안 다른 요청은 OPEN과 동일하게 거부됩니다.</p>
     */
    HALF_OPEN
}
