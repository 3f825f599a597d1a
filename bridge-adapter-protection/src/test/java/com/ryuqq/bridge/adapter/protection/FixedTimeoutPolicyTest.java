package com.ryuqq.bridge.adapter.protection;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * FixedTimeoutPolicy 테스트.
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
class FixedTimeoutPolicyTest {

    @Test
    void 타임아웃_기록_횟수_누적() {
        // given
        FixedTimeoutPolicy policy = new FixedTimeoutPolicy(250);

        // when
        policy.recordTimeout(251);
        policy.recordTimeout(300);

        // then
        assertThat(policy.getTimeoutMs()).isEqualTo(250);
        assertThat(policy.getTimeoutCount()).isEqualTo(2);
    }

    @Test
    void 음수_타임아웃_거부() {
        assertThatThrownBy(() -> new FixedTimeoutPolicy(-1))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessage("timeoutMs must be non-negative (current: -1)");
        assertThat(new FixedTimeoutPolicy(0).getTimeoutMs()).isZero();
    }
}
