package com.ryuqq.bridge.core.protection;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Protection 설정 record 검증 테스트.
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
class ProtectionConfigTest {

    @Test
    void rateLimiterConfig_기본값() {
        RateLimiterConfig config = new RateLimiterConfig();

        assertThat(config.permitsPerSecond()).isEqualTo(100.0);
        assertThat(config.maxBurstSize()).isEqualTo(1000);
    }

    @Test
    void rateLimiterConfig_리필_0_허용() {
        RateLimiterConfig config = new RateLimiterConfig(0, 10);

        assertThat(config.permitsPerSecond()).isZero();
    }

    @Test
    void rateLimiterConfig_음수_거부() {
        assertThatThrownBy(() -> new RateLimiterConfig(-1, 10))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("permitsPerSecond");
        assertThatThrownBy(() -> new RateLimiterConfig(1, -10))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("maxBurstSize must be positive (current: -10)");
    }

    @Test
    void circuitBreakerConfig_기본값과_with() {
        CircuitBreakerConfig config = new CircuitBreakerConfig().withFailureThreshold(3).withOpenTimeoutMs(1000);

        assertThat(config.failureThreshold()).isEqualTo(3);
        assertThat(config.openTimeoutMs()).isEqualTo(1000);
        assertThat(new CircuitBreakerConfig().failureThreshold()).isEqualTo(5);
    }

    @Test
    void circuitBreakerConfig_검증() {
        assertThatThrownBy(() -> new CircuitBreakerConfig(0, 1000))
            .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> new CircuitBreakerConfig(3, 0))
            .isInstanceOf(IllegalArgumentException.class);
    }
}
