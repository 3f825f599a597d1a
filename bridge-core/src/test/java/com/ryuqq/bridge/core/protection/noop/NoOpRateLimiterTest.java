package com.ryuqq.bridge.core.protection.noop;

import com.ryuqq.bridge.core.protection.RateLimiter;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

/**
 * NoOpRateLimiter 유닛 테스트.
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
@DisplayName("NoOpRateLimiter 테스트")
class NoOpRateLimiterTest {

    @Test
    @DisplayName("tryAcquire() 는 횟수와 무관하게 항상 true를 반환한다")
    void tryAcquire_항상_true_반환() {
        // given
        RateLimiter limiter = new NoOpRateLimiter();

        // when & then
        for (int i = 0; i < 10_000; i++) {
            assertTrue(limiter.tryAcquire());
        }
        assertTrue(limiter.tryAcquire(500));
    }

    @Test
    @DisplayName("tryAcquire() 에 양수가 아닌 permits를 넘기면 예외가 발생한다")
    void tryAcquire_음수_permits_예외() {
        // given
        RateLimiter limiter = new NoOpRateLimiter();

        // when & then
        assertThrows(IllegalArgumentException.class, () -> limiter.tryAcquire(0));
    }

    @Test
    @DisplayName("getAvailableTokens() 는 버킷 크기를 반환한다")
    void getAvailableTokens_버킷_크기_반환() {
        // given
        RateLimiter limiter = new NoOpRateLimiter();

        // when & then
        assertEquals(limiter.getConfig().maxBurstSize(), limiter.getAvailableTokens());
    }
}
