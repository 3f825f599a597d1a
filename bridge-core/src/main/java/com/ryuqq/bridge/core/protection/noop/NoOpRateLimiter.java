package com.ryuqq.bridge.core.protection.noop;

import com.ryuqq.bridge.core.protection.RateLimiter;
import com.ryuqq.bridge.core.protection.RateLimiterConfig;

/**
 * Rate Limiter NoOp 구현.
 *
 * <p>모든 요청을 항상 허용합니다. 토큰을 차감하지 않으므로
 * {@link #getAvailableTokens()}는 항상 버킷 크기를 반환합니다.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public final class NoOpRateLimiter implements RateLimiter {

    private static final RateLimiterConfig UNLIMITED = new RateLimiterConfig(Double.MAX_VALUE, Integer.MAX_VALUE);

    @Override
    public boolean tryAcquire(int permits) {
        if (permits <= 0) {
            throw new IllegalArgumentException("permits must be positive (current: " + permits + ")");
        }
        return true;
    }

    @Override
    public double getAvailableTokens() {
        return UNLIMITED.maxBurstSize();
    }

    @Override
    public RateLimiterConfig getConfig() {
        return UNLIMITED;
    }
}
