package com.ryuqq.bridge.core.protection.noop;

import com.ryuqq.bridge.core.protection.TimeoutPolicy;

/**
 * Timeout Policy NoOp 구현.
 *
 * <p>타임아웃을 적용하지 않습니다 ({@link #getTimeoutMs()}는 항상 0).</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public final class NoOpTimeoutPolicy implements TimeoutPolicy {

    @Override
    public long getTimeoutMs() {
        return 0;
    }

    @Override
    public void recordTimeout(long elapsedMs) {
        // NoOp
    }
}
