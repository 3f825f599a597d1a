package com.ryuqq.bridge.adapter.protection;

import com.ryuqq.bridge.core.protection.TimeoutPolicy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.concurrent.atomic.AtomicLong;

/**
 * 고정 시간 Timeout Policy.
 *
 * <p>timeoutMs가 0이면 타임아웃을 적용하지 않습니다.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public final class FixedTimeoutPolicy implements TimeoutPolicy {

    private static final Logger log = LoggerFactory.getLogger(FixedTimeoutPolicy.class);

    private final long timeoutMs;
    private final AtomicLong timeoutCount = new AtomicLong();

    /**
     * 생성자.
     *
     * @param timeoutMs 타임아웃 (밀리초, 0 이상)
     * @throws IllegalArgumentException timeoutMs가 음수인 경우
     */
    public FixedTimeoutPolicy(long timeoutMs) {
        if (timeoutMs < 0) {
            throw new IllegalArgumentException("timeoutMs must be non-negative (current: " + timeoutMs + ")");
        }
        this.timeoutMs = timeoutMs;
    }

    @Override
    public long getTimeoutMs() {
        return timeoutMs;
    }

    @Override
    public void recordTimeout(long elapsedMs) {
        long total = timeoutCount.incrementAndGet();
        log.warn("Backend call timed out after {}ms (limit: {}ms, total timeouts: {})", elapsedMs, timeoutMs, total);
    }

    /**
     * 누적 타임아웃 횟수 조회.
     *
     * @return 타임아웃 횟수
     */
    public long getTimeoutCount() {
        return timeoutCount.get();
    }
}
