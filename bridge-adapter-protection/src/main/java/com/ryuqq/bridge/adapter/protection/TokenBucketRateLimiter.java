package com.ryuqq.bridge.adapter.protection;

import com.ryuqq.bridge.core.protection.RateLimiter;
import com.ryuqq.bridge.core.protection.RateLimiterConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Token Bucket 기반 Rate Limiter.
 *
 * <p>버킷은 가득 찬 상태(maxBurstSize)로 시작하며, 매 요청마다 경과 시간만큼 토큰을 리필한 뒤
 * 요청한 토큰을 차감할 수 있으면 허용합니다.</p>
 *
 * <p><strong>알고리즘:</strong></p>
 * <ol>
 *   <li>elapsed = max(0, now − lastRefill)</li>
 *   <li>tokens = min(maxBurstSize, tokens + elapsed × permitsPerSecond), lastRefill = now</li>
 *   <li>tokens − permits ≥ 0 이면 차감 후 true, 아니면 토큰 변경 없이 false</li>
 * </ol>
 *
 * <p>시계가 뒤로 가더라도 경과 시간은 0으로 취급하므로 토큰이 줄어들지 않습니다.</p>
 *
 * <p><strong>동시성:</strong> 모든 상태 변경은 단일 {@link ReentrantLock} 안에서 수행되며,
 * 락 안에서 블로킹 작업을 하지 않습니다.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public final class TokenBucketRateLimiter implements RateLimiter {

    private static final Logger log = LoggerFactory.getLogger(TokenBucketRateLimiter.class);

    private static final double NANOS_PER_SECOND = 1_000_000_000.0;

    private final RateLimiterConfig config;
    private final Clock clock;
    private final ReentrantLock lock = new ReentrantLock();

    private double tokens;
    private Instant lastRefill;

    /**
     * 생성자 (시스템 시계).
     *
     * @param config Rate Limiter 설정
     */
    public TokenBucketRateLimiter(RateLimiterConfig config) {
        this(config, Clock.systemUTC());
    }

    /**
     * 생성자.
     *
     * @param config Rate Limiter 설정
     * @param clock 리필 계산 기준 시계
     * @throws IllegalArgumentException 인자가 null인 경우
     */
    public TokenBucketRateLimiter(RateLimiterConfig config, Clock clock) {
        if (config == null) {
            throw new IllegalArgumentException("config cannot be null");
        }
        if (clock == null) {
            throw new IllegalArgumentException("clock cannot be null");
        }
        this.config = config;
        this.clock = clock;
        this.tokens = config.maxBurstSize();
        this.lastRefill = clock.instant();
    }

    @Override
    public boolean tryAcquire(int permits) {
        if (permits <= 0) {
            throw new IllegalArgumentException("permits must be positive (current: " + permits + ")");
        }

        lock.lock();
        try {
            refill();
            if (tokens - permits >= 0) {
                tokens -= permits;
                return true;
            }
            log.debug("Rate limit exceeded: requested={}, available={}", permits, tokens);
            return false;
        } finally {
            lock.unlock();
        }
    }

    @Override
    public double getAvailableTokens() {
        lock.lock();
        try {
            return tokens;
        } finally {
            lock.unlock();
        }
    }

    @Override
    public RateLimiterConfig getConfig() {
        return config;
    }

    // lock 보유 상태에서만 호출
    private void refill() {
        Instant now = clock.instant();
        Duration elapsed = Duration.between(lastRefill, now);
        lastRefill = now;
        if (elapsed.isNegative() || elapsed.isZero()) {
            return;
        }
        double elapsedSeconds = elapsed.getSeconds() + elapsed.getNano() / NANOS_PER_SECOND;
        tokens = Math.min(config.maxBurstSize(), tokens + elapsedSeconds * config.permitsPerSecond());
    }
}
