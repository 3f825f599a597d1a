package com.ryuqq.bridge.core.telemetry;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Telemetry Recorder.
 *
 * <p>텔레메트리 샘플을 버퍼에 누적하고, 버퍼가 임계값에 도달하면 {@link TelemetrySink}로
 * 넘긴 뒤 비웁니다. 또한 Health/Metrics 보고에 쓰이는 요청 집계 카운터를 관리합니다.</p>
 *
 * <p><strong>보장:</strong></p>
 * <ul>
 *   <li>기록은 호출자를 블로킹하지 않음 (짧은 락만 사용, Sink 전달은 락 밖에서 수행)</li>
 *   <li>기록은 실패하지 않음 (잘못된 샘플과 Sink 오류는 WARN 로그 후 버림)</li>
 *   <li>평균 지연 시간은 누적 이동 평균으로 O(1) 갱신:
 *       {@code new_avg = (old_avg × (n−1) + sample) / n}</li>
 * </ul>
 *
 * <p><strong>사용 예시:</strong></p>
 * <pre>{@code
 * TelemetryRecorder recorder = new TelemetryRecorder(new TelemetryConfig(), new LoggingTelemetrySink(), Clock.systemUTC());
 *
 * recorder.record("request_success", 1);
 * recorder.recordRequest(true, Duration.ofMillis(42));
 *
 * TelemetrySnapshot snapshot = recorder.snapshot();
 * }</pre>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public final class TelemetryRecorder {

    private static final Logger log = LoggerFactory.getLogger(TelemetryRecorder.class);

    private final TelemetryConfig config;
    private final TelemetrySink sink;
    private final Clock clock;

    private final ReentrantLock lock = new ReentrantLock();

    // lock 보호 대상
    private List<TelemetrySample> buffer = new ArrayList<>();
    private long requestCount;
    private long errorCount;
    private double totalLatencyMs;
    private double averageLatencyMs;

    private final AtomicLong flushedSamples = new AtomicLong();
    private final AtomicLong droppedSamples = new AtomicLong();

    /**
     * 생성자 (기본 설정, 로그 Sink, 시스템 시계).
     */
    public TelemetryRecorder() {
        this(new TelemetryConfig(), new LoggingTelemetrySink(), Clock.systemUTC());
    }

    /**
     * 생성자.
     *
     * @param config 설정
     * @param sink 샘플 전달 대상
     * @param clock 샘플 시각 기준 시계
     * @throws IllegalArgumentException 인자가 null인 경우
     */
    public TelemetryRecorder(TelemetryConfig config, TelemetrySink sink, Clock clock) {
        if (config == null) {
            throw new IllegalArgumentException("config cannot be null");
        }
        if (sink == null) {
            throw new IllegalArgumentException("sink cannot be null");
        }
        if (clock == null) {
            throw new IllegalArgumentException("clock cannot be null");
        }
        this.config = config;
        this.sink = sink;
        this.clock = clock;
    }

    /**
     * 라벨 없이 샘플 기록.
     *
     * @param name 지표 이름
     * @param value 값
     */
    public void record(String name, double value) {
        record(name, value, Map.of());
    }

    /**
     * 샘플 기록 후 필요 시 버퍼 전달.
     *
     * @param name 지표 이름
     * @param value 값
     * @param labels 라벨 (null 허용)
     */
    public void record(String name, double value, Map<String, String> labels) {
        TelemetrySample sample;
        try {
            sample = new TelemetrySample(name, value, clock.instant(), labels);
        } catch (IllegalArgumentException e) {
            droppedSamples.incrementAndGet();
            log.warn("Dropping invalid telemetry sample '{}': {}", name, e.getMessage());
            return;
        }

        lock.lock();
        try {
            buffer.add(sample);
        } finally {
            lock.unlock();
        }

        flushIfDue();
    }

    /**
     * 버퍼가 flushThreshold 이상이면 Sink로 전달하고 비움.
     *
     * @return 전달이 일어났으면 true
     */
    public boolean flushIfDue() {
        List<TelemetrySample> batch = null;
        lock.lock();
        try {
            if (buffer.size() >= config.flushThreshold()) {
                batch = drainBuffer();
            }
        } finally {
            lock.unlock();
        }

        if (batch == null) {
            return false;
        }
        publish(batch);
        return true;
    }

    /**
     * 버퍼를 무조건 Sink로 전달하고 비움.
     *
     * @return 전달된 샘플 수
     */
    public int flush() {
        List<TelemetrySample> batch;
        lock.lock();
        try {
            if (buffer.isEmpty()) {
                return 0;
            }
            batch = drainBuffer();
        } finally {
            lock.unlock();
        }

        publish(batch);
        return batch.size();
    }

    /**
     * 요청 한 건의 결과를 집계 카운터에 반영.
     *
     * @param success 성공 여부
     * @param latency 처리 소요 시간 (null이면 0으로 취급)
     */
    public void recordRequest(boolean success, Duration latency) {
        double latencyMs = latency == null || latency.isNegative() ? 0.0 : latency.toNanos() / 1_000_000.0;

        lock.lock();
        try {
            requestCount++;
            if (!success) {
                errorCount++;
            }
            totalLatencyMs += latencyMs;
            averageLatencyMs = (averageLatencyMs * (requestCount - 1) + latencyMs) / requestCount;
        } finally {
            lock.unlock();
        }
    }

    /**
     * 현재 오류율 조회.
     *
     * @return errorCount / max(requestCount, 1)
     */
    public double errorRate() {
        lock.lock();
        try {
            return (double) errorCount / Math.max(requestCount, 1);
        } finally {
            lock.unlock();
        }
    }

    /**
     * 집계 카운터 스냅샷 조회 (읽기 전용 복사본).
     *
     * @return 스냅샷
     */
    public TelemetrySnapshot snapshot() {
        lock.lock();
        try {
            return new TelemetrySnapshot(
                requestCount,
                errorCount,
                totalLatencyMs,
                averageLatencyMs,
                buffer.size(),
                flushedSamples.get(),
                droppedSamples.get()
            );
        } finally {
            lock.unlock();
        }
    }

    /**
     * 설정 조회.
     *
     * @return 설정
     */
    public TelemetryConfig getConfig() {
        return config;
    }

    private List<TelemetrySample> drainBuffer() {
        List<TelemetrySample> batch = buffer;
        buffer = new ArrayList<>(config.flushThreshold());
        return Collections.unmodifiableList(batch);
    }

    private void publish(List<TelemetrySample> batch) {
        try {
            sink.publish(batch);
            flushedSamples.addAndGet(batch.size());
        } catch (RuntimeException e) {
            droppedSamples.addAndGet(batch.size());
            log.warn("Telemetry sink failed, dropping {} samples", batch.size(), e);
        }
    }
}
