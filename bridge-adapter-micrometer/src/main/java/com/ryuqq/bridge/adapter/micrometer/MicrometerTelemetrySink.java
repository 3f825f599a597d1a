package com.ryuqq.bridge.adapter.micrometer;

import com.ryuqq.bridge.core.telemetry.TelemetrySample;
import com.ryuqq.bridge.core.telemetry.TelemetrySink;
import io.micrometer.core.instrument.DistributionSummary;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Tag;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Micrometer 기반 TelemetrySink.
 *
 * <p>샘플 하나를 {@code bridge.<name>} 이름의 {@link DistributionSummary}에 기록합니다.
 * 샘플 라벨은 그대로 Meter 태그가 됩니다.</p>
 *
 * <p>라벨 값이 요청마다 달라지는 샘플(예: confidence의 preview)은 태그 조합이 무한히
 * 늘어날 수 있으므로 {@link #MicrometerTelemetrySink(MeterRegistry, List)}로 제외할 라벨
 * 키를 지정합니다. 기본 생성자는 {@code preview}를 제외합니다.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public final class MicrometerTelemetrySink implements TelemetrySink {

    private static final Logger log = LoggerFactory.getLogger(MicrometerTelemetrySink.class);

    /** Meter 이름 접두사. */
    public static final String PREFIX = "bridge.";

    private final MeterRegistry registry;
    private final List<String> ignoredLabels;

    /**
     * 생성자 ({@code preview} 라벨 제외).
     *
     * @param registry Meter 등록 대상
     */
    public MicrometerTelemetrySink(MeterRegistry registry) {
        this(registry, List.of("preview"));
    }

    /**
     * 생성자.
     *
     * @param registry Meter 등록 대상
     * @param ignoredLabels 태그로 옮기지 않을 라벨 키
     * @throws IllegalArgumentException 인자가 null인 경우
     */
    public MicrometerTelemetrySink(MeterRegistry registry, List<String> ignoredLabels) {
        if (registry == null) {
            throw new IllegalArgumentException("registry cannot be null");
        }
        if (ignoredLabels == null) {
            throw new IllegalArgumentException("ignoredLabels cannot be null");
        }
        this.registry = registry;
        this.ignoredLabels = List.copyOf(ignoredLabels);
    }

    @Override
    public void publish(List<TelemetrySample> samples) {
        for (TelemetrySample sample : samples) {
            DistributionSummary.builder(PREFIX + sample.name())
                .tags(tagsOf(sample.labels()))
                .register(registry)
                .record(sample.value());
        }
        log.debug("Published {} telemetry samples to {}", samples.size(), registry.getClass().getSimpleName());
    }

    private List<Tag> tagsOf(Map<String, String> labels) {
        List<Tag> tags = new ArrayList<>(labels.size());
        for (Map.Entry<String, String> label : labels.entrySet()) {
            if (!ignoredLabels.contains(label.getKey()) && label.getValue() != null) {
                tags.add(Tag.of(label.getKey(), label.getValue()));
            }
        }
        return tags;
    }
}
