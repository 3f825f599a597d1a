package com.ryuqq.bridge.application.gateway;

import com.ryuqq.bridge.application.bridge.Bridge;
import com.ryuqq.bridge.application.health.BridgeMetrics;
import com.ryuqq.bridge.application.health.HealthReporter;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.concurrent.CompletableFuture;

/**
 * Message Gateway.
 *
 * <p>전송 계층(HTTP 등)이 노출할 논리적 엔드포인트 세 가지를 제공합니다.</p>
 * <ul>
 *   <li>{@link #handleMessage(MessageRequest)}: 메시지 처리</li>
 *   <li>{@link #health()}: Health + 가동 시간</li>
 *   <li>{@link #metrics()}: 집계 지표</li>
 * </ul>
 *
 * <p>전송 계층 자체는 포함하지 않습니다.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public final class MessageGateway {

    private final Bridge bridge;
    private final HealthReporter reporter;
    private final Clock clock;
    private final Instant startedAt;

    /**
     * 생성자 (시스템 시계).
     *
     * @param bridge 요청 처리 Bridge
     * @param reporter Health/Metrics 조회
     */
    public MessageGateway(Bridge bridge, HealthReporter reporter) {
        this(bridge, reporter, Clock.systemUTC());
    }

    /**
     * 생성자.
     *
     * @param bridge 요청 처리 Bridge
     * @param reporter Health/Metrics 조회
     * @param clock 응답 시각 및 가동 시간 기준 시계
     * @throws IllegalArgumentException 인자가 null인 경우
     */
    public MessageGateway(Bridge bridge, HealthReporter reporter, Clock clock) {
        if (bridge == null) {
            throw new IllegalArgumentException("bridge cannot be null");
        }
        if (reporter == null) {
            throw new IllegalArgumentException("reporter cannot be null");
        }
        if (clock == null) {
            throw new IllegalArgumentException("clock cannot be null");
        }
        this.bridge = bridge;
        this.reporter = reporter;
        this.clock = clock;
        this.startedAt = clock.instant();
    }

    /**
     * 메시지 처리.
     *
     * @param message 입력 메시지
     * @return 응답 future (예외로 완료되지 않음)
     * @throws IllegalArgumentException message가 null인 경우
     */
    public CompletableFuture<MessageResponse> handleMessage(MessageRequest message) {
        if (message == null) {
            throw new IllegalArgumentException("message cannot be null");
        }
        return bridge.execute(message.toRequest())
            .thenApply(result -> MessageResponse.from(result, clock.instant()));
    }

    /**
     * Health 조회.
     *
     * @return Bridge Health와 가동 시간
     */
    public GatewayHealth health() {
        Duration uptime = Duration.between(startedAt, clock.instant());
        return new GatewayHealth(reporter.health(), uptime.isNegative() ? Duration.ZERO : uptime);
    }

    /**
     * 지표 조회.
     *
     * @return Bridge 집계 지표
     */
    public BridgeMetrics metrics() {
        return reporter.metrics();
    }
}
