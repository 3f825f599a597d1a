package com.ryuqq.bridge.core.spi;

import com.ryuqq.bridge.core.model.Request;
import com.ryuqq.bridge.core.model.Result;

import java.util.Map;
import java.util.concurrent.CompletableFuture;

/**
 * Backend Handler SPI.
 *
 * <p>Bridge가 보호하는 외부 요청 처리기입니다. Bridge는 구체 구현을 가정하지 않으며,
 * 이 인터페이스를 구현한 어떤 백엔드든 연결할 수 있습니다.</p>
 *
 * <p><strong>계약:</strong></p>
 * <ul>
 *   <li>{@link #handle(Request)}는 비블로킹으로 즉시 future를 반환해야 합니다.</li>
 *   <li>실패는 예외로 완료된 future 또는 {@code success = false}인 Result로 표현합니다.
 *       Bridge는 두 경우를 원인과 무관하게 동일한 실패로 취급합니다.</li>
 *   <li>지연 시간에 대한 계약은 없습니다 (타임아웃은 Bridge가 적용).</li>
 * </ul>
 *
 * <p><strong>동시성:</strong> 구현체는 thread-safe해야 합니다.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public interface BackendHandler {

    /**
     * 요청 처리 (비동기).
     *
     * @param request 처리할 요청
     * @return 처리 결과 future
     */
    CompletableFuture<Result> handle(Request request);

    /**
     * 백엔드 상태 조회 (Health 보고용).
     *
     * @return 상태 문자열 (기본값: "ready")
     */
    default String getStatus() {
        return "ready";
    }

    /**
     * 백엔드 자체 지표 조회 (Metrics 보고용).
     *
     * @return 지표 맵 (기본값: 빈 맵)
     */
    default Map<String, Object> getMetrics() {
        return Map.of();
    }
}
