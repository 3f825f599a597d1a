package com.ryuqq.bridge.application.bridge;

import com.ryuqq.bridge.core.model.Request;
import com.ryuqq.bridge.core.model.Result;

import java.util.concurrent.CompletableFuture;

/**
 * Bridge 실행 계약.
 *
 * <p>백엔드 앞단에서 Admission → Cache → Circuit Breaker → Backend 순서로 요청을 처리하고,
 * 어떤 경우에도 균일한 {@link Result}를 반환합니다.</p>
 *
 * <p><strong>사용 예시:</strong></p>
 * <pre>
 * Request request = Request.of("What is my order status for #12345?", "user-001");
 * Result result = bridge.execute(request).join();
 *
 * if (result.success()) {
 *     // 백엔드 결과 또는 캐시된 결과
 * } else {
 *     // result.failureType(): ADMISSION_REJECTED, BREAKER_OPEN, BACKEND_FAILURE ...
 * }
 * </pre>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public interface Bridge {

    /**
     * 요청 처리.
     *
     * <p>반환된 future는 예외로 완료되지 않습니다. 모든 실패는
     * {@code success = false}인 Result로 표현됩니다.</p>
     *
     * @param request 처리할 요청
     * @return 처리 결과 future
     * @throws IllegalArgumentException request가 null인 경우
     */
    CompletableFuture<Result> execute(Request request);
}
