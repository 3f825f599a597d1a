/**
 * Bridge Application Layer - 요청 처리 API.
 *
 * <p>{@link com.ryuqq.bridge.application.bridge.Bridge}는 포트이며,
 * 구현체는 adapter-runner 모듈에 위치합니다.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
package com.ryuqq.bridge.application.bridge;
