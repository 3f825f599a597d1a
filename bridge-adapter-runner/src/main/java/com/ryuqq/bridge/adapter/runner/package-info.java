/**
 * Bridge Runner - {@link com.ryuqq.bridge.application.bridge.Bridge} 구현체와 구성.
 *
 * <h2>핵심 클래스</h2>
 * <ul>
 *   <li>{@link com.ryuqq.bridge.adapter.runner.ResilientBridge} - Admission → Cache → Circuit Breaker → Backend 조정</li>
 *   <li>{@link com.ryuqq.bridge.adapter.runner.BridgeConfig} - 불변 설정 record</li>
 *   <li>{@link com.ryuqq.bridge.adapter.runner.BridgeHealthReporter} - 읽기 전용 Health/Metrics</li>
 *   <li>{@link com.ryuqq.bridge.adapter.runner.ExecutorBackendHandler} - 블로킹 함수용 BackendHandler</li>
 * </ul>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
package com.ryuqq.bridge.adapter.runner;
