/**
 * Result Cache SPI 및 설정.
 *
 * <p>구현체는 {@code bridge-adapter-inmemory} 모듈에 있습니다.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
package com.ryuqq.bridge.core.cache;
