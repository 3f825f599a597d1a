/**
 * Bridge 도메인 모델.
 *
 * <ul>
 *   <li>{@link com.ryuqq.bridge.core.model.Request}: 불변 요청 (본문, 요청자, 메타데이터, Fingerprint)</li>
 *   <li>{@link com.ryuqq.bridge.core.model.Fingerprint}: 본문 SHA-256 다이제스트 (캐시 키)</li>
 *   <li>{@link com.ryuqq.bridge.core.model.Result}: 불변 처리 결과</li>
 * </ul>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
package com.ryuqq.bridge.core.model;
