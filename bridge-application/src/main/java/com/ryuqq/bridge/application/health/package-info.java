/**
 * Health/Metrics 조회 포트와 읽기 모델.
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
package com.ryuqq.bridge.application.health;
