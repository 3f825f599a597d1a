/**
 * 전송 계층이 노출할 논리적 서비스 엔드포인트.
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
package com.ryuqq.bridge.application.gateway;
