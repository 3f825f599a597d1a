/**
 * Bridge 실패 분류와 실패 신호 예외.
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
package com.ryuqq.bridge.core.failure;
