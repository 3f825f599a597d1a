/**
 * Protection SPI의 NoOp (No Operation) 기본 구현.
 *
 * <p>모든 요청을 허용하고 상태를 추적하지 않습니다.
 * 특정 보호 장치를 끄고 Bridge를 실행할 때 사용합니다.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
package com.ryuqq.bridge.core.protection.noop;
