/**
 * Bridge 외부 협력자 SPI.
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
package com.ryuqq.bridge.core.spi;
