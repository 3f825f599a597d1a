/**
 * Contract test support for bridge implementations.
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
package com.ryuqq.bridge.testkit.contract;
