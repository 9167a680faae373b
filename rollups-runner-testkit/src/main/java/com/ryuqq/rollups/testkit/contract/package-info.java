/**
 * Reusable contract tests and fixtures for the runner's SPIs.
 *
 * <p>Adapter modules extend the {@code Abstract*ContractTest} classes in their test
 * sources so every implementation is checked against the same behavior.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
package com.ryuqq.rollups.testkit.contract;
