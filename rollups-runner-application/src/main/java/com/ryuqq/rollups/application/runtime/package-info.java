/**
 * Runner Runtime Layer.
 *
 * <p>{@link com.ryuqq.rollups.application.runtime.Runtime} is the contract of the
 * rollups runner loop. The implementation lives in rollups-runner-adapter-runner.</p>
 *
 * <h2>Architecture</h2>
 * <pre>
 * adapter-runner (AdvanceRunner)
 *   ↓ implements
 * application (Runtime, RunnerException taxonomy)
 *   ↓ depends on
 * core (model, spi, statemachine)
 * </pre>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
package com.ryuqq.rollups.application.runtime;
