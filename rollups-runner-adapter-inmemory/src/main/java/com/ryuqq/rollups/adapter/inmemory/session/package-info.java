/**
 * In-memory Compute Session adapter.
 *
 * <p>Deterministic stand-in for the compute engine: same checkpoint plus same inputs
 * gives the same epoch claim.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
package com.ryuqq.rollups.adapter.inmemory.session;
