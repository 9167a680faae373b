/**
 * In-memory Snapshot Store adapter.
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
package com.ryuqq.rollups.adapter.inmemory.snapshot;
