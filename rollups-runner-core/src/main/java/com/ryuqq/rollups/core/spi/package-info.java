/**
 * Service Provider Interface (SPI) package.
 *
 * <p>This package defines the three external collaborators the runner depends on.
 * Adapter modules provide the concrete implementations.</p>
 *
 * <h2>SPI Interfaces</h2>
 * <ul>
 *   <li>{@link com.ryuqq.rollups.core.spi.SnapshotStore} - latest snapshot pointer and snapshot locations</li>
 *   <li>{@link com.ryuqq.rollups.core.spi.EventLog} - input stream and claim stream</li>
 *   <li>{@link com.ryuqq.rollups.core.spi.ComputeSession} - stateful compute engine session</li>
 * </ul>
 *
 * <h2>Failure Model</h2>
 * <p>Each SPI reports failures with its own unchecked exception
 * ({@link com.ryuqq.rollups.core.spi.SnapshotStoreException},
 * {@link com.ryuqq.rollups.core.spi.EventLogException},
 * {@link com.ryuqq.rollups.core.spi.ComputeSessionException}) carrying a reason enum.
 * Retrying transient failures is the implementation's concern; the runner never retries.</p>
 *
 * <h2>Implementations</h2>
 * <ul>
 *   <li>rollups-runner-adapter-inmemory: in-memory implementations of all three SPIs</li>
 *   <li>rollups-runner-adapter-filesystem: filesystem SnapshotStore</li>
 * </ul>
 *
 * @since 1.0.0
 * @author Orchestrator Team
 */
package com.ryuqq.rollups.core.spi;
