package com.ryuqq.rollups.core.spi;

import com.ryuqq.rollups.core.model.Snapshot;

/**
 * Durable Snapshot Storage SPI.
 *
 * <p>This interface abstracts where and how compute-session checkpoints are physically
 * persisted (filesystem, object storage, etc.). The runner only reads and writes
 * {@link Snapshot} values through it.</p>
 *
 * <p><strong>Responsibilities:</strong></p>
 * <ul>
 *   <li>Returning the snapshot currently marked as "latest"</li>
 *   <li>Allocating a fresh, writable location for a future snapshot</li>
 *   <li>Atomically moving the "latest" pointer to a written snapshot</li>
 * </ul>
 *
 * <p><strong>Epoch Tagging:</strong></p>
 * <pre>
 * finish epoch N
 *   → getStorageDirectory(N + 1)   // location for the state epoch N+1 resumes from
 *   → session writes checkpoint
 *   → setLatest(snapshot{epoch: N + 1})
 * </pre>
 *
 * <p><strong>Implementation Requirements:</strong></p>
 * <ul>
 *   <li>Single writer: only one runner updates the "latest" pointer</li>
 *   <li>Atomic pointer update: a reader never observes a half-written pointer</li>
 * </ul>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public interface SnapshotStore {

    /**
     * Retrieves the snapshot currently marked as latest.
     *
     * @return the latest snapshot
     * @throws SnapshotStoreException with {@code NOT_FOUND} if no snapshot was ever recorded,
     *         or {@code STORE_UNAVAILABLE} if the store cannot be read
     */
    Snapshot getLatest();

    /**
     * Allocates a fresh location tagged with {@code epoch}.
     *
     * <p>The returned snapshot is not yet "latest"; it only becomes so after
     * {@link #setLatest(Snapshot)} is called.</p>
     *
     * @param epoch the epoch the snapshot will resume into
     * @return a snapshot pointing at a writable location
     * @throws IllegalArgumentException if epoch is negative
     * @throws SnapshotStoreException with {@code ALLOCATION_FAILED} or {@code STORE_UNAVAILABLE}
     */
    Snapshot getStorageDirectory(long epoch);

    /**
     * Atomically records {@code snapshot} as the latest one.
     *
     * @param snapshot a snapshot previously allocated and written
     * @throws IllegalArgumentException if snapshot is null
     * @throws SnapshotStoreException with {@code STORE_UNAVAILABLE}, or {@code NOT_FOUND}
     *         if nothing was written at the snapshot location
     */
    void setLatest(Snapshot snapshot);
}
