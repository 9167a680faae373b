package com.ryuqq.rollups.adapter.inmemory.snapshot;

import com.ryuqq.rollups.core.model.Snapshot;
import com.ryuqq.rollups.core.spi.SnapshotStore;
import com.ryuqq.rollups.core.spi.SnapshotStoreException;

import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicReference;

/**
 * In-memory implementation of {@link SnapshotStore} for testing and reference purposes.
 *
 * <p>Locations are virtual ({@code memory://snapshots/<epoch>}); nothing is written
 * by the store itself. Pair it with {@code InMemoryComputeSession}, which keeps the
 * checkpoint content under the same location.</p>
 *
 * <p><strong>Thread Safety:</strong> the latest pointer is an {@link AtomicReference}.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public class InMemorySnapshotStore implements SnapshotStore {

    /** Prefix of every location handed out by this store. */
    public static final String LOCATION_PREFIX = "memory://snapshots/";

    private final AtomicReference<Snapshot> latest = new AtomicReference<>();
    private final List<Snapshot> history = new CopyOnWriteArrayList<>();

    /**
     * Creates an empty store without a latest snapshot.
     */
    public InMemorySnapshotStore() {
    }

    /**
     * Creates a store whose latest snapshot is already set.
     *
     * @param initial initial latest snapshot
     * @throws IllegalArgumentException if initial is null
     */
    public InMemorySnapshotStore(Snapshot initial) {
        if (initial == null) {
            throw new IllegalArgumentException("initial cannot be null");
        }
        latest.set(initial);
    }

    /**
     * Builds the location for an epoch.
     *
     * @param epoch epoch index
     * @return location string
     */
    public static String locationOf(long epoch) {
        return LOCATION_PREFIX + epoch;
    }

    /**
     * {@inheritDoc}
     */
    @Override
    public Snapshot getLatest() {
        Snapshot snapshot = latest.get();
        if (snapshot == null) {
            throw new SnapshotStoreException(SnapshotStoreException.Reason.NOT_FOUND, "no latest snapshot");
        }
        return snapshot;
    }

    /**
     * {@inheritDoc}
     */
    @Override
    public Snapshot getStorageDirectory(long epoch) {
        if (epoch < 0) {
            throw new IllegalArgumentException("epoch must be non-negative (current: " + epoch + ")");
        }
        return Snapshot.of(locationOf(epoch), epoch);
    }

    /**
     * {@inheritDoc}
     */
    @Override
    public void setLatest(Snapshot snapshot) {
        if (snapshot == null) {
            throw new IllegalArgumentException("snapshot cannot be null");
        }
        latest.set(snapshot);
        history.add(snapshot);
    }

    /**
     * Returns every snapshot passed to {@link #setLatest(Snapshot)}, in call order.
     *
     * @return promotion history
     */
    public List<Snapshot> getHistory() {
        return List.copyOf(history);
    }
}
