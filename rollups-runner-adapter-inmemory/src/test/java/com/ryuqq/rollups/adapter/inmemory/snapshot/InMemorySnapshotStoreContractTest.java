package com.ryuqq.rollups.adapter.inmemory.snapshot;

import com.ryuqq.rollups.core.model.Snapshot;
import com.ryuqq.rollups.core.spi.SnapshotStore;
import com.ryuqq.rollups.testkit.contract.AbstractSnapshotStoreContractTest;

class InMemorySnapshotStoreContractTest extends AbstractSnapshotStoreContractTest {

    @Override
    protected SnapshotStore createStore() {
        return new InMemorySnapshotStore();
    }

    @Override
    protected void writeSnapshot(Snapshot snapshot) {
        // locations are virtual
    }
}
