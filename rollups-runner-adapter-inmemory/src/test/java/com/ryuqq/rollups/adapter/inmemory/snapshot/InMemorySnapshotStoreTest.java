package com.ryuqq.rollups.adapter.inmemory.snapshot;

import com.ryuqq.rollups.core.model.Snapshot;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class InMemorySnapshotStoreTest {

    @Test
    void getStorageDirectory_UsesMemoryLocation() {
        InMemorySnapshotStore store = new InMemorySnapshotStore();

        assertThat(store.getStorageDirectory(4).path()).isEqualTo("memory://snapshots/4");
    }

    @Test
    void constructor_WithInitialSnapshot_IsLatestWithoutHistory() {
        Snapshot initial = Snapshot.of(InMemorySnapshotStore.locationOf(3), 3);

        InMemorySnapshotStore store = new InMemorySnapshotStore(initial);

        assertThat(store.getLatest()).isEqualTo(initial);
        assertThat(store.getHistory()).isEmpty();
    }

    @Test
    void setLatest_RecordsHistoryInOrder() {
        InMemorySnapshotStore store = new InMemorySnapshotStore();
        Snapshot first = store.getStorageDirectory(1);
        Snapshot second = store.getStorageDirectory(2);

        store.setLatest(first);
        store.setLatest(second);

        assertThat(store.getHistory()).containsExactly(first, second);
    }

    @Test
    void constructor_NullInitial_ThrowsIllegalArgument() {
        assertThatThrownBy(() -> new InMemorySnapshotStore(null))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessage("initial cannot be null");
    }
}
