package dk.cloudcreate.streamsourcing.aggregates.snapshot;

import org.junit.jupiter.api.Test;

import java.util.UUID;

import static org.assertj.core.api.Assertions.*;

class InMemorySnapshotStoreTest {
    private final UUID aggregateId = UUID.randomUUID();

    @Test
    void the_newest_snapshot_at_or_below_the_requested_version_is_loaded() {
        // Given
        var store = new InMemorySnapshotStore();
        store.save("account-1", new Snapshot<>(aggregateId, 5, "five"));
        store.save("account-1", new Snapshot<>(aggregateId, 10, "ten"));
        store.save("account-2", new Snapshot<>(UUID.randomUUID(), 20, "other"));

        // Then
        assertThat(store.loadLatest("account-1")).hasValueSatisfying(snapshot -> assertThat(snapshot.state()).isEqualTo("ten"));
        assertThat(store.loadLatest("account-1", 10)).hasValueSatisfying(snapshot -> assertThat(snapshot.version()).isEqualTo(10));
        assertThat(store.loadLatest("account-1", 9)).hasValueSatisfying(snapshot -> assertThat(snapshot.state()).isEqualTo("five"));
        assertThat(store.loadLatest("account-1", 4)).isEmpty();
        assertThat(store.loadLatest("unknown")).isEmpty();
    }

    @Test
    void deleting_removes_all_snapshots_of_the_stream() {
        var store = new InMemorySnapshotStore();
        store.save("account-1", new Snapshot<>(aggregateId, 5, "five"));
        store.save("account-2", new Snapshot<>(UUID.randomUUID(), 5, "other"));

        store.delete("account-1");

        assertThat(store.loadLatest("account-1")).isEmpty();
        assertThat(store.snapshotVersions("account-2")).containsExactly(5L);
    }

    @Test
    void the_none_store_never_finds_a_snapshot() {
        var store = SnapshotStore.none();
        store.save("account-1", new Snapshot<>(aggregateId, 5, "five"));

        assertThat(store.loadLatest("account-1")).isEmpty();
    }

    @Test
    void a_snapshot_requires_a_positive_version_and_a_state() {
        assertThatThrownBy(() -> new Snapshot<>(aggregateId, 0, "zero"))
                .isExactlyInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> new Snapshot<>(aggregateId, 1, null))
                .isExactlyInstanceOf(IllegalArgumentException.class);
    }
}
