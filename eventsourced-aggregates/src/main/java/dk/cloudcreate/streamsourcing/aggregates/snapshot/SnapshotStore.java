package dk.cloudcreate.streamsourcing.aggregates.snapshot;

import java.util.Optional;

/**
 * Stores {@link Snapshot}'s per stream
 *
 * @see InMemorySnapshotStore
 * @see #none()
 */
public interface SnapshotStore {
    /**
     * A {@link SnapshotStore} that stores nothing and never finds a snapshot
     */
    SnapshotStore NONE = new SnapshotStore() {
        @Override
        public void save(String streamName, Snapshot<?> snapshot) {
        }

        @Override
        public Optional<Snapshot<?>> loadLatest(String streamName, long atOrBelowVersion) {
            return Optional.empty();
        }

        @Override
        public void delete(String streamName) {
        }

        @Override
        public String toString() {
            return "SnapshotStore.none()";
        }
    };

    static SnapshotStore none() {
        return NONE;
    }

    void save(String streamName, Snapshot<?> snapshot);

    /**
     * Find the newest snapshot of <code>streamName</code> whose version is at or below <code>atOrBelowVersion</code>
     */
    Optional<Snapshot<?>> loadLatest(String streamName, long atOrBelowVersion);

    default Optional<Snapshot<?>> loadLatest(String streamName) {
        return loadLatest(streamName, Long.MAX_VALUE);
    }

    /**
     * Delete all snapshots of <code>streamName</code>
     */
    void delete(String streamName);
}
