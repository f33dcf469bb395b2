package dk.cloudcreate.streamsourcing.aggregates.snapshot;

import java.util.*;
import java.util.concurrent.*;

import static dk.cloudcreate.essentials.shared.FailFast.requireNonNull;

/**
 * Thread-safe {@link SnapshotStore} that keeps all snapshots in memory
 */
public final class InMemorySnapshotStore implements SnapshotStore {
    private final ConcurrentMap<String, ConcurrentNavigableMap<Long, Snapshot<?>>> snapshots = new ConcurrentHashMap<>();

    @Override
    public void save(String streamName, Snapshot<?> snapshot) {
        requireNonNull(streamName, "No streamName provided");
        requireNonNull(snapshot, "No snapshot provided");
        snapshots.computeIfAbsent(streamName, name -> new ConcurrentSkipListMap<>())
                 .put(snapshot.version(), snapshot);
    }

    @Override
    public Optional<Snapshot<?>> loadLatest(String streamName, long atOrBelowVersion) {
        requireNonNull(streamName, "No streamName provided");
        var streamSnapshots = snapshots.get(streamName);
        if (streamSnapshots == null) {
            return Optional.empty();
        }
        return Optional.ofNullable(streamSnapshots.floorEntry(atOrBelowVersion))
                       .map(Map.Entry::getValue);
    }

    @Override
    public void delete(String streamName) {
        requireNonNull(streamName, "No streamName provided");
        snapshots.remove(streamName);
    }

    /**
     * @return the versions of the snapshots stored for <code>streamName</code> in ascending order
     */
    public List<Long> snapshotVersions(String streamName) {
        var streamSnapshots = snapshots.get(streamName);
        return streamSnapshots == null ? List.of() : List.copyOf(streamSnapshots.keySet());
    }
}
