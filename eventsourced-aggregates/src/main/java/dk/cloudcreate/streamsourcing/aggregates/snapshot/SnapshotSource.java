package dk.cloudcreate.streamsourcing.aggregates.snapshot;

import dk.cloudcreate.streamsourcing.aggregates.EventSource;

/**
 * An {@link EventSource} that can capture its state in a {@link Snapshot} and be restored from one,
 * so loading it doesn't require replaying its entire history
 *
 * @param <STATE> the snapshot state type. It must be immutable, or at least never changed after the snapshot has been taken
 */
public interface SnapshotSource<STATE> extends EventSource {
    Snapshot<STATE> takeSnapshot();

    /**
     * Set the aggregate's id, state and version from <code>snapshot</code>.<br>
     * Only allowed on an aggregate that hasn't applied any events
     */
    void restoreFromSnapshot(Snapshot<STATE> snapshot);
}
