package dk.cloudcreate.streamsourcing.aggregates.snapshot;

import java.util.*;

import static dk.cloudcreate.essentials.shared.FailFast.*;

/**
 * A point in time copy of an aggregate's state
 *
 * @param <STATE> the type of the (opaque) aggregate state
 */
public final class Snapshot<STATE> {
    private final UUID  aggregateId;
    private final long  version;
    private final STATE state;

    /**
     * @param aggregateId the id of the aggregate the snapshot was taken of
     * @param version     the version (number of applied events) of the aggregate when the snapshot was taken
     * @param state       the aggregate state
     */
    public Snapshot(UUID aggregateId, long version, STATE state) {
        this.aggregateId = requireNonNull(aggregateId, "No aggregateId provided");
        requireTrue(version > 0, "A snapshot version must be > 0");
        this.version = version;
        this.state = requireNonNull(state, "No state provided");
    }

    public UUID aggregateId() {
        return aggregateId;
    }

    public long version() {
        return version;
    }

    public STATE state() {
        return state;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Snapshot)) return false;
        Snapshot<?> snapshot = (Snapshot<?>) o;
        return version == snapshot.version && aggregateId.equals(snapshot.aggregateId) && state.equals(snapshot.state);
    }

    @Override
    public int hashCode() {
        return Objects.hash(aggregateId, version, state);
    }

    @Override
    public String toString() {
        return "Snapshot{" +
                "aggregateId=" + aggregateId +
                ", version=" + version +
                ", state=" + state +
                '}';
    }
}
