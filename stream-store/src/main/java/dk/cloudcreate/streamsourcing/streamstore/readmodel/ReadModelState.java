package dk.cloudcreate.streamsourcing.streamstore.readmodel;

import java.util.*;

import static dk.cloudcreate.essentials.shared.FailFast.requireNonNull;

/**
 * Snapshot of a {@link SnapshotReadModel}: the read model state together with the checkpoints of the listeners that built it
 *
 * @param <STATE> the type of read model state
 */
public final class ReadModelState<STATE> {
    private final String                    readModelName;
    private final List<ReadModelCheckpoint> checkpoints;
    private final STATE                     state;

    /**
     * @param readModelName the name of the read model
     * @param checkpoints   the listener checkpoints. May be empty, in which case restoring the state doesn't start any listeners
     * @param state         the read model state
     */
    public ReadModelState(String readModelName, List<ReadModelCheckpoint> checkpoints, STATE state) {
        this.readModelName = requireNonNull(readModelName, "No readModelName provided");
        this.checkpoints = List.copyOf(requireNonNull(checkpoints, "No checkpoints provided"));
        this.state = requireNonNull(state, "No state provided");
    }

    public String readModelName() {
        return readModelName;
    }

    public List<ReadModelCheckpoint> checkpoints() {
        return checkpoints;
    }

    public STATE state() {
        return state;
    }

    @Override
    public String toString() {
        return "ReadModelState{" +
                "readModelName='" + readModelName + '\'' +
                ", checkpoints=" + checkpoints +
                ", state=" + state +
                '}';
    }
}
