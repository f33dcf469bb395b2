package dk.cloudcreate.streamsourcing.streamstore.readmodel;

import dk.cloudcreate.streamsourcing.streamstore.StreamStoreConnection;
import dk.cloudcreate.streamsourcing.streamstore.listener.Listener;
import dk.cloudcreate.streamsourcing.streamstore.naming.StreamNameBuilder;
import dk.cloudcreate.streamsourcing.streamstore.serializer.EventSerializer;
import org.slf4j.Logger;

import java.time.Duration;
import java.util.function.Supplier;

import static dk.cloudcreate.essentials.shared.FailFast.requireNonNull;
import static dk.cloudcreate.essentials.shared.MessageFormatter.msg;

/**
 * A {@link ReadModelBase} whose state can be captured using {@link #getState()} and later restored using {@link #restore(ReadModelState)},
 * after which the read model continues listening on the streams captured in the {@link ReadModelState#checkpoints()} from the position
 * recorded for each stream.
 *
 * @param <STATE> the type of read model state
 */
public abstract class SnapshotReadModel<STATE> extends ReadModelBase {
    public static final Duration DEFAULT_RESTORE_TIMEOUT = Duration.ofSeconds(5);

    private boolean restored;

    protected SnapshotReadModel(String readModelName,
                                StreamStoreConnection connection,
                                StreamNameBuilder streamNameBuilder,
                                EventSerializer eventSerializer) {
        super(readModelName, connection, streamNameBuilder, eventSerializer);
    }

    protected SnapshotReadModel(String readModelName, Supplier<Listener> listenerFactory) {
        super(readModelName, listenerFactory);
    }

    protected SnapshotReadModel(String readModelName, Supplier<Listener> listenerFactory, Logger log) {
        super(readModelName, listenerFactory, log);
    }

    /**
     * @return a copy of the current read model state (must not be shared with the read model)
     */
    protected abstract STATE currentState();

    /**
     * Replace the read model state with <code>state</code>
     */
    protected abstract void applyState(STATE state);

    /**
     * Capture the current state together with the checkpoints of all listeners
     */
    public ReadModelState<STATE> getState() {
        synchronized (handlerLock) {
            return new ReadModelState<>(readModelName(), getCheckpoints(), currentState());
        }
    }

    public void restore(ReadModelState<STATE> state) {
        restore(state, DEFAULT_RESTORE_TIMEOUT);
    }

    /**
     * Restore the read model state and start a listener for each of the {@link ReadModelState#checkpoints()}.<br>
     * A read model can only be restored once.
     *
     * @param state                 the state to restore
     * @param blockUntilLiveTimeout how long to wait for each listener to catch up with its stream
     * @throws IllegalStateException    if the read model has already been restored
     * @throws IllegalArgumentException if the state belongs to another read model
     */
    public void restore(ReadModelState<STATE> state, Duration blockUntilLiveTimeout) {
        requireNonNull(state, "No state provided");
        requireNonNull(blockUntilLiveTimeout, "No blockUntilLiveTimeout provided");
        if (!readModelName().equals(state.readModelName())) {
            throw new IllegalArgumentException(msg("Can't restore read model '{}' using the state of read model '{}'",
                                                   readModelName(),
                                                   state.readModelName()));
        }
        synchronized (handlerLock) {
            if (restored) {
                throw new IllegalStateException(msg("Read model '{}' has already been restored", readModelName()));
            }
            restored = true;
            applyState(state.state());
        }
        state.checkpoints().forEach(checkpoint -> start(checkpoint.streamName(),
                                                        checkpoint.position(),
                                                        true,
                                                        blockUntilLiveTimeout));
    }
}
