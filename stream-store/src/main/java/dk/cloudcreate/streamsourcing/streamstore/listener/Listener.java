package dk.cloudcreate.streamsourcing.streamstore.listener;

import dk.cloudcreate.streamsourcing.common.Lifecycle;

import java.time.Duration;
import java.util.*;

/**
 * A listener subscribes to a single stream (an aggregate stream, a category stream, an event type stream or a custom named stream),
 * catches up with the events already in the stream and afterwards receives new events as they're appended.<br>
 * Received events are deserialized and handed to the {@link ListenerEventHandler}'s added using {@link #addEventHandler(ListenerEventHandler)}
 */
public interface Listener extends Lifecycle {
    Duration DEFAULT_LIVE_TIMEOUT = Duration.ofSeconds(1);

    String listenerName();

    /**
     * @return the name of the stream the listener was started on
     */
    Optional<String> streamName();

    /**
     * @return the event number of the last event handled (in the stream the listener was started on)
     */
    Optional<Long> position();

    /**
     * @return true if the listener has caught up with its stream and now receives events as they're appended
     */
    boolean isLive();

    /**
     * Add a handler that will receive every event the listener receives
     */
    void addEventHandler(ListenerEventHandler eventHandler);

    /**
     * Start listening on a named stream
     *
     * @param streamName     the exact stream name. The stream doesn't have to exist yet
     * @param checkpoint     the event number of the last event that has already been handled. Listening starts with the next event.
     *                       If empty, then listening starts with the first event in the stream
     * @param blockUntilLive wait until the listener has caught up with the stream before returning
     * @param timeout        the maximum time to wait if <code>blockUntilLive</code> is true
     * @throws ListenerTimeoutException if <code>blockUntilLive</code> is true and the listener didn't catch up within the <code>timeout</code>
     * @throws IllegalStateException    if the listener is already started
     */
    void start(String streamName, Optional<Long> checkpoint, boolean blockUntilLive, Duration timeout);

    default void start(String streamName) {
        start(streamName, Optional.empty(), false, DEFAULT_LIVE_TIMEOUT);
    }

    /**
     * Start listening on the stream of a single aggregate instance
     */
    void startForAggregate(Class<?> aggregateType, UUID aggregateId, Optional<Long> checkpoint, boolean blockUntilLive, Duration timeout);

    /**
     * Start listening on the category stream containing the events of all instances of <code>aggregateType</code>
     */
    void startForCategory(Class<?> aggregateType, Optional<Long> checkpoint, boolean blockUntilLive, Duration timeout);

    /**
     * Start listening on the stream containing all events of the given type
     */
    void startForEventType(Class<?> eventType, Optional<Long> checkpoint, boolean blockUntilLive, Duration timeout);
}
