package dk.cloudcreate.streamsourcing.streamstore;

import dk.cloudcreate.streamsourcing.streamstore.subscription.*;
import dk.cloudcreate.streamsourcing.streamstore.types.ExpectedVersion;

import java.util.*;
import java.util.function.*;

/**
 * The logical contract of an event stream store.<br>
 * Streams are addressed by name. Every stream is an ordered, append-only sequence of events, where each event
 * has a zero based event number. The version of a stream is the number of events in it.
 * <p>
 * Implementations MUST be thread-safe, as a single connection is shared by many repositories and listeners.
 */
public interface StreamStoreConnection extends AutoCloseable {
    /**
     * @return the name of this connection (used for logging)
     */
    String connectionName();

    void connect();

    /**
     * Close the connection. All active subscriptions are dropped with {@link SubscriptionDropReason#CONNECTION_CLOSED}
     */
    @Override
    void close();

    /**
     * Append events to a stream
     *
     * @param streamName      the name of the stream
     * @param expectedVersion the version the caller expects the stream to be at (see {@link ExpectedVersion})
     * @param events          the events to append
     * @return the result of the append
     * @throws WrongExpectedVersionException   if the stream isn't at the expected version
     * @throws StreamDeletedException          if the stream has been deleted
     * @throws StreamStoreUnavailableException if the store couldn't be reached
     */
    WriteResult appendToStream(String streamName, ExpectedVersion expectedVersion, List<EventData> events);

    default WriteResult appendToStream(String streamName, ExpectedVersion expectedVersion, EventData... events) {
        return appendToStream(streamName, expectedVersion, Arrays.asList(events));
    }

    /**
     * Read up to <code>count</code> events from a stream, starting with (and including) event number <code>start</code>
     *
     * @return the slice read. If the stream doesn't exist or has been deleted, then the {@link StreamEventsSlice#status()}
     * reflects this
     */
    StreamEventsSlice readStreamForward(String streamName, long start, long count);

    /**
     * Read up to <code>count</code> events from a stream backwards, starting with (and including) event number <code>start</code>.<br>
     * Use {@link StreamPosition#END} to start from the last event in the stream
     */
    StreamEventsSlice readStreamBackward(String streamName, long start, long count);

    /**
     * Subscribe to a stream. All events after <code>lastCheckpoint</code> (or all events if no checkpoint is provided) are delivered
     * to <code>eventAppeared</code>, after which <code>liveProcessingStarted</code> is called and new events are delivered as they're appended.<br>
     * Callbacks are called on a thread owned by the subscription and never concurrently.
     *
     * @param streamName            the stream to subscribe to. The stream doesn't have to exist yet
     * @param lastCheckpoint        the event number of the last event already processed by the subscriber
     * @param eventAppeared         called for every event
     * @param liveProcessingStarted called once all historic events have been delivered
     * @param subscriptionDropped   called when the subscription is dropped
     * @return the subscription
     */
    StreamSubscription subscribeToStreamFrom(String streamName,
                                             Optional<Long> lastCheckpoint,
                                             Consumer<RecordedEvent> eventAppeared,
                                             Runnable liveProcessingStarted,
                                             BiConsumer<SubscriptionDropReason, Exception> subscriptionDropped);

    /**
     * Soft delete a stream. The stream can't be read or appended to afterwards, but its events remain visible in
     * the projection streams (category, event-type and all)
     *
     * @throws WrongExpectedVersionException if the stream isn't at the expected version
     * @throws StreamNotFoundException       if the stream doesn't exist
     * @throws StreamDeletedException        if the stream has already been deleted
     */
    void deleteStream(String streamName, ExpectedVersion expectedVersion);

    /**
     * Permanently delete a stream including its events. The stream name can never be used again
     *
     * @throws WrongExpectedVersionException if the stream isn't at the expected version
     * @throws StreamNotFoundException       if the stream doesn't exist
     * @throws StreamDeletedException        if the stream has already been hard deleted
     */
    void hardDeleteStream(String streamName, ExpectedVersion expectedVersion);
}
