package dk.cloudcreate.streamsourcing.streamstore.inmemory;

import dk.cloudcreate.streamsourcing.streamstore.*;
import dk.cloudcreate.streamsourcing.streamstore.subscription.*;
import dk.cloudcreate.streamsourcing.streamstore.types.ExpectedVersion;
import org.slf4j.*;

import java.time.Clock;
import java.util.*;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.function.*;
import java.util.stream.Collectors;

import static dk.cloudcreate.essentials.shared.FailFast.*;
import static dk.cloudcreate.essentials.shared.MessageFormatter.msg;

/**
 * Thread-safe, in-memory {@link StreamStoreConnection}.<br>
 * Besides the streams appended to directly, the connection maintains the following projection streams, which contain links
 * to the original events:
 * <ul>
 *     <li><code>$ce-{category}</code> - where category is the part of the stream name before the first <code>-</code></li>
 *     <li><code>$et-{eventType}</code> - one per {@link EventData#eventType()}</li>
 *     <li><code>$all</code> - every event appended</li>
 * </ul>
 * Projection streams are read-only: appending to, or deleting, a stream whose name starts with <code>$</code> is rejected.<br>
 * A soft deleted stream can't be read or appended to, but its events remain visible in the projection streams.
 * A hard deleted stream loses its events, so links to them are skipped when reading or subscribing to a projection stream.
 */
public final class InMemoryStreamStoreConnection implements StreamStoreConnection {
    public static final String SYSTEM_STREAM_PREFIX       = "$";
    public static final String CATEGORY_STREAM_PREFIX     = "$ce-";
    public static final String EVENT_TYPE_STREAM_PREFIX   = "$et-";
    public static final String ALL_STREAM                 = "$all";

    private final Logger                                           log;
    private final String                                           connectionName;
    private final Clock                                            clock;
    private final Object                                           lock          = new Object();
    private final Map<String, MemoryStream>                        streams       = new HashMap<>();
    private final Set<String>                                      purgedStreams = new HashSet<>();
    private final Map<String, List<InMemoryCatchUpSubscription>>   subscriptions = new HashMap<>();
    private volatile boolean                                       connected;

    public InMemoryStreamStoreConnection(String connectionName) {
        this(connectionName, LoggerFactory.getLogger(InMemoryStreamStoreConnection.class));
    }

    public InMemoryStreamStoreConnection(String connectionName, Logger log) {
        this(connectionName, log, Clock.systemUTC());
    }

    public InMemoryStreamStoreConnection(String connectionName, Logger log, Clock clock) {
        this.connectionName = requireNonNull(connectionName, "No connectionName provided");
        this.log = requireNonNull(log, "No log provided");
        this.clock = requireNonNull(clock, "No clock provided");
    }

    @Override
    public String connectionName() {
        return connectionName;
    }

    @Override
    public void connect() {
        if (!connected) {
            log.info("[{}] Connecting", connectionName);
            connected = true;
        }
    }

    public boolean isConnected() {
        return connected;
    }

    @Override
    public void close() {
        if (!connected) {
            return;
        }
        log.info("[{}] Closing connection", connectionName);
        List<InMemoryCatchUpSubscription> subscriptionsToDrop;
        synchronized (lock) {
            connected = false;
            subscriptionsToDrop = subscriptions.values()
                                               .stream()
                                               .flatMap(Collection::stream)
                                               .collect(Collectors.toList());
        }
        subscriptionsToDrop.forEach(subscription -> subscription.drop(SubscriptionDropReason.CONNECTION_CLOSED, null));
    }

    @Override
    public WriteResult appendToStream(String streamName, ExpectedVersion expectedVersion, List<EventData> events) {
        requireNonNull(streamName, "No streamName provided");
        requireNonNull(expectedVersion, "No expectedVersion provided");
        requireNonNull(events, "No events provided");
        events.forEach(eventData -> requireNonNull(eventData, "events contained a null EventData"));
        requireNotSystemStream(streamName);
        requireConnected();

        synchronized (lock) {
            var stream = streams.get(streamName);
            if (stream != null && stream.isDeleted()) {
                throw new StreamDeletedException(streamName);
            }
            var currentVersion = stream != null ? stream.version() : 0L;
            if (!expectedVersion.isSatisfiedBy(currentVersion)) {
                throw new WrongExpectedVersionException(streamName, expectedVersion, currentVersion);
            }
            if (events.isEmpty()) {
                return new WriteResult(ExpectedVersion.of(currentVersion));
            }
            if (stream == null) {
                stream = new MemoryStream(streamName);
                streams.put(streamName, stream);
            }

            var now = clock.instant();
            for (var eventData : events) {
                var recordedEvent = RecordedEvent.record(streamName, stream.version(), eventData, now);
                stream.events.add(recordedEvent);
                publish(recordedEvent);
                linkToProjection(categoryStreamNameOf(streamName), recordedEvent);
                linkToProjection(EVENT_TYPE_STREAM_PREFIX + eventData.eventType(), recordedEvent);
                linkToProjection(ALL_STREAM, recordedEvent);
            }
            log.trace("[{}] Appended {} event(s) to stream '{}' which is now at version {}",
                      connectionName,
                      events.size(),
                      streamName,
                      stream.version());
            return new WriteResult(ExpectedVersion.of(stream.version()));
        }
    }

    /**
     * Resolve the category of a stream, i.e. the part of the stream name before the first <code>-</code>
     * (or the entire stream name if it doesn't contain a <code>-</code>)
     *
     * @return the name of the category projection stream
     */
    public static String categoryStreamNameOf(String streamName) {
        requireNonNull(streamName, "No streamName provided");
        var separatorIndex = streamName.indexOf('-');
        var category       = separatorIndex >= 0 ? streamName.substring(0, separatorIndex) : streamName;
        return CATEGORY_STREAM_PREFIX + category;
    }

    private void linkToProjection(String projectionStreamName, RecordedEvent recordedEvent) {
        var projectionStream = streams.computeIfAbsent(projectionStreamName, MemoryStream::new);
        var link             = recordedEvent.linkFrom(projectionStreamName, projectionStream.version());
        projectionStream.events.add(link);
        publish(link);
    }

    private void publish(RecordedEvent recordedEvent) {
        var streamSubscriptions = subscriptions.get(recordedEvent.streamName());
        if (streamSubscriptions != null) {
            streamSubscriptions.forEach(subscription -> subscription.eventAppended(recordedEvent));
        }
    }

    @Override
    public StreamEventsSlice readStreamForward(String streamName, long start, long count) {
        requireNonNull(streamName, "No streamName provided");
        requireTrue(start >= 0, "start must be >= 0");
        requireTrue(count > 0, "count must be > 0");
        requireConnected();

        synchronized (lock) {
            var stream = streams.get(streamName);
            if (stream == null) {
                return StreamEventsSlice.streamNotFound(streamName, start, ReadDirection.FORWARD);
            }
            if (stream.isDeleted()) {
                return StreamEventsSlice.streamDeleted(streamName, start, ReadDirection.FORWARD);
            }

            var size    = stream.version();
            var result  = new ArrayList<RecordedEvent>();
            var index   = start;
            var scanned = 0L;
            while (index < size && scanned < count) {
                var recordedEvent = stream.events.get((int) index);
                if (isVisible(recordedEvent)) {
                    result.add(recordedEvent);
                }
                index++;
                scanned++;
            }
            return new StreamEventsSlice(SliceReadStatus.SUCCESS,
                                         streamName,
                                         start,
                                         ReadDirection.FORWARD,
                                         result,
                                         index,
                                         size - 1,
                                         index >= size);
        }
    }

    @Override
    public StreamEventsSlice readStreamBackward(String streamName, long start, long count) {
        requireNonNull(streamName, "No streamName provided");
        requireTrue(start >= StreamPosition.END, "start must be >= -1");
        requireTrue(count > 0, "count must be > 0");
        requireConnected();

        synchronized (lock) {
            var stream = streams.get(streamName);
            if (stream == null) {
                return StreamEventsSlice.streamNotFound(streamName, start, ReadDirection.BACKWARD);
            }
            if (stream.isDeleted()) {
                return StreamEventsSlice.streamDeleted(streamName, start, ReadDirection.BACKWARD);
            }

            var size    = stream.version();
            var from    = start == StreamPosition.END || start >= size ? size - 1 : start;
            var result  = new ArrayList<RecordedEvent>();
            var index   = from;
            var scanned = 0L;
            while (index >= 0 && scanned < count) {
                var recordedEvent = stream.events.get((int) index);
                if (isVisible(recordedEvent)) {
                    result.add(recordedEvent);
                }
                index--;
                scanned++;
            }
            return new StreamEventsSlice(SliceReadStatus.SUCCESS,
                                         streamName,
                                         from,
                                         ReadDirection.BACKWARD,
                                         result,
                                         index,
                                         size - 1,
                                         index < 0);
        }
    }

    @Override
    public StreamSubscription subscribeToStreamFrom(String streamName,
                                                    Optional<Long> lastCheckpoint,
                                                    Consumer<RecordedEvent> eventAppeared,
                                                    Runnable liveProcessingStarted,
                                                    BiConsumer<SubscriptionDropReason, Exception> subscriptionDropped) {
        requireNonNull(streamName, "No streamName provided");
        requireNonNull(lastCheckpoint, "No lastCheckpoint provided");
        requireNonNull(eventAppeared, "No eventAppeared callback provided");
        requireConnected();

        synchronized (lock) {
            var stream = streams.get(streamName);
            if (stream != null && stream.isDeleted()) {
                throw new StreamDeletedException(streamName);
            }
            var fromEventNumber = lastCheckpoint.map(checkpoint -> checkpoint + 1).orElse(0L);
            var historicEvents  = stream == null ? List.<RecordedEvent>of() : stream.events.stream()
                                                                                             .skip(Math.max(fromEventNumber, 0))
                                                                                             .filter(this::isVisible)
                                                                                             .collect(Collectors.toList());
            var subscription = new InMemoryCatchUpSubscription(log,
                                                               connectionName,
                                                               streamName,
                                                               eventAppeared,
                                                               liveProcessingStarted,
                                                               subscriptionDropped,
                                                               this::removeSubscription);
            subscriptions.computeIfAbsent(streamName, name -> new CopyOnWriteArrayList<>()).add(subscription);
            log.debug("[{}] Subscribing to stream '{}' from event number {} ({} historic event(s))",
                      connectionName,
                      streamName,
                      fromEventNumber,
                      historicEvents.size());
            subscription.catchUp(historicEvents);
            return subscription;
        }
    }

    private void removeSubscription(InMemoryCatchUpSubscription subscription) {
        synchronized (lock) {
            var streamSubscriptions = subscriptions.get(subscription.streamName());
            if (streamSubscriptions != null) {
                streamSubscriptions.remove(subscription);
                if (streamSubscriptions.isEmpty()) {
                    subscriptions.remove(subscription.streamName());
                }
            }
        }
    }

    @Override
    public void deleteStream(String streamName, ExpectedVersion expectedVersion) {
        delete(streamName, expectedVersion, false);
    }

    @Override
    public void hardDeleteStream(String streamName, ExpectedVersion expectedVersion) {
        delete(streamName, expectedVersion, true);
    }

    private void delete(String streamName, ExpectedVersion expectedVersion, boolean hardDelete) {
        requireNonNull(streamName, "No streamName provided");
        requireNonNull(expectedVersion, "No expectedVersion provided");
        requireNotSystemStream(streamName);
        requireConnected();

        List<InMemoryCatchUpSubscription> subscriptionsToDrop;
        synchronized (lock) {
            var stream = streams.get(streamName);
            if (stream == null) {
                throw new StreamNotFoundException(streamName);
            }
            if (stream.state == StreamState.HARD_DELETED || (stream.state == StreamState.SOFT_DELETED && !hardDelete)) {
                throw new StreamDeletedException(streamName);
            }
            if (!expectedVersion.isSatisfiedBy(stream.version())) {
                throw new WrongExpectedVersionException(streamName, expectedVersion, stream.version());
            }
            if (hardDelete) {
                stream.state = StreamState.HARD_DELETED;
                stream.events.clear();
                purgedStreams.add(streamName);
            } else {
                stream.state = StreamState.SOFT_DELETED;
            }
            log.debug("[{}] {} deleted stream '{}'", connectionName, hardDelete ? "Hard" : "Soft", streamName);
            subscriptionsToDrop = List.copyOf(subscriptions.getOrDefault(streamName, List.of()));
        }
        subscriptionsToDrop.forEach(subscription -> subscription.drop(SubscriptionDropReason.STREAM_DELETED, null));
    }

    private boolean isVisible(RecordedEvent recordedEvent) {
        return !recordedEvent.isLink() || !purgedStreams.contains(recordedEvent.originalStreamName());
    }

    private void requireConnected() {
        if (!connected) {
            throw new StreamStoreUnavailableException(connectionName, msg("Connection '{}' isn't connected", connectionName));
        }
    }

    private static void requireNotSystemStream(String streamName) {
        if (streamName.startsWith(SYSTEM_STREAM_PREFIX)) {
            throw new IllegalArgumentException(msg("'{}' is a system stream which can't be written to", streamName));
        }
    }

    @Override
    public String toString() {
        return "InMemoryStreamStoreConnection{" +
                "connectionName='" + connectionName + '\'' +
                ", connected=" + connected +
                '}';
    }

    private enum StreamState {
        ACTIVE,
        SOFT_DELETED,
        HARD_DELETED
    }

    private static final class MemoryStream {
        private final String              name;
        private final List<RecordedEvent> events = new ArrayList<>();
        private       StreamState         state  = StreamState.ACTIVE;

        private MemoryStream(String name) {
            this.name = name;
        }

        private long version() {
            return events.size();
        }

        private boolean isDeleted() {
            return state != StreamState.ACTIVE;
        }

        @Override
        public String toString() {
            return "MemoryStream{" +
                    "name='" + name + '\'' +
                    ", version=" + version() +
                    ", state=" + state +
                    '}';
        }
    }
}
