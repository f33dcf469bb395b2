package dk.cloudcreate.streamsourcing.streamstore.listener;

import dk.cloudcreate.streamsourcing.streamstore.*;
import dk.cloudcreate.streamsourcing.streamstore.naming.StreamNameBuilder;
import dk.cloudcreate.streamsourcing.streamstore.serializer.EventSerializer;
import org.slf4j.*;

import java.time.*;
import java.util.*;
import java.util.function.BooleanSupplier;

import static dk.cloudcreate.essentials.shared.FailFast.*;

/**
 * Reads the events already contained in a stream (an aggregate stream, a category stream, an event type stream or a custom named stream)
 * and hands the deserialized events to a {@link ListenerEventHandler}.<br>
 * Events are read in pages of {@link #READ_PAGE_SIZE} events.<br>
 * Unlike a {@link Listener}, a reader doesn't receive events appended after the read has completed.
 * <p>
 * A reader is not thread-safe, except for {@link #cancel()} which may be called from another thread (e.g. the event handler's)
 */
public final class StreamReader {
    public static final int READ_PAGE_SIZE = 500;

    private final Logger                log;
    private final String                readerName;
    private final StreamStoreConnection connection;
    private final StreamNameBuilder     streamNameBuilder;
    private final EventSerializer       eventSerializer;
    private final ListenerEventHandler  eventHandler;
    private volatile boolean            cancelled;
    private          String             streamName;
    private          Long               position;

    public StreamReader(String readerName,
                        StreamStoreConnection connection,
                        StreamNameBuilder streamNameBuilder,
                        EventSerializer eventSerializer,
                        ListenerEventHandler eventHandler) {
        this(readerName, connection, streamNameBuilder, eventSerializer, eventHandler, LoggerFactory.getLogger(StreamReader.class));
    }

    public StreamReader(String readerName,
                        StreamStoreConnection connection,
                        StreamNameBuilder streamNameBuilder,
                        EventSerializer eventSerializer,
                        ListenerEventHandler eventHandler,
                        Logger log) {
        this.readerName = requireNonNull(readerName, "No readerName provided");
        this.connection = requireNonNull(connection, "No connection provided");
        this.streamNameBuilder = requireNonNull(streamNameBuilder, "No streamNameBuilder provided");
        this.eventSerializer = requireNonNull(eventSerializer, "No eventSerializer provided");
        this.eventHandler = requireNonNull(eventHandler, "No eventHandler provided");
        this.log = requireNonNull(log, "No log provided");
    }

    public String readerName() {
        return readerName;
    }

    /**
     * @return the name of the stream last read
     */
    public Optional<String> streamName() {
        return Optional.ofNullable(streamName);
    }

    /**
     * @return the event number of the last event read, or empty if the last read didn't read any events
     */
    public Optional<Long> position() {
        return Optional.ofNullable(position);
    }

    /**
     * Read all events from a named stream
     *
     * @see #read(String, Optional, Optional, boolean)
     */
    public boolean read(String streamName) {
        return read(streamName, Optional.empty(), Optional.empty(), false);
    }

    /**
     * Read events from a named stream
     *
     * @param streamName    the exact stream name
     * @param checkpoint    the event number of the last event already handled. Reading starts with the next event (in the read direction).
     *                      If empty then reading starts with the first (or last, if <code>readBackwards</code> is true) event in the stream
     * @param count         the maximum number of events to read. If empty then all events are read
     * @param readBackwards read the stream from the end towards the start
     * @return true if any events were read
     */
    public boolean read(String streamName, Optional<Long> checkpoint, Optional<Long> count, boolean readBackwards) {
        requireNonNull(streamName, "No streamName provided");
        requireNonNull(checkpoint, "No checkpoint provided");
        requireNonNull(count, "No count provided");
        checkpoint.ifPresent(eventNumber -> requireTrue(eventNumber >= 0, "checkpoint must be >= 0"));
        count.ifPresent(numberOfEvents -> requireTrue(numberOfEvents > 0, "count must be > 0"));

        cancelled = false;
        position = null;
        this.streamName = streamName;

        if (!streamExists(streamName)) {
            log.debug("[{}] Stream '{}' can't be read", readerName, streamName);
            return false;
        }

        long sliceStart;
        if (checkpoint.isEmpty()) {
            sliceStart = readBackwards ? StreamPosition.END : StreamPosition.START;
        } else {
            sliceStart = checkpoint.get() + (readBackwards ? -1 : 1);
            if (sliceStart < 0) {
                return false;
            }
        }

        var               remaining = count.orElse(Long.MAX_VALUE);
        var               eventsRead = false;
        StreamEventsSlice currentSlice;
        do {
            var pageSize = Math.min(remaining, READ_PAGE_SIZE);
            currentSlice = readBackwards ?
                           connection.readStreamBackward(streamName, sliceStart, pageSize) :
                           connection.readStreamForward(streamName, sliceStart, pageSize);
            if (!currentSlice.isSuccess()) {
                break;
            }
            remaining -= currentSlice.events().size();
            sliceStart = currentSlice.nextEventNumber();
            for (var recordedEvent : currentSlice.events()) {
                if (cancelled) {
                    break;
                }
                eventHandler.handle(eventSerializer.deserialize(recordedEvent), recordedEvent);
                position = recordedEvent.eventNumber();
                eventsRead = true;
            }
        } while (!currentSlice.isEndOfStream() && !cancelled && remaining > 0);

        log.debug("[{}] Read stream '{}' up to event number {}", readerName, streamName, position);
        return eventsRead;
    }

    /**
     * Read events from a named stream and afterwards wait until <code>completionCheck</code> returns true, which can be used to
     * await asynchronous processing of the events read
     *
     * @throws ListenerTimeoutException if events were read and the <code>completionCheck</code> didn't return true within the <code>timeout</code>
     * @see #read(String, Optional, Optional, boolean)
     */
    public boolean read(String streamName,
                        Optional<Long> checkpoint,
                        Optional<Long> count,
                        boolean readBackwards,
                        BooleanSupplier completionCheck,
                        Duration timeout) {
        requireNonNull(completionCheck, "No completionCheck provided");
        requireNonNull(timeout, "No timeout provided");
        var eventsRead = read(streamName, checkpoint, count, readBackwards);
        if (eventsRead) {
            awaitCompletion(streamName, completionCheck, timeout);
        }
        return eventsRead;
    }

    public boolean readForAggregate(Class<?> aggregateType, UUID aggregateId, Optional<Long> checkpoint, Optional<Long> count, boolean readBackwards) {
        return read(streamNameBuilder.generateForAggregate(aggregateType, aggregateId), checkpoint, count, readBackwards);
    }

    public boolean readForCategory(Class<?> aggregateType, Optional<Long> checkpoint, Optional<Long> count, boolean readBackwards) {
        return read(streamNameBuilder.generateForCategory(aggregateType), checkpoint, count, readBackwards);
    }

    public boolean readForEventType(Class<?> eventType, Optional<Long> checkpoint, Optional<Long> count, boolean readBackwards) {
        requireNonNull(eventType, "No eventType provided");
        return read(streamNameBuilder.generateForEventType(eventType.getSimpleName()), checkpoint, count, readBackwards);
    }

    /**
     * Stop the read in progress after the event currently being handled
     */
    public void cancel() {
        cancelled = true;
    }

    private boolean streamExists(String streamName) {
        return connection.readStreamForward(streamName, StreamPosition.START, 1).isSuccess();
    }

    private void awaitCompletion(String streamName, BooleanSupplier completionCheck, Duration timeout) {
        var deadline = Instant.now().plus(timeout);
        while (!completionCheck.getAsBoolean()) {
            if (Instant.now().isAfter(deadline)) {
                throw new ListenerTimeoutException(readerName, streamName, timeout, "waiting for the completion check");
            }
            try {
                Thread.sleep(10);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                throw new ListenerTimeoutException(readerName, streamName, timeout, "being interrupted while waiting for the completion check");
            }
        }
    }

    @Override
    public String toString() {
        return "StreamReader{" +
                "readerName='" + readerName + '\'' +
                ", streamName='" + streamName + '\'' +
                ", position=" + position +
                '}';
    }
}
