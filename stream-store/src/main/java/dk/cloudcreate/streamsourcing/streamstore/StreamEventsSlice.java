package dk.cloudcreate.streamsourcing.streamstore;

import java.util.List;

import static dk.cloudcreate.essentials.shared.FailFast.requireNonNull;

/**
 * The result of reading a page of events from a stream
 *
 * @see StreamStoreConnection#readStreamForward(String, long, long)
 * @see StreamStoreConnection#readStreamBackward(String, long, long)
 */
public final class StreamEventsSlice {
    private final SliceReadStatus     status;
    private final String              streamName;
    private final long                fromEventNumber;
    private final ReadDirection       readDirection;
    private final List<RecordedEvent> events;
    private final long                nextEventNumber;
    private final long                lastEventNumber;
    private final boolean             isEndOfStream;

    public StreamEventsSlice(SliceReadStatus status,
                             String streamName,
                             long fromEventNumber,
                             ReadDirection readDirection,
                             List<RecordedEvent> events,
                             long nextEventNumber,
                             long lastEventNumber,
                             boolean isEndOfStream) {
        this.status = requireNonNull(status, "No status provided");
        this.streamName = requireNonNull(streamName, "No streamName provided");
        this.fromEventNumber = fromEventNumber;
        this.readDirection = requireNonNull(readDirection, "No readDirection provided");
        this.events = List.copyOf(requireNonNull(events, "No events provided"));
        this.nextEventNumber = nextEventNumber;
        this.lastEventNumber = lastEventNumber;
        this.isEndOfStream = isEndOfStream;
    }

    public static StreamEventsSlice streamNotFound(String streamName, long fromEventNumber, ReadDirection readDirection) {
        return new StreamEventsSlice(SliceReadStatus.STREAM_NOT_FOUND, streamName, fromEventNumber, readDirection, List.of(), -1, -1, true);
    }

    public static StreamEventsSlice streamDeleted(String streamName, long fromEventNumber, ReadDirection readDirection) {
        return new StreamEventsSlice(SliceReadStatus.STREAM_DELETED, streamName, fromEventNumber, readDirection, List.of(), -1, -1, true);
    }

    public SliceReadStatus status() {
        return status;
    }

    public boolean isSuccess() {
        return status == SliceReadStatus.SUCCESS;
    }

    public String streamName() {
        return streamName;
    }

    public long fromEventNumber() {
        return fromEventNumber;
    }

    public ReadDirection readDirection() {
        return readDirection;
    }

    /**
     * The events read in the order of the {@link #readDirection()}
     */
    public List<RecordedEvent> events() {
        return events;
    }

    /**
     * The event number to start the next read from
     */
    public long nextEventNumber() {
        return nextEventNumber;
    }

    /**
     * The event number of the last event in the stream at the time of reading, or -1 if the stream is empty
     */
    public long lastEventNumber() {
        return lastEventNumber;
    }

    public boolean isEndOfStream() {
        return isEndOfStream;
    }

    @Override
    public String toString() {
        return "StreamEventsSlice{" +
                "status=" + status +
                ", streamName='" + streamName + '\'' +
                ", fromEventNumber=" + fromEventNumber +
                ", readDirection=" + readDirection +
                ", numberOfEvents=" + events.size() +
                ", nextEventNumber=" + nextEventNumber +
                ", lastEventNumber=" + lastEventNumber +
                ", isEndOfStream=" + isEndOfStream +
                '}';
    }
}
