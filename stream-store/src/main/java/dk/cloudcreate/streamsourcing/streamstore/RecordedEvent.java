package dk.cloudcreate.streamsourcing.streamstore;

import java.time.Instant;
import java.util.*;

import static dk.cloudcreate.essentials.shared.FailFast.requireNonNull;

/**
 * An event as it was recorded in a stream.<br>
 * When read from a projection stream (category, event type or all), {@link #streamName()} and {@link #eventNumber()}
 * refer to the position in the projection stream, whereas {@link #originalStreamName()} and {@link #originalEventNumber()}
 * refer to the stream the event was originally appended to.
 */
public final class RecordedEvent {
    private final String  streamName;
    private final long    eventNumber;
    private final String  originalStreamName;
    private final long    originalEventNumber;
    private final UUID    eventId;
    private final String  eventType;
    private final boolean isJson;
    private final byte[]  data;
    private final byte[]  metadata;
    private final Instant created;

    public RecordedEvent(String streamName,
                         long eventNumber,
                         String originalStreamName,
                         long originalEventNumber,
                         UUID eventId,
                         String eventType,
                         boolean isJson,
                         byte[] data,
                         byte[] metadata,
                         Instant created) {
        this.streamName = requireNonNull(streamName, "No streamName provided");
        this.eventNumber = eventNumber;
        this.originalStreamName = requireNonNull(originalStreamName, "No originalStreamName provided");
        this.originalEventNumber = originalEventNumber;
        this.eventId = requireNonNull(eventId, "No eventId provided");
        this.eventType = requireNonNull(eventType, "No eventType provided");
        this.isJson = isJson;
        this.data = requireNonNull(data, "No data provided");
        this.metadata = requireNonNull(metadata, "No metadata provided");
        this.created = requireNonNull(created, "No created timestamp provided");
    }

    /**
     * Record <code>eventData</code> as event number <code>eventNumber</code> in <code>streamName</code>
     */
    public static RecordedEvent record(String streamName, long eventNumber, EventData eventData, Instant created) {
        requireNonNull(eventData, "No eventData provided");
        return new RecordedEvent(streamName,
                                 eventNumber,
                                 streamName,
                                 eventNumber,
                                 eventData.eventId(),
                                 eventData.eventType(),
                                 eventData.isJson(),
                                 eventData.data(),
                                 eventData.metadata(),
                                 created);
    }

    /**
     * Create a link to this event from the projection stream <code>projectionStreamName</code>
     */
    public RecordedEvent linkFrom(String projectionStreamName, long projectionEventNumber) {
        return new RecordedEvent(projectionStreamName,
                                 projectionEventNumber,
                                 originalStreamName,
                                 originalEventNumber,
                                 eventId,
                                 eventType,
                                 isJson,
                                 data,
                                 metadata,
                                 created);
    }

    public String streamName() {
        return streamName;
    }

    public long eventNumber() {
        return eventNumber;
    }

    public String originalStreamName() {
        return originalStreamName;
    }

    public long originalEventNumber() {
        return originalEventNumber;
    }

    public boolean isLink() {
        return !streamName.equals(originalStreamName);
    }

    public UUID eventId() {
        return eventId;
    }

    public String eventType() {
        return eventType;
    }

    public boolean isJson() {
        return isJson;
    }

    public byte[] data() {
        return data;
    }

    public byte[] metadata() {
        return metadata;
    }

    public Instant created() {
        return created;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof RecordedEvent)) return false;
        RecordedEvent that = (RecordedEvent) o;
        return eventNumber == that.eventNumber && streamName.equals(that.streamName) && eventId.equals(that.eventId);
    }

    @Override
    public int hashCode() {
        return Objects.hash(streamName, eventNumber, eventId);
    }

    @Override
    public String toString() {
        return "RecordedEvent{" +
                "streamName='" + streamName + '\'' +
                ", eventNumber=" + eventNumber +
                ", originalStreamName='" + originalStreamName + '\'' +
                ", originalEventNumber=" + originalEventNumber +
                ", eventId=" + eventId +
                ", eventType='" + eventType + '\'' +
                '}';
    }
}
