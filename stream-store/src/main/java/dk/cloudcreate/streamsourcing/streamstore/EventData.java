package dk.cloudcreate.streamsourcing.streamstore;

import java.util.*;

import static dk.cloudcreate.essentials.shared.FailFast.requireNonNull;

/**
 * A serialized event that's ready to be appended to a stream
 */
public final class EventData {
    private final UUID    eventId;
    private final String  eventType;
    private final boolean isJson;
    private final byte[]  data;
    private final byte[]  metadata;

    public EventData(UUID eventId, String eventType, boolean isJson, byte[] data, byte[] metadata) {
        this.eventId = requireNonNull(eventId, "No eventId provided");
        this.eventType = requireNonNull(eventType, "No eventType provided");
        this.isJson = isJson;
        this.data = requireNonNull(data, "No data provided");
        this.metadata = metadata != null ? metadata : new byte[0];
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

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof EventData)) return false;
        return eventId.equals(((EventData) o).eventId);
    }

    @Override
    public int hashCode() {
        return Objects.hash(eventId);
    }

    @Override
    public String toString() {
        return "EventData{" +
                "eventId=" + eventId +
                ", eventType='" + eventType + '\'' +
                ", isJson=" + isJson +
                '}';
    }
}
