package dk.cloudcreate.streamsourcing.streamstore.readmodel;

import java.util.*;

import static dk.cloudcreate.essentials.shared.FailFast.requireNonNull;

/**
 * The position of one of a read model's listeners
 */
public final class ReadModelCheckpoint {
    private final String streamName;
    private final Long   position;

    public ReadModelCheckpoint(String streamName, Optional<Long> position) {
        this.streamName = requireNonNull(streamName, "No streamName provided");
        this.position = requireNonNull(position, "No position provided").orElse(null);
    }

    public static ReadModelCheckpoint of(String streamName, long position) {
        return new ReadModelCheckpoint(streamName, Optional.of(position));
    }

    public String streamName() {
        return streamName;
    }

    /**
     * @return the event number of the last event handled, or empty if no events have been handled
     */
    public Optional<Long> position() {
        return Optional.ofNullable(position);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof ReadModelCheckpoint)) return false;
        ReadModelCheckpoint that = (ReadModelCheckpoint) o;
        return streamName.equals(that.streamName) && Objects.equals(position, that.position);
    }

    @Override
    public int hashCode() {
        return Objects.hash(streamName, position);
    }

    @Override
    public String toString() {
        return streamName + "@" + position;
    }
}
