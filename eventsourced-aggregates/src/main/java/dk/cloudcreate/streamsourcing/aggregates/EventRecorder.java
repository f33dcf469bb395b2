package dk.cloudcreate.streamsourcing.aggregates;

import java.util.*;

import static dk.cloudcreate.essentials.shared.FailFast.requireNonNull;

/**
 * Buffers the events raised by an aggregate until they're drained and persisted.<br>
 * An {@link EventRecorder} is owned by a single aggregate instance and isn't thread-safe.
 */
public final class EventRecorder {
    private final List<Object> recordedEvents = new ArrayList<>();

    public void record(Object event) {
        requireNonNull(event, "You must supply an event");
        recordedEvents.add(event);
    }

    /**
     * Take all recorded events and reset the recorder. Each recorded event is returned by exactly one call.
     *
     * @return the recorded events in the order they were recorded
     */
    public List<Object> drainRecordedEvents() {
        var drained = new ArrayList<>(recordedEvents);
        recordedEvents.clear();
        return drained;
    }

    public boolean hasRecordedEvents() {
        return !recordedEvents.isEmpty();
    }

    /**
     * @return a read-only view of the events recorded since the last {@link #drainRecordedEvents()}
     */
    public List<Object> recordedEvents() {
        return Collections.unmodifiableList(recordedEvents);
    }
}
