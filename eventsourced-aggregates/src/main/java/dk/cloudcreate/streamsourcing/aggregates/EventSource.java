package dk.cloudcreate.streamsourcing.aggregates;

import java.util.*;

/**
 * The contract between an event sourced aggregate and the infrastructure that loads and persists it.<br>
 * The version of an aggregate is the number of events that have been applied to it, so an aggregate
 * that hasn't applied any events is at version {@link #NO_EVENTS_HAVE_BEEN_APPLIED}.
 *
 * @see AggregateRoot
 */
public interface EventSource {
    long NO_EVENTS_HAVE_BEEN_APPLIED = 0;

    /**
     * @return the aggregate id
     * @throws IllegalStateException if the id hasn't been assigned yet
     */
    UUID id();

    /**
     * @return the number of events applied to this instance
     */
    long expectedVersion();

    /**
     * Overwrite the version. Only for infrastructure use, e.g. when restoring from a snapshot
     */
    void expectedVersion(long expectedVersion);

    /**
     * Left fold the previously persisted <code>events</code> into the aggregate's state
     *
     * @param events the events in the order they were persisted
     * @throws IllegalArgumentException   if <code>events</code> is null
     * @throws UnknownEventTypeException  if the aggregate can't handle one of the events
     * @throws IllegalStateException      if the aggregate has recorded events that haven't been drained
     */
    void restoreFromEvents(List<?> events);

    /**
     * Apply newer persisted events to an aggregate that is expected to be at <code>expectedVersion</code>
     *
     * @throws AggregateVersionConflictException if the aggregate isn't at <code>expectedVersion</code>
     */
    void updateWithEvents(List<?> events, long expectedVersion);

    /**
     * Take the events raised since the last drain. Each raised event is returned by exactly one call
     *
     * @return the raised events in the order they were raised
     */
    List<Object> drainUncommittedEvents();

    /**
     * Has the aggregate raised events that haven't been drained
     */
    boolean hasUncommittedEvents();
}
