package dk.cloudcreate.streamsourcing.aggregates;

import static dk.cloudcreate.essentials.shared.MessageFormatter.msg;

/**
 * Thrown when an event is applied to an aggregate that doesn't have an {@link EventHandler} for the event's type.<br>
 * Unknown events are never skipped, since skipping them would leave the aggregate in a state that doesn't reflect its history.
 */
public class UnknownEventTypeException extends AggregateException {
    public final Class<?> aggregateType;
    public final Class<?> eventType;

    public UnknownEventTypeException(Class<?> aggregateType, Class<?> eventType) {
        super(msg("Aggregate '{}' doesn't have an @EventHandler method that accepts event type '{}'",
                  aggregateType.getName(),
                  eventType.getName()));
        this.aggregateType = aggregateType;
        this.eventType = eventType;
    }
}
