package dk.cloudcreate.streamsourcing.streamstore.naming;

import java.util.UUID;

/**
 * Strategy that generates the names of the streams an aggregate instance, an aggregate category or an event type is stored in.<br>
 * The generated names are persisted in the stream store, so a given input must always produce the same stream name.
 *
 * @see PrefixedCamelCaseStreamNameBuilder
 */
public interface StreamNameBuilder {
    /**
     * Generate the name of the stream that contains the events of a single aggregate instance
     *
     * @param aggregateType the aggregate type
     * @param aggregateId   the aggregate id
     * @return the stream name
     */
    String generateForAggregate(Class<?> aggregateType, UUID aggregateId);

    /**
     * Generate the name of the category stream that contains the events of all instances of the given aggregate type
     *
     * @param aggregateType the aggregate type
     * @return the stream name
     */
    String generateForCategory(Class<?> aggregateType);

    /**
     * Generate the name of the stream that contains all events of a given event type
     *
     * @param eventType the event type (as used in {@link dk.cloudcreate.streamsourcing.streamstore.EventData#eventType()})
     * @return the stream name
     */
    String generateForEventType(String eventType);
}
