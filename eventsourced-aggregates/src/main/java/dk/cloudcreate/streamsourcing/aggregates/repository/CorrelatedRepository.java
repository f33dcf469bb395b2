package dk.cloudcreate.streamsourcing.aggregates.repository;

import dk.cloudcreate.streamsourcing.aggregates.*;
import dk.cloudcreate.streamsourcing.common.messaging.CorrelatedMessage;

import java.util.*;

/**
 * A repository that loads aggregates on behalf of a source message (typically the command being handled), so all events
 * the loaded aggregate raises continue the causal chain of the source message:
 * <ul>
 *     <li>the event's correlationId is the source message's correlationId</li>
 *     <li>the event's causationId is the source message's msgId</li>
 * </ul>
 *
 * @see CorrelatedStreamStoreRepository
 */
public interface CorrelatedRepository {
    default <AGGREGATE extends CorrelatedEventSource> AGGREGATE getById(Class<AGGREGATE> aggregateType, UUID aggregateId, CorrelatedMessage source) {
        return getById(aggregateType, aggregateId, Repository.LATEST_VERSION, source);
    }

    <AGGREGATE extends CorrelatedEventSource> AGGREGATE getById(Class<AGGREGATE> aggregateType, UUID aggregateId, long version, CorrelatedMessage source);

    default <AGGREGATE extends CorrelatedEventSource> Optional<AGGREGATE> tryGetById(Class<AGGREGATE> aggregateType, UUID aggregateId, CorrelatedMessage source) {
        return tryGetById(aggregateType, aggregateId, Repository.LATEST_VERSION, source);
    }

    default <AGGREGATE extends CorrelatedEventSource> Optional<AGGREGATE> tryGetById(Class<AGGREGATE> aggregateType, UUID aggregateId, long version, CorrelatedMessage source) {
        try {
            return Optional.of(getById(aggregateType, aggregateId, version, source));
        } catch (AggregateNotFoundException e) {
            return Optional.empty();
        }
    }

    void save(EventSource aggregate);

    void delete(EventSource aggregate);

    void hardDelete(EventSource aggregate);
}
