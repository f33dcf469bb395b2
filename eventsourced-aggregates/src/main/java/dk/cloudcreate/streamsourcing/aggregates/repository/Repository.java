package dk.cloudcreate.streamsourcing.aggregates.repository;

import dk.cloudcreate.streamsourcing.aggregates.*;
import dk.cloudcreate.streamsourcing.streamstore.*;

import java.util.*;

/**
 * Loads and persists event sourced aggregates.<br>
 * An aggregate is loaded by replaying the events in its stream, and persisted by appending the events it has raised
 * since it was loaded, using the aggregate's version for optimistic concurrency control.
 * <p>
 * Repositories are stateless between calls and may be shared, but a loaded aggregate instance must only be used by one thread at a time.
 *
 * @see StreamStoreRepository
 * @see CorrelatedRepository
 * @see CachingRepository
 */
public interface Repository {
    /**
     * Version argument meaning "the latest version"
     */
    long LATEST_VERSION = Long.MAX_VALUE;

    /**
     * Load the latest version of an aggregate
     *
     * @throws AggregateNotFoundException if the aggregate's stream doesn't exist
     * @throws AggregateDeletedException  if the aggregate's stream has been deleted
     */
    default <AGGREGATE extends EventSource> AGGREGATE getById(Class<AGGREGATE> aggregateType, UUID aggregateId) {
        return getById(aggregateType, aggregateId, LATEST_VERSION);
    }

    /**
     * Load an aggregate at a specific version, i.e. with exactly <code>version</code> events applied
     *
     * @throws IllegalArgumentException    if <code>version</code> is &lt;= 0
     * @throws AggregateNotFoundException  if the aggregate's stream doesn't exist
     * @throws AggregateDeletedException   if the aggregate's stream has been deleted
     * @throws AggregateVersionException   if the stream doesn't contain <code>version</code> events
     */
    <AGGREGATE extends EventSource> AGGREGATE getById(Class<AGGREGATE> aggregateType, UUID aggregateId, long version);

    /**
     * Load the latest version of an aggregate
     *
     * @return the aggregate or {@link Optional#empty()} if the aggregate's stream doesn't exist. Any other failure is propagated
     */
    default <AGGREGATE extends EventSource> Optional<AGGREGATE> tryGetById(Class<AGGREGATE> aggregateType, UUID aggregateId) {
        return tryGetById(aggregateType, aggregateId, LATEST_VERSION);
    }

    default <AGGREGATE extends EventSource> Optional<AGGREGATE> tryGetById(Class<AGGREGATE> aggregateType, UUID aggregateId, long version) {
        try {
            return Optional.of(getById(aggregateType, aggregateId, version));
        } catch (AggregateNotFoundException e) {
            return Optional.empty();
        }
    }

    /**
     * Persist the events the aggregate has raised since it was loaded or last saved.
     * The events are drained from the aggregate before they're appended, so a failed save is never retried with the same events.
     *
     * @throws WrongExpectedVersionException if another writer has appended to the aggregate's stream since the aggregate was loaded
     * @throws AggregateDeletedException     if the aggregate's stream has been deleted
     */
    void save(EventSource aggregate);

    /**
     * Soft delete the aggregate's stream
     *
     * @throws IllegalStateException         if the aggregate has events that haven't been saved
     * @throws WrongExpectedVersionException if the aggregate isn't at the stream's version
     */
    void delete(EventSource aggregate);

    /**
     * Permanently delete the aggregate's stream and its snapshots
     *
     * @throws IllegalStateException         if the aggregate has events that haven't been saved
     * @throws WrongExpectedVersionException if the aggregate isn't at the stream's version
     */
    void hardDelete(EventSource aggregate);

    /**
     * Apply the events that have been appended to the aggregate's stream after the aggregate's current version
     *
     * @throws IllegalStateException             if the aggregate has events that haven't been saved
     * @throws AggregateVersionConflictException if the aggregate's version changed while it was being updated
     */
    void updateToCurrent(EventSource aggregate);
}
