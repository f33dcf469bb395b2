package dk.cloudcreate.streamsourcing.aggregates;

import java.util.UUID;

import static dk.cloudcreate.essentials.shared.MessageFormatter.msg;

/**
 * Thrown by {@link EventSource#updateWithEvents(java.util.List, long)} when the aggregate isn't at the version the
 * caller expected it to be at
 */
public class AggregateVersionConflictException extends AggregateException {
    public final Class<?> aggregateType;
    public final UUID     aggregateId;
    public final long     expectedVersion;
    public final long     actualVersion;

    public AggregateVersionConflictException(Class<?> aggregateType, UUID aggregateId, long expectedVersion, long actualVersion) {
        super(msg("Cannot update '{}' with id '{}' - expected it to be at version {} but it's at version {}",
                  aggregateType.getName(),
                  aggregateId,
                  expectedVersion,
                  actualVersion));
        this.aggregateType = aggregateType;
        this.aggregateId = aggregateId;
        this.expectedVersion = expectedVersion;
        this.actualVersion = actualVersion;
    }
}
