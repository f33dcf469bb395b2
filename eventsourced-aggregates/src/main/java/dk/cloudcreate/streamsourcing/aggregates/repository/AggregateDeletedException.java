package dk.cloudcreate.streamsourcing.aggregates.repository;

import dk.cloudcreate.streamsourcing.aggregates.AggregateException;

import java.util.UUID;

import static dk.cloudcreate.essentials.shared.MessageFormatter.msg;

public class AggregateDeletedException extends AggregateException {
    public final UUID     aggregateId;
    public final Class<?> aggregateType;

    public AggregateDeletedException(UUID aggregateId, Class<?> aggregateType) {
        this(aggregateId, aggregateType, null);
    }

    public AggregateDeletedException(UUID aggregateId, Class<?> aggregateType, Throwable cause) {
        super(msg("'{}' with id '{}' has been deleted",
                  aggregateType.getName(),
                  aggregateId),
              cause);
        this.aggregateId = aggregateId;
        this.aggregateType = aggregateType;
    }
}
