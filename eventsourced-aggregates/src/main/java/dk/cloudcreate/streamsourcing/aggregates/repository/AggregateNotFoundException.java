package dk.cloudcreate.streamsourcing.aggregates.repository;

import dk.cloudcreate.streamsourcing.aggregates.AggregateException;

import java.util.UUID;

import static dk.cloudcreate.essentials.shared.MessageFormatter.msg;

public class AggregateNotFoundException extends AggregateException {
    public final UUID     aggregateId;
    public final Class<?> aggregateType;

    public AggregateNotFoundException(UUID aggregateId, Class<?> aggregateType) {
        this(aggregateId, aggregateType, null);
    }

    public AggregateNotFoundException(UUID aggregateId, Class<?> aggregateType, Throwable cause) {
        super(msg("Couldn't find a '{}' with id '{}'",
                  aggregateType.getName(),
                  aggregateId),
              cause);
        this.aggregateId = aggregateId;
        this.aggregateType = aggregateType;
    }
}
