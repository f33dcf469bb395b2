package dk.cloudcreate.streamsourcing.aggregates.repository;

import dk.cloudcreate.streamsourcing.aggregates.AggregateException;

import java.util.UUID;

import static dk.cloudcreate.essentials.shared.MessageFormatter.msg;

/**
 * Thrown when an aggregate is loaded at a specific version, but the stream doesn't contain enough events to reach that version
 */
public class AggregateVersionException extends AggregateException {
    public final UUID     aggregateId;
    public final Class<?> aggregateType;
    public final long     requestedVersion;
    public final long     actualVersion;

    public AggregateVersionException(UUID aggregateId, Class<?> aggregateType, long requestedVersion, long actualVersion) {
        super(msg("Requested version {} of '{}' with id '{}' but only version {} is available",
                  requestedVersion,
                  aggregateType.getName(),
                  aggregateId,
                  actualVersion));
        this.aggregateId = aggregateId;
        this.aggregateType = aggregateType;
        this.requestedVersion = requestedVersion;
        this.actualVersion = actualVersion;
    }
}
