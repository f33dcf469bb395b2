package dk.cloudcreate.streamsourcing.aggregates.repository;

import dk.cloudcreate.streamsourcing.aggregates.*;
import dk.cloudcreate.streamsourcing.common.messaging.CorrelatedMessage;

import java.util.UUID;

import static dk.cloudcreate.essentials.shared.FailFast.requireNonNull;

/**
 * {@link CorrelatedRepository} that loads and persists through another {@link Repository} and seeds every loaded
 * aggregate with the source message
 */
public class CorrelatedStreamStoreRepository implements CorrelatedRepository {
    private final Repository repository;

    public CorrelatedStreamStoreRepository(Repository repository) {
        this.repository = requireNonNull(repository, "No repository provided");
    }

    @Override
    public <AGGREGATE extends CorrelatedEventSource> AGGREGATE getById(Class<AGGREGATE> aggregateType, UUID aggregateId, long version, CorrelatedMessage source) {
        requireNonNull(source, "No source message provided");
        var aggregate = repository.getById(aggregateType, aggregateId, version);
        aggregate.correlateWith(source);
        return aggregate;
    }

    @Override
    public void save(EventSource aggregate) {
        repository.save(aggregate);
    }

    @Override
    public void delete(EventSource aggregate) {
        repository.delete(aggregate);
    }

    @Override
    public void hardDelete(EventSource aggregate) {
        repository.hardDelete(aggregate);
    }
}
