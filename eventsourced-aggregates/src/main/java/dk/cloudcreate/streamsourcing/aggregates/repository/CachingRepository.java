package dk.cloudcreate.streamsourcing.aggregates.repository;

import dk.cloudcreate.streamsourcing.aggregates.*;
import org.slf4j.*;

import java.util.*;
import java.util.concurrent.*;

import static dk.cloudcreate.essentials.shared.FailFast.requireNonNull;

/**
 * Read-through cache in front of another {@link Repository}.<br>
 * An aggregate is cached the first time it's loaded at its latest version. Later loads return the cached instance after
 * applying any events that have been appended to its stream in the meantime (see {@link Repository#updateToCurrent(EventSource)}).
 * Loads at a specific version bypass the cache.
 * <p>
 * A failed save, update or delete evicts the aggregate from the cache. Beyond that, eviction is the responsibility of the owner
 * (see {@link #clearCache()} and {@link #clearCache(UUID)}).
 * <p>
 * The cached instances are shared, so a {@link CachingRepository} must only be used by one thread at a time.
 */
public class CachingRepository implements Repository {
    private final Repository                       repository;
    private final ConcurrentMap<UUID, EventSource> knownAggregates = new ConcurrentHashMap<>();
    private final Logger                           log;

    public CachingRepository(Repository repository) {
        this(repository, LoggerFactory.getLogger(CachingRepository.class));
    }

    public CachingRepository(Repository repository, Logger log) {
        this.repository = requireNonNull(repository, "No repository provided");
        this.log = requireNonNull(log, "No log provided");
    }

    @Override
    public <AGGREGATE extends EventSource> AGGREGATE getById(Class<AGGREGATE> aggregateType, UUID aggregateId, long version) {
        requireNonNull(aggregateType, "No aggregateType provided");
        requireNonNull(aggregateId, "No aggregateId provided");
        if (version != LATEST_VERSION) {
            return repository.getById(aggregateType, aggregateId, version);
        }

        var cached = knownAggregates.get(aggregateId);
        if (aggregateType.isInstance(cached)) {
            log.trace("Found cached {} with id '{}' at version {}", aggregateType.getName(), aggregateId, cached.expectedVersion());
            try {
                repository.updateToCurrent(cached);
            } catch (RuntimeException e) {
                knownAggregates.remove(aggregateId);
                throw e;
            }
            return aggregateType.cast(cached);
        }

        var aggregate = repository.getById(aggregateType, aggregateId);
        knownAggregates.put(aggregateId, aggregate);
        return aggregate;
    }

    @Override
    public void save(EventSource aggregate) {
        requireNonNull(aggregate, "No aggregate provided");
        try {
            repository.save(aggregate);
        } catch (RuntimeException e) {
            log.debug("Evicting '{}' with id '{}' from the cache since saving it failed", aggregate.getClass().getName(), aggregate.id());
            knownAggregates.remove(aggregate.id());
            throw e;
        }
        knownAggregates.put(aggregate.id(), aggregate);
    }

    @Override
    public void delete(EventSource aggregate) {
        requireNonNull(aggregate, "No aggregate provided");
        knownAggregates.remove(aggregate.id());
        repository.delete(aggregate);
    }

    @Override
    public void hardDelete(EventSource aggregate) {
        requireNonNull(aggregate, "No aggregate provided");
        knownAggregates.remove(aggregate.id());
        repository.hardDelete(aggregate);
    }

    @Override
    public void updateToCurrent(EventSource aggregate) {
        repository.updateToCurrent(aggregate);
    }

    public boolean isCached(UUID aggregateId) {
        return knownAggregates.containsKey(aggregateId);
    }

    public void clearCache() {
        knownAggregates.clear();
    }

    /**
     * @return true if the aggregate was cached
     */
    public boolean clearCache(UUID aggregateId) {
        return knownAggregates.remove(aggregateId) != null;
    }
}
