package dk.cloudcreate.streamsourcing.aggregates.repository;

import dk.cloudcreate.streamsourcing.aggregates.EventSource;
import org.slf4j.*;

import java.util.*;
import java.util.concurrent.*;

import static dk.cloudcreate.essentials.shared.FailFast.requireNonNull;

/**
 * Cache in front of another {@link Repository} for an owner that is the only one changing the aggregates it works with.<br>
 * An aggregate is cached when it has been saved successfully and later loads return the cached instance without asking the
 * stream store for newer events. Aggregates that haven't been saved through this repository are loaded from the wrapped {@link Repository}
 * (and aren't cached until they're saved).
 * <p>
 * Only the latest version of an aggregate can be loaded. A failed save evicts the aggregate, so the owner can load the current
 * version and retry. Beyond that, eviction is the responsibility of the owner (see {@link #clearCache()} and {@link #clearCache(UUID)}).
 *
 * @see CachingRepository
 */
public class OptimisticCacheRepository {
    private final Repository                       repository;
    private final ConcurrentMap<UUID, EventSource> knownAggregates = new ConcurrentHashMap<>();
    private final Logger                           log;

    public OptimisticCacheRepository(Repository repository) {
        this(repository, LoggerFactory.getLogger(OptimisticCacheRepository.class));
    }

    public OptimisticCacheRepository(Repository repository, Logger log) {
        this.repository = requireNonNull(repository, "No repository provided");
        this.log = requireNonNull(log, "No log provided");
    }

    /**
     * Get the cached aggregate or load the latest version from the wrapped {@link Repository}
     *
     * @throws AggregateNotFoundException if the aggregate isn't cached and its stream doesn't exist
     * @throws AggregateDeletedException  if the aggregate isn't cached and its stream has been deleted
     */
    public <AGGREGATE extends EventSource> AGGREGATE getById(Class<AGGREGATE> aggregateType, UUID aggregateId) {
        requireNonNull(aggregateType, "No aggregateType provided");
        requireNonNull(aggregateId, "No aggregateId provided");
        var cached = knownAggregates.get(aggregateId);
        if (aggregateType.isInstance(cached)) {
            log.trace("Found cached {} with id '{}' at version {}", aggregateType.getName(), aggregateId, cached.expectedVersion());
            return aggregateType.cast(cached);
        }
        return repository.getById(aggregateType, aggregateId);
    }

    /**
     * Same as {@link #getById(Class, UUID)}, except an aggregate that doesn't exist results in {@link Optional#empty()}
     */
    public <AGGREGATE extends EventSource> Optional<AGGREGATE> tryGetById(Class<AGGREGATE> aggregateType, UUID aggregateId) {
        try {
            return Optional.of(getById(aggregateType, aggregateId));
        } catch (AggregateNotFoundException e) {
            return Optional.empty();
        }
    }

    /**
     * Save the aggregate using the wrapped {@link Repository} and cache it
     *
     * @throws RuntimeException the exception thrown by the wrapped {@link Repository}, after the aggregate has been evicted
     */
    public void save(EventSource aggregate) {
        requireNonNull(aggregate, "No aggregate provided");
        try {
            repository.save(aggregate);
        } catch (RuntimeException e) {
            log.debug("Evicting '{}' with id '{}' from the cache since saving it failed", aggregate.getClass().getName(), aggregate.id());
            knownAggregates.remove(aggregate.id());
            throw e;
        }
        knownAggregates.putIfAbsent(aggregate.id(), aggregate);
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
