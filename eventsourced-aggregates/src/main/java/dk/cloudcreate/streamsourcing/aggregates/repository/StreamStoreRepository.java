package dk.cloudcreate.streamsourcing.aggregates.repository;

import dk.cloudcreate.streamsourcing.aggregates.*;
import dk.cloudcreate.streamsourcing.aggregates.snapshot.*;
import dk.cloudcreate.streamsourcing.streamstore.*;
import dk.cloudcreate.streamsourcing.streamstore.naming.StreamNameBuilder;
import dk.cloudcreate.streamsourcing.streamstore.serializer.*;
import dk.cloudcreate.streamsourcing.streamstore.types.ExpectedVersion;
import org.slf4j.*;

import java.util.*;
import java.util.stream.Collectors;

import static dk.cloudcreate.essentials.shared.FailFast.*;
import static dk.cloudcreate.essentials.shared.MessageFormatter.msg;

/**
 * {@link Repository} that stores each aggregate instance in its own stream in a {@link StreamStoreConnection}.<br>
 * The stream name is generated by the {@link StreamNameBuilder} from the aggregate type and id.
 * <p>
 * Every event saved carries the commit headers {@link EventHeaders#COMMIT_ID} (shared by all events saved together) and
 * {@link EventHeaders#AGGREGATE_JAVA_TYPE} in its metadata.
 * <p>
 * If a {@link SnapshotStore} is configured, aggregates that implement {@link SnapshotSource} are restored from their newest
 * snapshot (at or below the requested version) after which only the newer events are replayed. New snapshots are taken on save
 * according to the {@link SnapshotPolicy}.
 */
public class StreamStoreRepository implements Repository {
    public static final int READ_PAGE_SIZE = 500;

    private final StreamNameBuilder            streamNameBuilder;
    private final StreamStoreConnection        connection;
    private final EventSerializer              serializer;
    private final AggregateRootInstanceFactory aggregateRootInstanceFactory;
    private final SnapshotStore                snapshotStore;
    private final SnapshotPolicy               snapshotPolicy;
    private final Logger                       log;

    public StreamStoreRepository(StreamNameBuilder streamNameBuilder,
                                 StreamStoreConnection connection,
                                 EventSerializer serializer) {
        this(streamNameBuilder,
             connection,
             serializer,
             AggregateRootInstanceFactory.defaultConstructorFactory(),
             SnapshotStore.none(),
             SnapshotPolicy.never(),
             LoggerFactory.getLogger(StreamStoreRepository.class));
    }

    public StreamStoreRepository(StreamNameBuilder streamNameBuilder,
                                 StreamStoreConnection connection,
                                 EventSerializer serializer,
                                 SnapshotStore snapshotStore,
                                 SnapshotPolicy snapshotPolicy) {
        this(streamNameBuilder,
             connection,
             serializer,
             AggregateRootInstanceFactory.defaultConstructorFactory(),
             snapshotStore,
             snapshotPolicy,
             LoggerFactory.getLogger(StreamStoreRepository.class));
    }

    /**
     * @param streamNameBuilder            generates the stream name of each aggregate instance
     * @param connection                   the stream store
     * @param serializer                   serializes and deserializes the events
     * @param aggregateRootInstanceFactory creates the empty aggregate instances that are restored from the events
     * @param snapshotStore                where snapshots are stored. Use {@link SnapshotStore#none()} to disable snapshots
     * @param snapshotPolicy               decides when a snapshot is taken on save
     * @param log                          the logger to use
     */
    public StreamStoreRepository(StreamNameBuilder streamNameBuilder,
                                 StreamStoreConnection connection,
                                 EventSerializer serializer,
                                 AggregateRootInstanceFactory aggregateRootInstanceFactory,
                                 SnapshotStore snapshotStore,
                                 SnapshotPolicy snapshotPolicy,
                                 Logger log) {
        this.streamNameBuilder = requireNonNull(streamNameBuilder, "No streamNameBuilder provided");
        this.connection = requireNonNull(connection, "No connection provided");
        this.serializer = requireNonNull(serializer, "No serializer provided");
        this.aggregateRootInstanceFactory = requireNonNull(aggregateRootInstanceFactory, "No aggregateRootInstanceFactory provided");
        this.snapshotStore = requireNonNull(snapshotStore, "No snapshotStore provided");
        this.snapshotPolicy = requireNonNull(snapshotPolicy, "No snapshotPolicy provided");
        this.log = requireNonNull(log, "No log provided");
    }

    @Override
    public <AGGREGATE extends EventSource> AGGREGATE getById(Class<AGGREGATE> aggregateType, UUID aggregateId, long version) {
        requireNonNull(aggregateType, "No aggregateType provided");
        requireNonNull(aggregateId, "No aggregateId provided");
        requireTrue(version > 0, msg("Cannot get version {} of '{}' with id '{}' - the version must be > 0",
                                     version,
                                     aggregateType.getName(),
                                     aggregateId));
        log.trace("Trying to load {} with id '{}' and version {}", aggregateType.getName(), aggregateId, version == LATEST_VERSION ? "latest" : version);

        var streamName = streamNameBuilder.generateForAggregate(aggregateType, aggregateId);
        var aggregate  = aggregateRootInstanceFactory.create(aggregateType);
        restoreFromSnapshot(aggregate, streamName, version);

        var sliceStart  = aggregate.expectedVersion();
        var endOfStream         = false;
        var streamStatusChecked = false;
        while (!endOfStream && sliceStart < version) {
            var currentSlice = connection.readStreamForward(streamName, sliceStart, Math.min(READ_PAGE_SIZE, version - sliceStart));
            requireStreamIsReadable(currentSlice, aggregateType, aggregateId);
            aggregate.restoreFromEvents(deserialize(currentSlice));
            sliceStart = currentSlice.nextEventNumber();
            endOfStream = currentSlice.isEndOfStream();
            streamStatusChecked = true;
        }
        if (!streamStatusChecked) {
            // The snapshot covers the requested version, but the stream may have been deleted since it was taken
            requireStreamIsReadable(connection.readStreamBackward(streamName, StreamPosition.END, 1), aggregateType, aggregateId);
        }

        if (aggregate.expectedVersion() == EventSource.NO_EVENTS_HAVE_BEEN_APPLIED) {
            log.trace("Didn't find a {} with id '{}'", aggregateType.getName(), aggregateId);
            throw new AggregateNotFoundException(aggregateId, aggregateType);
        }
        if (version != LATEST_VERSION && aggregate.expectedVersion() != version) {
            log.trace("Found {} with id '{}' but requested version {} != actual version {}",
                      aggregateType.getName(),
                      aggregateId,
                      version,
                      aggregate.expectedVersion());
            throw new AggregateVersionException(aggregateId, aggregateType, version, aggregate.expectedVersion());
        }
        log.debug("Found {} with id '{}' at version {}", aggregateType.getName(), aggregateId, aggregate.expectedVersion());
        return aggregate;
    }

    @Override
    public void save(EventSource aggregate) {
        requireNonNull(aggregate, "No aggregate provided");
        var events = aggregate.drainUncommittedEvents();
        if (events.isEmpty()) {
            log.trace("No changes detected for '{}' with id '{}'", aggregate.getClass().getName(), aggregate.id());
            return;
        }
        var streamName        = streamNameBuilder.generateForAggregate(aggregate.getClass(), aggregate.id());
        var versionAfterSave  = aggregate.expectedVersion();
        var versionBeforeSave = versionAfterSave - events.size();
        var commitHeaders = Map.<String, Object>of(EventHeaders.COMMIT_ID, UUID.randomUUID().toString(),
                                                   EventHeaders.AGGREGATE_JAVA_TYPE, aggregate.getClass().getName());

        if (log.isTraceEnabled()) {
            log.trace("Persisting {} event(s) related to '{}' with id '{}': {}",
                      events.size(),
                      aggregate.getClass().getName(),
                      aggregate.id(),
                      events.stream()
                            .map(event -> event.getClass().getName())
                            .reduce((s, s2) -> s + ", " + s2)
                            .orElse(""));
        } else {
            log.debug("Persisting {} event(s) related to '{}' with id '{}'",
                      events.size(),
                      aggregate.getClass().getName(),
                      aggregate.id());
        }
        var eventsToSave = events.stream()
                                 .map(event -> serializer.serialize(event, new HashMap<>(commitHeaders)))
                                 .collect(Collectors.toList());
        try {
            connection.appendToStream(streamName, ExpectedVersion.of(versionBeforeSave), eventsToSave);
        } catch (StreamDeletedException e) {
            throw new AggregateDeletedException(aggregate.id(), aggregate.getClass(), e);
        }

        if (aggregate instanceof SnapshotSource && snapshotPolicy.shouldTakeSnapshot(versionBeforeSave, versionAfterSave)) {
            var snapshot = ((SnapshotSource<?>) aggregate).takeSnapshot();
            log.debug("Taking snapshot of '{}' with id '{}' at version {}", aggregate.getClass().getName(), aggregate.id(), snapshot.version());
            snapshotStore.save(streamName, snapshot);
        }
    }

    @Override
    public void delete(EventSource aggregate) {
        var streamName = prepareDelete(aggregate);
        log.debug("Deleting '{}' with id '{}'", aggregate.getClass().getName(), aggregate.id());
        try {
            connection.deleteStream(streamName, ExpectedVersion.of(aggregate.expectedVersion()));
        } catch (StreamNotFoundException e) {
            throw new AggregateNotFoundException(aggregate.id(), aggregate.getClass(), e);
        } catch (StreamDeletedException e) {
            throw new AggregateDeletedException(aggregate.id(), aggregate.getClass(), e);
        }
    }

    @Override
    public void hardDelete(EventSource aggregate) {
        var streamName = prepareDelete(aggregate);
        log.debug("Hard deleting '{}' with id '{}'", aggregate.getClass().getName(), aggregate.id());
        try {
            connection.hardDeleteStream(streamName, ExpectedVersion.of(aggregate.expectedVersion()));
        } catch (StreamNotFoundException e) {
            throw new AggregateNotFoundException(aggregate.id(), aggregate.getClass(), e);
        } catch (StreamDeletedException e) {
            throw new AggregateDeletedException(aggregate.id(), aggregate.getClass(), e);
        }
        snapshotStore.delete(streamName);
    }

    @Override
    public void updateToCurrent(EventSource aggregate) {
        requireNonNull(aggregate, "No aggregate provided");
        if (aggregate.hasUncommittedEvents()) {
            throw new IllegalStateException(msg("Cannot update '{}' with id '{}' to the current version since it has events that haven't been saved",
                                                aggregate.getClass().getName(),
                                                aggregate.id()));
        }
        var aggregateType = aggregate.getClass();
        var streamName    = streamNameBuilder.generateForAggregate(aggregateType, aggregate.id());
        var versionBefore = aggregate.expectedVersion();

        StreamEventsSlice currentSlice;
        do {
            currentSlice = connection.readStreamForward(streamName, aggregate.expectedVersion(), READ_PAGE_SIZE);
            requireStreamIsReadable(currentSlice, aggregateType, aggregate.id());
            aggregate.updateWithEvents(deserialize(currentSlice), aggregate.expectedVersion());
        } while (!currentSlice.isEndOfStream());

        if (aggregate.expectedVersion() != versionBefore) {
            log.debug("Updated '{}' with id '{}' from version {} to version {}", aggregateType.getName(), aggregate.id(), versionBefore, aggregate.expectedVersion());
        }
    }

    private String prepareDelete(EventSource aggregate) {
        requireNonNull(aggregate, "No aggregate provided");
        if (aggregate.hasUncommittedEvents()) {
            throw new IllegalStateException(msg("Cannot delete '{}' with id '{}' since it has events that haven't been saved",
                                                aggregate.getClass().getName(),
                                                aggregate.id()));
        }
        return streamNameBuilder.generateForAggregate(aggregate.getClass(), aggregate.id());
    }

    @SuppressWarnings("unchecked")
    private void restoreFromSnapshot(EventSource aggregate, String streamName, long version) {
        if (!(aggregate instanceof SnapshotSource)) {
            return;
        }
        var snapshotSource = (SnapshotSource<Object>) aggregate;
        snapshotStore.loadLatest(streamName, version)
                     .ifPresent(snapshot -> {
                         log.trace("Restoring '{}' with id '{}' from snapshot at version {}", aggregate.getClass().getName(), snapshot.aggregateId(), snapshot.version());
                         snapshotSource.restoreFromSnapshot((Snapshot<Object>) snapshot);
                     });
    }

    private void requireStreamIsReadable(StreamEventsSlice slice, Class<?> aggregateType, UUID aggregateId) {
        if (slice.status() == SliceReadStatus.STREAM_NOT_FOUND) {
            log.trace("Didn't find a {} with id '{}'", aggregateType.getName(), aggregateId);
            throw new AggregateNotFoundException(aggregateId, aggregateType);
        }
        if (slice.status() == SliceReadStatus.STREAM_DELETED) {
            log.trace("{} with id '{}' has been deleted", aggregateType.getName(), aggregateId);
            throw new AggregateDeletedException(aggregateId, aggregateType);
        }
    }

    private List<Object> deserialize(StreamEventsSlice slice) {
        return slice.events()
                    .stream()
                    .map(serializer::deserialize)
                    .collect(Collectors.toList());
    }

    @Override
    public String toString() {
        return "StreamStoreRepository{" +
                "connection=" + connection.connectionName() +
                ", snapshotStore=" + snapshotStore +
                '}';
    }
}
