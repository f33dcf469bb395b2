package dk.cloudcreate.streamsourcing.aggregates;

import dk.cloudcreate.essentials.shared.reflection.invocation.PatternMatchingMethodInvoker;
import dk.cloudcreate.essentials.shared.types.GenericType;
import dk.cloudcreate.streamsourcing.aggregates.repository.Repository;
import dk.cloudcreate.streamsourcing.common.messaging.CorrelatedMessage;

import java.util.*;

import static dk.cloudcreate.essentials.shared.FailFast.*;
import static dk.cloudcreate.essentials.shared.MessageFormatter.msg;

/**
 * A mutable event sourced aggregate whose state is a left fold over the {@link Event}'s it has raised or restored.<br>
 * Business methods validate their input against the current state and then {@link #raise(Event)} an event. The
 * state itself is only ever changed by the {@link EventHandler} methods, which are called both when an event is raised
 * and when the aggregate is restored from its history.
 * <pre>{@code
 * public class Account extends AggregateRoot<AccountEvent> {
 *     private long balance;
 *
 *     public void deposit(long amount) {
 *         requireTrue(amount > 0, "amount must be positive");
 *         raise(new AmountDeposited(amount));
 *     }
 *
 *     @EventHandler
 *     private void on(AmountDeposited e) {
 *         balance += e.amount;
 *     }
 * }
 * }</pre>
 * The aggregate id is either assigned by the concrete aggregate using {@link #id(UUID)} or taken from the first event restored.
 * <p>
 * Note: the {@link AggregateRoot} lazily initializes its internal state, so instances created by
 * {@link AggregateRootInstanceFactory#objenesisAggregateRootFactory()} (which doesn't call any constructor) work as expected.
 *
 * @param <EVENT> the common super type of the events this aggregate raises. If it's <code>sealed</code> then every permitted
 *                event type must have an {@link EventHandler} method
 * @see Repository
 */
public abstract class AggregateRoot<EVENT extends Event> implements CorrelatedEventSource {
    private UUID                                 id;
    private Long                                 version;
    private EventRecorder                        recorder;
    private Optional<CorrelatedMessage>          correlationSource;
    private boolean                              isRestoring;
    private EventHandlerRegistry                 registry;
    private PatternMatchingMethodInvoker<Object> invoker;

    protected AggregateRoot() {
        registry();
    }

    protected AggregateRoot(UUID id) {
        registry();
        id(id);
    }

    protected AggregateRoot(UUID id, CorrelatedMessage source) {
        this(id);
        correlateWith(source);
    }

    @Override
    public UUID id() {
        if (id == null) {
            throw new IllegalStateException(msg("The id of aggregate '{}' hasn't been assigned", getClass().getName()));
        }
        return id;
    }

    /**
     * Has the aggregate id been assigned
     */
    public boolean hasId() {
        return id != null;
    }

    /**
     * Assign the aggregate id. The id can only be assigned once
     *
     * @throws IllegalArgumentException if <code>id</code> is null or the nil UUID
     * @throws IllegalStateException    if a different id has already been assigned
     */
    protected final void id(UUID id) {
        requireNonNull(id, "You must supply an aggregate id");
        if (id.getMostSignificantBits() == 0 && id.getLeastSignificantBits() == 0) {
            throw new IllegalArgumentException(msg("The nil UUID isn't a valid id for aggregate '{}'", getClass().getName()));
        }
        if (this.id != null && !this.id.equals(id)) {
            throw new IllegalStateException(msg("Aggregate '{}' already has id '{}' and cannot be assigned id '{}'",
                                                getClass().getName(),
                                                this.id,
                                                id));
        }
        this.id = id;
    }

    @Override
    public long expectedVersion() {
        if (version == null) {
            version = NO_EVENTS_HAVE_BEEN_APPLIED;
        }
        return version;
    }

    @Override
    public void expectedVersion(long expectedVersion) {
        requireTrue(expectedVersion >= NO_EVENTS_HAVE_BEEN_APPLIED, msg("expectedVersion must be >= {}", NO_EVENTS_HAVE_BEEN_APPLIED));
        this.version = expectedVersion;
    }

    @Override
    public void restoreFromEvents(List<?> events) {
        requireNonNull(events, "You must supply a list of events");
        if (recorder().hasRecordedEvents()) {
            throw new IllegalStateException(msg("Cannot restore aggregate '{}' with id '{}' while it has {} undrained event(s)",
                                                getClass().getName(),
                                                id,
                                                recorder().recordedEvents().size()));
        }
        isRestoring = true;
        try {
            events.forEach(this::restore);
        } finally {
            isRestoring = false;
        }
    }

    @Override
    public void updateWithEvents(List<?> events, long expectedVersion) {
        requireNonNull(events, "You must supply a list of events");
        if (expectedVersion != expectedVersion()) {
            throw new AggregateVersionConflictException(getClass(), id, expectedVersion, expectedVersion());
        }
        restoreFromEvents(events);
    }

    @Override
    public List<Object> drainUncommittedEvents() {
        correlationSource = Optional.empty();
        return recorder().drainRecordedEvents();
    }

    /**
     * @return a read-only view of the events raised since the last {@link #drainUncommittedEvents()}
     */
    public List<Object> uncommittedEvents() {
        return recorder().recordedEvents();
    }

    @Override
    public boolean hasUncommittedEvents() {
        return recorder().hasRecordedEvents();
    }

    @Override
    public void correlateWith(CorrelatedMessage source) {
        requireNonNull(source, "You must supply a correlation source");
        var currentSource = correlationSource();
        if (currentSource.isPresent() && currentSource.get() != source && recorder().hasRecordedEvents()) {
            throw new IllegalStateException(msg("Cannot correlate aggregate '{}' with id '{}' with message '{}' while it has undrained events caused by message '{}'",
                                                getClass().getName(),
                                                id,
                                                source.msgId(),
                                                currentSource.get().msgId()));
        }
        correlationSource = Optional.of(source);
    }

    @Override
    public Optional<CorrelatedMessage> correlationSource() {
        if (correlationSource == null) {
            correlationSource = Optional.empty();
        }
        return correlationSource;
    }

    /**
     * Raise a new event: assign its correlation envelope and aggregate id, apply it to the aggregate's state,
     * increment the version and record it for persistence
     *
     * @param event the new event
     */
    protected final void raise(EVENT event) {
        requireNonNull(event, "You must supply an event");
        event.aggregateId(id());
        event.stamp(correlationSource());
        applyEventToTheAggregate(event);
        version = expectedVersion() + 1;
        recorder().record(event);
    }

    /**
     * Is the event currently being applied part of the aggregate's history (as opposed to being raised)
     */
    protected final boolean isRestoring() {
        return isRestoring;
    }

    /**
     * Resolve the common super type of the events this aggregate raises.<br>
     * Override if the type can't be resolved from the generic type argument of {@link AggregateRoot}
     */
    protected Class<?> eventBaseType() {
        return GenericType.resolveGenericTypeOnSuperClass(getClass(), 0);
    }

    private void restore(Object event) {
        requireNonNull(event, msg("Aggregate '{}' cannot restore a null event", getClass().getName()));
        var registry = registry();
        if (!registry.eventBaseType().isInstance(event)) {
            throw new UnknownEventTypeException(getClass(), event.getClass());
        }
        var aggregateId = ((Event) event).aggregateId();
        if (id == null) {
            // The aggregate doesn't know its id, hence the first restored event must know it
            requireNonNull(aggregateId, msg("The first event '{}' restored into aggregate '{}' didn't contain an aggregateId",
                                            event.getClass().getName(),
                                            getClass().getName()));
            id(aggregateId);
        } else if (aggregateId != null && !aggregateId.equals(id)) {
            throw new IllegalArgumentException(msg("Cannot restore event '{}' belonging to aggregate '{}' into aggregate '{}' with id '{}'",
                                                   event.getClass().getName(),
                                                   aggregateId,
                                                   getClass().getName(),
                                                   id));
        }
        applyEventToTheAggregate(event);
        version = expectedVersion() + 1;
    }

    /**
     * Apply the event to the aggregate's state by calling the {@link EventHandler} method with the most specific parameter type
     *
     * @param event the event to apply
     * @throws UnknownEventTypeException if no {@link EventHandler} method accepts the event
     * @see #isRestoring()
     */
    protected void applyEventToTheAggregate(Object event) {
        if (!registry().eventBaseType().isInstance(event)) {
            throw new UnknownEventTypeException(getClass(), event.getClass());
        }
        if (invoker == null) {
            // Created lazily since instances created by Objenesis skip the constructor
            invoker = registry().createInvoker(this);
        }
        invoker.invoke(event, unmatchedEvent -> {
            throw new UnknownEventTypeException(getClass(), unmatchedEvent.getClass());
        });
    }

    private EventHandlerRegistry registry() {
        if (registry == null) {
            registry = EventHandlerRegistry.of(getClass(), eventBaseType());
        }
        return registry;
    }

    private EventRecorder recorder() {
        if (recorder == null) {
            recorder = new EventRecorder();
        }
        return recorder;
    }
}
