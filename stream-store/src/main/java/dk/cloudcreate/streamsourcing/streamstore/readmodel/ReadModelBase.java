package dk.cloudcreate.streamsourcing.streamstore.readmodel;

import dk.cloudcreate.essentials.shared.reflection.invocation.*;
import dk.cloudcreate.streamsourcing.streamstore.*;
import dk.cloudcreate.streamsourcing.streamstore.listener.*;
import dk.cloudcreate.streamsourcing.streamstore.naming.StreamNameBuilder;
import dk.cloudcreate.streamsourcing.streamstore.serializer.EventSerializer;
import org.slf4j.*;

import java.lang.reflect.Method;
import java.time.Duration;
import java.util.*;
import java.util.function.Supplier;
import java.util.stream.Collectors;

import static dk.cloudcreate.essentials.shared.FailFast.*;

/**
 * Base class for read models, i.e. query side projections that are built from the events in one or more streams.<br>
 * Each call to one of the <code>start</code> methods creates a new {@link Listener} (using the listener factory supplied to the constructor),
 * whose events are dispatched to the methods in the concrete read model annotated with {@link ReadModelEventHandler}.<br>
 * Events without a matching {@link ReadModelEventHandler} method are ignored.
 * <p>
 * Events are dispatched to the read model one at a time, even if multiple listeners have been started.
 * <pre>{@code
 * public class AccountBalances extends ReadModelBase {
 *     private final Map<UUID, Long> balances = new ConcurrentHashMap<>();
 *
 *     public AccountBalances(StreamStoreConnection connection, StreamNameBuilder streamNameBuilder, EventSerializer eventSerializer) {
 *         super("AccountBalances", connection, streamNameBuilder, eventSerializer);
 *         startForCategory(Account.class, Optional.empty(), true, Duration.ofSeconds(5));
 *     }
 *
 *     @ReadModelEventHandler
 *     private void on(AmountDeposited e) {
 *         balances.merge(e.aggregateId(), e.amount, Long::sum);
 *     }
 * }
 * }</pre>
 */
public abstract class ReadModelBase implements AutoCloseable {
    private final   Logger                               log;
    private final   String                               readModelName;
    private final   Supplier<Listener>                   listenerFactory;
    private final   List<Listener>                       listeners   = new ArrayList<>();
    /**
     * The event number of the last event each listener has dispatched to this read model. Guarded by {@link #handlerLock}
     */
    private final   Map<Listener, Long>                  handledPositions = new IdentityHashMap<>();
    private final   PatternMatchingMethodInvoker<Object> invoker;
    final           Object                               handlerLock = new Object();

    /**
     * Create a read model that uses {@link StreamListener}'s
     */
    protected ReadModelBase(String readModelName,
                            StreamStoreConnection connection,
                            StreamNameBuilder streamNameBuilder,
                            EventSerializer eventSerializer) {
        this(readModelName, () -> new StreamListener(readModelName, connection, streamNameBuilder, eventSerializer));
    }

    protected ReadModelBase(String readModelName, Supplier<Listener> listenerFactory) {
        this(readModelName, listenerFactory, LoggerFactory.getLogger(ReadModelBase.class));
    }

    protected ReadModelBase(String readModelName, Supplier<Listener> listenerFactory, Logger log) {
        this.readModelName = requireNonNull(readModelName, "No readModelName provided");
        this.listenerFactory = requireNonNull(listenerFactory, "No listenerFactory provided");
        this.log = requireNonNull(log, "No log provided");
        invoker = new PatternMatchingMethodInvoker<>(this,
                                                     new ReadModelEventHandlerMethodPatternMatcher(),
                                                     InvocationStrategy.InvokeMostSpecificTypeMatched);
    }

    public String readModelName() {
        return readModelName;
    }

    /**
     * Start listening on a named stream
     *
     * @see Listener#start(String, Optional, boolean, Duration)
     */
    public void start(String streamName, Optional<Long> checkpoint, boolean blockUntilLive, Duration timeout) {
        addNewListener().start(streamName, checkpoint, blockUntilLive, timeout);
    }

    /**
     * @see Listener#startForAggregate(Class, UUID, Optional, boolean, Duration)
     */
    public void startForAggregate(Class<?> aggregateType, UUID aggregateId, Optional<Long> checkpoint, boolean blockUntilLive, Duration timeout) {
        addNewListener().startForAggregate(aggregateType, aggregateId, checkpoint, blockUntilLive, timeout);
    }

    /**
     * @see Listener#startForCategory(Class, Optional, boolean, Duration)
     */
    public void startForCategory(Class<?> aggregateType, Optional<Long> checkpoint, boolean blockUntilLive, Duration timeout) {
        addNewListener().startForCategory(aggregateType, checkpoint, blockUntilLive, timeout);
    }

    /**
     * @see Listener#startForEventType(Class, Optional, boolean, Duration)
     */
    public void startForEventType(Class<?> eventType, Optional<Long> checkpoint, boolean blockUntilLive, Duration timeout) {
        addNewListener().startForEventType(eventType, checkpoint, blockUntilLive, timeout);
    }

    private Listener addNewListener() {
        var listener = requireNonNull(listenerFactory.get(), "The listenerFactory returned null");
        listener.addEventHandler((event, recordedEvent) -> dispatch(listener, event, recordedEvent));
        synchronized (listeners) {
            listeners.add(listener);
        }
        return listener;
    }

    /**
     * The checkpoint of each listener is the event number of the last event dispatched to this read model, so it always matches
     * the state built by the {@link ReadModelEventHandler} methods
     *
     * @return the checkpoints of all the listeners started by this read model
     */
    public List<ReadModelCheckpoint> getCheckpoints() {
        synchronized (handlerLock) {
            return listenersSnapshot().stream()
                                      .filter(listener -> listener.streamName().isPresent())
                                      .map(listener -> new ReadModelCheckpoint(listener.streamName().get(), checkpointOf(listener)))
                                      .collect(Collectors.toList());
        }
    }

    private Optional<Long> checkpointOf(Listener listener) {
        var handledPosition = handledPositions.get(listener);
        if (handledPosition != null) {
            return Optional.of(handledPosition);
        }
        // Nothing dispatched yet, so the listener is still at the checkpoint it was started from
        return listener.position();
    }

    private List<Listener> listenersSnapshot() {
        synchronized (listeners) {
            return new ArrayList<>(listeners);
        }
    }

    /**
     * @return true if all listeners started by this read model have caught up with their streams
     */
    public boolean isLive() {
        var currentListeners = listenersSnapshot();
        return !currentListeners.isEmpty() && currentListeners.stream().allMatch(Listener::isLive);
    }

    private void dispatch(Listener listener, Object event, RecordedEvent recordedEvent) {
        synchronized (handlerLock) {
            invoker.invoke(new ReceivedEvent(event, recordedEvent), unmatchedEvent -> {
                log.trace("[{}] No ReadModelEventHandler for event of type '{}' from stream '{}'",
                          readModelName,
                          event.getClass().getName(),
                          recordedEvent.streamName());
            });
            handledPositions.put(listener, recordedEvent.eventNumber());
        }
    }

    /**
     * Stop all listeners
     */
    @Override
    public void close() {
        var listenersToStop = listenersSnapshot();
        log.debug("[{}] Stopping {} listener(s)", readModelName, listenersToStop.size());
        listenersToStop.forEach(Listener::stop);
    }

    @Override
    public String toString() {
        return getClass().getSimpleName() + "{" +
                "readModelName='" + readModelName + '\'' +
                '}';
    }

    private static final class ReceivedEvent {
        private final Object        event;
        private final RecordedEvent recordedEvent;

        private ReceivedEvent(Object event, RecordedEvent recordedEvent) {
            this.event = event;
            this.recordedEvent = recordedEvent;
        }
    }

    private static final class ReadModelEventHandlerMethodPatternMatcher implements MethodPatternMatcher<Object> {
        @Override
        public boolean isInvokableMethod(Method method) {
            requireNonNull(method, "No candidate method supplied");
            if (!method.isAnnotationPresent(ReadModelEventHandler.class)) {
                return false;
            }
            if (method.getParameterCount() == 2) {
                return RecordedEvent.class.equals(method.getParameterTypes()[1]);
            }
            return method.getParameterCount() == 1;
        }

        @Override
        public Class<?> resolveInvocationArgumentTypeFromMethodDefinition(Method method) {
            requireNonNull(method, "No method supplied");
            return method.getParameterTypes()[0];
        }

        @Override
        public Class<?> resolveInvocationArgumentTypeFromObject(Object argument) {
            requireNonNull(argument, "No argument supplied");
            requireMustBeInstanceOf(argument, ReceivedEvent.class);
            return ((ReceivedEvent) argument).event.getClass();
        }

        @Override
        public void invokeMethod(Method methodToInvoke, Object argument, Object invokeMethodOn, Class<?> resolvedInvokeMethodWithArgumentOfType) throws Exception {
            requireNonNull(methodToInvoke, "No methodToInvoke supplied");
            requireNonNull(argument, "No argument supplied");
            requireMustBeInstanceOf(argument, ReceivedEvent.class);
            requireNonNull(invokeMethodOn, "No invokeMethodOn supplied");

            var receivedEvent = (ReceivedEvent) argument;
            if (methodToInvoke.getParameterCount() == 1) {
                methodToInvoke.invoke(invokeMethodOn, receivedEvent.event);
            } else {
                methodToInvoke.invoke(invokeMethodOn, receivedEvent.event, receivedEvent.recordedEvent);
            }
        }
    }
}
