package dk.cloudcreate.streamsourcing.streamstore.listener;

import dk.cloudcreate.streamsourcing.streamstore.*;
import dk.cloudcreate.streamsourcing.streamstore.naming.StreamNameBuilder;
import dk.cloudcreate.streamsourcing.streamstore.serializer.EventSerializer;
import dk.cloudcreate.streamsourcing.streamstore.subscription.*;
import org.slf4j.*;

import java.time.Duration;
import java.util.*;
import java.util.concurrent.*;
import java.util.concurrent.atomic.AtomicLong;

import static dk.cloudcreate.essentials.shared.FailFast.*;

/**
 * {@link Listener} that wraps a catch-up {@link StreamSubscription} obtained from a {@link StreamStoreConnection}.<br>
 * The {@link RecordedEvent}'s received are deserialized using the {@link EventSerializer} and handed to all
 * {@link ListenerEventHandler}'s, in order, on the subscription's thread.<br>
 * If an event handler throws an exception then the subscription is dropped and the listener is stopped.
 * <p>
 * After {@link #stop()}, calling {@link #start()} resumes listening on the same stream, starting after the last
 * event handled (see {@link #position()}).
 */
public final class StreamListener implements Listener {
    private final Logger                           log;
    private final String                           listenerName;
    private final StreamStoreConnection            connection;
    private final StreamNameBuilder                streamNameBuilder;
    private final EventSerializer                  eventSerializer;
    private final List<ListenerEventHandler>       eventHandlers = new CopyOnWriteArrayList<>();
    private final Object                           startLock     = new Object();
    /**
     * Incremented every time the listener subscribes, so callbacks from a previous subscription can be ignored
     */
    private final AtomicLong                       generation    = new AtomicLong();
    private volatile StreamSubscription            subscription;
    private volatile CountDownLatch                liveLatch     = new CountDownLatch(1);
    private volatile String                        streamName;
    private volatile Long                          position;
    private volatile boolean                       started;

    public StreamListener(String listenerName,
                          StreamStoreConnection connection,
                          StreamNameBuilder streamNameBuilder,
                          EventSerializer eventSerializer) {
        this(listenerName, connection, streamNameBuilder, eventSerializer, LoggerFactory.getLogger(StreamListener.class));
    }

    public StreamListener(String listenerName,
                          StreamStoreConnection connection,
                          StreamNameBuilder streamNameBuilder,
                          EventSerializer eventSerializer,
                          Logger log) {
        this.listenerName = requireNonNull(listenerName, "No listenerName provided");
        this.connection = requireNonNull(connection, "No connection provided");
        this.streamNameBuilder = requireNonNull(streamNameBuilder, "No streamNameBuilder provided");
        this.eventSerializer = requireNonNull(eventSerializer, "No eventSerializer provided");
        this.log = requireNonNull(log, "No log provided");
    }

    @Override
    public String listenerName() {
        return listenerName;
    }

    @Override
    public Optional<String> streamName() {
        return Optional.ofNullable(streamName);
    }

    @Override
    public Optional<Long> position() {
        return Optional.ofNullable(position);
    }

    @Override
    public boolean isLive() {
        return started && liveLatch.getCount() == 0;
    }

    @Override
    public boolean isStarted() {
        return started;
    }

    @Override
    public void addEventHandler(ListenerEventHandler eventHandler) {
        eventHandlers.add(requireNonNull(eventHandler, "No eventHandler provided"));
    }

    @Override
    public void startForAggregate(Class<?> aggregateType, UUID aggregateId, Optional<Long> checkpoint, boolean blockUntilLive, Duration timeout) {
        start(streamNameBuilder.generateForAggregate(aggregateType, aggregateId), checkpoint, blockUntilLive, timeout);
    }

    @Override
    public void startForCategory(Class<?> aggregateType, Optional<Long> checkpoint, boolean blockUntilLive, Duration timeout) {
        start(streamNameBuilder.generateForCategory(aggregateType), checkpoint, blockUntilLive, timeout);
    }

    @Override
    public void startForEventType(Class<?> eventType, Optional<Long> checkpoint, boolean blockUntilLive, Duration timeout) {
        requireNonNull(eventType, "No eventType provided");
        start(streamNameBuilder.generateForEventType(eventType.getSimpleName()), checkpoint, blockUntilLive, timeout);
    }

    @Override
    public void start(String streamName, Optional<Long> checkpoint, boolean blockUntilLive, Duration timeout) {
        requireNonNull(streamName, "No streamName provided");
        requireNonNull(checkpoint, "No checkpoint provided");
        requireNonNull(timeout, "No timeout provided");
        checkpoint.ifPresent(eventNumber -> requireTrue(eventNumber >= 0, "checkpoint must be >= 0"));

        CountDownLatch latch;
        synchronized (startLock) {
            if (started) {
                throw new IllegalStateException("Listener '" + listenerName + "' is already started");
            }
            latch = subscribe(streamName, checkpoint);
        }

        if (blockUntilLive) {
            awaitLive(latch, streamName, timeout);
        }
    }

    /**
     * Resume listening on the stream the listener was previously started on, starting after the last event handled
     *
     * @throws IllegalStateException if the listener has never been started on a stream
     */
    @Override
    public void start() {
        synchronized (startLock) {
            if (started) {
                return;
            }
            if (streamName == null) {
                throw new IllegalStateException("Listener '" + listenerName + "' has never been started on a stream");
            }
            subscribe(streamName, position());
        }
    }

    private CountDownLatch subscribe(String streamName, Optional<Long> checkpoint) {
        log.info("[{}] Starting listener on stream '{}' from checkpoint {}", listenerName, streamName, checkpoint.orElse(null));
        this.streamName = streamName;
        this.position = checkpoint.orElse(null);
        var latch = new CountDownLatch(1);
        liveLatch = latch;
        var subscriptionGeneration = generation.incrementAndGet();
        subscription = connection.subscribeToStreamFrom(streamName,
                                                        checkpoint,
                                                        recordedEvent -> onEvent(recordedEvent, subscriptionGeneration),
                                                        () -> onLive(latch, subscriptionGeneration),
                                                        (reason, cause) -> onDropped(reason, cause, subscriptionGeneration));
        started = true;
        return latch;
    }

    private void awaitLive(CountDownLatch latch, String streamName, Duration timeout) {
        boolean isLive;
        try {
            isLive = latch.await(timeout.toMillis(), TimeUnit.MILLISECONDS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            stop();
            throw new ListenerTimeoutException(listenerName, streamName, timeout, "being interrupted while waiting for the listener to become live");
        }
        if (!isLive) {
            stop();
            throw new ListenerTimeoutException(listenerName, streamName, timeout, "waiting for the listener to become live");
        }
    }

    private void onEvent(RecordedEvent recordedEvent, long subscriptionGeneration) {
        if (subscriptionGeneration != generation.get()) {
            return;
        }
        var event = eventSerializer.deserialize(recordedEvent);
        log.trace("[{}] Received event {} of type '{}' from stream '{}'",
                  listenerName,
                  recordedEvent.eventNumber(),
                  recordedEvent.eventType(),
                  recordedEvent.streamName());
        eventHandlers.forEach(eventHandler -> eventHandler.handle(event, recordedEvent));
        position = recordedEvent.eventNumber();
    }

    private void onLive(CountDownLatch latch, long subscriptionGeneration) {
        if (subscriptionGeneration == generation.get()) {
            log.debug("[{}] Listener on stream '{}' is live", listenerName, streamName);
        }
        latch.countDown();
    }

    private void onDropped(SubscriptionDropReason reason, Exception cause, long subscriptionGeneration) {
        if (subscriptionGeneration != generation.get()) {
            return;
        }
        if (reason == SubscriptionDropReason.USER_INITIATED) {
            log.debug("[{}] Subscription to stream '{}' was stopped", listenerName, streamName);
        } else {
            log.warn("[{}] Subscription to stream '{}' was dropped due to {}. Last handled event: {}",
                     listenerName,
                     streamName,
                     reason,
                     position);
            synchronized (startLock) {
                if (subscriptionGeneration == generation.get()) {
                    started = false;
                    subscription = null;
                }
            }
        }
    }

    @Override
    public void stop() {
        StreamSubscription subscriptionToStop;
        synchronized (startLock) {
            if (!started) {
                return;
            }
            log.info("[{}] Stopping listener on stream '{}'", listenerName, streamName);
            started = false;
            subscriptionToStop = subscription;
            subscription = null;
        }
        if (subscriptionToStop != null) {
            subscriptionToStop.unsubscribe();
        }
    }

    @Override
    public String toString() {
        return "StreamListener{" +
                "listenerName='" + listenerName + '\'' +
                ", streamName='" + streamName + '\'' +
                ", position=" + position +
                ", started=" + started +
                '}';
    }
}
