package dk.cloudcreate.streamsourcing.streamstore.inmemory;

import dk.cloudcreate.essentials.shared.concurrent.ThreadFactoryBuilder;
import dk.cloudcreate.streamsourcing.streamstore.RecordedEvent;
import dk.cloudcreate.streamsourcing.streamstore.subscription.*;
import org.slf4j.Logger;

import java.util.List;
import java.util.concurrent.*;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.function.*;

import static dk.cloudcreate.essentials.shared.FailFast.requireNonNull;
import static dk.cloudcreate.essentials.shared.MessageFormatter.msg;

/**
 * Catch-up subscription used by {@link InMemoryStreamStoreConnection}.<br>
 * All callbacks are executed, in order, by a single dispatcher thread owned by the subscription.
 * Historic events are queued before any live event, so no event is lost or delivered twice at the switch over to live.
 */
final class InMemoryCatchUpSubscription implements StreamSubscription {
    private final Logger                                        log;
    private final String                                        streamName;
    private final Consumer<RecordedEvent>                       eventAppeared;
    private final Runnable                                      liveProcessingStarted;
    private final BiConsumer<SubscriptionDropReason, Exception> subscriptionDropped;
    private final Consumer<InMemoryCatchUpSubscription>         onDropped;
    private final ExecutorService                               dispatcher;
    private final AtomicBoolean                                 active = new AtomicBoolean(true);
    private volatile boolean                                    live;

    InMemoryCatchUpSubscription(Logger log,
                                String connectionName,
                                String streamName,
                                Consumer<RecordedEvent> eventAppeared,
                                Runnable liveProcessingStarted,
                                BiConsumer<SubscriptionDropReason, Exception> subscriptionDropped,
                                Consumer<InMemoryCatchUpSubscription> onDropped) {
        this.log = requireNonNull(log, "No log provided");
        this.streamName = requireNonNull(streamName, "No streamName provided");
        this.eventAppeared = requireNonNull(eventAppeared, "No eventAppeared callback provided");
        this.liveProcessingStarted = liveProcessingStarted != null ? liveProcessingStarted : () -> {};
        this.subscriptionDropped = subscriptionDropped != null ? subscriptionDropped : (reason, e) -> {};
        this.onDropped = requireNonNull(onDropped, "No onDropped callback provided");
        this.dispatcher = Executors.newSingleThreadExecutor(ThreadFactoryBuilder.builder()
                                                                                .nameFormat(connectionName + "-Subscription-" + streamName + "-%d")
                                                                                .daemon(true)
                                                                                .build());
    }

    /**
     * Must be called while the connection holds its lock, so that no live event can be queued before the historic events
     */
    void catchUp(List<RecordedEvent> historicEvents) {
        dispatcher.execute(() -> {
            log.trace("[{}] Catching up with {} historic event(s)", streamName, historicEvents.size());
            for (var historicEvent : historicEvents) {
                if (!deliver(historicEvent)) {
                    return;
                }
            }
            if (active.get()) {
                live = true;
                log.debug("[{}] Subscription is live", streamName);
                liveProcessingStarted.run();
            }
        });
    }

    /**
     * Must be called while the connection holds its lock
     */
    void eventAppended(RecordedEvent recordedEvent) {
        if (!active.get()) {
            return;
        }
        try {
            dispatcher.execute(() -> deliver(recordedEvent));
        } catch (RejectedExecutionException e) {
            log.trace("[{}] Ignoring event {} as the subscription has been dropped", streamName, recordedEvent.eventNumber());
        }
    }

    private boolean deliver(RecordedEvent recordedEvent) {
        if (!active.get()) {
            return false;
        }
        try {
            eventAppeared.accept(recordedEvent);
            return true;
        } catch (Exception e) {
            log.error(msg("[{}] Subscriber failed to handle event {} (eventType: {}). Dropping subscription",
                          streamName,
                          recordedEvent.eventNumber(),
                          recordedEvent.eventType()), e);
            drop(SubscriptionDropReason.SUBSCRIBER_ERROR, e);
            return false;
        }
    }

    void drop(SubscriptionDropReason reason, Exception cause) {
        if (active.compareAndSet(true, false)) {
            log.debug("[{}] Dropping subscription due to {}", streamName, reason);
            live = false;
            onDropped.accept(this);
            try {
                subscriptionDropped.accept(reason, cause);
            } finally {
                dispatcher.shutdown();
            }
        }
    }

    @Override
    public String streamName() {
        return streamName;
    }

    @Override
    public boolean isActive() {
        return active.get();
    }

    @Override
    public boolean isLive() {
        return live;
    }

    @Override
    public void unsubscribe() {
        drop(SubscriptionDropReason.USER_INITIATED, null);
    }

    @Override
    public String toString() {
        return "InMemoryCatchUpSubscription{" +
                "streamName='" + streamName + '\'' +
                ", active=" + active.get() +
                ", live=" + live +
                '}';
    }
}
