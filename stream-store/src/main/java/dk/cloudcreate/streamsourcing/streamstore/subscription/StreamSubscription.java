package dk.cloudcreate.streamsourcing.streamstore.subscription;

/**
 * A catch-up subscription to a single stream
 */
public interface StreamSubscription extends AutoCloseable {
    /**
     * @return the name of the stream subscribed to
     */
    String streamName();

    /**
     * @return true until the subscription has been dropped
     */
    boolean isActive();

    /**
     * @return true once all historic events have been delivered and the subscription receives events as they're appended
     */
    boolean isLive();

    /**
     * Stop receiving events. The <code>subscriptionDropped</code> callback will be called with {@link SubscriptionDropReason#USER_INITIATED}.<br>
     * Calling this method on a dropped subscription is ignored
     */
    void unsubscribe();

    @Override
    default void close() {
        unsubscribe();
    }
}
