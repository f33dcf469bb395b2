package dk.cloudcreate.streamsourcing.streamstore.subscription;

public enum SubscriptionDropReason {
    /**
     * {@link StreamSubscription#unsubscribe()} was called
     */
    USER_INITIATED,
    /**
     * The <code>eventAppeared</code> callback threw an exception
     */
    SUBSCRIBER_ERROR,
    /**
     * The stream subscribed to was deleted
     */
    STREAM_DELETED,
    /**
     * The connection was closed
     */
    CONNECTION_CLOSED
}
