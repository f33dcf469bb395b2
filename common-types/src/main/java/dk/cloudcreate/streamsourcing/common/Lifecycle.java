package dk.cloudcreate.streamsourcing.common;

/**
 * Common life cycle interface for long running components, such as stream listeners and read models
 */
public interface Lifecycle {
    /**
     * Start processing. Calling {@link #start()} on a component where {@link #isStarted()} already returns true
     * is ignored
     */
    void start();

    /**
     * Stop processing and release any subscriptions held. Calling {@link #stop()} on a component where {@link #isStarted()}
     * returns false is ignored
     */
    void stop();

    /**
     * @return true if the component is started otherwise false
     */
    boolean isStarted();
}
