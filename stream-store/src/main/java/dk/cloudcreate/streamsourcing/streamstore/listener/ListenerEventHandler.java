package dk.cloudcreate.streamsourcing.streamstore.listener;

import dk.cloudcreate.streamsourcing.streamstore.RecordedEvent;

/**
 * Callback for events received by a {@link Listener} or a {@link StreamReader}
 */
@FunctionalInterface
public interface ListenerEventHandler {
    /**
     * @param event         the deserialized event
     * @param recordedEvent the recorded event the <code>event</code> was deserialized from
     */
    void handle(Object event, RecordedEvent recordedEvent);
}
