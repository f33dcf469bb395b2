package dk.cloudcreate.streamsourcing.streamstore.serializer;

/**
 * Thrown if a {@link dk.cloudcreate.streamsourcing.streamstore.RecordedEvent} couldn't be converted back into a Java event,
 * e.g. because the Java type it was serialized from is unknown
 */
public class EventDeserializationException extends RuntimeException {
    public EventDeserializationException(String message) {
        super(message);
    }

    public EventDeserializationException(String msg, Exception cause) {
        super(msg, cause);
    }
}
