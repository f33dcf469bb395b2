package dk.cloudcreate.streamsourcing.streamstore.serializer;

public class EventSerializationException extends RuntimeException {
    public EventSerializationException(String msg, Exception cause) {
        super(msg, cause);
    }
}
