package dk.cloudcreate.streamsourcing.streamstore.serializer;

import dk.cloudcreate.streamsourcing.streamstore.*;

import java.util.Map;

/**
 * Converts Java events to and from the {@link EventData}/{@link RecordedEvent} representation used by a {@link StreamStoreConnection}
 */
public interface EventSerializer {
    /**
     * Serialize an event
     *
     * @param event   the event
     * @param headers additional headers that will be stored in the event's metadata
     * @return the serialized event
     * @throws EventSerializationException in case the event couldn't be serialized
     */
    EventData serialize(Object event, Map<String, Object> headers);

    /**
     * Deserialize the event contained in <code>recordedEvent</code>
     *
     * @param recordedEvent the recorded event
     * @return the deserialized event
     * @throws EventDeserializationException in case the event couldn't be deserialized, e.g. if its Java type is unknown
     */
    Object deserialize(RecordedEvent recordedEvent);

    /**
     * Deserialize the headers contained in the metadata of <code>recordedEvent</code>
     *
     * @param recordedEvent the recorded event
     * @return the headers
     * @throws EventDeserializationException in case the metadata couldn't be deserialized
     */
    Map<String, Object> deserializeHeaders(RecordedEvent recordedEvent);
}
