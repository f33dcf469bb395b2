package dk.cloudcreate.streamsourcing.streamstore.serializer;

import com.fasterxml.jackson.annotation.JsonAutoDetect;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.*;
import com.fasterxml.jackson.databind.json.JsonMapper;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import dk.cloudcreate.essentials.types.jackson.EssentialTypesJacksonModule;
import dk.cloudcreate.streamsourcing.common.messaging.CorrelatedMessage;
import dk.cloudcreate.streamsourcing.streamstore.*;

import java.io.IOException;
import java.util.*;

import static dk.cloudcreate.essentials.shared.FailFast.requireNonNull;
import static dk.cloudcreate.essentials.shared.MessageFormatter.msg;

/**
 * Jackson based {@link EventSerializer}.<br>
 * The event is serialized as the JSON data of the {@link EventData} and its Fully Qualified Class Name is stored in the
 * {@link EventHeaders#EVENT_JAVA_TYPE} header, which is used to resolve the Java type during deserialization.<br>
 * The {@link EventData#eventType()} is the simple class name of the event.<br>
 * If the event is a {@link CorrelatedMessage} then its {@link CorrelatedMessage#msgId()} is used as {@link EventData#eventId()}
 *
 * @see #createDefaultObjectMapper()
 */
public final class JacksonEventSerializer implements EventSerializer {
    private static final TypeReference<LinkedHashMap<String, Object>> HEADERS_TYPE = new TypeReference<>() {
    };

    private final ObjectMapper objectMapper;

    public JacksonEventSerializer() {
        this(createDefaultObjectMapper());
    }

    public JacksonEventSerializer(ObjectMapper objectMapper) {
        this.objectMapper = requireNonNull(objectMapper, "No objectMapper provided");
    }

    /**
     * Create an {@link ObjectMapper} that serializes fields (of any visibility) and ignores getters and setters,
     * which allows events to keep their state in private fields.<br>
     * The {@link EssentialTypesJacksonModule} is registered, so e.g. {@link dk.cloudcreate.essentials.types.CharSequenceType}'s
     * are serialized as plain JSON values
     */
    public static ObjectMapper createDefaultObjectMapper() {
        var objectMapper = JsonMapper.builder()
                                     .disable(MapperFeature.AUTO_DETECT_GETTERS)
                                     .disable(MapperFeature.AUTO_DETECT_IS_GETTERS)
                                     .disable(MapperFeature.AUTO_DETECT_SETTERS)
                                     .disable(MapperFeature.DEFAULT_VIEW_INCLUSION)
                                     .disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES)
                                     .disable(SerializationFeature.FAIL_ON_EMPTY_BEANS)
                                     .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS)
                                     .enable(MapperFeature.AUTO_DETECT_CREATORS)
                                     .enable(MapperFeature.AUTO_DETECT_FIELDS)
                                     .enable(MapperFeature.PROPAGATE_TRANSIENT_MARKER)
                                     .addModule(new JavaTimeModule())
                                     .addModule(new EssentialTypesJacksonModule())
                                     .build();

        objectMapper.setVisibility(objectMapper.getSerializationConfig().getDefaultVisibilityChecker()
                                               .withGetterVisibility(JsonAutoDetect.Visibility.NONE)
                                               .withSetterVisibility(JsonAutoDetect.Visibility.NONE)
                                               .withFieldVisibility(JsonAutoDetect.Visibility.ANY)
                                               .withCreatorVisibility(JsonAutoDetect.Visibility.ANY));
        return objectMapper;
    }

    public ObjectMapper getObjectMapper() {
        return objectMapper;
    }

    @Override
    public EventData serialize(Object event, Map<String, Object> headers) {
        requireNonNull(event, "No event provided");
        requireNonNull(headers, "No headers provided");

        var metadata = new LinkedHashMap<>(headers);
        metadata.put(EventHeaders.EVENT_JAVA_TYPE, event.getClass().getName());
        try {
            return new EventData(resolveEventId(event),
                                 event.getClass().getSimpleName(),
                                 true,
                                 objectMapper.writeValueAsBytes(event),
                                 objectMapper.writeValueAsBytes(metadata));
        } catch (JsonProcessingException e) {
            throw new EventSerializationException(msg("Failed to serialize event of type '{}'", event.getClass().getName()), e);
        }
    }

    private static UUID resolveEventId(Object event) {
        if (event instanceof CorrelatedMessage) {
            var msgId = ((CorrelatedMessage) event).msgId();
            if (msgId != null) {
                return msgId.toUUID();
            }
        }
        return UUID.randomUUID();
    }

    @Override
    public Object deserialize(RecordedEvent recordedEvent) {
        requireNonNull(recordedEvent, "No recordedEvent provided");
        var javaTypeName = deserializeHeaders(recordedEvent).get(EventHeaders.EVENT_JAVA_TYPE);
        if (javaTypeName == null) {
            throw new EventDeserializationException(msg("Event {} in stream '{}' (eventType: '{}') doesn't contain the '{}' header",
                                                        recordedEvent.originalEventNumber(),
                                                        recordedEvent.originalStreamName(),
                                                        recordedEvent.eventType(),
                                                        EventHeaders.EVENT_JAVA_TYPE));
        }

        Class<?> javaType;
        try {
            javaType = Class.forName(javaTypeName.toString(), true, Thread.currentThread().getContextClassLoader());
        } catch (ClassNotFoundException e) {
            throw new EventDeserializationException(msg("Unknown event Java type '{}' for event {} in stream '{}'",
                                                        javaTypeName,
                                                        recordedEvent.originalEventNumber(),
                                                        recordedEvent.originalStreamName()), e);
        }

        try {
            return objectMapper.readValue(recordedEvent.data(), javaType);
        } catch (IOException e) {
            throw new EventDeserializationException(msg("Failed to deserialize event {} in stream '{}' to Java type '{}'",
                                                        recordedEvent.originalEventNumber(),
                                                        recordedEvent.originalStreamName(),
                                                        javaType.getName()), e);
        }
    }

    @Override
    public Map<String, Object> deserializeHeaders(RecordedEvent recordedEvent) {
        requireNonNull(recordedEvent, "No recordedEvent provided");
        if (recordedEvent.metadata().length == 0) {
            return Map.of();
        }
        try {
            return objectMapper.readValue(recordedEvent.metadata(), HEADERS_TYPE);
        } catch (IOException e) {
            throw new EventDeserializationException(msg("Failed to deserialize the metadata of event {} in stream '{}'",
                                                        recordedEvent.originalEventNumber(),
                                                        recordedEvent.originalStreamName()), e);
        }
    }
}
