package dk.cloudcreate.streamstore.serializer.json;

import com.fasterxml.jackson.annotation.JsonAutoDetect;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.*;
import com.fasterxml.jackson.databind.json.JsonMapper;
import com.fasterxml.jackson.datatype.jdk8.Jdk8Module;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import dk.cloudcreate.streamstore.common.correlation.CorrelatedMessage;
import dk.cloudcreate.streamstore.connection.EventData;
import dk.cloudcreate.streamstore.serializer.*;
import org.slf4j.*;

import java.io.IOException;
import java.util.*;
import java.util.concurrent.*;

import static com.google.common.base.Preconditions.*;
import static com.google.common.base.Strings.lenientFormat;

/**
 * Jackson based {@link EventSerializer}.<br>
 * An event is stored with its simple class name as event type tag and a JSON metadata object containing the custom headers,
 * the {@link EventMetaData#EVENT_JAVA_TYPE} header and, for {@link CorrelatedMessage} events, the
 * {@link EventMetaData#MESSAGE_ID}, {@link EventMetaData#CORRELATION_ID} and {@link EventMetaData#CAUSATION_ID} headers.<br>
 * On read the Java type is resolved from the event types registered using {@link #registerEventType(Class)} and otherwise from the
 * {@link EventMetaData#EVENT_JAVA_TYPE} header.
 */
public class JacksonEventSerializer implements EventSerializer {
    private static final Logger                              log                 = LoggerFactory.getLogger(JacksonEventSerializer.class);
    private static final TypeReference<LinkedHashMap<String, Object>> METADATA_TYPE = new TypeReference<>() {
    };

    private final ObjectMapper                       objectMapper;
    /**
     * Key: event type tag<br>
     * Value: the Java type registered for the tag
     */
    private final ConcurrentMap<String, Class<?>>    registeredEventTypes = new ConcurrentHashMap<>();
    /**
     * Key: Fully qualified class name
     */
    private final ConcurrentMap<String, Class<?>>    resolvedJavaTypes    = new ConcurrentHashMap<>();

    public JacksonEventSerializer() {
        this(createDefaultObjectMapper());
    }

    public JacksonEventSerializer(ObjectMapper objectMapper) {
        this.objectMapper = checkNotNull(objectMapper, "No objectMapper provided");
    }

    /**
     * Create an {@link ObjectMapper} that (de)serializes events using their fields (of any visibility) instead of getters/setters
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
                                     .addModule(new Jdk8Module())
                                     .addModule(new JavaTimeModule())
                                     .build();

        objectMapper.setVisibility(objectMapper.getSerializationConfig().getDefaultVisibilityChecker()
                                               .withGetterVisibility(JsonAutoDetect.Visibility.NONE)
                                               .withSetterVisibility(JsonAutoDetect.Visibility.NONE)
                                               .withFieldVisibility(JsonAutoDetect.Visibility.ANY)
                                               .withCreatorVisibility(JsonAutoDetect.Visibility.ANY));
        return objectMapper;
    }

    /**
     * Register the Java type of an event under its event type tag ({@link #eventTypeOf(Class)})
     *
     * @param eventType the event type
     * @return this serializer instance
     */
    public JacksonEventSerializer registerEventType(Class<?> eventType) {
        return registerEventType(eventTypeOf(eventType), eventType);
    }

    public JacksonEventSerializer registerEventTypes(Class<?>... eventTypes) {
        checkNotNull(eventTypes, "No eventTypes provided");
        Arrays.stream(eventTypes).forEach(this::registerEventType);
        return this;
    }

    /**
     * Register the Java type that events stored with the <code>eventTypeTag</code> are deserialized into
     *
     * @param eventTypeTag the event type tag
     * @param eventType    the Java type
     * @return this serializer instance
     * @throws IllegalArgumentException if another Java type has already been registered for the tag
     */
    public JacksonEventSerializer registerEventType(String eventTypeTag, Class<?> eventType) {
        checkArgument(eventTypeTag != null && !eventTypeTag.isBlank(), "An eventTypeTag must be provided");
        checkNotNull(eventType, "No eventType provided");
        var existing = registeredEventTypes.putIfAbsent(eventTypeTag, eventType);
        checkArgument(existing == null || existing.equals(eventType),
                      "Event type tag '%s' is already registered for '%s'. Cannot register it for '%s'",
                      eventTypeTag,
                      existing != null ? existing.getName() : null,
                      eventType.getName());
        return this;
    }

    public ObjectMapper objectMapper() {
        return objectMapper;
    }

    @Override
    public String eventTypeOf(Class<?> eventType) {
        checkNotNull(eventType, "No eventType provided");
        return eventType.getSimpleName();
    }

    @Override
    public EventData serialize(Object event, Map<String, Object> headers) {
        checkNotNull(event, "No event provided");
        checkNotNull(headers, "No headers provided");

        var metadata = new LinkedHashMap<String, Object>(headers);
        metadata.put(EventMetaData.EVENT_JAVA_TYPE, event.getClass().getName());
        var eventId = UUID.randomUUID();
        if (event instanceof CorrelatedMessage) {
            var correlatedMessage = (CorrelatedMessage) event;
            if (correlatedMessage.messageId() != null) {
                eventId = correlatedMessage.messageId().value();
                metadata.put(EventMetaData.MESSAGE_ID, correlatedMessage.messageId().toString());
            }
            if (correlatedMessage.correlationId() != null) {
                metadata.put(EventMetaData.CORRELATION_ID, correlatedMessage.correlationId().toString());
            }
            if (correlatedMessage.causationId() != null) {
                metadata.put(EventMetaData.CAUSATION_ID, correlatedMessage.causationId().toString());
            }
        }

        try {
            return new EventData(eventId,
                                 eventTypeOf(event.getClass()),
                                 objectMapper.writeValueAsBytes(event),
                                 objectMapper.writeValueAsBytes(metadata),
                                 true);
        } catch (JsonProcessingException e) {
            throw new JSONSerializationException(lenientFormat("Failed to serialize event of type '%s'", event.getClass().getName()), e);
        }
    }

    @Override
    public Object deserialize(String eventType, byte[] payload, byte[] metadata) {
        checkNotNull(eventType, "No eventType provided");
        checkNotNull(payload, "No payload provided");
        var javaType = resolveJavaType(eventType, deserializeMetaData(metadata));
        try {
            return objectMapper.readValue(payload, javaType);
        } catch (IOException e) {
            throw new JSONDeserializationException(lenientFormat("Failed to deserialize event with type '%s' into '%s'", eventType, javaType.getName()), e);
        }
    }

    @Override
    public EventMetaData deserializeMetaData(byte[] metadata) {
        if (metadata == null || metadata.length == 0) {
            return EventMetaData.empty();
        }
        try {
            return EventMetaData.of(objectMapper.readValue(metadata, METADATA_TYPE));
        } catch (IOException e) {
            throw new JSONDeserializationException("Failed to deserialize event metadata", e);
        }
    }

    private Class<?> resolveJavaType(String eventType, EventMetaData metaData) {
        var registeredType = registeredEventTypes.get(eventType);
        if (registeredType != null) {
            return registeredType;
        }
        var javaTypeName = metaData.eventJavaType()
                                   .orElseThrow(() -> new UnknownEventTypeException(eventType,
                                                                                    lenientFormat("Event type '%s' isn't registered and the event metadata doesn't contain the '%s' header",
                                                                                                  eventType,
                                                                                                  EventMetaData.EVENT_JAVA_TYPE)));
        var javaType = resolvedJavaTypes.get(javaTypeName);
        if (javaType == null) {
            try {
                javaType = Class.forName(javaTypeName, true, resolveClassLoader());
            } catch (ClassNotFoundException e) {
                throw new UnknownEventTypeException(eventType, lenientFormat("Event type '%s' refers to Java type '%s' which couldn't be found", eventType, javaTypeName), e);
            }
            resolvedJavaTypes.put(javaTypeName, javaType);
            log.trace("Resolved event type '{}' to Java type '{}'", eventType, javaTypeName);
        }
        return javaType;
    }

    private static ClassLoader resolveClassLoader() {
        var contextClassLoader = Thread.currentThread().getContextClassLoader();
        return contextClassLoader != null ? contextClassLoader : JacksonEventSerializer.class.getClassLoader();
    }
}
