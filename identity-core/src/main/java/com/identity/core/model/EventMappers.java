package com.identity.core.model;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.identity.core.exception.InternalException;
import com.identity.core.model.user.MachineAddedPayload;
import com.identity.core.model.user.MachineChangedPayload;
import com.identity.core.model.user.MachineSecretSetPayload;
import com.identity.core.model.user.UserNameReservedPayload;
import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;
import java.util.Objects;

/**
 * Immutable registry of payload codecs keyed by event type.
 *
 * Built once at startup and handed to event stores; there is no global registration.
 * Event types without a decoder are read as {@link UnknownPayload}.
 */
public final class EventMappers {

    private final ObjectMapper objectMapper;
    private final Map<EventType, PayloadDecoder> decoders;

    private EventMappers(ObjectMapper objectMapper, Map<EventType, PayloadDecoder> decoders) {
        this.objectMapper = objectMapper;
        this.decoders = Collections.unmodifiableMap(new EnumMap<>(decoders));
    }

    /**
     * Registry with decoders for every user and user name event type.
     */
    public static EventMappers userMappers(ObjectMapper objectMapper) {
        return builder(objectMapper)
            .register(EventType.USER_MACHINE_ADDED, MachineAddedPayload.class)
            .register(EventType.USER_MACHINE_CHANGED, MachineChangedPayload.class)
            .register(EventType.USER_MACHINE_SECRET_SET, MachineSecretSetPayload.class)
            .registerEmpty(EventType.USER_MACHINE_SECRET_REMOVED)
            .registerEmpty(EventType.USER_MACHINE_SECRET_CHECK_SUCCEEDED)
            .registerEmpty(EventType.USER_MACHINE_SECRET_CHECK_FAILED)
            .registerEmpty(EventType.USER_DEACTIVATED)
            .registerEmpty(EventType.USER_REACTIVATED)
            .registerEmpty(EventType.USER_REMOVED)
            .register(EventType.USER_NAME_RESERVED, UserNameReservedPayload.class)
            .registerEmpty(EventType.USER_NAME_RELEASED)
            .build();
    }

    public static Builder builder(ObjectMapper objectMapper) {
        return new Builder(objectMapper);
    }

    public boolean hasDecoder(EventType type) {
        return decoders.containsKey(type);
    }

    /**
     * Decode a persisted payload.
     *
     * @throws InternalException if the payload does not match the registered shape
     */
    public EventPayload decode(EventType type, String json) {
        try {
            JsonNode node = json == null || json.isBlank()
                ? objectMapper.createObjectNode()
                : objectMapper.readTree(json);
            PayloadDecoder decoder = decoders.get(type);
            if (decoder == null) {
                return new UnknownPayload(node);
            }
            return decoder.decode(objectMapper, node);
        } catch (JsonProcessingException | IllegalArgumentException e) {
            throw new InternalException("EVENT-Dk3lP", "Errors.Internal", e);
        }
    }

    /**
     * Encode a payload for persistence.
     */
    public String encode(EventPayload payload) {
        try {
            if (payload == null || payload instanceof EmptyPayload) {
                return "{}";
            }
            if (payload instanceof UnknownPayload) {
                return objectMapper.writeValueAsString(((UnknownPayload) payload).raw());
            }
            return objectMapper.writeValueAsString(payload);
        } catch (JsonProcessingException e) {
            throw new InternalException("EVENT-s0Gq2", "Errors.Internal", e);
        }
    }

    @FunctionalInterface
    public interface PayloadDecoder {
        EventPayload decode(ObjectMapper mapper, JsonNode node) throws JsonProcessingException;
    }

    public static final class Builder {

        private final ObjectMapper objectMapper;
        private final Map<EventType, PayloadDecoder> decoders = new EnumMap<>(EventType.class);

        private Builder(ObjectMapper objectMapper) {
            this.objectMapper = Objects.requireNonNull(objectMapper, "objectMapper");
        }

        public Builder register(EventType type, Class<? extends EventPayload> payloadType) {
            return register(type, (mapper, node) -> mapper.treeToValue(node, payloadType));
        }

        public Builder registerEmpty(EventType type) {
            return register(type, (mapper, node) -> EmptyPayload.INSTANCE);
        }

        public Builder register(EventType type, PayloadDecoder decoder) {
            if (decoders.putIfAbsent(type, decoder) != null) {
                throw new IllegalStateException("Decoder already registered for " + type.value());
            }
            return this;
        }

        public EventMappers build() {
            return new EventMappers(objectMapper, decoders);
        }
    }
}
