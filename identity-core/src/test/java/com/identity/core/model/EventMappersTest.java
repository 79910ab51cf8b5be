package com.identity.core.model;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.identity.core.exception.InternalException;
import com.identity.core.model.user.MachineAddedPayload;
import com.identity.core.model.user.MachineSecretSetPayload;
import com.identity.core.projection.AccessTokenType;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class EventMappersTest {

    private EventMappers mappers;

    @BeforeEach
    void setUp() {
        mappers = EventMappers.userMappers(new ObjectMapper());
    }

    @Test
    void decode_shouldBuildTypedPayload() {
        String json = mappers.encode(new MachineAddedPayload("svc", "Service", "desc", AccessTokenType.JWT));

        EventPayload payload = mappers.decode(EventType.USER_MACHINE_ADDED, json);

        assertEquals(new MachineAddedPayload("svc", "Service", "desc", AccessTokenType.JWT), payload);
    }

    @Test
    void encode_shouldWriteEmptyObjectForEmptyPayload() {
        assertEquals("{}", mappers.encode(EmptyPayload.INSTANCE));
        assertSame(EmptyPayload.INSTANCE, mappers.decode(EventType.USER_REMOVED, "{}"));
    }

    @Test
    void decode_shouldKeepRawJsonWhenNoDecoderRegistered() {
        EventMappers partial = EventMappers.builder(new ObjectMapper())
            .registerEmpty(EventType.USER_REMOVED)
            .build();

        EventPayload payload = partial.decode(EventType.USER_MACHINE_SECRET_SET, "{\"secretHash\":\"x\"}");

        assertInstanceOf(UnknownPayload.class, payload);
        assertEquals("x", ((UnknownPayload) payload).raw().get("secretHash").asText());
        assertFalse(partial.hasDecoder(EventType.USER_MACHINE_SECRET_SET));
    }

    @Test
    void decode_shouldFailOnMalformedPayload() {
        InternalException e = assertThrows(InternalException.class,
            () -> mappers.decode(EventType.USER_MACHINE_SECRET_SET, "{not json"));

        assertNotNull(e.getCause());
    }

    @Test
    void decode_shouldFailOnPayloadOfWrongShape() {
        assertThrows(InternalException.class,
            () -> mappers.decode(EventType.USER_MACHINE_SECRET_SET, "{\"unexpected\":1}"));
    }

    @Test
    void builder_shouldRejectDuplicateRegistration() {
        EventMappers.Builder builder = EventMappers.builder(new ObjectMapper())
            .register(EventType.USER_MACHINE_SECRET_SET, MachineSecretSetPayload.class);

        assertThrows(IllegalStateException.class,
            () -> builder.register(EventType.USER_MACHINE_SECRET_SET, MachineSecretSetPayload.class));
    }

    @Test
    void secretPayload_shouldNotPrintHash() {
        assertFalse(new MachineSecretSetPayload("$2a$10$abcdef").toString().contains("abcdef"));
    }
}
