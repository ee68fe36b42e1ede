package com.caf.backend.modules.audit.application;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.UUID;

import com.caf.backend.global.common.EntityType;
import com.caf.backend.modules.audit.domain.EntitySnapshot;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;

import org.springframework.stereotype.Component;

/**
 * JSON form of snapshot fields as stored in {@code old_values} / {@code new_values}. Decoding
 * yields the same normalized values the snapshot was built from.
 */
@Component
public class SnapshotCodec {

    private static final TypeReference<LinkedHashMap<String, Object>> FIELDS_TYPE = new TypeReference<>() {
    };

    private final ObjectMapper objectMapper;

    public SnapshotCodec(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper.copy()
                .enable(DeserializationFeature.USE_LONG_FOR_INTS)
                .enable(DeserializationFeature.USE_BIG_DECIMAL_FOR_FLOATS)
                .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
    }

    public String encode(EntitySnapshot snapshot) {
        Map<String, Object> fields = snapshot != null ? snapshot.fields() : Map.of();
        try {
            return objectMapper.writeValueAsString(fields);
        } catch (JsonProcessingException ex) {
            throw new IllegalStateException("Failed to encode snapshot of " + snapshot.entityType().code(), ex);
        }
    }

    public Map<String, Object> decodeFields(String json) {
        if (json == null || json.isBlank()) {
            return Map.of();
        }
        try {
            return objectMapper.readValue(json, FIELDS_TYPE);
        } catch (JsonProcessingException ex) {
            throw new IllegalStateException("Failed to decode snapshot fields", ex);
        }
    }

    public EntitySnapshot decode(EntityType entityType, UUID entityId, UUID officeId, String json) {
        return new EntitySnapshot(entityType, entityId, officeId, decodeFields(json));
    }
}
