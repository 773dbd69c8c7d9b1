package com.craftnotify.engine.service;

import com.craftnotify.engine.entity.Notification;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.Collections;
import java.util.Map;
import java.util.Optional;

/**
 * Reads and writes the JSON metadata column of a notification.
 * 
 * Unreadable metadata is treated as empty rather than failing a send.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class NotificationMetadataSerializer {

    private static final TypeReference<Map<String, Object>> MAP_TYPE = new TypeReference<>() {};

    private final ObjectMapper objectMapper;

    /**
     * @return JSON text, or null for a null/empty map
     * @throws IllegalArgumentException if a value cannot be serialized
     */
    public String write(Map<String, Object> metadata) {
        if (metadata == null || metadata.isEmpty()) {
            return null;
        }
        try {
            return objectMapper.writeValueAsString(metadata);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Metadata is not serializable: " + e.getOriginalMessage(), e);
        }
    }

    public Map<String, Object> read(String json) {
        if (json == null || json.isBlank()) {
            return Collections.emptyMap();
        }
        try {
            Map<String, Object> metadata = objectMapper.readValue(json, MAP_TYPE);
            return metadata != null ? metadata : Collections.emptyMap();
        } catch (JsonProcessingException e) {
            log.warn("Ignoring unreadable notification metadata: {}", e.getOriginalMessage());
            return Collections.emptyMap();
        }
    }

    public Map<String, Object> read(Notification notification) {
        return read(notification.getMetadata());
    }

    /**
     * String value of a metadata key, ignoring blank values.
     */
    public Optional<String> getString(Notification notification, String key) {
        Object value = read(notification).get(key);
        if (value == null || value.toString().isBlank()) {
            return Optional.empty();
        }
        return Optional.of(value.toString());
    }
}
