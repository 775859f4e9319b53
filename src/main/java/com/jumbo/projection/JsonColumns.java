package com.jumbo.projection;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * JSON text columns of the projection tables. Lists are stored as JSON arrays and
 * a missing or null column reads back as an empty list.
 */
public class JsonColumns {

    private static final TypeReference<List<Object>> LIST = new TypeReference<>() {};
    private static final TypeReference<List<Map<String, Object>>> ENTRY_LIST = new TypeReference<>() {};
    private static final TypeReference<Map<String, Object>> OBJECT = new TypeReference<>() {};

    private final ObjectMapper objectMapper;

    public JsonColumns(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    public String write(Object value) {
        if (value == null) {
            return null;
        }
        try {
            return objectMapper.writeValueAsString(value);
        } catch (JsonProcessingException ex) {
            throw new IllegalArgumentException("Value is not serializable as JSON: " + value, ex);
        }
    }

    /** Serializes a list column, writing {@code []} for null. */
    public String writeList(List<?> values) {
        return write(values == null ? List.of() : values);
    }

    public List<String> readStrings(String json) {
        List<String> result = new ArrayList<>();
        for (Object item : read(json, LIST, List.of())) {
            result.add(item == null ? null : item.toString());
        }
        return result;
    }

    public List<Map<String, Object>> readEntries(String json) {
        return new ArrayList<>(read(json, ENTRY_LIST, List.of()));
    }

    public Map<String, Object> readObject(String json) {
        return read(json, OBJECT, null);
    }

    private <T> T read(String json, TypeReference<T> type, T fallback) {
        if (json == null || json.isBlank()) {
            return fallback;
        }
        try {
            return objectMapper.readValue(json, type);
        } catch (JsonProcessingException ex) {
            throw new IllegalStateException("Corrupt JSON column: " + json, ex);
        }
    }
}
