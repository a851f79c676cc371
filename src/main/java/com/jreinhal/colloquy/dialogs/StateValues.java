package com.jreinhal.colloquy.dialogs;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Converts frame-state values between the typed objects dialogs put there during a turn
 * and the plain maps they come back as after a storage round trip.
 */
public final class StateValues {
    private static final ObjectMapper MAPPER = new ObjectMapper()
            .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);

    private StateValues() {
    }

    public static <T> T convert(Object value, Class<T> type) {
        if (value == null || type.isInstance(value)) {
            return type.cast(value);
        }
        return MAPPER.convertValue(value, type);
    }

    /**
     * Reads {@code key} from a frame state as {@code type}, replacing the raw entry with the
     * converted object so later mutations are persisted.
     */
    public static <T> T get(Map<String, Object> state, String key, Class<T> type) {
        Object raw = state.get(key);
        T value = convert(raw, type);
        if (value != null && value != raw) {
            state.put(key, value);
        }
        return value;
    }

    /**
     * Nested record under {@code key}, created empty when absent.
     */
    @SuppressWarnings("unchecked")
    public static Map<String, Object> map(Map<String, Object> state, String key) {
        Object raw = state.get(key);
        if (raw instanceof Map<?, ?> existing) {
            return (Map<String, Object>) existing;
        }
        Map<String, Object> created = new LinkedHashMap<>();
        state.put(key, created);
        return created;
    }

    public static int intValue(Object value, int fallback) {
        return value instanceof Number number ? number.intValue() : fallback;
    }

    public static long longValue(Object value, long fallback) {
        return value instanceof Number number ? number.longValue() : fallback;
    }
}
