package com.jreinhal.colloquy.dialogs.memory;

import java.util.LinkedHashMap;
import java.util.Map;

final class MemoryMaps {

    private MemoryMaps() {
    }

    @SuppressWarnings("unchecked")
    static Map<String, Object> asRecord(Object memory) {
        if (!(memory instanceof Map<?, ?> map)) {
            throw new IllegalArgumentException("Memory must be a record, got " + memory.getClass().getSimpleName());
        }
        return map instanceof LinkedHashMap<?, ?> ? (Map<String, Object>) map : new LinkedHashMap<>((Map<String, Object>) map);
    }
}
