package com.jreinhal.colloquy.dialogs.memory;

import com.jreinhal.colloquy.dialogs.DialogContext;
import com.jreinhal.colloquy.dialogs.StateValues;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Dotted-path access over the memory scopes of a context. The first segment names the
 * scope ({@code turn.lastresult}, {@code this.options.prompt}); {@code $name} is short for
 * {@code dialog.name} and {@code %name} for {@code class.name}. Segments below the scope
 * match record keys, exactly first and then ignoring case.
 */
public class DialogMemory {
    private final DialogContext dc;
    private final MemoryScopes scopes;

    public DialogMemory(DialogContext dc, MemoryScopes scopes) {
        this.dc = dc;
        this.scopes = scopes;
    }

    public Object getValue(String path) {
        String[] segments = segments(path);
        Object current = scope(segments[0]).getMemory(this.dc);
        for (int i = 1; i < segments.length && current != null; i++) {
            current = current instanceof Map<?, ?> map ? lookup(map, segments[i]) : null;
        }
        return current;
    }

    public <T> T getValue(String path, Class<T> type, T defaultValue) {
        T value = StateValues.convert(getValue(path), type);
        return value == null ? defaultValue : value;
    }

    /**
     * Writes {@code value} at {@code path}, creating intermediate records. A path that names
     * only a scope replaces the scope's memory.
     */
    public void setValue(String path, Object value) {
        String[] segments = segments(path);
        MemoryScope scope = scope(segments[0]);
        if (segments.length == 1) {
            scope.setMemory(this.dc, value);
            return;
        }
        Map<String, Object> parent = parentRecord(scope, segments, true);
        parent.put(existingKey(parent, segments[segments.length - 1]), value);
    }

    public void deleteValue(String path) {
        String[] segments = segments(path);
        if (segments.length == 1) {
            throw new IllegalArgumentException("Cannot delete the '" + segments[0] + "' scope");
        }
        Map<String, Object> parent = parentRecord(scope(segments[0]), segments, false);
        if (parent != null) {
            parent.remove(existingKey(parent, segments[segments.length - 1]));
        }
    }

    @SuppressWarnings("unchecked")
    private Map<String, Object> parentRecord(MemoryScope scope, String[] segments, boolean create) {
        Object current = scope.getMemory(this.dc);
        for (int i = 1; i < segments.length - 1; i++) {
            if (!(current instanceof Map<?, ?> map)) {
                throw new IllegalArgumentException("'" + String.join(".", segments) + "' does not resolve to a record");
            }
            Map<String, Object> record = (Map<String, Object>) map;
            String key = existingKey(record, segments[i]);
            Object next = record.get(key);
            if (next == null) {
                if (!create) {
                    return null;
                }
                next = new LinkedHashMap<String, Object>();
                record.put(key, next);
            }
            current = next;
        }
        if (!(current instanceof Map<?, ?>)) {
            if (!create && current == null) {
                return null;
            }
            throw new IllegalArgumentException("'" + String.join(".", segments) + "' does not resolve to a record");
        }
        return (Map<String, Object>) current;
    }

    private MemoryScope scope(String name) {
        MemoryScope scope = this.scopes.get(name);
        if (scope == null) {
            throw new IllegalArgumentException("Unknown memory scope '" + name + "'");
        }
        return scope;
    }

    private static Object lookup(Map<?, ?> map, String segment) {
        if (map.containsKey(segment)) {
            return map.get(segment);
        }
        for (Map.Entry<?, ?> entry : map.entrySet()) {
            if (entry.getKey() instanceof String key && key.equalsIgnoreCase(segment)) {
                return entry.getValue();
            }
        }
        return null;
    }

    private static String existingKey(Map<String, Object> map, String segment) {
        if (map.containsKey(segment)) {
            return segment;
        }
        for (String key : map.keySet()) {
            if (key.equalsIgnoreCase(segment)) {
                return key;
            }
        }
        return segment;
    }

    private static String[] segments(String path) {
        if (path == null || path.isBlank()) {
            throw new IllegalArgumentException("A memory path is required");
        }
        String normalized = path.trim();
        if (normalized.startsWith("$")) {
            normalized = ScopePath.DIALOG + "." + normalized.substring(1);
        } else if (normalized.startsWith("%")) {
            normalized = ScopePath.CLASS + "." + normalized.substring(1);
        }
        String[] segments = normalized.split("\\.");
        for (String segment : segments) {
            if (segment.isEmpty()) {
                throw new IllegalArgumentException("Invalid memory path '" + path + "'");
            }
        }
        return segments;
    }
}
