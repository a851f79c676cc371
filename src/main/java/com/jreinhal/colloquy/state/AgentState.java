package com.jreinhal.colloquy.state;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.jreinhal.colloquy.storage.Storage;
import com.jreinhal.colloquy.storage.StorageException;
import com.jreinhal.colloquy.turn.TurnContext;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * A record of named properties persisted under one storage key per turn.
 *
 * <p>The record is read fully on first access in a turn, mutated in memory and written
 * back wholesale by {@link #saveChanges}. Nothing is written when the serialized form
 * did not change.</p>
 */
public abstract class AgentState {
    private static final Logger log = LoggerFactory.getLogger(AgentState.class);
    private static final TypeReference<LinkedHashMap<String, Object>> RECORD_TYPE = new TypeReference<>() {};

    private final Storage storage;
    private final ObjectMapper objectMapper;

    protected AgentState(Storage storage, ObjectMapper objectMapper) {
        this.storage = storage;
        this.objectMapper = objectMapper;
    }

    /**
     * @return the storage key for the current turn, derived from the inbound activity.
     */
    public abstract String getStorageKey(TurnContext context);

    public <T> StatePropertyAccessor<T> createProperty(String name, Class<T> type) {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("Property name is required");
        }
        return new StatePropertyAccessor<>(this, name, type);
    }

    public void load(TurnContext context) {
        load(context, false);
    }

    public void load(TurnContext context, boolean force) {
        CachedState cached = context.getLoadedState(this);
        if (cached != null && !force) {
            return;
        }
        String key = getStorageKey(context);
        Map<String, Object> items = this.storage.read(List.of(key));
        Map<String, Object> record = new LinkedHashMap<>();
        Object stored = items.get(key);
        if (stored != null) {
            record.putAll(this.objectMapper.convertValue(stored, RECORD_TYPE));
        }
        context.putLoadedState(this, new CachedState(record, serialize(record)));
    }

    public void saveChanges(TurnContext context) {
        saveChanges(context, false);
    }

    public void saveChanges(TurnContext context, boolean force) {
        CachedState cached = context.getLoadedState(this);
        if (cached == null) {
            return;
        }
        String current = serialize(cached.state());
        if (!force && current.equals(cached.snapshot())) {
            return;
        }
        String key = getStorageKey(context);
        this.storage.write(Map.of(key, cached.state()));
        // The store stamps a new eTag; reload next turn rather than reusing the old one.
        cached.state().remove(Storage.ETAG_FIELD);
        context.putLoadedState(this, new CachedState(cached.state(), serialize(cached.state())));
        log.debug("Saved {} for turn", getClass().getSimpleName());
    }

    public void clear(TurnContext context) {
        context.putLoadedState(this, new CachedState(new LinkedHashMap<>(), ""));
    }

    public void delete(TurnContext context) {
        context.clearLoadedState(this);
        this.storage.delete(List.of(getStorageKey(context)));
    }

    /**
     * Live view of the loaded record, loading it on first use.
     */
    public Map<String, Object> get(TurnContext context) {
        load(context);
        CachedState cached = context.getLoadedState(this);
        return cached.state();
    }

    <T> T getProperty(TurnContext context, String name, Class<T> type) {
        Map<String, Object> record = get(context);
        Object value = record.get(name);
        if (value == null || type.isInstance(value)) {
            return type.cast(value);
        }
        T converted = this.objectMapper.convertValue(value, type);
        record.put(name, converted);
        return converted;
    }

    void setProperty(TurnContext context, String name, Object value) {
        get(context).put(name, value);
    }

    void deleteProperty(TurnContext context, String name) {
        get(context).remove(name);
    }

    private String serialize(Map<String, Object> record) {
        try {
            return this.objectMapper.writeValueAsString(record);
        } catch (JsonProcessingException e) {
            throw new StorageException("Unable to serialize " + getClass().getSimpleName(), e);
        }
    }

    private record CachedState(Map<String, Object> state, String snapshot) {}
}
