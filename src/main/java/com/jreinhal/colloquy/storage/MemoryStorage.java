package com.jreinhal.colloquy.storage;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import com.jreinhal.colloquy.util.LogSanitizer;
import java.time.Duration;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.concurrent.atomic.AtomicLong;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * In-process storage. Records are kept as JSON strings so that every read hands out a
 * fresh copy, and each write stamps a new {@code eTag}.
 */
public class MemoryStorage implements Storage {
    private static final Logger log = LoggerFactory.getLogger(MemoryStorage.class);
    private static final TypeReference<LinkedHashMap<String, Object>> RECORD_TYPE = new TypeReference<>() {};

    private final ObjectMapper objectMapper;
    private final Cache<String, String> memory;
    private final AtomicLong etag = new AtomicLong(1L);

    public MemoryStorage(ObjectMapper objectMapper) {
        this(objectMapper, Duration.ZERO);
    }

    public MemoryStorage(ObjectMapper objectMapper, Duration expireAfterAccess) {
        this.objectMapper = objectMapper;
        Caffeine<Object, Object> builder = Caffeine.newBuilder();
        if (expireAfterAccess != null && !expireAfterAccess.isZero() && !expireAfterAccess.isNegative()) {
            builder.expireAfterAccess(expireAfterAccess);
        }
        this.memory = builder.build();
    }

    @Override
    public Map<String, Object> read(Collection<String> keys) {
        if (keys == null || keys.isEmpty()) {
            throw new IllegalArgumentException("Keys are required when reading.");
        }
        Map<String, Object> data = new LinkedHashMap<>();
        for (String key : keys) {
            String item = this.memory.getIfPresent(key);
            if (item != null) {
                log.debug("Reading key: {}", LogSanitizer.sanitize(key));
                data.put(key, this.parse(key, item));
            }
        }
        return data;
    }

    @Override
    public void write(Map<String, ?> changes) {
        if (changes == null || changes.isEmpty()) {
            throw new IllegalArgumentException("Changes are required when writing.");
        }
        for (Map.Entry<String, ?> change : changes.entrySet()) {
            String key = change.getKey();
            Object newItem = change.getValue();
            log.debug("Writing key: {}", LogSanitizer.sanitize(key));
            String newEtag = etagOf(newItem);
            String oldItem = this.memory.getIfPresent(key);
            if (oldItem != null && newEtag != null && !"*".equals(newEtag)) {
                String oldEtag = etagOf(this.parse(key, oldItem));
                if (!newEtag.equals(oldEtag)) {
                    throw new StorageException("Storage: error writing \"" + key + "\" due to eTag conflict.");
                }
            }
            this.saveItem(key, newItem);
        }
    }

    @Override
    public void delete(Collection<String> keys) {
        if (keys == null || keys.isEmpty()) {
            return;
        }
        log.debug("Deleting {} key(s)", keys.size());
        this.memory.invalidateAll(keys);
    }

    public long size() {
        return this.memory.estimatedSize();
    }

    private void saveItem(String key, Object item) {
        Object stored = item;
        if (item != null && !(item instanceof CharSequence) && !(item instanceof Number) && !(item instanceof Boolean)) {
            Map<String, Object> record = this.objectMapper.convertValue(item, RECORD_TYPE);
            record.put(ETAG_FIELD, Long.toString(this.etag.getAndIncrement()));
            stored = record;
        }
        try {
            this.memory.put(key, this.objectMapper.writeValueAsString(stored));
        } catch (JsonProcessingException e) {
            throw new StorageException("Unable to serialize record for key " + key, e);
        }
    }

    private Object parse(String key, String json) {
        try {
            return this.objectMapper.readValue(json, Object.class);
        } catch (JsonProcessingException e) {
            throw new StorageException("Unable to deserialize record for key " + key, e);
        }
    }

    private static String etagOf(Object item) {
        if (item instanceof Map<?, ?> map) {
            Object value = map.get(ETAG_FIELD);
            return value == null ? null : value.toString();
        }
        return null;
    }
}
