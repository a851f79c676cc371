package com.jreinhal.colloquy.storage;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.bson.Document;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataAccessException;
import org.springframework.data.mongodb.core.MongoTemplate;
import org.springframework.data.mongodb.core.query.Criteria;
import org.springframework.data.mongodb.core.query.Query;
import org.springframework.data.mongodb.core.query.Update;

/**
 * MongoDB-backed storage: one document per key, the record kept under {@code document}.
 * Writes are unconditional upserts (last writer wins).
 */
public class MongoStorage implements Storage {
    private static final Logger log = LoggerFactory.getLogger(MongoStorage.class);
    private static final TypeReference<LinkedHashMap<String, Object>> RECORD_TYPE = new TypeReference<>() {};
    private static final String DOCUMENT_FIELD = "document";

    private final MongoTemplate mongoTemplate;
    private final ObjectMapper objectMapper;
    private final String collection;

    public MongoStorage(MongoTemplate mongoTemplate, ObjectMapper objectMapper, String collection) {
        this.mongoTemplate = mongoTemplate;
        this.objectMapper = objectMapper;
        this.collection = collection;
    }

    @Override
    public Map<String, Object> read(Collection<String> keys) {
        if (keys == null || keys.isEmpty()) {
            throw new IllegalArgumentException("Keys are required when reading.");
        }
        Query query = new Query(Criteria.where("_id").in(keys));
        List<Document> found;
        try {
            found = this.mongoTemplate.find(query, Document.class, this.collection);
        } catch (DataAccessException e) {
            log.error("Failed to read {} key(s) from {}: {}", keys.size(), this.collection, e.getMessage());
            throw new StorageException("Failed to read from collection " + this.collection, e);
        }
        Map<String, Object> data = new LinkedHashMap<>();
        for (Document document : found) {
            Object record = document.get(DOCUMENT_FIELD);
            if (record != null) {
                data.put(document.getString("_id"), this.objectMapper.convertValue(record, Object.class));
            }
        }
        return data;
    }

    @Override
    public void write(Map<String, ?> changes) {
        if (changes == null || changes.isEmpty()) {
            throw new IllegalArgumentException("Changes are required when writing.");
        }
        long now = System.currentTimeMillis();
        for (Map.Entry<String, ?> change : changes.entrySet()) {
            Object value = change.getValue();
            Object record = value instanceof CharSequence || value instanceof Number || value instanceof Boolean
                    ? value
                    : this.objectMapper.convertValue(value, RECORD_TYPE);
            Query query = new Query(Criteria.where("_id").is(change.getKey()));
            Update update = new Update()
                    .set(DOCUMENT_FIELD, record)
                    .set("updatedAtEpochMs", now)
                    .setOnInsert("createdAtEpochMs", now);
            try {
                this.mongoTemplate.upsert(query, update, this.collection);
            } catch (DataAccessException e) {
                log.error("Failed to write key to {}: {}", this.collection, e.getMessage());
                throw new StorageException("Failed to write to collection " + this.collection, e);
            }
        }
    }

    @Override
    public void delete(Collection<String> keys) {
        if (keys == null || keys.isEmpty()) {
            return;
        }
        Query query = new Query(Criteria.where("_id").in(keys));
        long deleted = this.mongoTemplate.remove(query, this.collection).getDeletedCount();
        log.debug("Deleted {} of {} key(s) from {}", deleted, keys.size(), this.collection);
    }
}
