package com.jreinhal.colloquy.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.jreinhal.colloquy.state.ConversationState;
import com.jreinhal.colloquy.state.UserState;
import com.jreinhal.colloquy.storage.MemoryStorage;
import com.jreinhal.colloquy.storage.MongoStorage;
import com.jreinhal.colloquy.storage.Storage;
import java.time.Duration;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.data.mongodb.core.MongoTemplate;

@Configuration
public class StorageConfig {
    private static final Logger log = LoggerFactory.getLogger(StorageConfig.class);

    @Bean
    public Storage agentStorage(ObjectMapper objectMapper,
                                ObjectProvider<MongoTemplate> mongoTemplate,
                                @Value("${colloquy.storage.type:memory}") String storageType,
                                @Value("${colloquy.storage.memory.expire-after-access-minutes:0}") long expireAfterAccessMinutes,
                                @Value("${colloquy.storage.mongo.collection:agent_state}") String collection) {
        if ("mongo".equalsIgnoreCase(storageType)) {
            MongoTemplate template = mongoTemplate.getIfAvailable();
            if (template == null) {
                throw new IllegalStateException("colloquy.storage.type=mongo requires a configured MongoDB connection");
            }
            log.info("Using MongoDB storage, collection '{}'", collection);
            return new MongoStorage(template, objectMapper, collection);
        }
        if (!"memory".equalsIgnoreCase(storageType)) {
            log.warn("Unknown colloquy.storage.type '{}', falling back to memory storage", storageType);
        }
        log.info("Using in-memory storage (expire after access: {} min)", expireAfterAccessMinutes);
        return expireAfterAccessMinutes > 0
                ? new MemoryStorage(objectMapper, Duration.ofMinutes(expireAfterAccessMinutes))
                : new MemoryStorage(objectMapper);
    }

    @Bean
    public ConversationState conversationState(Storage storage, ObjectMapper objectMapper) {
        return new ConversationState(storage, objectMapper);
    }

    @Bean
    public UserState userState(Storage storage, ObjectMapper objectMapper) {
        return new UserState(storage, objectMapper);
    }
}
