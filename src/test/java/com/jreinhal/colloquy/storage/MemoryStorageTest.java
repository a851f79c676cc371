package com.jreinhal.colloquy.storage;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

import com.fasterxml.jackson.databind.ObjectMapper;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

class MemoryStorageTest {

    private MemoryStorage storage;

    @BeforeEach
    void setUp() {
        storage = new MemoryStorage(new ObjectMapper());
    }

    @Nested
    @DisplayName("read and write")
    class ReadWrite {

        @Test
        void readsWhatWasWrittenWithAnEtag() {
            storage.write(Map.of("k1", Map.of("count", 1)));

            Map<String, Object> data = storage.read(List.of("k1", "missing"));

            assertThat(data).containsOnlyKeys("k1");
            @SuppressWarnings("unchecked")
            Map<String, Object> record = (Map<String, Object>) data.get("k1");
            assertEquals(1, record.get("count"));
            assertThat(record).containsKey(Storage.ETAG_FIELD);
        }

        @Test
        void readHandsOutCopies() {
            storage.write(Map.of("k1", Map.of("count", 1)));
            @SuppressWarnings("unchecked")
            Map<String, Object> first = (Map<String, Object>) storage.read(List.of("k1")).get("k1");
            first.put("count", 99);

            @SuppressWarnings("unchecked")
            Map<String, Object> second = (Map<String, Object>) storage.read(List.of("k1")).get("k1");
            assertEquals(1, second.get("count"));
        }

        @Test
        void rejectsEmptyInput() {
            assertThrows(IllegalArgumentException.class, () -> storage.read(List.of()));
            assertThrows(IllegalArgumentException.class, () -> storage.write(Map.of()));
        }
    }

    @Nested
    @DisplayName("eTag checks")
    class Etags {

        @Test
        void staleEtagIsRejected() {
            storage.write(Map.of("k1", Map.of("v", "a")));
            @SuppressWarnings("unchecked")
            Map<String, Object> loaded = new LinkedHashMap<>((Map<String, Object>) storage.read(List.of("k1")).get("k1"));
            storage.write(Map.of("k1", loaded));

            loaded.put("v", "b");
            assertThrows(StorageException.class, () -> storage.write(Map.of("k1", loaded)));
        }

        @Test
        void wildcardEtagOverwrites() {
            storage.write(Map.of("k1", Map.of("v", "a")));
            storage.write(Map.of("k1", Map.of("v", "b", Storage.ETAG_FIELD, "*")));

            @SuppressWarnings("unchecked")
            Map<String, Object> record = (Map<String, Object>) storage.read(List.of("k1")).get("k1");
            assertEquals("b", record.get("v"));
        }
    }

    @Test
    void deleteRemovesKeys() {
        storage.write(Map.of("k1", Map.of("v", 1), "k2", Map.of("v", 2)));

        storage.delete(List.of("k1"));

        assertThat(storage.read(List.of("k1", "k2"))).containsOnlyKeys("k2");
    }
}
