package com.jreinhal.colloquy.storage;

import java.util.Collection;
import java.util.Map;

/**
 * Durable key/value store for conversation records.
 *
 * <p>Values come back as plain JSON-shaped objects (maps, lists, strings, numbers,
 * booleans). No locking or transactional guarantee is provided; concurrent writers to
 * the same key are last-writer-wins unless the record carries an {@code eTag}.</p>
 */
public interface Storage {

    String ETAG_FIELD = "eTag";

    /**
     * @return the records found, keyed by storage key. Missing keys are absent from the result.
     */
    Map<String, Object> read(Collection<String> keys);

    void write(Map<String, ?> changes);

    void delete(Collection<String> keys);
}
