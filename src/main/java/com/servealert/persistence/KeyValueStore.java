package com.servealert.persistence;

import java.util.Optional;

/**
 * String key-value storage used for persisted alert state.
 *
 * <p>Implementations translate their own failures into
 * {@link com.servealert.exception.StorageException}.
 */
public interface KeyValueStore {

    Optional<String> get(String key);

    void put(String key, String value);

    void delete(String key);
}
