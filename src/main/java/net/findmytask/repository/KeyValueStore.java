package net.findmytask.repository;

import java.util.List;
import java.util.Optional;

/**
 * Minimal persistent key-value contract for small lists of strings.
 *
 * <p>Implementations throw {@link net.findmytask.exception.KeyValueStoreException}
 * when the underlying storage fails.</p>
 */
public interface KeyValueStore {

    Optional<List<String>> getStringList(String key);

    void putStringList(String key, List<String> values);

    void remove(String key);
}
