package net.findmytask.repository;

import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Process-local {@link KeyValueStore}; contents are lost on shutdown.
 */
public class InMemoryKeyValueStore implements KeyValueStore {

    private final Map<String, List<String>> entries = new ConcurrentHashMap<>();

    @Override
    public Optional<List<String>> getStringList(String key) {
        return Optional.ofNullable(entries.get(key));
    }

    @Override
    public void putStringList(String key, List<String> values) {
        entries.put(key, List.copyOf(values));
    }

    @Override
    public void remove(String key) {
        entries.remove(key);
    }
}
