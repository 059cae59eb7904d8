package net.findmytask.service;

import lombok.extern.slf4j.Slf4j;
import net.findmytask.config.SearchProperties;
import net.findmytask.repository.KeyValueStore;
import net.findmytask.util.SearchQueryUtils;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Service for remembering the queries a user recently ran
 *
 * Features:
 * - Most recent query first; re-running a query moves it back to the front
 * - Trims the history to {@code search.recent.max-entries} (20 by default)
 * - Ignores blank queries and stores trimmed text
 * - Storage lives behind {@link KeyValueStore}; failures propagate as
 *   {@link net.findmytask.exception.KeyValueStoreException} for the caller to handle
 */
@Service
@Slf4j
public class RecentSearchService {

    private final KeyValueStore keyValueStore;
    private final int maxEntries;
    private final String storageKey;

    @Autowired
    public RecentSearchService(KeyValueStore keyValueStore, SearchProperties searchProperties) {
        this(keyValueStore, searchProperties.getRecent().getMaxEntries(), searchProperties.getRecent().getKey());
    }

    RecentSearchService(KeyValueStore keyValueStore, int maxEntries, String storageKey) {
        this.keyValueStore = keyValueStore;
        this.maxEntries = maxEntries;
        this.storageKey = storageKey;
    }

    /**
     * Records a query at the front of the history, removing any earlier copy.
     *
     * @param query raw query text; blank input is ignored
     */
    public synchronized void save(String query) {
        String normalized = SearchQueryUtils.normalize(query);
        if (normalized == null) {
            log.debug("Ignoring blank query for recent searches");
            return;
        }

        List<String> recents = new ArrayList<>(list());
        recents.removeIf(normalized::equals);
        recents.add(0, normalized);
        while (recents.size() > maxEntries) {
            String dropped = recents.remove(recents.size() - 1);
            log.debug("Trimmed recent search '{}'", SearchQueryUtils.logPreview(dropped));
        }

        keyValueStore.putStringList(storageKey, recents);
        log.debug("Saved recent search '{}'; history size now {}", SearchQueryUtils.logPreview(normalized), recents.size());
    }

    /**
     * Returns the remembered queries, most recent first.
     */
    public synchronized List<String> list() {
        return keyValueStore.getStringList(storageKey).orElse(List.of()).stream()
            .filter(Objects::nonNull)
            .limit(maxEntries)
            .toList();
    }

    public synchronized void clear() {
        keyValueStore.remove(storageKey);
        log.debug("Recent searches cleared.");
    }
}
