package net.findmytask.config;

import lombok.extern.slf4j.Slf4j;
import net.findmytask.repository.InMemoryKeyValueStore;
import net.findmytask.repository.JsonFileKeyValueStore;
import net.findmytask.repository.KeyValueStore;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import tools.jackson.databind.ObjectMapper;
import tools.jackson.databind.json.JsonMapper;

import java.nio.file.Path;

/**
 * Wires the key-value store behind the recent-search history.
 *
 * Features:
 * - {@code search.recent.store=file} persists history as JSON at {@code search.recent.file}
 * - {@code search.recent.store=memory} keeps history for the lifetime of the process
 */
@Configuration
@Slf4j
public class RecentSearchStoreConfig {

    @Bean
    public ObjectMapper searchStateObjectMapper() {
        return JsonMapper.builder().build();
    }

    @Bean
    public KeyValueStore recentSearchKeyValueStore(SearchProperties searchProperties, ObjectMapper searchStateObjectMapper) {
        SearchProperties.Recent recent = searchProperties.getRecent();
        if (recent.getStore() == SearchProperties.StoreType.MEMORY) {
            log.info("Recent searches kept in memory only");
            return new InMemoryKeyValueStore();
        }
        Path file = Path.of(recent.getFile());
        log.info("Recent searches persisted to {}", file.toAbsolutePath());
        return new JsonFileKeyValueStore(file, searchStateObjectMapper);
    }
}
