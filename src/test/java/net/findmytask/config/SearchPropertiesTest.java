package net.findmytask.config;

import net.findmytask.service.search.AndSemantics;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatCode;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class SearchPropertiesTest {

    @Test
    void should_UseDocumentedDefaults() {
        SearchProperties properties = new SearchProperties();

        assertThat(properties.getAndSemantics()).isEqualTo(AndSemantics.PER_FIELD);
        assertThat(properties.getParallelThreshold()).isEqualTo(2000);
        assertThat(properties.getBatchSize()).isEqualTo(500);
        assertThat(properties.getRecent().getMaxEntries()).isEqualTo(20);
        assertThat(properties.getRecent().getStore()).isEqualTo(SearchProperties.StoreType.FILE);
        assertThat(properties.getRecent().getKey()).isEqualTo("recentSearches");
        assertThat(properties.getRecent().getFile()).endsWith("search-state.json");
        assertThatCode(properties::validate).doesNotThrowAnyException();
    }

    @Test
    void should_RejectNonPositiveMaxEntries() {
        SearchProperties properties = new SearchProperties();
        properties.getRecent().setMaxEntries(0);

        assertThatThrownBy(properties::validate)
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("search.recent.max-entries");
    }

    @Test
    void should_RejectNonPositiveBatchSize() {
        SearchProperties properties = new SearchProperties();
        properties.setBatchSize(0);

        assertThatThrownBy(properties::validate)
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("search.batch-size");
    }

    @Test
    void should_RejectBlankStorageKey() {
        SearchProperties properties = new SearchProperties();
        properties.getRecent().setKey(" ");

        assertThatThrownBy(properties::validate)
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("search.recent.key");
    }
}
