package net.findmytask.config;

import jakarta.annotation.PostConstruct;
import net.findmytask.service.search.AndSemantics;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;
import org.springframework.util.Assert;

/**
 * Strongly typed configuration for task search.
 */
@Component
@ConfigurationProperties(prefix = "search")
public class SearchProperties {

    /**
     * How AND queries combine across fields.
     */
    private AndSemantics andSemantics = AndSemantics.PER_FIELD;

    /**
     * Collections at least this large are scored in parallel chunks.
     */
    private int parallelThreshold = 2000;

    /**
     * Number of tasks scored per chunk, for parallel scoring and cancellable searches.
     */
    private int batchSize = 500;

    /**
     * Worker threads for parallel scoring; zero means one per available processor.
     */
    private int scoringThreads = 0;

    private final Recent recent = new Recent();

    @PostConstruct
    void validate() {
        Assert.notNull(andSemantics, "search.and-semantics must be set");
        Assert.isTrue(parallelThreshold > 0, "search.parallel-threshold must be positive");
        Assert.isTrue(batchSize > 0, "search.batch-size must be positive");
        Assert.isTrue(scoringThreads >= 0, "search.scoring-threads must be non-negative");
        Assert.isTrue(recent.maxEntries > 0, "search.recent.max-entries must be positive");
        Assert.notNull(recent.store, "search.recent.store must be set");
        Assert.hasText(recent.file, "search.recent.file must not be blank");
        Assert.hasText(recent.key, "search.recent.key must not be blank");
    }

    public AndSemantics getAndSemantics() {
        return andSemantics;
    }

    public void setAndSemantics(AndSemantics andSemantics) {
        this.andSemantics = andSemantics;
    }

    public int getParallelThreshold() {
        return parallelThreshold;
    }

    public void setParallelThreshold(int parallelThreshold) {
        this.parallelThreshold = parallelThreshold;
    }

    public int getBatchSize() {
        return batchSize;
    }

    public void setBatchSize(int batchSize) {
        this.batchSize = batchSize;
    }

    public int getScoringThreads() {
        return scoringThreads;
    }

    public void setScoringThreads(int scoringThreads) {
        this.scoringThreads = scoringThreads;
    }

    public Recent getRecent() {
        return recent;
    }

    /**
     * Recent-search history settings.
     */
    public static class Recent {

        /**
         * Maximum number of remembered queries.
         */
        private int maxEntries = 20;

        /**
         * Backing store for the history.
         */
        private StoreType store = StoreType.FILE;

        /**
         * JSON file used when {@code store} is {@code file}.
         */
        private String file = System.getProperty("user.home") + "/.findmytask/search-state.json";

        /**
         * Key the history list is stored under.
         */
        private String key = "recentSearches";

        public int getMaxEntries() {
            return maxEntries;
        }

        public void setMaxEntries(int maxEntries) {
            this.maxEntries = maxEntries;
        }

        public StoreType getStore() {
            return store;
        }

        public void setStore(StoreType store) {
            this.store = store;
        }

        public String getFile() {
            return file;
        }

        public void setFile(String file) {
            this.file = file;
        }

        public String getKey() {
            return key;
        }

        public void setKey(String key) {
            this.key = key;
        }
    }

    public enum StoreType {
        FILE,
        MEMORY
    }
}
