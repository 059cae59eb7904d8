package net.findmytask.config;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.core.task.AsyncTaskExecutor;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

import java.time.Clock;

/**
 * Thread pool and clock used by the search pipeline.
 *
 * Features:
 * - Dedicated pool for CPU-bound parallel scoring of large task collections
 * - Pool sized from configuration, defaulting to one thread per processor
 * - Shared system clock so ranking reads "now" once per call and tests can pin it
 */
@Configuration
public class SearchExecutorConfig {

    static final String THREAD_PREFIX = "search-score-";
    private static final int QUEUE_CAPACITY = 256;

    /**
     * Creates the executor used to score chunks of tasks in parallel.
     *
     * @param searchProperties search configuration supplying the pool size
     * @return initialized executor; callers fall back to the caller thread when it rejects work
     */
    @Bean("searchScoringExecutor")
    public AsyncTaskExecutor searchScoringExecutor(SearchProperties searchProperties) {
        int configured = searchProperties.getScoringThreads();
        int processors = Runtime.getRuntime().availableProcessors();
        int poolSize = configured > 0 ? configured : Math.max(2, processors);

        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(poolSize);
        executor.setMaxPoolSize(poolSize);
        executor.setQueueCapacity(QUEUE_CAPACITY);
        executor.setThreadNamePrefix(THREAD_PREFIX);
        executor.setWaitForTasksToCompleteOnShutdown(true);
        executor.initialize();
        return executor;
    }

    @Bean
    public Clock searchClock() {
        return Clock.systemUTC();
    }
}
