package io.electionradar.ingestion.config;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.retry.backoff.Sleeper;
import org.springframework.retry.backoff.ThreadWaitSleeper;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

import java.time.Clock;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.ThreadPoolExecutor;

@Configuration
public class WorkerPoolConfig {

    /**
     * Bounded pool for all blocking I/O of a run: feed GETs, history-store calls and
     * platform delivery. Sized so every enabled feed can be fetched at once.
     */
    @Bean
    public ThreadPoolTaskExecutor pipelineTaskExecutor(IngestionConfig config) {
        int sources = Math.max(1, config.getEnabledSources().size());

        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(sources + 2);
        executor.setMaxPoolSize(sources + 4);
        executor.setQueueCapacity(64);
        executor.setKeepAliveSeconds(60);
        executor.setThreadNamePrefix("Pipeline-IO-");
        executor.setRejectedExecutionHandler(new ThreadPoolExecutor.AbortPolicy());
        executor.initialize();
        return executor;
    }

    @Bean
    public ExecutorService pipelineExecutor(ThreadPoolTaskExecutor pipelineTaskExecutor) {
        return pipelineTaskExecutor.getThreadPoolExecutor();
    }

    /**
     * Used for retry backoff, rate-limit waits and the pause between posts.
     */
    @Bean
    public Sleeper sleeper() {
        return new ThreadWaitSleeper();
    }

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }
}
