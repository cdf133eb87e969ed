package at.totenbilder.search.config;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

import java.util.concurrent.Executor;

/**
 * Executor for background work: bulk indexing, payload sync and dependency warm-up,
 * so the triggering request returns immediately.
 */
@Configuration
public class AsyncConfig {

    @Bean(name = "indexingJobExecutor")
    public Executor indexingJobExecutor() {
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(2);
        executor.setMaxPoolSize(4);
        executor.setQueueCapacity(100);
        executor.setThreadNamePrefix("indexing-job-");
        executor.initialize();
        return executor;
    }
}
