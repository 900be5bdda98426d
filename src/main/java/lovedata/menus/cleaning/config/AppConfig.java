package lovedata.menus.cleaning.config;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

import java.time.Clock;
import java.util.concurrent.ThreadPoolExecutor;

/**
 * Application configuration for sharded cleaning and the run clock
 */
@Configuration
public class AppConfig {

    /**
     * Thread pool the pipeline spreads record shards over
     */
    @Bean(name = "cleaningExecutor")
    public ThreadPoolTaskExecutor cleaningExecutor(CleaningConfig cleaningConfig) {
        int workers = Math.max(1, cleaningConfig.getProcessing().getWorkerThreads());

        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(workers);
        executor.setMaxPoolSize(workers);

        // Shards wait here when every worker is busy
        executor.setQueueCapacity(1000);
        executor.setThreadNamePrefix("Menu-Cleaning-");

        // Queue full: the submitting thread cleans the shard itself
        executor.setRejectedExecutionHandler(new ThreadPoolExecutor.CallerRunsPolicy());

        executor.setWaitForTasksToCompleteOnShutdown(true);
        executor.setAwaitTerminationSeconds(60);
        executor.initialize();
        return executor;
    }

    /**
     * Source of the run date (upper bound for menu dates)
     */
    @Bean
    public Clock clock() {
        return Clock.systemDefaultZone();
    }
}
