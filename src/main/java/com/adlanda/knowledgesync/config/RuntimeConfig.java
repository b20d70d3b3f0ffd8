package com.adlanda.knowledgesync.config;

import com.adlanda.knowledgesync.service.CancellationToken;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

import java.time.Clock;

/**
 * Shared runtime beans: the insights handler pool, the shutdown signal and the clock.
 */
@Configuration
public class RuntimeConfig {

    private static final Logger log = LoggerFactory.getLogger(RuntimeConfig.class);

    @Bean(name = "insightsExecutor")
    public ThreadPoolTaskExecutor insightsExecutor(InsightsProperties properties) {
        InsightsProperties.Worker worker = properties.getWorker();
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();

        // Claims never exceed free slots, so the queue only absorbs hand-off jitter
        executor.setCorePoolSize(worker.getMaxConcurrent());
        executor.setMaxPoolSize(worker.getMaxConcurrent());
        executor.setQueueCapacity(worker.getMaxConcurrent());
        executor.setThreadNamePrefix("insights-handler-");

        // InsightsWorker drains the pool within the shutdown timeout; whatever is left at
        // destruction is interrupted
        executor.setWaitForTasksToCompleteOnShutdown(false);

        executor.initialize();

        log.info("Insights executor configured: pool={}, shutdownTimeout={}",
                worker.getMaxConcurrent(), worker.getShutdownTimeout());

        return executor;
    }

    /**
     * Cancelled when the application context starts closing.
     */
    @Bean
    public CancellationToken shutdownSignal() {
        return new CancellationToken();
    }

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }
}
