package com.vaultrebalancer.config;

import java.time.Clock;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskScheduler;

/**
 * Timer infrastructure for the rebalance scheduler.
 *
 * <p>A single-thread scheduler is enough: rounds never overlap and there is nothing else
 * on this pool. The {@link Clock} bean is injected everywhere "now" matters so tests can pin it.
 */
@Configuration
public class SchedulerConfig {

    private static final Logger log = LoggerFactory.getLogger(SchedulerConfig.class);

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    @Bean(destroyMethod = "shutdown")
    public ThreadPoolTaskScheduler rebalanceTaskScheduler() {
        ThreadPoolTaskScheduler scheduler = new ThreadPoolTaskScheduler();
        scheduler.setPoolSize(1);
        scheduler.setThreadNamePrefix("rebalance-");
        scheduler.setWaitForTasksToCompleteOnShutdown(false);
        scheduler.setErrorHandler(t -> log.error("Uncaught error on rebalance scheduler thread", t));
        scheduler.initialize();
        return scheduler;
    }
}
