package com.heronix.fleet.config;

import java.time.Clock;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskScheduler;

/**
 * Infrastructure beans shared by the registry components.
 *
 * @author Heronix Development Team
 * @version 1.0.0
 */
@Configuration
public class FleetConfig {

    /**
     * Time source for last_seen stamps and liveness decisions.
     */
    @Bean
    public Clock fleetClock() {
        return Clock.systemUTC();
    }

    /**
     * Single-threaded scheduler owning the periodic liveness sweep.
     */
    @Bean
    public ThreadPoolTaskScheduler livenessTaskScheduler() {
        ThreadPoolTaskScheduler scheduler = new ThreadPoolTaskScheduler();
        scheduler.setPoolSize(1);
        scheduler.setThreadNamePrefix("liveness-sweep-");
        scheduler.setWaitForTasksToCompleteOnShutdown(true);
        scheduler.setAwaitTerminationSeconds(5);
        scheduler.setRemoveOnCancelPolicy(true);
        return scheduler;
    }
}
