package com.example.pharmacyrota.config;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.TaskScheduler;
import org.springframework.scheduling.annotation.EnableScheduling;
import org.springframework.scheduling.concurrent.ThreadPoolTaskScheduler;

import java.time.Clock;

@Configuration
@EnableScheduling
public class SchedulingConfig {

    /**
     * Source of "now" for provenance stamps and retention cutoffs.
     */
    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    /**
     * Single thread for the retention sweep
     */
    @Bean(name = "taskScheduler")
    public TaskScheduler taskScheduler() {
        ThreadPoolTaskScheduler scheduler = new ThreadPoolTaskScheduler();
        scheduler.setPoolSize(1);
        scheduler.setThreadNamePrefix("RotaCleanup-");
        scheduler.initialize();
        return scheduler;
    }
}
