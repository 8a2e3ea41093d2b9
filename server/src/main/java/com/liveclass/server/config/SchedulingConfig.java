package com.liveclass.server.config;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;

@Configuration
public class SchedulingConfig {

    /** Runs room closure timers. */
    @Bean(name = "roomCloserScheduler", destroyMethod = "shutdownNow")
    public ScheduledExecutorService roomCloserScheduler() {
        return Executors.newSingleThreadScheduledExecutor(r -> {
            Thread t = new Thread(r, "room-closer");
            t.setDaemon(true);
            return t;
        });
    }

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }
}
