package com.deliveryroute.tracking.config;

import com.deliveryroute.tracking.service.KeyedSerialExecutor;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.annotation.EnableAsync;
import org.springframework.scheduling.annotation.EnableScheduling;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

import java.util.concurrent.Executor;
import java.util.concurrent.ThreadPoolExecutor;

/**
 * Thread pools of the tracking subsystem.
 *
 *  positionIngestExecutor  one task per polled vehicle and cycle
 *  recalculationExecutor   schedule cascades, fed through a per-route serial queue
 *
 * The ingest pool uses CallerRunsPolicy: when its queue is full the polling thread does the
 * work, so no position is dropped. The recalculation queue is unbounded instead, so a cascade
 * and its estimator calls never run on the thread that fixed the stop event.
 */
@Configuration
@EnableAsync
@EnableScheduling
public class AsyncConfig {

    @Bean("positionIngestExecutor")
    public Executor positionIngestExecutor() {
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(10);
        executor.setMaxPoolSize(50);
        executor.setQueueCapacity(500);
        executor.setThreadNamePrefix("position-ingest-");
        executor.setRejectedExecutionHandler(new ThreadPoolExecutor.CallerRunsPolicy());
        executor.initialize();
        return executor;
    }

    @Bean("recalculationExecutor")
    public Executor recalculationExecutor() {
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(8);
        executor.setMaxPoolSize(8);
        executor.setQueueCapacity(Integer.MAX_VALUE);
        executor.setThreadNamePrefix("schedule-recalc-");
        executor.setWaitForTasksToCompleteOnShutdown(true);
        executor.setAwaitTerminationSeconds(30);
        executor.initialize();
        return executor;
    }

    @Bean
    public KeyedSerialExecutor routeRecalculationQueue(@Qualifier("recalculationExecutor") Executor recalculationExecutor) {
        return new KeyedSerialExecutor(recalculationExecutor);
    }
}
