package com.dashboard.config;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

/**
 * Thread pools for the statistics path.
 * 
 * - aggregateExecutor: fan-out of the sub-aggregates of one computation
 * - snapshotWriteExecutor: fire-and-forget snapshot saves after a real-time computation
 * - refreshWorkerExecutor: fixed-size pool capping concurrent refreshes against the database
 * - refreshCycleExecutor: runs the refresh cycle itself, one at a time
 * 
 * Each pool is separate so a refresh cycle blocked on its workers can never
 * starve the aggregates those workers are waiting for.
 */
@Configuration
public class AsyncConfig {
    
    @Bean(name = "aggregateExecutor")
    public ThreadPoolTaskExecutor aggregateExecutor(
            @Value("${app.compute.aggregate-threads:10}") int threads,
            @Value("${app.compute.aggregate-queue:500}") int queueCapacity) {
        return executor("stats-aggregate-", threads, threads * 2, queueCapacity);
    }
    
    @Bean(name = "snapshotWriteExecutor")
    public ThreadPoolTaskExecutor snapshotWriteExecutor() {
        ThreadPoolTaskExecutor executor = executor("snapshot-write-", 2, 4, 100);
        // In-flight saves finish on shutdown so computed work is not lost
        executor.setWaitForTasksToCompleteOnShutdown(true);
        executor.setAwaitTerminationSeconds(30);
        return executor;
    }
    
    @Bean(name = "refreshWorkerExecutor")
    public ThreadPoolTaskExecutor refreshWorkerExecutor(@Value("${app.refresh.workers:4}") int workers) {
        return executor("stats-refresh-", workers, workers, Integer.MAX_VALUE);
    }
    
    @Bean(name = "refreshCycleExecutor")
    public ThreadPoolTaskExecutor refreshCycleExecutor() {
        return executor("stats-refresh-cycle-", 1, 1, 1);
    }
    
    private ThreadPoolTaskExecutor executor(String prefix, int core, int max, int queueCapacity) {
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setThreadNamePrefix(prefix);
        executor.setCorePoolSize(core);
        executor.setMaxPoolSize(max);
        executor.setQueueCapacity(queueCapacity);
        return executor;
    }
}
