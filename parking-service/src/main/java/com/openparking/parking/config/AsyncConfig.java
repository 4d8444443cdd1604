package com.openparking.parking.config;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.annotation.EnableAsync;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

import java.util.concurrent.Executor;

/**
 * Executors for side effects that must never run on a request thread: outgoing mail and
 * audit inserts.
 */
@Configuration
@EnableAsync
public class AsyncConfig {

    @Bean(name = "notificationExecutor")
    public Executor notificationExecutor(
            @Value("${parking.notification.pool.core-size:2}") int coreSize,
            @Value("${parking.notification.pool.max-size:5}") int maxSize,
            @Value("${parking.notification.pool.queue-capacity:100}") int queueCapacity) {
        return executor("notification-", coreSize, maxSize, queueCapacity);
    }

    /**
     * Audit writes queue here; when the queue is full the entry is dropped with a warning
     * rather than slowing the caller down.
     */
    @Bean(name = "auditExecutor")
    public ThreadPoolTaskExecutor auditExecutor(
            @Value("${parking.audit.pool.core-size:2}") int coreSize,
            @Value("${parking.audit.pool.max-size:4}") int maxSize,
            @Value("${parking.audit.pool.queue-capacity:1000}") int queueCapacity) {
        return executor("audit-", coreSize, maxSize, queueCapacity);
    }

    private static ThreadPoolTaskExecutor executor(String threadNamePrefix, int coreSize, int maxSize,
                                                   int queueCapacity) {
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(coreSize);
        executor.setMaxPoolSize(maxSize);
        executor.setQueueCapacity(queueCapacity);
        executor.setThreadNamePrefix(threadNamePrefix);
        executor.initialize();
        return executor;
    }
}
