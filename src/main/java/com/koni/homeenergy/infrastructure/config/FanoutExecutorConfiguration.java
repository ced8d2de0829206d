package com.koni.homeenergy.infrastructure.config;

import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

/**
 * Executors behind the real-time fan-out.
 *
 * The fan-out executor is a single worker draining a bounded queue, so publishing a
 * sample costs the ingestion path one enqueue. When the queue is full the task is
 * rejected and the broadcaster drops that update.
 *
 * The delivery executor runs the per-subscriber sends. It hands each task straight to
 * a thread, up to the configured maximum, so a blocked subscriber occupies one thread
 * and never delays the others.
 */
@Slf4j
@Configuration
public class FanoutExecutorConfiguration {

    @Value("${telemetry.fanout.queue-capacity:10000}")
    private int queueCapacity;

    @Value("${telemetry.fanout.delivery-max-threads:64}")
    private int deliveryMaxThreads;

    @Bean
    public ThreadPoolTaskExecutor fanoutExecutor() {
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(1);
        executor.setMaxPoolSize(1);
        executor.setQueueCapacity(queueCapacity);
        executor.setThreadNamePrefix("fanout-");
        executor.setWaitForTasksToCompleteOnShutdown(false);
        executor.initialize();
        log.info("Fan-out executor configured: queueCapacity={}", queueCapacity);
        return executor;
    }

    @Bean
    public ThreadPoolTaskExecutor fanoutDeliveryExecutor() {
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(0);
        executor.setMaxPoolSize(deliveryMaxThreads);
        executor.setQueueCapacity(0);
        executor.setKeepAliveSeconds(60);
        executor.setThreadNamePrefix("fanout-delivery-");
        executor.setWaitForTasksToCompleteOnShutdown(false);
        executor.initialize();
        log.info("Fan-out delivery executor configured: maxThreads={}", deliveryMaxThreads);
        return executor;
    }
}
