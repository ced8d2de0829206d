package com.koni.homeenergy.infrastructure.observability;

import com.koni.homeenergy.infrastructure.fanout.SampleBroadcaster;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.HealthIndicator;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;
import org.springframework.stereotype.Component;

import java.util.concurrent.ThreadPoolExecutor;

/**
 * Health of the real-time channel: live subscribers and fan-out backlog.
 * DOWN once the fan-out executor has been shut down.
 */
@Component
public class FanoutHealthIndicator implements HealthIndicator {

    private final SampleBroadcaster broadcaster;
    private final ThreadPoolTaskExecutor fanoutExecutor;

    public FanoutHealthIndicator(
            SampleBroadcaster broadcaster,
            @Qualifier("fanoutExecutor") ThreadPoolTaskExecutor fanoutExecutor) {
        this.broadcaster = broadcaster;
        this.fanoutExecutor = fanoutExecutor;
    }

    @Override
    public Health health() {
        ThreadPoolExecutor pool = fanoutExecutor.getThreadPoolExecutor();
        Health.Builder builder = pool.isShutdown() ? Health.down() : Health.up();
        return builder
                .withDetail("subscribers", broadcaster.subscriberCount())
                .withDetail("queued", pool.getQueue().size())
                .withDetail("queueRemaining", pool.getQueue().remainingCapacity())
                .build();
    }
}
