package com.koni.homeenergy.infrastructure.retention;

import com.koni.homeenergy.application.command.PurgeSamplesCommand;
import com.koni.homeenergy.application.command.PurgeSamplesCommandHandler;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

/**
 * Periodic retention sweep. Off unless {@code telemetry.retention.scheduled.enabled=true};
 * runs the same operation as the cleanup endpoint.
 */
@Slf4j
@Component
@ConditionalOnProperty(prefix = "telemetry.retention.scheduled", name = "enabled", havingValue = "true")
public class RetentionScheduler {

    private final PurgeSamplesCommandHandler purgeSamplesHandler;
    private final int daysToKeep;

    public RetentionScheduler(
            PurgeSamplesCommandHandler purgeSamplesHandler,
            @Value("${telemetry.retention.scheduled.days-to-keep:30}") int daysToKeep) {
        this.purgeSamplesHandler = purgeSamplesHandler;
        this.daysToKeep = daysToKeep;
        log.info("Scheduled retention sweep enabled: daysToKeep={}", daysToKeep);
    }

    @Scheduled(cron = "${telemetry.retention.scheduled.cron:0 30 3 * * *}")
    public void sweep() {
        long deleted = purgeSamplesHandler.handle(new PurgeSamplesCommand(daysToKeep));
        log.info("Scheduled retention sweep deleted {} samples", deleted);
    }
}
