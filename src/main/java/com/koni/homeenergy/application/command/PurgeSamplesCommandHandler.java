package com.koni.homeenergy.application.command;

import com.koni.homeenergy.domain.exception.ValidationException;
import com.koni.homeenergy.domain.exception.ValidationException.Violation;
import com.koni.homeenergy.domain.repository.SampleRepository;
import com.koni.homeenergy.infrastructure.observability.TelemetryMetrics;
import io.micrometer.observation.annotation.Observed;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;
import java.time.temporal.ChronoUnit;

/**
 * Command handler for the retention sweep.
 * Deletes samples whose timestamp is strictly older than {@code now - daysToKeep days}.
 * Out-of-range retention periods are rejected, never clamped.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class PurgeSamplesCommandHandler {

    private final SampleRepository sampleRepository;
    private final TelemetryMetrics telemetryMetrics;
    private final Clock clock;

    /**
     * @return number of deleted samples
     * @throws ValidationException if daysToKeep is outside [1, 365]
     */
    @Observed(name = "command.handler", contextualName = "purge-samples")
    public long handle(PurgeSamplesCommand command) {
        int daysToKeep = command.getDaysToKeep();
        if (daysToKeep < PurgeSamplesCommand.MIN_DAYS_TO_KEEP || daysToKeep > PurgeSamplesCommand.MAX_DAYS_TO_KEEP) {
            throw new ValidationException(Violation.INVALID_RETENTION, "Days to keep must be between 1 and 365");
        }

        Instant cutoff = clock.instant().minus(daysToKeep, ChronoUnit.DAYS);
        log.info("Deleting telemetry older than {} days (cutoff={})", daysToKeep, cutoff);

        long deleted = sampleRepository.deleteOlderThan(cutoff);
        telemetryMetrics.recordRetentionDeleted(deleted);
        log.info("Successfully deleted {} old telemetry records", deleted);
        return deleted;
    }
}
