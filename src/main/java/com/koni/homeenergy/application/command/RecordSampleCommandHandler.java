package com.koni.homeenergy.application.command;

import com.koni.homeenergy.application.port.SamplePublisher;
import com.koni.homeenergy.domain.event.SampleRecorded;
import com.koni.homeenergy.domain.exception.UnknownDeviceException;
import com.koni.homeenergy.domain.exception.ValidationException;
import com.koni.homeenergy.domain.model.Sample;
import com.koni.homeenergy.domain.repository.DeviceRegistry;
import com.koni.homeenergy.domain.repository.SampleRepository;
import com.koni.homeenergy.domain.service.SampleValidator;
import com.koni.homeenergy.infrastructure.observability.TelemetryMetrics;
import io.micrometer.observation.annotation.Observed;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;

/**
 * Command handler for ingesting a single sample.
 *
 * Responsibilities:
 * - Validate the sample against business rules
 * - Reject samples for devices the registry does not know
 * - Persist the sample with its server-assigned receivedAt
 * - Publish a SampleRecorded event for real-time subscribers
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class RecordSampleCommandHandler {

    private final SampleValidator sampleValidator;
    private final DeviceRegistry deviceRegistry;
    private final SampleRepository sampleRepository;
    private final SamplePublisher samplePublisher;
    private final TelemetryMetrics telemetryMetrics;
    private final Clock clock;

    /**
     * Handles the RecordSampleCommand.
     *
     * @param command the sample to ingest
     * @return the stored sample
     * @throws ValidationException if a business rule is broken
     * @throws UnknownDeviceException if the device is not registered
     * @throws com.koni.homeenergy.domain.exception.StorageUnavailableException if the store is unreachable
     */
    @Observed(name = "command.handler", contextualName = "ingest-sample")
    public Sample handle(RecordSampleCommand command) {
        log.debug("Handling RecordSampleCommand: deviceId={}, category={}, value={}, timestamp={}",
                command.getDeviceId(), command.getCategory(), command.getValue(), command.getTimestamp());

        return telemetryMetrics.recordProcessingTime(() -> {
            Sample sample = command.toSample();
            try {
                sampleValidator.validate(sample);
            } catch (ValidationException e) {
                telemetryMetrics.recordRejected(e.getViolation().name());
                throw e;
            }

            if (!deviceRegistry.exists(sample.getDeviceId())) {
                telemetryMetrics.recordRejected("UNKNOWN_DEVICE");
                throw new UnknownDeviceException(sample.getDeviceId());
            }

            Sample stored = sampleRepository.save(sample.withReceivedAt(clock.instant()));
            telemetryMetrics.recordIngested(1);
            log.info("Sample saved: id={}, deviceId={}, category={}, value={}",
                    stored.getId(), stored.getDeviceId(), stored.getCategory(), stored.getValue());

            publishQuietly(stored);
            return stored;
        });
    }

    private void publishQuietly(Sample stored) {
        try {
            samplePublisher.publish(SampleRecorded.of(stored));
        } catch (RuntimeException e) {
            log.warn("Fan-out publish failed for sample id={}, deviceId={}: {}",
                    stored.getId(), stored.getDeviceId(), e.getMessage());
        }
    }
}
