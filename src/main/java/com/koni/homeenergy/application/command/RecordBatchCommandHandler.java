package com.koni.homeenergy.application.command;

import com.koni.homeenergy.application.port.SamplePublisher;
import com.koni.homeenergy.domain.event.SampleRecorded;
import com.koni.homeenergy.domain.exception.BatchInsertFailedException;
import com.koni.homeenergy.domain.exception.NoValidRecordsException;
import com.koni.homeenergy.domain.exception.StorageUnavailableException;
import com.koni.homeenergy.domain.exception.ValidationException;
import com.koni.homeenergy.domain.exception.ValidationException.Violation;
import com.koni.homeenergy.domain.model.BulkInsertResult;
import com.koni.homeenergy.domain.model.Device;
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
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Command handler for ingesting a batch of samples.
 *
 * The whole batch is validated before anything is written; the first invalid record
 * rejects the batch. Records for unknown devices are dropped with a warning. The rest
 * are stored with an unordered bulk insert, so one record's storage failure does not
 * block its siblings, and every stored record is published once.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class RecordBatchCommandHandler {

    private final SampleValidator sampleValidator;
    private final DeviceRegistry deviceRegistry;
    private final SampleRepository sampleRepository;
    private final SamplePublisher samplePublisher;
    private final TelemetryMetrics telemetryMetrics;
    private final Clock clock;

    /**
     * Handles the RecordBatchCommand.
     *
     * @param command the batch to ingest
     * @return the stored samples, in no particular order
     * @throws ValidationException if the batch is empty, too large, or holds an invalid record
     * @throws NoValidRecordsException if every record referenced an unknown device
     * @throws BatchInsertFailedException if some records could not be stored
     * @throws StorageUnavailableException if the store was unreachable for every record
     */
    @Observed(name = "command.handler", contextualName = "ingest-batch")
    public List<Sample> handle(RecordBatchCommand command) {
        List<RecordSampleCommand> records = command.getSamples();
        if (records == null || records.isEmpty()) {
            telemetryMetrics.recordRejected(Violation.EMPTY_BATCH.name());
            throw new ValidationException(Violation.EMPTY_BATCH, "Batch must contain at least one record");
        }
        if (records.size() > RecordBatchCommand.MAX_BATCH_SIZE) {
            telemetryMetrics.recordRejected(Violation.BATCH_TOO_LARGE.name());
            throw new ValidationException(Violation.BATCH_TOO_LARGE,
                    "Batch size cannot exceed " + RecordBatchCommand.MAX_BATCH_SIZE + " records");
        }

        log.debug("Handling RecordBatchCommand with {} records", records.size());

        return telemetryMetrics.recordProcessingTime(() -> {
            List<Sample> samples = new ArrayList<>(records.size());
            for (int i = 0; i < records.size(); i++) {
                Sample sample = records.get(i) == null ? new Sample(null, null, null, true, null) : records.get(i).toSample();
                try {
                    sampleValidator.validate(sample, i);
                } catch (ValidationException e) {
                    telemetryMetrics.recordRejected(e.getViolation().name());
                    throw e;
                }
                samples.add(sample);
            }

            List<Sample> accepted = keepKnownDevices(samples);
            if (accepted.isEmpty()) {
                telemetryMetrics.recordRejected("NO_VALID_RECORDS");
                throw new NoValidRecordsException("No telemetry ingested: all records referenced unknown devices");
            }

            BulkInsertResult result = sampleRepository.saveAllUnordered(accepted);
            List<Sample> inserted = result.getInserted();
            telemetryMetrics.recordIngested(inserted.size());
            inserted.forEach(this::publishQuietly);
            log.info("Batch ingested: received={}, accepted={}, inserted={}",
                    records.size(), accepted.size(), inserted.size());

            if (result.hasFailures()) {
                if (inserted.isEmpty() && result.isStorageUnavailable()) {
                    throw new StorageUnavailableException("Sample store unavailable: no batch record could be stored");
                }
                log.error("Batch partially stored: inserted={}, failed={}", inserted.size(), result.getFailures().size());
                telemetryMetrics.recordRejected("PARTIAL_BATCH_FAILURE");
                throw new BatchInsertFailedException(inserted.size(), result.getFailures());
            }
            return inserted;
        });
    }

    private List<Sample> keepKnownDevices(List<Sample> samples) {
        Set<String> referenced = samples.stream()
                .map(Sample::getDeviceId)
                .collect(Collectors.toCollection(LinkedHashSet::new));
        Set<String> known = deviceRegistry.findMany(referenced).stream()
                .map(Device::getDeviceId)
                .collect(Collectors.toSet());

        Instant receivedAt = clock.instant();
        List<Sample> accepted = new ArrayList<>(samples.size());
        int dropped = 0;
        for (Sample sample : samples) {
            if (known.contains(sample.getDeviceId())) {
                accepted.add(sample.withReceivedAt(receivedAt));
            } else {
                log.warn("Skipping telemetry for unknown device '{}'", sample.getDeviceId());
                dropped++;
            }
        }
        telemetryMetrics.recordDroppedUnknownDevice(dropped);
        return accepted;
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
