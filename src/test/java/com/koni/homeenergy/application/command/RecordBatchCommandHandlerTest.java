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
import com.koni.homeenergy.tags.UnitTest;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.concurrent.atomic.AtomicLong;
import java.util.stream.Collectors;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyCollection;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

@UnitTest
@ExtendWith(MockitoExtension.class)
class RecordBatchCommandHandlerTest {

    private static final Instant NOW = Instant.parse("2025-06-01T12:00:00Z");

    @Mock
    private DeviceRegistry deviceRegistry;

    @Mock
    private SampleRepository sampleRepository;

    @Mock
    private SamplePublisher samplePublisher;

    private SimpleMeterRegistry meterRegistry;
    private RecordBatchCommandHandler handler;

    @BeforeEach
    void setUp() {
        Clock clock = Clock.fixed(NOW, ZoneOffset.UTC);
        meterRegistry = new SimpleMeterRegistry();
        handler = new RecordBatchCommandHandler(
                new SampleValidator(clock),
                deviceRegistry,
                sampleRepository,
                samplePublisher,
                new TelemetryMetrics(meterRegistry),
                clock);
    }

    @Test
    void shouldRejectEmptyBatch() {
        assertThatThrownBy(() -> handler.handle(new RecordBatchCommand(List.of())))
                .isInstanceOf(ValidationException.class)
                .hasMessage("Batch must contain at least one record")
                .extracting("violation").isEqualTo(Violation.EMPTY_BATCH);

        verifyNoInteractions(deviceRegistry, sampleRepository, samplePublisher);
    }

    @Test
    void shouldRejectBatchOverOneThousandRecords() {
        List<RecordSampleCommand> records = new ArrayList<>();
        for (int i = 0; i < 1001; i++) {
            records.add(record("dev-001", "10"));
        }

        assertThatThrownBy(() -> handler.handle(new RecordBatchCommand(records)))
                .hasMessage("Batch size cannot exceed 1000 records")
                .extracting("violation").isEqualTo(Violation.BATCH_TOO_LARGE);

        verifyNoInteractions(deviceRegistry, sampleRepository, samplePublisher);
    }

    @Test
    void shouldStoreFullBatchAndPublishOncePerRecord() {
        List<RecordSampleCommand> records = new ArrayList<>();
        for (int i = 0; i < 1000; i++) {
            records.add(record("dev-" + (i % 3), String.valueOf(i)));
        }
        knownDevices("dev-0", "dev-1", "dev-2");
        storeEverything();

        List<Sample> stored = handler.handle(new RecordBatchCommand(records));

        assertThat(stored).hasSize(1000);
        verify(samplePublisher, times(1000)).publish(any(SampleRecorded.class));
        assertThat(meterRegistry.get("telemetry.ingested.total").counter().count()).isEqualTo(1000.0);
    }

    @Test
    void shouldDropRecordsOfUnknownDevices() {
        knownDevices("dev-001", "dev-002");
        storeEverything();

        List<Sample> stored = handler.handle(new RecordBatchCommand(List.of(
                record("dev-001", "10"),
                record("ghost-1", "20"),
                record("dev-002", "30"))));

        assertThat(stored).extracting(Sample::getDeviceId).containsExactlyInAnyOrder("dev-001", "dev-002");
        verify(samplePublisher, times(2)).publish(any(SampleRecorded.class));
        assertThat(meterRegistry.get("telemetry.dropped.unknown_device.total").counter().count()).isEqualTo(1.0);
    }

    @Test
    void shouldFailWhenEveryDeviceIsUnknown() {
        when(deviceRegistry.findMany(anyCollection())).thenReturn(List.of());

        assertThatThrownBy(() -> handler.handle(new RecordBatchCommand(List.of(record("ghost-1", "10")))))
                .isInstanceOf(NoValidRecordsException.class);

        verifyNoInteractions(sampleRepository, samplePublisher);
    }

    @Test
    void shouldAbortWholeBatchOnFirstInvalidRecord() {
        List<RecordSampleCommand> records = List.of(
                record("dev-001", "10"),
                record("dev-001", "-5000000"),
                record("bad id", "10"));

        assertThatThrownBy(() -> handler.handle(new RecordBatchCommand(records)))
                .isInstanceOf(ValidationException.class)
                .hasMessage("Record 2: Value must be between -1,000,000 and 1,000,000");

        verifyNoInteractions(deviceRegistry, sampleRepository, samplePublisher);
    }

    @Test
    void shouldReportMissingRecordWithItsIndex() {
        List<RecordSampleCommand> records = new ArrayList<>();
        records.add(record("dev-001", "10"));
        records.add(null);

        assertThatThrownBy(() -> handler.handle(new RecordBatchCommand(records)))
                .hasMessage("Record 2: deviceId is required");
    }

    @Test
    void shouldPublishStoredRecordsAndReportPartialFailure() {
        knownDevices("dev-001", "dev-002");
        when(sampleRepository.saveAllUnordered(anyList())).thenAnswer(invocation -> {
            List<Sample> samples = invocation.getArgument(0);
            return new BulkInsertResult(
                    List.of(RecordSampleCommandHandlerTest.withId(samples.get(0), 1L)),
                    List.of("device 'dev-002' at 2025-06-01T11:59:30Z: constraint violation"),
                    false);
        });

        assertThatThrownBy(() -> handler.handle(new RecordBatchCommand(List.of(
                record("dev-001", "10"),
                record("dev-002", "20")))))
                .isInstanceOf(BatchInsertFailedException.class)
                .hasMessage("Batch insert failed: device 'dev-002' at 2025-06-01T11:59:30Z: constraint violation")
                .satisfies(e -> {
                    BatchInsertFailedException failure = (BatchInsertFailedException) e;
                    assertThat(failure.getInsertedCount()).isEqualTo(1);
                    assertThat(failure.getFailedCount()).isEqualTo(1);
                });

        verify(samplePublisher, times(1)).publish(any(SampleRecorded.class));
    }

    @Test
    void shouldReportStorageUnavailableWhenNothingWasStored() {
        knownDevices("dev-001");
        when(sampleRepository.saveAllUnordered(anyList()))
                .thenReturn(new BulkInsertResult(List.of(), List.of("device 'dev-001': connection refused"), true));

        assertThatThrownBy(() -> handler.handle(new RecordBatchCommand(List.of(record("dev-001", "10")))))
                .isInstanceOf(StorageUnavailableException.class);

        verifyNoInteractions(samplePublisher);
    }

    @Test
    void shouldStampEveryRecordWithReceivedAt() {
        knownDevices("dev-001");
        storeEverything();

        handler.handle(new RecordBatchCommand(List.of(record("dev-001", "1"), record("dev-001", "2"))));

        @SuppressWarnings("unchecked")
        ArgumentCaptor<List<Sample>> captor = ArgumentCaptor.forClass(List.class);
        verify(sampleRepository).saveAllUnordered(captor.capture());
        assertThat(captor.getValue()).extracting(Sample::getReceivedAt).containsOnly(NOW);
    }

    private void knownDevices(String... ids) {
        when(deviceRegistry.findMany(anyCollection())).thenAnswer(invocation -> {
            Collection<String> requested = invocation.getArgument(0);
            List<String> known = List.of(ids);
            return requested.stream()
                    .filter(known::contains)
                    .map(id -> new Device(id, id, "meter", "kitchen", null))
                    .collect(Collectors.toList());
        });
    }

    private void storeEverything() {
        AtomicLong ids = new AtomicLong();
        when(sampleRepository.saveAllUnordered(anyList())).thenAnswer(invocation -> {
            List<Sample> samples = invocation.getArgument(0);
            List<Sample> stored = samples.stream()
                    .map(sample -> RecordSampleCommandHandlerTest.withId(sample, ids.incrementAndGet()))
                    .collect(Collectors.toList());
            return new BulkInsertResult(stored, List.of(), false);
        });
    }

    private static RecordSampleCommand record(String deviceId, String value) {
        return new RecordSampleCommand(deviceId, "power", new BigDecimal(value), true, NOW.minusSeconds(30));
    }
}
