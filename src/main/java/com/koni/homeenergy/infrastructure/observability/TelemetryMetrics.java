package com.koni.homeenergy.infrastructure.observability;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.function.Supplier;

/**
 * Component for tracking telemetry-specific metrics.
 * Provides counters and timers for ingestion, fan-out, admission and retention.
 */
@Slf4j
@Component
public class TelemetryMetrics {

    private final MeterRegistry registry;
    private final Counter samplesIngested;
    private final Counter droppedUnknownDevice;
    private final Counter fanoutDelivered;
    private final Counter fanoutFailed;
    private final Counter fanoutDropped;
    private final Counter fanoutEvicted;
    private final Counter retentionDeleted;
    private final Timer processingTime;

    public TelemetryMetrics(MeterRegistry registry) {
        this.registry = registry;

        this.samplesIngested = Counter.builder("telemetry.ingested.total")
                .description("Total samples persisted")
                .register(registry);

        this.droppedUnknownDevice = Counter.builder("telemetry.dropped.unknown_device.total")
                .description("Total batch records dropped because their device is unknown")
                .register(registry);

        this.fanoutDelivered = Counter.builder("telemetry.fanout.delivered.total")
                .description("Total real-time messages delivered to subscribers")
                .register(registry);

        this.fanoutFailed = Counter.builder("telemetry.fanout.failed.total")
                .description("Total real-time deliveries that failed")
                .register(registry);

        this.fanoutDropped = Counter.builder("telemetry.fanout.dropped.total")
                .description("Total events dropped because the fan-out queue was full")
                .register(registry);

        this.fanoutEvicted = Counter.builder("telemetry.fanout.evicted.total")
                .description("Total subscribers dropped for falling behind")
                .register(registry);

        this.retentionDeleted = Counter.builder("telemetry.retention.deleted.total")
                .description("Total samples deleted by retention sweeps")
                .register(registry);

        this.processingTime = Timer.builder("telemetry.processing.time")
                .description("Time to ingest telemetry")
                .publishPercentiles(0.5, 0.95, 0.99)
                .register(registry);
    }

    public void recordIngested(int count) {
        samplesIngested.increment(count);
        log.debug("Ingested counter incremented by {}", count);
    }

    /**
     * Increment the rejection counter for the given reason (violation code or error kind).
     */
    public void recordRejected(String reason) {
        Counter.builder("telemetry.rejected.total")
                .description("Total ingestion requests rejected")
                .tag("reason", reason)
                .register(registry)
                .increment();
    }

    public void recordDroppedUnknownDevice(int count) {
        if (count > 0) {
            droppedUnknownDevice.increment(count);
        }
    }

    public void recordFanoutDelivered() {
        fanoutDelivered.increment();
    }

    public void recordFanoutFailed() {
        fanoutFailed.increment();
    }

    public void recordFanoutDropped() {
        fanoutDropped.increment();
    }

    public void recordFanoutEvicted() {
        fanoutEvicted.increment();
    }

    /**
     * Expose the live subscriber count as a gauge.
     */
    public void registerSubscriberGauge(Supplier<Number> subscriberCount) {
        Gauge.builder("telemetry.fanout.subscribers", subscriberCount)
                .description("Currently connected real-time subscribers")
                .register(registry);
    }

    public void recordAdmissionRejected(String tier) {
        Counter.builder("telemetry.admission.rejected.total")
                .description("Total requests rejected by admission control")
                .tag("tier", tier)
                .register(registry)
                .increment();
    }

    public void recordRetentionDeleted(long count) {
        retentionDeleted.increment(count);
    }

    /**
     * Record the processing time for an ingestion operation.
     *
     * @param operation The operation to time
     * @param <T> The return type of the operation
     * @return The result of the operation
     */
    public <T> T recordProcessingTime(Supplier<T> operation) {
        return processingTime.record(operation);
    }
}
