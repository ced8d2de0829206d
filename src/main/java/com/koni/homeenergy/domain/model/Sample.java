package com.koni.homeenergy.domain.model;

import lombok.EqualsAndHashCode;
import lombok.Getter;

import java.math.BigDecimal;
import java.time.Instant;

/**
 * Sample value object representing one telemetry reading from a device at an instant.
 * Samples are immutable once written; the store assigns {@code id}, ingestion assigns {@code receivedAt}.
 */
@Getter
@EqualsAndHashCode
public class Sample {

    private final Long id;
    private final String deviceId;
    private final String category;
    private final BigDecimal value;
    private final boolean status;
    private final Instant timestamp;
    private final Instant receivedAt;

    /**
     * Creates a sample that has not been persisted yet.
     *
     * @param deviceId the device that produced the reading
     * @param category the reading category, e.g. power, lighting, temperature
     * @param value the measured value
     * @param status the on/off status reported with the reading
     * @param timestamp the instant the reading was taken
     */
    public Sample(String deviceId, String category, BigDecimal value, boolean status, Instant timestamp) {
        this(null, deviceId, category, value, status, timestamp, null);
    }

    public Sample(Long id, String deviceId, String category, BigDecimal value, boolean status,
                  Instant timestamp, Instant receivedAt) {
        this.id = id;
        this.deviceId = deviceId;
        this.category = category;
        this.value = value;
        this.status = status;
        this.timestamp = timestamp;
        this.receivedAt = receivedAt;
    }

    public Sample withReceivedAt(Instant receivedAt) {
        return new Sample(id, deviceId, category, value, status, timestamp, receivedAt);
    }

    public boolean isPersisted() {
        return id != null;
    }

    @Override
    public String toString() {
        return "Sample{" +
                "id=" + id +
                ", deviceId='" + deviceId + '\'' +
                ", category='" + category + '\'' +
                ", value=" + value +
                ", status=" + status +
                ", timestamp=" + timestamp +
                ", receivedAt=" + receivedAt +
                '}';
    }
}
