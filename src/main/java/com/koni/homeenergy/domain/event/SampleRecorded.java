package com.koni.homeenergy.domain.event;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.koni.homeenergy.domain.model.Sample;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;

import java.math.BigDecimal;
import java.time.Instant;

/**
 * SampleRecorded domain event.
 * Published once for every sample that reached the store, and pushed to
 * real-time subscribers as the {@value #TYPE} message.
 */
@Getter
@EqualsAndHashCode
@ToString
public final class SampleRecorded {

    public static final String TYPE = "telemetry:update";

    private final Long id;
    private final String deviceId;
    private final String category;
    private final BigDecimal value;
    private final boolean status;
    private final Instant timestamp;
    private final Instant receivedAt;

    @JsonCreator
    public SampleRecorded(
            @JsonProperty("id") Long id,
            @JsonProperty("deviceId") String deviceId,
            @JsonProperty("category") String category,
            @JsonProperty("value") BigDecimal value,
            @JsonProperty("status") boolean status,
            @JsonProperty("timestamp") Instant timestamp,
            @JsonProperty("receivedAt") Instant receivedAt) {
        this.id = id;
        this.deviceId = deviceId;
        this.category = category;
        this.value = value;
        this.status = status;
        this.timestamp = timestamp;
        this.receivedAt = receivedAt;
    }

    public static SampleRecorded of(Sample sample) {
        return new SampleRecorded(
                sample.getId(),
                sample.getDeviceId(),
                sample.getCategory(),
                sample.getValue(),
                sample.isStatus(),
                sample.getTimestamp(),
                sample.getReceivedAt()
        );
    }
}
