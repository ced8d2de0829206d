package com.koni.homeenergy.infrastructure.persistence.entity;

import com.koni.homeenergy.domain.service.SampleValidator;
import jakarta.persistence.*;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

import java.math.BigDecimal;
import java.time.Instant;
import java.time.temporal.ChronoUnit;

/**
 * JPA entity for persisting telemetry samples.
 * Rows are appended by ingestion and removed only by the retention sweep.
 */
@Entity
@Table(
    name = "telemetry_sample",
    indexes = {
        @Index(name = "idx_sample_device_ts", columnList = "device_id, sample_ts"),
        @Index(name = "idx_sample_ts", columnList = "sample_ts"),
        @Index(name = "idx_sample_received_at", columnList = "received_at")
    }
)
@Getter
@Setter
@NoArgsConstructor
public class SampleEntity {

    public static final int VALUE_PRECISION = 19;
    public static final int VALUE_SCALE = 6;

    /**
     * Finest timestamp resolution the store keeps.
     */
    public static final ChronoUnit TIMESTAMP_RESOLUTION = ChronoUnit.MICROS;

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "device_id", nullable = false, length = SampleValidator.MAX_DEVICE_ID_LENGTH)
    private String deviceId;

    @Column(name = "category", nullable = false, length = SampleValidator.MAX_CATEGORY_LENGTH)
    private String category;

    @Column(name = "sample_value", nullable = false, precision = VALUE_PRECISION, scale = VALUE_SCALE)
    private BigDecimal value;

    @Column(name = "status", nullable = false)
    private boolean status;

    @Column(name = "sample_ts", nullable = false)
    private Instant timestamp;

    @Column(name = "received_at", nullable = false)
    private Instant receivedAt;

    public SampleEntity(String deviceId, String category, BigDecimal value, boolean status,
                        Instant timestamp, Instant receivedAt) {
        this.deviceId = deviceId;
        this.category = category;
        this.value = value;
        this.status = status;
        this.timestamp = timestamp;
        this.receivedAt = receivedAt;
    }

    @PrePersist
    protected void onCreate() {
        if (receivedAt == null) {
            receivedAt = Instant.now().truncatedTo(TIMESTAMP_RESOLUTION);
        }
    }
}
