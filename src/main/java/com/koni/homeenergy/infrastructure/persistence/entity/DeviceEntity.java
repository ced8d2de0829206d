package com.koni.homeenergy.infrastructure.persistence.entity;

import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

import java.math.BigDecimal;

/**
 * JPA entity mapped onto the device registry table.
 * The telemetry core only reads it; registry management happens elsewhere.
 */
@Entity
@Table(
    name = "device",
    indexes = {
        @Index(name = "idx_device_type", columnList = "device_type"),
        @Index(name = "idx_device_room", columnList = "room")
    }
)
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
public class DeviceEntity {

    @Id
    @Column(name = "device_id", length = 64)
    private String deviceId;

    @Column(name = "name", nullable = false)
    private String name;

    @Column(name = "device_type", nullable = false, length = 64)
    private String type;

    @Column(name = "room", length = 64)
    private String room;

    @Column(name = "rated_power", precision = 12, scale = 2)
    private BigDecimal ratedPower;
}
