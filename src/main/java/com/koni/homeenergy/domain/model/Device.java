package com.koni.homeenergy.domain.model;

import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.ToString;

import java.math.BigDecimal;

/**
 * Device metadata as seen by the telemetry core.
 * Devices are owned by the device registry; this side only reads them.
 */
@Getter
@ToString
@AllArgsConstructor
public class Device {

    private final String deviceId;
    private final String name;
    private final String type;
    private final String room;
    private final BigDecimal ratedPower;
}
