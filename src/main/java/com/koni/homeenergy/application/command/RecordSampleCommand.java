package com.koni.homeenergy.application.command;

import com.koni.homeenergy.domain.model.Sample;
import lombok.AllArgsConstructor;
import lombok.Getter;

import java.math.BigDecimal;
import java.time.Instant;

/**
 * Command to record a single telemetry sample from a device.
 */
@Getter
@AllArgsConstructor
public class RecordSampleCommand {

    private final String deviceId;
    private final String category;
    private final BigDecimal value;

    /**
     * On/off status; devices that omit it are reported as on.
     */
    private final Boolean status;

    private final Instant timestamp;

    public Sample toSample() {
        return new Sample(deviceId, category, value, status == null || status, timestamp);
    }
}
