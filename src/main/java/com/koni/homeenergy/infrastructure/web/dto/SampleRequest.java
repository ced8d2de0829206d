package com.koni.homeenergy.infrastructure.web.dto;

import com.koni.homeenergy.application.command.RecordSampleCommand;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;
import java.time.Instant;

/**
 * Data Transfer Object for one telemetry sample submitted by a device.
 * 
 * Contains:
 * - deviceId: identifier of the reporting device
 * - category: what was measured (power, temperature, ...)
 * - value: the reading; for the power category, watts
 * - status: on/off state of the device, defaults to on
 * - timestamp: when the reading was taken (ISO 8601)
 * 
 * Business rules (value range, timestamp window, id format) are checked by the
 * domain validator, not here.
 */
@Getter
@NoArgsConstructor
@AllArgsConstructor
public class SampleRequest {

    @NotBlank(message = "deviceId is required")
    private String deviceId;

    @NotBlank(message = "category is required")
    private String category;

    @NotNull(message = "value is required")
    private BigDecimal value;

    private Boolean status;

    @NotNull(message = "timestamp is required")
    private Instant timestamp;

    public RecordSampleCommand toCommand() {
        return new RecordSampleCommand(deviceId, category, value, status, timestamp);
    }
}
