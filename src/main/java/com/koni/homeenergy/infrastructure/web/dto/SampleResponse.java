package com.koni.homeenergy.infrastructure.web.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.koni.homeenergy.application.query.SampleView;
import com.koni.homeenergy.domain.model.Sample;
import lombok.AllArgsConstructor;
import lombok.Getter;

import java.math.BigDecimal;
import java.time.Instant;

/**
 * A stored sample as returned by the API. {@code device} is only present when the
 * caller asked for device metadata.
 */
@Getter
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class SampleResponse {

    private final Long id;
    private final String deviceId;
    private final String category;
    private final BigDecimal value;
    private final boolean status;
    private final Instant timestamp;
    private final Instant receivedAt;
    private final DeviceSummary device;

    public static SampleResponse from(Sample sample) {
        return new SampleResponse(
                sample.getId(),
                sample.getDeviceId(),
                sample.getCategory(),
                sample.getValue(),
                sample.isStatus(),
                sample.getTimestamp(),
                sample.getReceivedAt(),
                null);
    }

    public static SampleResponse from(SampleView view) {
        Sample sample = view.getSample();
        return new SampleResponse(
                sample.getId(),
                sample.getDeviceId(),
                sample.getCategory(),
                sample.getValue(),
                sample.isStatus(),
                sample.getTimestamp(),
                sample.getReceivedAt(),
                view.getDevice() == null ? null : DeviceSummary.from(view.getDevice()));
    }
}
