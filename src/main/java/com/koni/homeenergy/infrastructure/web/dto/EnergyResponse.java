package com.koni.homeenergy.infrastructure.web.dto;

import com.koni.homeenergy.domain.model.EnergyReport;
import lombok.AllArgsConstructor;
import lombok.Getter;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.Map;
import java.util.TreeMap;

/**
 * Whole-window energy total with a per-device breakdown, devices in id order.
 */
@Getter
@AllArgsConstructor
public class EnergyResponse {

    private final Instant startTime;
    private final Instant endTime;
    private final BigDecimal energyWh;
    private final BigDecimal energyKWh;
    private final Map<String, EnergyBucketResponse> devices;

    public static EnergyResponse from(EnergyReport report) {
        Map<String, EnergyBucketResponse> devices = new TreeMap<>();
        report.getByDevice().forEach((deviceId, bucket) -> devices.put(deviceId, EnergyBucketResponse.from(bucket)));
        return new EnergyResponse(
                report.getWindowStart(),
                report.getWindowEnd(),
                report.getEnergyWh(),
                EnergyBucketResponse.roundKWh(report.getTotal().getEnergyKWh()),
                devices);
    }
}
