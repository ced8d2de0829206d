package com.koni.homeenergy.domain.model;

import lombok.Getter;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.Map;

/**
 * Whole-window energy total with the per-device contributions it was summed from.
 */
@Getter
public class EnergyReport {

    private final EnergyBucket total;
    private final Map<String, EnergyBucket> byDevice;

    public EnergyReport(EnergyBucket total, Map<String, EnergyBucket> byDevice) {
        this.total = total;
        this.byDevice = Map.copyOf(byDevice);
    }

    public Instant getWindowStart() {
        return total.getPeriodStart();
    }

    public Instant getWindowEnd() {
        return total.getPeriodEnd();
    }

    public BigDecimal getEnergyWh() {
        return total.getEnergyWh();
    }
}
