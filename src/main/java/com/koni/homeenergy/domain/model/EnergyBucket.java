package com.koni.homeenergy.domain.model;

import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;

import java.math.BigDecimal;
import java.math.MathContext;
import java.time.Instant;

/**
 * Energy consumed during one period. Derived on demand, never persisted.
 *
 * <p>Energy is kept as exact watt-milliseconds so that buckets tiling a window
 * add up to the window total without rounding drift.
 */
@Getter
@ToString
@EqualsAndHashCode
public class EnergyBucket {

    private static final BigDecimal MILLIS_PER_HOUR = BigDecimal.valueOf(3_600_000L);
    private static final BigDecimal WH_PER_KWH = BigDecimal.valueOf(1000L);

    private final Instant periodStart;
    private final Instant periodEnd;
    private final BigDecimal wattMillis;

    public EnergyBucket(Instant periodStart, Instant periodEnd, BigDecimal wattMillis) {
        this.periodStart = periodStart;
        this.periodEnd = periodEnd;
        this.wattMillis = wattMillis;
    }

    public BigDecimal getEnergyWh() {
        return wattMillis.divide(MILLIS_PER_HOUR, MathContext.DECIMAL128);
    }

    public BigDecimal getEnergyKWh() {
        return getEnergyWh().divide(WH_PER_KWH, MathContext.DECIMAL128);
    }
}
