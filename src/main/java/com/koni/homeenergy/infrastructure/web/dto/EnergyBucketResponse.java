package com.koni.homeenergy.infrastructure.web.dto;

import com.koni.homeenergy.domain.model.EnergyBucket;
import lombok.AllArgsConstructor;
import lombok.Getter;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.Instant;

/**
 * Energy over one period. Wh is reported at full precision, kWh rounded to three decimals.
 */
@Getter
@AllArgsConstructor
public class EnergyBucketResponse {

    static final int KWH_SCALE = 3;

    private final Instant periodStart;
    private final Instant periodEnd;
    private final BigDecimal energyWh;
    private final BigDecimal energyKWh;

    public static EnergyBucketResponse from(EnergyBucket bucket) {
        return new EnergyBucketResponse(
                bucket.getPeriodStart(),
                bucket.getPeriodEnd(),
                bucket.getEnergyWh(),
                roundKWh(bucket.getEnergyKWh()));
    }

    static BigDecimal roundKWh(BigDecimal kWh) {
        return kWh.setScale(KWH_SCALE, RoundingMode.HALF_UP);
    }
}
