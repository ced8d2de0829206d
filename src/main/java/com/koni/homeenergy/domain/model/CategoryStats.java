package com.koni.homeenergy.domain.model;

import lombok.AllArgsConstructor;
import lombok.Getter;

import java.math.BigDecimal;
import java.time.Instant;

/**
 * Aggregated readings of one category for one device over a time window.
 */
@Getter
@AllArgsConstructor
public class CategoryStats {

    private final String category;
    private final long count;
    private final double avgValue;
    private final BigDecimal minValue;
    private final BigDecimal maxValue;
    private final Instant lastReading;
}
