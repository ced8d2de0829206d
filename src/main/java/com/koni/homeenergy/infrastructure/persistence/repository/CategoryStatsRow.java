package com.koni.homeenergy.infrastructure.persistence.repository;

import lombok.AllArgsConstructor;
import lombok.Getter;

import java.math.BigDecimal;
import java.time.Instant;

/**
 * Row produced by the per-category aggregation query.
 */
@Getter
@AllArgsConstructor
public class CategoryStatsRow {

    private final String category;
    private final Long count;
    private final Double avgValue;
    private final BigDecimal minValue;
    private final BigDecimal maxValue;
    private final Instant lastReading;
}
