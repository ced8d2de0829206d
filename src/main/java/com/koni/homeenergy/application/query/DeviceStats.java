package com.koni.homeenergy.application.query;

import com.koni.homeenergy.domain.model.CategoryStats;
import lombok.AllArgsConstructor;
import lombok.Getter;

import java.time.Instant;
import java.util.List;

/**
 * Per-category statistics of one device over a period.
 */
@Getter
@AllArgsConstructor
public class DeviceStats {

    private final String deviceId;
    private final Instant startTime;
    private final Instant endTime;
    private final int hours;
    private final List<CategoryStats> categories;
}
