package com.koni.homeenergy.application.query;

import lombok.AllArgsConstructor;
import lombok.Getter;

/**
 * Query for per-category statistics of one device over the last {@code hours} hours.
 */
@Getter
@AllArgsConstructor
public class GetDeviceStatsQuery {

    public static final int DEFAULT_HOURS = 24;
    public static final int MAX_HOURS = 168;

    private final String deviceId;
    private final int hours;
}
