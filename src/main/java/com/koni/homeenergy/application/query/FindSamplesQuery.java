package com.koni.homeenergy.application.query;

import lombok.AllArgsConstructor;
import lombok.Getter;

import java.time.Instant;

/**
 * Query to retrieve samples. Every filter is optional.
 */
@Getter
@AllArgsConstructor
public class FindSamplesQuery {

    private final String deviceId;
    private final String deviceType;
    private final String room;
    private final Instant startTime;
    private final Instant endTime;

    /**
     * Attach the registry's device metadata to each returned sample.
     */
    private final boolean includeDevice;
}
