package com.koni.homeenergy.application.query;

import lombok.AllArgsConstructor;
import lombok.Getter;

import java.time.Instant;

/**
 * Query for total energy consumed over {@code [startTime, endTime)}.
 */
@Getter
@AllArgsConstructor
public class GetEnergyQuery {

    private final String deviceId;
    private final String deviceType;
    private final String room;
    private final Instant startTime;
    private final Instant endTime;
}
