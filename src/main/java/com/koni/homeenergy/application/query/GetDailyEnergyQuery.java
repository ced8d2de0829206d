package com.koni.homeenergy.application.query;

import lombok.AllArgsConstructor;
import lombok.Getter;

import java.time.LocalDate;

/**
 * Query for energy consumed per calendar day, {@code from} and {@code to} inclusive.
 */
@Getter
@AllArgsConstructor
public class GetDailyEnergyQuery {

    public static final int MAX_DAYS = 366;

    private final String deviceId;
    private final String deviceType;
    private final String room;
    private final LocalDate from;
    private final LocalDate to;
}
