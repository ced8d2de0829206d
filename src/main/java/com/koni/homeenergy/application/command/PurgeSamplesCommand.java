package com.koni.homeenergy.application.command;

import lombok.AllArgsConstructor;
import lombok.Getter;

/**
 * Command to delete samples older than the retention period.
 */
@Getter
@AllArgsConstructor
public class PurgeSamplesCommand {

    public static final int DEFAULT_DAYS_TO_KEEP = 30;
    public static final int MIN_DAYS_TO_KEEP = 1;
    public static final int MAX_DAYS_TO_KEEP = 365;

    private final int daysToKeep;
}
