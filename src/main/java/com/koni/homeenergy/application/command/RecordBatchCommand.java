package com.koni.homeenergy.application.command;

import lombok.AllArgsConstructor;
import lombok.Getter;

import java.util.List;

/**
 * Command to record a batch of telemetry samples submitted together.
 */
@Getter
@AllArgsConstructor
public class RecordBatchCommand {

    public static final int MAX_BATCH_SIZE = 1000;

    private final List<RecordSampleCommand> samples;
}
