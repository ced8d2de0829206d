package com.koni.homeenergy.application.query;

import com.koni.homeenergy.domain.model.Device;
import com.koni.homeenergy.domain.model.Sample;
import lombok.AllArgsConstructor;
import lombok.Getter;

/**
 * A stored sample, optionally joined with its device's metadata.
 */
@Getter
@AllArgsConstructor
public class SampleView {

    private final Sample sample;

    /**
     * The device record, or {@code null} when not requested or no longer registered.
     */
    private final Device device;
}
