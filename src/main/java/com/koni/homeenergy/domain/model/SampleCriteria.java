package com.koni.homeenergy.domain.model;

import lombok.Getter;

import java.time.Instant;
import java.util.Collections;
import java.util.Set;

/**
 * Store-level filter for sample lookups.
 * A {@code null} device set means "any device"; a {@code null} bound is open-ended.
 */
@Getter
public class SampleCriteria {

    private final Set<String> deviceIds;
    private final Instant from;
    private final Instant to;

    public SampleCriteria(Set<String> deviceIds, Instant from, Instant to) {
        this.deviceIds = deviceIds == null ? null : Collections.unmodifiableSet(deviceIds);
        this.from = from;
        this.to = to;
    }

    public boolean hasDeviceFilter() {
        return deviceIds != null;
    }
}
