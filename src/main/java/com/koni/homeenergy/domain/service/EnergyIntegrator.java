package com.koni.homeenergy.domain.service;

import com.koni.homeenergy.domain.model.EnergyBucket;
import com.koni.homeenergy.domain.model.EnergyReport;
import com.koni.homeenergy.domain.model.Sample;

import java.math.BigDecimal;
import java.time.Duration;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneId;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * Turns power samples (watts) into energy using piecewise-constant integration.
 *
 * <p>Each sample's value is held from its timestamp until the next sample of the same
 * device, clipped to the window {@code [windowStart, windowEnd)}. The last sample of a
 * device is held until the window end. A sample taken before the window start still
 * contributes the part of its hold interval that lies inside the window.
 *
 * <p>Day buckets run the same computation once per local calendar day over the same
 * sample sequence, so a set of buckets tiling a window sums exactly to that window.
 */
public class EnergyIntegrator {

    private static final Comparator<Sample> BY_TIMESTAMP = Comparator.comparing(Sample::getTimestamp);

    /**
     * Integrates every device's samples over one window.
     *
     * @throws IllegalArgumentException if the window end is not after its start
     */
    public EnergyReport integrate(List<Sample> samples, Instant windowStart, Instant windowEnd) {
        requireWindow(windowStart, windowEnd);

        Map<String, EnergyBucket> byDevice = new LinkedHashMap<>();
        BigDecimal total = BigDecimal.ZERO;
        for (Map.Entry<String, List<Sample>> device : partitionByDevice(samples).entrySet()) {
            BigDecimal wattMillis = integrateDevice(device.getValue(), windowStart, windowEnd);
            byDevice.put(device.getKey(), new EnergyBucket(windowStart, windowEnd, wattMillis));
            total = total.add(wattMillis);
        }
        return new EnergyReport(new EnergyBucket(windowStart, windowEnd, total), byDevice);
    }

    /**
     * Produces one bucket per calendar day in {@code [from, to]} (inclusive) in the given zone.
     * Days without any held sample yield a zero bucket.
     */
    public List<EnergyBucket> dailyBuckets(List<Sample> samples, LocalDate from, LocalDate to, ZoneId zone) {
        if (to.isBefore(from)) {
            throw new IllegalArgumentException("Day range end " + to + " is before start " + from);
        }

        Map<String, List<Sample>> partitioned = partitionByDevice(samples);
        List<EnergyBucket> buckets = new ArrayList<>();
        for (LocalDate day = from; !day.isAfter(to); day = day.plusDays(1)) {
            Instant dayStart = day.atStartOfDay(zone).toInstant();
            Instant nextDayStart = day.plusDays(1).atStartOfDay(zone).toInstant();

            BigDecimal wattMillis = BigDecimal.ZERO;
            for (List<Sample> deviceSamples : partitioned.values()) {
                wattMillis = wattMillis.add(integrateDevice(deviceSamples, dayStart, nextDayStart));
            }
            buckets.add(new EnergyBucket(dayStart, nextDayStart.minusMillis(1), wattMillis));
        }
        return buckets;
    }

    private Map<String, List<Sample>> partitionByDevice(List<Sample> samples) {
        Map<String, List<Sample>> partitioned = new TreeMap<>();
        for (Sample sample : samples) {
            partitioned.computeIfAbsent(sample.getDeviceId(), id -> new ArrayList<>()).add(sample);
        }
        partitioned.values().forEach(list -> list.sort(BY_TIMESTAMP));
        return partitioned;
    }

    // samples must be sorted ascending
    private BigDecimal integrateDevice(List<Sample> samples, Instant windowStart, Instant windowEnd) {
        BigDecimal wattMillis = BigDecimal.ZERO;
        for (int i = 0; i < samples.size(); i++) {
            Sample sample = samples.get(i);
            Instant start = max(sample.getTimestamp(), windowStart);
            Instant end = i + 1 < samples.size()
                    ? min(samples.get(i + 1).getTimestamp(), windowEnd)
                    : windowEnd;
            if (end.isAfter(start)) {
                long heldMillis = Duration.between(start, end).toMillis();
                wattMillis = wattMillis.add(sample.getValue().multiply(BigDecimal.valueOf(heldMillis)));
            }
        }
        return wattMillis;
    }

    private static void requireWindow(Instant windowStart, Instant windowEnd) {
        if (!windowEnd.isAfter(windowStart)) {
            throw new IllegalArgumentException("Window end " + windowEnd + " must be after start " + windowStart);
        }
    }

    private static Instant max(Instant a, Instant b) {
        return a.isAfter(b) ? a : b;
    }

    private static Instant min(Instant a, Instant b) {
        return a.isBefore(b) ? a : b;
    }
}
