package com.koni.homeenergy.application.query;

import com.koni.homeenergy.domain.model.Device;
import com.koni.homeenergy.domain.model.Sample;
import com.koni.homeenergy.domain.model.SampleCriteria;
import com.koni.homeenergy.domain.repository.DeviceRegistry;
import com.koni.homeenergy.domain.repository.SampleRepository;
import io.micrometer.observation.annotation.Observed;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * Query handler for sample retrieval.
 *
 * Responsibilities:
 * - Normalise the time window (swapped bounds are swapped back, missing bounds are open)
 * - Resolve device type / room filters through the device registry
 * - Return matching samples newest first, optionally with device metadata
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class FindSamplesQueryHandler {

    private final SampleRepository sampleRepository;
    private final DeviceRegistry deviceRegistry;

    @Observed(name = "query.handler", contextualName = "find-samples")
    public List<SampleView> handle(FindSamplesQuery query) {
        Instant start = query.getStartTime();
        Instant end = query.getEndTime();
        if (start != null && end != null && start.isAfter(end)) {
            log.debug("Swapping inverted time bounds: startTime={}, endTime={}", start, end);
            Instant tmp = start;
            start = end;
            end = tmp;
        }

        DeviceScope scope = DeviceScope.resolve(deviceRegistry, query.getDeviceId(), query.getDeviceType(), query.getRoom());
        if (scope.matchesNothing()) {
            log.debug("No device matches deviceId={}, deviceType={}, room={}",
                    query.getDeviceId(), query.getDeviceType(), query.getRoom());
            return List.of();
        }

        List<Sample> samples = sampleRepository.find(new SampleCriteria(scope.getDeviceIds(), start, end));
        log.debug("Found {} samples", samples.size());

        Map<String, Device> devices = query.isIncludeDevice() ? lookupDevices(samples) : Collections.emptyMap();
        return samples.stream()
                .map(sample -> new SampleView(sample, devices.get(sample.getDeviceId())))
                .collect(Collectors.toList());
    }

    private Map<String, Device> lookupDevices(List<Sample> samples) {
        if (samples.isEmpty()) {
            return Collections.emptyMap();
        }
        List<String> ids = samples.stream().map(Sample::getDeviceId).distinct().collect(Collectors.toList());
        return deviceRegistry.findMany(ids).stream()
                .collect(Collectors.toMap(Device::getDeviceId, Function.identity(), (a, b) -> a));
    }
}
