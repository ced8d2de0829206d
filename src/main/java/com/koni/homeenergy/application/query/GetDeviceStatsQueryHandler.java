package com.koni.homeenergy.application.query;

import com.koni.homeenergy.domain.exception.ValidationException;
import com.koni.homeenergy.domain.exception.ValidationException.Violation;
import com.koni.homeenergy.domain.model.CategoryStats;
import com.koni.homeenergy.domain.repository.SampleRepository;
import io.micrometer.observation.annotation.Observed;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.List;

/**
 * Query handler for device statistics.
 * Groups a device's readings of the last {@code hours} hours by category.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class GetDeviceStatsQueryHandler {

    private final SampleRepository sampleRepository;
    private final Clock clock;

    @Observed(name = "query.handler", contextualName = "device-stats")
    public DeviceStats handle(GetDeviceStatsQuery query) {
        String deviceId = DeviceScope.trimToNull(query.getDeviceId());
        if (deviceId == null) {
            throw new ValidationException(Violation.MISSING_FIELD, "Device ID is required");
        }
        if (query.getHours() <= 0 || query.getHours() > GetDeviceStatsQuery.MAX_HOURS) {
            throw new ValidationException(Violation.INVALID_STATS_WINDOW, "Hours must be between 1 and 168");
        }

        Instant endTime = clock.instant();
        Instant startTime = endTime.minus(query.getHours(), ChronoUnit.HOURS);
        List<CategoryStats> categories = sampleRepository.statsByCategory(deviceId, startTime, endTime);

        log.info("Retrieved stats for device {} over {} hours: {} categories", deviceId, query.getHours(), categories.size());
        return new DeviceStats(deviceId, startTime, endTime, query.getHours(), categories);
    }
}
