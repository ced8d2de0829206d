package com.koni.homeenergy.infrastructure.web.dto;

import com.koni.homeenergy.application.query.DeviceStats;
import com.koni.homeenergy.domain.model.CategoryStats;
import lombok.AllArgsConstructor;
import lombok.Getter;

import java.time.Instant;
import java.util.List;

@Getter
@AllArgsConstructor
public class DeviceStatsResponse {

    private final String deviceId;
    private final int hours;
    private final Instant startTime;
    private final Instant endTime;
    private final List<CategoryStats> stats;

    public static DeviceStatsResponse from(DeviceStats deviceStats) {
        return new DeviceStatsResponse(
                deviceStats.getDeviceId(),
                deviceStats.getHours(),
                deviceStats.getStartTime(),
                deviceStats.getEndTime(),
                deviceStats.getCategories());
    }
}
