package com.koni.homeenergy.infrastructure.web.dto;

import com.koni.homeenergy.domain.model.Device;
import lombok.AllArgsConstructor;
import lombok.Getter;

@Getter
@AllArgsConstructor
public class DeviceSummary {

    private final String name;
    private final String type;
    private final String room;

    public static DeviceSummary from(Device device) {
        return new DeviceSummary(device.getName(), device.getType(), device.getRoom());
    }
}
