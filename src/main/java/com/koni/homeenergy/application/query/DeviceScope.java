package com.koni.homeenergy.application.query;

import com.koni.homeenergy.domain.model.Device;
import com.koni.homeenergy.domain.repository.DeviceRegistry;
import lombok.Getter;

import java.util.Set;
import java.util.stream.Collectors;

/**
 * The set of devices a query is restricted to.
 *
 * Filtering by device type or room needs a registry lookup; filtering by device id
 * alone does not. A join filter that matches no device yields an empty scope, which
 * callers answer with an empty result rather than an error.
 */
@Getter
class DeviceScope {

    private static final DeviceScope ANY = new DeviceScope(null);

    /**
     * Device ids to include, or {@code null} for every device.
     */
    private final Set<String> deviceIds;

    private DeviceScope(Set<String> deviceIds) {
        this.deviceIds = deviceIds;
    }

    static DeviceScope resolve(DeviceRegistry registry, String deviceId, String deviceType, String room) {
        String id = trimToNull(deviceId);
        String type = trimToNull(deviceType);
        String roomName = trimToNull(room);

        if (type == null && roomName == null) {
            return id == null ? ANY : new DeviceScope(Set.of(id));
        }

        Set<String> matching = registry.findByTypeOrRoom(type, roomName).stream()
                .map(Device::getDeviceId)
                .collect(Collectors.toSet());
        if (id != null) {
            return new DeviceScope(matching.contains(id) ? Set.of(id) : Set.of());
        }
        return new DeviceScope(matching);
    }

    boolean matchesNothing() {
        return deviceIds != null && deviceIds.isEmpty();
    }

    static String trimToNull(String value) {
        if (value == null || value.isBlank()) {
            return null;
        }
        return value.trim();
    }
}
