package com.koni.homeenergy.domain.repository;

import com.koni.homeenergy.domain.model.Device;

import java.util.Collection;
import java.util.List;

/**
 * Read-only view of the device registry.
 * Device records are managed elsewhere; the telemetry core only resolves them.
 */
public interface DeviceRegistry {

    boolean exists(String deviceId);

    /**
     * Resolves the given ids; unknown ids are simply absent from the result.
     */
    List<Device> findMany(Collection<String> deviceIds);

    /**
     * Finds devices matching every given filter. Type matches exactly, room matches
     * exactly ignoring case. A {@code null} filter is ignored.
     */
    List<Device> findByTypeOrRoom(String type, String room);
}
