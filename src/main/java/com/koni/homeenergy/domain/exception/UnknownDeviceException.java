package com.koni.homeenergy.domain.exception;

import lombok.Getter;

/**
 * Exception thrown when a sample references a device the registry does not know.
 */
@Getter
public class UnknownDeviceException extends RuntimeException {

    private final String deviceId;

    public UnknownDeviceException(String deviceId) {
        super("Device '" + deviceId + "' not found");
        this.deviceId = deviceId;
    }
}
