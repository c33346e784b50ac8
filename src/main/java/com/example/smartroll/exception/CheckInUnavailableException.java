package com.example.smartroll.exception;

import lombok.Getter;

/**
 * Infrastructure fault: a store behind the check-in flow could not answer in time,
 * or a write conflict could not be resolved. Never a business outcome; the caller
 * decides whether to retry.
 */
@Getter
public class CheckInUnavailableException extends RuntimeException {

    public static final String SESSION_REGISTRY = "session-registry";
    public static final String PRESENCE_RESOLVER = "presence-resolver";
    public static final String DEVICE_REGISTRY = "device-registry";
    public static final String ATTENDANCE_STORE = "attendance-store";

    private final String component;

    public CheckInUnavailableException(String component, String message, Throwable cause) {
        super(message, cause);
        this.component = component;
    }

    public CheckInUnavailableException(String component, String message) {
        super(message);
        this.component = component;
    }
}
