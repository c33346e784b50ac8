package com.example.smartroll.presence;

import com.example.smartroll.model.DeviceIdentifier;

import java.util.Optional;

/**
 * Looks up where a device is attached to the network right now.
 *
 * Implementations are read-only lookups against state owned elsewhere. A store that
 * cannot answer must raise {@link com.example.smartroll.exception.CheckInUnavailableException}
 * rather than report "no attachment".
 */
public interface NetworkPresenceResolver {

    /**
     * @return the device's current network address (e.g. "10.0.5.23"), or empty when no
     *         attachment is known for it
     */
    Optional<String> resolve(DeviceIdentifier device);
}
