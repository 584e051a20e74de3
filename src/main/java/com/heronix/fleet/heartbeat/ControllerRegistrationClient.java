package com.heronix.fleet.heartbeat;

import com.heronix.fleet.exception.DeviceCommunicationException;
import com.heronix.fleet.exception.RegistrationRejectedException;

/**
 * Device-side view of the main controller's registration endpoint.
 */
public interface ControllerRegistrationClient {

    /**
     * Register this device, or refresh its registration.
     *
     * @throws DeviceCommunicationException   when the controller could not be
     *                                        reached or failed on its side; worth retrying
     * @throws RegistrationRejectedException  when the controller refused the
     *                                        registration (validation, conflict, capacity)
     */
    void register(String deviceId, String deviceType, String ipAddress, int port)
            throws DeviceCommunicationException;
}
