package com.mk.fx.qa.device.offload;

import java.util.Map;

/**
 * Entry point to the remote offload platform. A simulated device opens one session with its
 * hardware requirements and then offloads workloads through it until the device stops.
 *
 * <p>Implementations must be safe to share between device threads; sessions are not.
 */
public interface OffloadClient {

    /**
     * Registers a device with the platform.
     *
     * @param requirements device requirements, including the {@code ID} entry
     * @return an open session bound to that device
     * @throws OffloadException if the platform cannot be reached or rejects the device
     * @throws InterruptedException if the calling device thread is interrupted while waiting
     */
    OffloadSession open(Map<String, Object> requirements)
            throws OffloadException, InterruptedException;
}
