package com.mk.fx.qa.device.offload;

/** A device's connection to the offload platform. Owned by exactly one device thread. */
public interface OffloadSession extends AutoCloseable {

    /**
     * Offloads one workload and waits for its outcome.
     *
     * @param request workload descriptor
     * @return timing and outcome reported for the call
     * @throws OffloadException on transport-level failure
     * @throws InterruptedException if the calling device thread is interrupted while waiting
     */
    OffloadResponse call(OffloadRequest request) throws OffloadException, InterruptedException;

    @Override
    void close();
}
