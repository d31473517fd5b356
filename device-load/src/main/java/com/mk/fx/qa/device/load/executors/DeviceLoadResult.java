package com.mk.fx.qa.device.load.executors;

import com.mk.fx.qa.device.load.coordinator.RunOutcome;

/**
 * Result of a device load run.
 *
 * @param outcome records persisted and dropped by the coordinator, {@code null} if devices
 *     outlived the join and the run completes once they stop
 * @param totalUsers devices requested
 * @param startedUsers devices that were submitted before the run stopped
 * @param stopRequested whether the run was stopped externally
 * @param runTimeExpired whether the configured run time elapsed
 */
public record DeviceLoadResult(
    RunOutcome outcome,
    int totalUsers,
    int startedUsers,
    boolean stopRequested,
    boolean runTimeExpired) {}
