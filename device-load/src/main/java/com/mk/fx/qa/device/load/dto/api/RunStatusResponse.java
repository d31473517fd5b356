package com.mk.fx.qa.device.load.dto.api;

import com.mk.fx.qa.device.load.coordinator.RunContext;
import com.mk.fx.qa.device.load.coordinator.RunOutcome;
import com.mk.fx.qa.device.load.coordinator.RunState;

/**
 * Snapshot of the coordinator: the active run, if any, and the outcome of the previous one.
 */
public record RunStatusResponse(
    RunState state,
    RunContext currentRun,
    int liveWorkers,
    long recordedCount,
    long droppedCount,
    RunOutcome lastRun) {}
