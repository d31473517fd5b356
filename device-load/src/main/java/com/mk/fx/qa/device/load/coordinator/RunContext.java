package com.mk.fx.qa.device.load.coordinator;

import java.time.Instant;

/**
 * Identity of a run shared by every record it produces.
 *
 * @param runId generated once per run
 * @param scenarioName scenario every device of the run executes
 * @param expectedWorkerCount number of devices requested
 * @param startedAt when validation succeeded
 */
public record RunContext(
    String runId, String scenarioName, int expectedWorkerCount, Instant startedAt) {}
