package com.mk.fx.qa.device.load.coordinator;

import com.fasterxml.jackson.annotation.JsonProperty;
import java.time.Instant;

/**
 * Bookkeeping of a finished run.
 *
 * @param context the run
 * @param recordedCount records persisted
 * @param droppedCount records lost to store write failures
 * @param finishedAt when the run returned to idle
 */
public record RunOutcome(
    RunContext context, long recordedCount, long droppedCount, Instant finishedAt) {

  /** True when at least one metric record could not be persisted. */
  @JsonProperty
  public boolean degraded() {
    return droppedCount > 0;
  }
}
