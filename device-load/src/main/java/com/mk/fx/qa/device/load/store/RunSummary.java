package com.mk.fx.qa.device.load.store;

import com.fasterxml.jackson.annotation.JsonProperty;
import java.time.Instant;

/** Aggregate of the records of one scenario within one run. */
public record RunSummary(
    String runId,
    String scenarioName,
    long totalRequests,
    long deviceCount,
    double avgLatencyMs,
    long successCount,
    Instant firstRecordAt,
    Instant lastRecordAt) {

  @JsonProperty
  public double successRatePct() {
    return totalRequests == 0 ? 0.0 : successCount * 100.0 / totalRequests;
  }
}
