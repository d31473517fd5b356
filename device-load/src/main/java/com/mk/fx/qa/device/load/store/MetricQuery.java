package com.mk.fx.qa.device.load.store;

import java.time.Instant;
import lombok.Builder;

/**
 * Filter for reading records back. Every field is optional; {@code from} is inclusive and
 * {@code to} exclusive.
 */
@Builder
public record MetricQuery(
    String runId,
    String scenarioName,
    String deviceId,
    Instant from,
    Instant to,
    Integer limit) {

  private static final MetricQuery ALL = MetricQuery.builder().build();

  public static MetricQuery all() {
    return ALL;
  }

  public static MetricQuery forRun(String runId) {
    return MetricQuery.builder().runId(runId).build();
  }
}
