package com.mk.fx.qa.device.load.coordinator;

import com.mk.fx.qa.device.load.store.MetricStatus;
import com.mk.fx.qa.device.offload.OffloadResponse;
import java.time.Duration;
import java.time.Instant;
import java.util.Map;
import java.util.Objects;

/** What a worker reports after one task, before it is turned into a metric record. */
public record TaskOutcome(
    String taskName,
    Map<String, Object> parameters,
    Duration latency,
    MetricStatus status,
    String errorMessage,
    Double metricValue,
    Instant completedAt) {

  public TaskOutcome {
    Objects.requireNonNull(taskName, "taskName");
    Objects.requireNonNull(status, "status");
    latency = latency != null ? latency : Duration.ZERO;
    completedAt = completedAt != null ? completedAt : Instant.now();
  }

  public static TaskOutcome success(
      String taskName, Map<String, Object> parameters, Duration latency, Double metricValue) {
    return new TaskOutcome(
        taskName, parameters, latency, MetricStatus.SUCCESS, null, metricValue, Instant.now());
  }

  public static TaskOutcome failure(
      String taskName, Map<String, Object> parameters, Duration latency, String errorMessage) {
    return new TaskOutcome(
        taskName, parameters, latency, MetricStatus.FAILURE, errorMessage, null, Instant.now());
  }

  public static TaskOutcome fromResponse(
      String taskName, Map<String, Object> parameters, OffloadResponse response) {
    if (response.isSuccess()) {
      return success(taskName, parameters, response.latency(), response.numericResult().orElse(null));
    }
    return failure(taskName, parameters, response.latency(), response.errorMessage());
  }
}
