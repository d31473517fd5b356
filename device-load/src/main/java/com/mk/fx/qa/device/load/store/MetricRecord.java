package com.mk.fx.qa.device.load.store;

import java.time.Duration;
import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import lombok.Builder;

/**
 * One completed unit of work of one device, immutable once written.
 *
 * @param runId run the execution belongs to
 * @param timestamp completion time
 * @param scenarioName scenario the device was running
 * @param deviceId identity of the device
 * @param deviceRequirements hardware profile the device announced
 * @param taskName workload that was offloaded
 * @param taskParameters arguments of the workload
 * @param latency time spent in the offload call
 * @param status outcome
 * @param errorMessage failure description, {@code null} on success
 * @param metricValue numeric workload result, if any
 */
@Builder
public record MetricRecord(
    String runId,
    Instant timestamp,
    String scenarioName,
    String deviceId,
    Map<String, Object> deviceRequirements,
    String taskName,
    Map<String, Object> taskParameters,
    Duration latency,
    MetricStatus status,
    String errorMessage,
    Double metricValue) {

  public MetricRecord {
    Objects.requireNonNull(runId, "runId");
    Objects.requireNonNull(scenarioName, "scenarioName");
    Objects.requireNonNull(deviceId, "deviceId");
    Objects.requireNonNull(taskName, "taskName");
    Objects.requireNonNull(status, "status");
    timestamp = timestamp != null ? timestamp : Instant.now();
    latency = latency != null ? latency : Duration.ZERO;
    deviceRequirements = readOnlyCopy(deviceRequirements);
    taskParameters = readOnlyCopy(taskParameters);
  }

  private static Map<String, Object> readOnlyCopy(Map<String, Object> source) {
    return source == null || source.isEmpty()
        ? Map.of()
        : Collections.unmodifiableMap(new LinkedHashMap<>(source));
  }
}
