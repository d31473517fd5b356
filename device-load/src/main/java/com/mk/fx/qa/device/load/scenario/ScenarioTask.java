package com.mk.fx.qa.device.load.scenario;

import com.mk.fx.qa.device.offload.OffloadRequest;
import java.time.Duration;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * One workload of a scenario.
 *
 * @param name workload function name, also the task name of its metric records
 * @param parameters arguments passed to the workload
 * @param weight relative selection weight, at least 1
 * @param timeout per-call timeout, {@code null} for the client default
 */
public record ScenarioTask(
    String name, Map<String, Object> parameters, int weight, Duration timeout) {

  public ScenarioTask {
    Objects.requireNonNull(name, "name");
    // JSON nulls are legal parameter values
    parameters =
        parameters == null || parameters.isEmpty()
            ? Map.of()
            : Collections.unmodifiableMap(new LinkedHashMap<>(parameters));
    if (weight < 1) {
      throw new IllegalArgumentException("Task " + name + " weight must be at least 1");
    }
  }

  public static ScenarioTask of(String name, Map<String, Object> parameters) {
    return new ScenarioTask(name, parameters, 1, null);
  }

  public OffloadRequest toRequest() {
    return new OffloadRequest(name, parameters, timeout);
  }
}
