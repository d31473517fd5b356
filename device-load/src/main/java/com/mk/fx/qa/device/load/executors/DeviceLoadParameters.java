package com.mk.fx.qa.device.load.executors;

import static com.mk.fx.qa.device.load.utils.LoadUtils.toDuration;

import java.time.Duration;

/**
 * Parameters of one device load run.
 *
 * @param users number of devices, each running on its own thread
 * @param spawnRate devices started per second; zero or less starts every device at once
 * @param runTime how long the run lasts, {@code null} or zero to run until stopped or until every
 *     device has ended
 */
public record DeviceLoadParameters(int users, double spawnRate, Duration runTime) {

  public DeviceLoadParameters {
    if (users < 1) {
      throw new IllegalArgumentException("users must be at least 1");
    }
    runTime = toDuration(runTime);
    if (runTime.isNegative()) {
      throw new IllegalArgumentException("runTime cannot be negative");
    }
  }
}
