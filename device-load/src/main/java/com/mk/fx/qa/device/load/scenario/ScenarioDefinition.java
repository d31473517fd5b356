package com.mk.fx.qa.device.load.scenario;

import com.mk.fx.qa.device.load.identity.DeviceProfile;
import com.mk.fx.qa.device.load.identity.IdentityMode;
import com.mk.fx.qa.device.load.identity.IdentityPool;
import java.time.Duration;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.ThreadLocalRandom;

/**
 * What every device of a run does: how it is identified, which workloads it offloads and how long
 * it waits in between.
 *
 * @param name scenario name recorded with every metric
 * @param identityMode random or pooled identities
 * @param baseDevice base requirements; its id prefixes random identities
 * @param pool seeded pool, {@code null} unless {@code identityMode} is POOL
 * @param tasks workloads, picked by weight
 * @param thinkTime wait after each task
 * @param initialDelayMax upper bound of a random delay before a device's first task
 */
public record ScenarioDefinition(
    String name,
    IdentityMode identityMode,
    DeviceProfile baseDevice,
    IdentityPool pool,
    List<ScenarioTask> tasks,
    ThinkTimeStrategy thinkTime,
    Duration initialDelayMax) {

  public ScenarioDefinition {
    Objects.requireNonNull(name, "name");
    Objects.requireNonNull(identityMode, "identityMode");
    Objects.requireNonNull(baseDevice, "baseDevice");
    if (identityMode == IdentityMode.POOL && pool == null) {
      throw new IllegalArgumentException("Scenario " + name + " uses pool mode without a pool");
    }
    if (tasks == null || tasks.isEmpty()) {
      throw new IllegalArgumentException("Scenario " + name + " defines no tasks");
    }
    tasks = List.copyOf(tasks);
    thinkTime = thinkTime != null ? thinkTime : ThinkTimeStrategy.none();
    initialDelayMax = initialDelayMax != null ? initialDelayMax : Duration.ZERO;
  }

  /** Picks a task with probability proportional to its weight. */
  public ScenarioTask pickTask() {
    if (tasks.size() == 1) {
      return tasks.get(0);
    }
    int total = tasks.stream().mapToInt(ScenarioTask::weight).sum();
    int roll = ThreadLocalRandom.current().nextInt(total);
    for (ScenarioTask task : tasks) {
      roll -= task.weight();
      if (roll < 0) {
        return task;
      }
    }
    return tasks.get(tasks.size() - 1);
  }

  /** Random stagger applied once before a device's first task. */
  public Duration nextInitialDelay() {
    return Duration.ofMillis(ThinkTimeStrategy.randomBetween(0, initialDelayMax.toMillis()));
  }
}
