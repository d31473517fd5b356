package com.mk.fx.qa.device.load.scenario;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.mk.fx.qa.device.load.dto.scenario.ScenarioConfig;
import com.mk.fx.qa.device.load.dto.scenario.TaskConfig;
import com.mk.fx.qa.device.load.identity.DeviceIdentity;
import com.mk.fx.qa.device.load.identity.DeviceProfile;
import com.mk.fx.qa.device.load.identity.IdentityMode;
import com.mk.fx.qa.device.load.identity.IdentityPool;
import java.io.IOException;
import java.io.InputStream;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import lombok.extern.slf4j.Slf4j;

/**
 * Scenarios available to runs, built once at startup. Pools of pooled scenarios are seeded here
 * and live for the whole process so their identities are reused run after run.
 */
@Slf4j
public class ScenarioCatalog {

  private static final TypeReference<List<ScenarioConfig>> CONFIG_LIST = new TypeReference<>() {};

  private final Map<String, ScenarioDefinition> scenarios;

  public ScenarioCatalog(Collection<ScenarioDefinition> definitions) {
    Map<String, ScenarioDefinition> map = new LinkedHashMap<>();
    for (ScenarioDefinition definition : definitions) {
      var existing = map.putIfAbsent(definition.name(), definition);
      if (existing != null) {
        throw new IllegalStateException("Scenario " + definition.name() + " is defined twice");
      }
    }
    this.scenarios = Collections.unmodifiableMap(map);
    log.info("Scenario catalog loaded: {}", map.keySet());
  }

  /** Reads a JSON array of {@link ScenarioConfig} and builds the catalog. */
  public static ScenarioCatalog load(InputStream json, ObjectMapper mapper) throws IOException {
    List<ScenarioConfig> configs = mapper.readValue(json, CONFIG_LIST);
    return new ScenarioCatalog(configs.stream().map(ScenarioCatalog::toDefinition).toList());
  }

  public Optional<ScenarioDefinition> find(String name) {
    return Optional.ofNullable(name).map(scenarios::get);
  }

  /**
   * @throws IllegalArgumentException if no scenario has that name
   */
  public ScenarioDefinition get(String name) {
    return find(name)
        .orElseThrow(
            () ->
                new IllegalArgumentException(
                    "Unknown scenario " + name + ". Available: " + scenarios.keySet()));
  }

  public Set<String> names() {
    return scenarios.keySet();
  }

  static ScenarioDefinition toDefinition(ScenarioConfig config) {
    Objects.requireNonNull(config.getName(), "Scenario name is required");
    if (config.getDevice() == null) {
      throw new IllegalArgumentException("Scenario " + config.getName() + " needs a device section");
    }
    var base = DeviceProfile.fromRequirements(config.getDevice());
    var mode =
        config.getIdentityMode() != null
            ? IdentityMode.fromValue(config.getIdentityMode())
            : IdentityMode.RANDOM;

    IdentityPool pool = null;
    if (mode == IdentityMode.POOL) {
      pool = IdentityPool.seeded(config.getName(), poolProfiles(config, base));
    }

    var tasks =
        Optional.ofNullable(config.getTasks()).orElse(List.of()).stream()
            .map(ScenarioCatalog::toTask)
            .toList();

    return new ScenarioDefinition(
        config.getName(),
        mode,
        base,
        pool,
        tasks,
        ThinkTimeStrategy.from(config.getThinkTime()),
        config.getInitialDelayMaxMs() != null
            ? Duration.ofMillis(config.getInitialDelayMaxMs())
            : Duration.ZERO);
  }

  private static List<DeviceProfile> poolProfiles(ScenarioConfig config, DeviceProfile base) {
    if (config.getPool() != null && !config.getPool().isEmpty()) {
      List<DeviceProfile> profiles = new ArrayList<>();
      for (Map<String, Object> entry : config.getPool()) {
        // pool entries override the base requirements field by field
        var merged = new LinkedHashMap<>(base.requirements());
        merged.putAll(entry);
        profiles.add(DeviceProfile.fromRequirements(merged));
      }
      return profiles;
    }
    var size = config.getPoolSize() != null ? config.getPoolSize() : 0;
    if (size < 1) {
      throw new IllegalArgumentException(
          "Pooled scenario " + config.getName() + " needs a pool or a poolSize");
    }
    var pattern =
        config.getPoolIdPattern() != null ? config.getPoolIdPattern() : base.id() + "-%03d";
    List<DeviceProfile> profiles = new ArrayList<>(size);
    for (int i = 1; i <= size; i++) {
      profiles.add(base.withIdentity(new DeviceIdentity(String.format(pattern, i))));
    }
    return profiles;
  }

  private static ScenarioTask toTask(TaskConfig task) {
    return new ScenarioTask(
        task.getName(),
        task.getParameters(),
        task.getWeight() != null ? task.getWeight() : 1,
        task.getTimeoutMs() != null ? Duration.ofMillis(task.getTimeoutMs()) : null);
  }
}
