package com.mk.fx.qa.device.load.scenario;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.mk.fx.qa.device.load.cfg.ObjectMapperConfig;
import com.mk.fx.qa.device.load.identity.IdentityMode;
import java.io.ByteArrayInputStream;
import java.nio.charset.StandardCharsets;
import java.util.Map;
import java.util.stream.IntStream;
import org.junit.jupiter.api.Test;

class ScenarioCatalogTest {

  private final ObjectMapper mapper = new ObjectMapperConfig().objectMapper();

  private ScenarioCatalog load(String json) throws Exception {
    return ScenarioCatalog.load(
        new ByteArrayInputStream(json.getBytes(StandardCharsets.UTF_8)), mapper);
  }

  @Test
  void bundledScenarios_loadWithSeededPools() throws Exception {
    ScenarioCatalog catalog;
    try (var in = getClass().getResourceAsStream("/scenarios.json")) {
      catalog = ScenarioCatalog.load(in, mapper);
    }

    assertThat(catalog.names())
        .containsExactly(
            "light-load", "concurrent-stress", "heavy-load", "device-pool", "energy-pool");
    var concurrent = catalog.get("concurrent-stress");
    assertThat(concurrent.baseDevice().id()).isEqualTo("device-ICE");
    assertThat(concurrent.tasks()).extracting(ScenarioTask::name).containsExactly("stress");
    assertThat(catalog.get("heavy-load").identityMode()).isEqualTo(IdentityMode.RANDOM);

    var devicePool = catalog.get("device-pool");
    assertThat(devicePool.identityMode()).isEqualTo(IdentityMode.POOL);
    assertThat(devicePool.pool().size()).isEqualTo(10);
    var first = devicePool.pool().profiles().get(0);
    var second = devicePool.pool().profiles().get(1);
    assertThat(first.id()).isEqualTo("device-pool-01");
    assertThat(first.requirements()).containsEntry("FLAVOUR", "GlobalOptimizer");
    assertThat(second.requirements()).containsEntry("FLAVOUR", "HighPerformance");
    // pool entries inherit the base requirements they do not override
    assertThat(first.requirements()).containsKey("PROVIDERS");

    var energy = catalog.get("energy-pool");
    assertThat(energy.pool().profiles().get(9).id()).isEqualTo("cognit-test-innovation-010");
    assertThat(energy.initialDelayMax().toMillis()).isEqualTo(5000);
  }

  @Test
  void generatedPool_defaultsToBaseIdPattern() throws Exception {
    var catalog =
        load(
            """
            [{
              "name": "generated",
              "identityMode": "POOL",
              "device": {"ID": "edge", "FLAVOUR": "GlobalOptimizer"},
              "poolSize": 3,
              "tasks": [{"name": "stress", "parameters": {"duration": 1}, "weight": 2}],
            }]
            """);

    var scenario = catalog.get("generated");
    assertThat(scenario.pool().profiles())
        .extracting(profile -> profile.id())
        .containsExactly("edge-001", "edge-002", "edge-003");
    assertThat(scenario.tasks().get(0).weight()).isEqualTo(2);
    assertThat(scenario.tasks().get(0).parameters()).isEqualTo(Map.of("duration", 1));
  }

  @Test
  void pooledScenarioWithoutPool_rejected() {
    assertThatThrownBy(
            () ->
                load(
                    """
                    [{"name": "broken", "identityMode": "pool", "device": {"ID": "x"},
                      "tasks": [{"name": "t"}]}]
                    """))
        .isInstanceOf(IllegalArgumentException.class)
        .hasMessageContaining("broken");
  }

  @Test
  void duplicateScenarioNames_rejected() {
    assertThatThrownBy(
            () ->
                load(
                    """
                    [{"name": "a", "device": {"ID": "x"}, "tasks": [{"name": "t"}]},
                     {"name": "a", "device": {"ID": "y"}, "tasks": [{"name": "t"}]}]
                    """))
        .isInstanceOf(IllegalStateException.class);
  }

  @Test
  void get_unknownScenario_listsAvailableOnes() throws Exception {
    var catalog = load("[{\"name\": \"a\", \"device\": {\"ID\": \"x\"}, \"tasks\": [{\"name\": \"t\"}]}]");

    assertThat(catalog.find("b")).isEmpty();
    assertThatThrownBy(() -> catalog.get("b"))
        .isInstanceOf(IllegalArgumentException.class)
        .hasMessageContaining("a");
  }

  @Test
  void pickTask_respectsWeights() throws Exception {
    var catalog =
        load(
            """
            [{"name": "weighted", "device": {"ID": "x"},
              "tasks": [{"name": "rare", "weight": 1}, {"name": "common", "weight": 99}]}]
            """);
    var scenario = catalog.get("weighted");

    long common =
        IntStream.range(0, 1000)
            .mapToObj(i -> scenario.pickTask().name())
            .filter("common"::equals)
            .count();
    assertThat(common).isGreaterThan(900);
  }

  @Test
  void names_keepDeclarationOrder() throws Exception {
    var catalog =
        load(
            """
            [{"name": "zulu", "device": {"ID": "z"}, "tasks": [{"name": "t"}]},
             {"name": "alpha", "device": {"ID": "a"}, "tasks": [{"name": "t"}]},
             {"name": "mike", "device": {"ID": "m"}, "tasks": [{"name": "t"}]}]
            """);

    assertThat(catalog.names()).containsExactly("zulu", "alpha", "mike");
  }

  @Test
  void nullTaskParameter_isKept() throws Exception {
    var catalog =
        load(
            """
            [{"name": "nullable", "device": {"ID": "x"},
              "tasks": [{"name": "stress", "parameters": {"duration": 1, "seed": null}}]}]
            """);

    var task = catalog.get("nullable").tasks().get(0);
    assertThat(task.parameters()).containsEntry("seed", null).containsEntry("duration", 1);
    assertThat(task.toRequest().parameters()).containsKey("seed");
  }
}
