package com.mk.fx.qa.device.load;

import static org.assertj.core.api.Assertions.assertThat;

import com.mk.fx.qa.device.load.coordinator.RunCoordinator;
import com.mk.fx.qa.device.load.coordinator.RunState;
import com.mk.fx.qa.device.load.scenario.ScenarioCatalog;
import com.mk.fx.qa.device.load.store.MetricQuery;
import com.mk.fx.qa.device.load.store.MetricStore;
import java.nio.file.Path;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.test.context.DynamicPropertyRegistry;
import org.springframework.test.context.DynamicPropertySource;

@SpringBootTest(webEnvironment = SpringBootTest.WebEnvironment.MOCK)
class DeviceLoadApplicationTest {

  @TempDir static Path tempDir;

  @DynamicPropertySource
  static void storeProperties(DynamicPropertyRegistry registry) {
    registry.add("device.load.store.path", () -> tempDir.resolve("metrics.db").toString());
  }

  @Autowired ScenarioCatalog catalog;
  @Autowired RunCoordinator coordinator;
  @Autowired MetricStore metricStore;

  @Test
  void contextLoads_withBundledScenariosAndEmptyStore() {
    assertThat(catalog.names()).contains("light-load", "heavy-load", "device-pool");
    assertThat(coordinator.getState()).isEqualTo(RunState.IDLE);
    assertThat(metricStore.count(MetricQuery.all())).isZero();
  }
}
