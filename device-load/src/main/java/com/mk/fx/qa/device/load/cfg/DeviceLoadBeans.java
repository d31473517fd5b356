package com.mk.fx.qa.device.load.cfg;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.mk.fx.qa.device.load.coordinator.RunCoordinator;
import com.mk.fx.qa.device.load.executors.DeviceLoadExecutor;
import com.mk.fx.qa.device.load.identity.IdentityAllocator;
import com.mk.fx.qa.device.load.scenario.ScenarioCatalog;
import com.mk.fx.qa.device.load.store.MetricStore;
import com.mk.fx.qa.device.load.store.SqliteMetricStore;
import com.mk.fx.qa.device.offload.HttpOffloadClient;
import com.mk.fx.qa.device.offload.OffloadClient;
import java.io.IOException;
import java.nio.file.Path;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.core.io.ResourceLoader;

/** Wires the allocator, store, coordinator and engine from {@link DeviceLoadCfg}. */
@Slf4j
@Configuration
public class DeviceLoadBeans {

  @Bean(destroyMethod = "close")
  public MetricStore metricStore(DeviceLoadCfg cfg, ObjectMapper objectMapper) {
    var store = cfg.getStore();
    return SqliteMetricStore.open(
        Path.of(store.getPath()), objectMapper, store.getWriteLockTimeout(), store.getWriteRetries());
  }

  @Bean
  public IdentityAllocator identityAllocator() {
    return new IdentityAllocator();
  }

  @Bean
  public RunCoordinator runCoordinator(IdentityAllocator allocator, MetricStore metricStore) {
    return new RunCoordinator(allocator, metricStore);
  }

  @Bean
  public OffloadClient offloadClient(DeviceLoadCfg cfg) {
    var offload = cfg.getOffload();
    return new HttpOffloadClient(
        offload.getBaseUrl(),
        offload.getConnectionTimeoutSeconds(),
        offload.getRequestTimeoutSeconds(),
        offload.getHeaders());
  }

  @Bean
  public DeviceLoadExecutor deviceLoadExecutor(
      RunCoordinator coordinator, OffloadClient offloadClient, DeviceLoadCfg cfg) {
    return new DeviceLoadExecutor(coordinator, offloadClient, cfg.getEngine().getJoinTimeout());
  }

  @Bean
  public ScenarioCatalog scenarioCatalog(
      DeviceLoadCfg cfg, ResourceLoader resourceLoader, ObjectMapper objectMapper)
      throws IOException {
    var resource = resourceLoader.getResource(cfg.getScenariosLocation());
    log.info("Loading scenarios from {}", resource.getDescription());
    try (var in = resource.getInputStream()) {
      return ScenarioCatalog.load(in, objectMapper);
    }
  }
}
