package com.mk.fx.qa.device.load.service;

import static com.mk.fx.qa.device.load.utils.LoadUtils.parseDuration;

import com.mk.fx.qa.device.load.cfg.DeviceLoadCfg;
import com.mk.fx.qa.device.load.coordinator.RunContext;
import com.mk.fx.qa.device.load.coordinator.RunCoordinator;
import com.mk.fx.qa.device.load.coordinator.RunState;
import com.mk.fx.qa.device.load.dto.api.RunRequest;
import com.mk.fx.qa.device.load.dto.api.RunStatusResponse;
import com.mk.fx.qa.device.load.executors.DeviceLoadExecutor;
import com.mk.fx.qa.device.load.executors.DeviceLoadParameters;
import com.mk.fx.qa.device.load.executors.DeviceLoadRun;
import com.mk.fx.qa.device.load.scenario.ScenarioCatalog;
import jakarta.annotation.PreDestroy;
import java.time.Duration;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicReference;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/**
 * Entry point for starting, stopping and inspecting runs. One run at a time; the coordinator
 * rejects a second start while a run is active.
 */
@Slf4j
@Service
public class DeviceRunService {

  private final ScenarioCatalog catalog;
  private final DeviceLoadExecutor executor;
  private final RunCoordinator coordinator;
  private final DeviceLoadCfg cfg;
  private final AtomicReference<DeviceLoadRun> activeRun = new AtomicReference<>();

  public DeviceRunService(
      ScenarioCatalog catalog,
      DeviceLoadExecutor executor,
      RunCoordinator coordinator,
      DeviceLoadCfg cfg) {
    this.catalog = catalog;
    this.executor = executor;
    this.coordinator = coordinator;
    this.cfg = cfg;
  }

  /**
   * Validates and starts a run in the background.
   *
   * @throws IllegalArgumentException for an unknown scenario or a malformed run time
   * @throws com.mk.fx.qa.device.load.identity.ConfigurationException if the scenario cannot serve
   *     the requested users
   * @throws IllegalStateException if a run is already active
   */
  public RunContext startRun(RunRequest request) {
    var scenario = catalog.get(request.getScenario());
    var spawnRate =
        request.getSpawnRate() != null
            ? request.getSpawnRate()
            : cfg.getEngine().getDefaultSpawnRate();
    var runTime = request.getRunTime() != null ? parseDuration(request.getRunTime()) : Duration.ZERO;
    var parameters = new DeviceLoadParameters(request.getUsers(), spawnRate, runTime);

    var run = executor.start(scenario, parameters);
    activeRun.set(run);
    run.result()
        .whenComplete(
            (result, error) -> {
              activeRun.compareAndSet(run, null);
              if (error != null) {
                log.error("Run {} ended with error: {}", run.context().runId(), error.getMessage());
              }
            });
    log.info(
        "Run {} accepted: scenario={} users={} spawnRate={} runTime={}",
        run.context().runId(),
        scenario.name(),
        parameters.users(),
        spawnRate,
        runTime);
    return run.context();
  }

  /**
   * Requests the active run to stop.
   *
   * @return the context of the stopped run, empty if no run was active
   */
  public Optional<RunContext> stopRun() {
    var run = activeRun.get();
    if (run != null) {
      log.info("Stop requested for run {}", run.context().runId());
      run.stop();
      return Optional.of(run.context());
    }
    if (coordinator.getState() == RunState.DRAINING) {
      // a previous run left workers behind after its join timeout; finish it once they are gone
      var outcome = coordinator.completeRun();
      return Optional.ofNullable(outcome.context());
    }
    return Optional.empty();
  }

  public RunStatusResponse status() {
    return new RunStatusResponse(
        coordinator.getState(),
        coordinator.currentRun().orElse(null),
        coordinator.getLiveWorkers(),
        coordinator.getRecordedCount(),
        coordinator.getDroppedCount(),
        coordinator.lastOutcome().orElse(null));
  }

  public Set<String> scenarioNames() {
    return catalog.names();
  }

  @PreDestroy
  void onShutdown() {
    var run = activeRun.get();
    if (run == null) {
      return;
    }
    log.info("Shutting down, stopping run {}", run.context().runId());
    run.stop();
    try {
      run.await(cfg.getEngine().getJoinTimeout().multipliedBy(2));
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      log.warn("Interrupted while waiting for run {} to stop", run.context().runId());
    } catch (ExecutionException | TimeoutException e) {
      log.warn("Run {} did not stop cleanly: {}", run.context().runId(), e.getMessage());
    }
  }
}
