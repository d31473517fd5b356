package com.mk.fx.qa.device.load.executors;

import static java.util.concurrent.Executors.newFixedThreadPool;

import com.google.common.util.concurrent.RateLimiter;
import com.mk.fx.qa.device.load.coordinator.RunContext;
import com.mk.fx.qa.device.load.coordinator.RunCoordinator;
import com.mk.fx.qa.device.load.coordinator.RunOutcome;
import com.mk.fx.qa.device.load.coordinator.TaskOutcome;
import com.mk.fx.qa.device.load.identity.DeviceProfile;
import com.mk.fx.qa.device.load.identity.PoolExhaustedException;
import com.mk.fx.qa.device.load.scenario.ScenarioDefinition;
import com.mk.fx.qa.device.load.scenario.ScenarioTask;
import com.mk.fx.qa.device.load.scenario.ThinkTimeStrategy;
import com.mk.fx.qa.device.offload.OffloadClient;
import com.mk.fx.qa.device.offload.OffloadException;
import com.mk.fx.qa.device.offload.OffloadSession;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.function.BooleanSupplier;
import lombok.extern.slf4j.Slf4j;

/**
 * Drives the devices of a run against the offload platform.
 *
 * <p>Every device runs on its own thread from a fixed pool sized to the number of users. Devices
 * are submitted at the configured spawn rate; each one takes an identity from the
 * {@link RunCoordinator}, opens an offload session with its requirements and then offloads
 * weighted tasks with think time in between until the run stops. Every finished task, successful
 * or not, produces exactly one metric record.
 *
 * <p>A run stops on {@link DeviceLoadRun#stop()}, when its run time elapses, or once every device
 * has ended. Devices are then joined for at most the join timeout, interrupted if still running,
 * and the run is completed on the coordinator. A task cut off by the interrupt leaves no record.
 * Devices that ignore the interrupt keep the run draining until the last of them stops.
 */
@Slf4j
public class DeviceLoadExecutor {

  /** Task name of the record written when a device cannot open its offload session. */
  public static final String RUNTIME_INIT_TASK = "device_runtime_init";

  private static final long POLL_MILLIS = 100L;

  private final RunCoordinator coordinator;
  private final OffloadClient offloadClient;
  private final Duration joinTimeout;

  public DeviceLoadExecutor(
      RunCoordinator coordinator, OffloadClient offloadClient, Duration joinTimeout) {
    this.coordinator = Objects.requireNonNull(coordinator, "coordinator");
    this.offloadClient = Objects.requireNonNull(offloadClient, "offloadClient");
    this.joinTimeout = joinTimeout != null ? joinTimeout : Duration.ofSeconds(30);
  }

  /**
   * Validates and starts a run, driving it on a background thread.
   *
   * @return handle to stop and await the run
   * @throws com.mk.fx.qa.device.load.identity.ConfigurationException if the scenario cannot serve
   *     the requested users; no device is started in that case
   * @throws IllegalStateException if another run is active
   */
  public DeviceLoadRun start(ScenarioDefinition scenario, DeviceLoadParameters parameters) {
    Objects.requireNonNull(parameters, "parameters");
    var context = coordinator.startRun(scenario, parameters.users());
    var run = new DeviceLoadRun(context);

    var driver =
        new Thread(
            () -> {
              try {
                run.complete(drive(run, scenario, parameters));
              } catch (InterruptedException interrupted) {
                Thread.currentThread().interrupt();
                run.fail(interrupted);
              } catch (RuntimeException ex) {
                log.error("Run {} failed: {}", context.runId(), ex.getMessage(), ex);
                run.fail(ex);
              }
            },
            "device-load-driver-" + context.runId());
    driver.setDaemon(true);
    driver.start();
    return run;
  }

  /**
   * Runs to completion on the calling thread.
   *
   * @throws InterruptedException if the calling thread is interrupted; the run is still completed
   */
  public DeviceLoadResult execute(ScenarioDefinition scenario, DeviceLoadParameters parameters)
      throws InterruptedException {
    Objects.requireNonNull(parameters, "parameters");
    var context = coordinator.startRun(scenario, parameters.users());
    return drive(new DeviceLoadRun(context), scenario, parameters);
  }

  private DeviceLoadResult drive(
      DeviceLoadRun run, ScenarioDefinition scenario, DeviceLoadParameters parameters)
      throws InterruptedException {
    var context = run.context();
    var users = parameters.users();
    var runTime = parameters.runTime();
    var deadline = runTime.isZero() ? Long.MAX_VALUE : System.nanoTime() + runTime.toNanos();
    var runTimeExpired = new AtomicBoolean(false);

    BooleanSupplier stop =
        () -> {
          if (System.nanoTime() >= deadline) {
            runTimeExpired.set(true);
            return true;
          }
          return run.isStopRequested() || coordinator.isStopRequested();
        };

    var executor = newFixedThreadPool(users, threadFactory(context));
    List<Future<?>> futures = new ArrayList<>();
    var spawnLimiter =
        parameters.spawnRate() > 0 ? RateLimiter.create(parameters.spawnRate()) : null;
    RunOutcome outcome;

    try {
      log.info(
          "Run {} spawning {} devices of scenario {} at {}/s",
          context.runId(),
          users,
          scenario.name(),
          parameters.spawnRate() > 0 ? parameters.spawnRate() : "all");
      for (int deviceIndex = 0; deviceIndex < users; deviceIndex++) {
        if (!awaitSpawnPermit(spawnLimiter, stop)) {
          log.info("Run {} stopping spawn at device {}", context.runId(), deviceIndex);
          break;
        }
        final var index = deviceIndex;
        futures.add(executor.submit(() -> runDevice(context, scenario, index, stop)));
      }

      waitForDevices(futures, stop);
    } finally {
      coordinator.requestStop();
      join(executor, context);
      outcome = coordinator.completeWhenDrained().orElse(null);
      if (outcome != null) {
        log.info(
            "Run {} finished: {} of {} devices started, {} records",
            context.runId(),
            futures.size(),
            users,
            outcome.recordedCount());
      } else {
        log.warn(
            "Run {} finished with {} devices still live; it completes when the last one stops",
            context.runId(),
            coordinator.getLiveWorkers());
      }
    }

    return new DeviceLoadResult(
        outcome,
        users,
        futures.size(),
        run.isStopRequested(),
        runTimeExpired.get());
  }

  /** Body of one device thread. */
  private void runDevice(
      RunContext context, ScenarioDefinition scenario, int deviceIndex, BooleanSupplier stop) {
    DeviceProfile device;
    try {
      device = coordinator.onWorkerStart();
    } catch (PoolExhaustedException ex) {
      log.error("Run {} device {} got no identity: {}", context.runId(), deviceIndex + 1, ex.getMessage());
      return;
    } catch (IllegalStateException ex) {
      log.info("Run {} device {} not started: {}", context.runId(), deviceIndex + 1, ex.getMessage());
      return;
    }

    int tasks = 0;
    try {
      var session = openSession(context, device);
      if (session == null) {
        return;
      }
      try (session) {
        ThinkTimeStrategy.sleep(scenario.nextInitialDelay(), stop);
        while (!stop.getAsBoolean() && !Thread.currentThread().isInterrupted()) {
          var task = scenario.pickTask();
          var outcome = executeTask(session, task);
          if (Thread.currentThread().isInterrupted()) {
            // cut off by the join: the task never finished, so there is nothing to record
            log.info(
                "Run {} device {} abandoned {} after {} tasks",
                context.runId(),
                device.id(),
                task.name(),
                tasks);
            break;
          }
          coordinator.onTaskCompleted(device, outcome);
          tasks++;
          scenario.thinkTime().pause(stop);
        }
      }
    } catch (InterruptedException interrupted) {
      Thread.currentThread().interrupt();
      log.info("Run {} device {} interrupted after {} tasks", context.runId(), device.id(), tasks);
    } finally {
      coordinator.onWorkerStop(device);
    }
    log.debug("Run {} device {} stopped after {} tasks", context.runId(), device.id(), tasks);
  }

  /** Opens the device's session, recording a failed initialisation. Returns null on failure. */
  private OffloadSession openSession(RunContext context, DeviceProfile device)
      throws InterruptedException {
    var startTime = System.nanoTime();
    try {
      return offloadClient.open(device.requirements());
    } catch (OffloadException | RuntimeException ex) {
      var latency = Duration.ofNanos(System.nanoTime() - startTime);
      log.warn(
          "Run {} device {} could not initialise its offload runtime: {}",
          context.runId(),
          device.id(),
          ex.getMessage());
      coordinator.onTaskCompleted(
          device, TaskOutcome.failure(RUNTIME_INIT_TASK, Map.of(), latency, describe(ex)));
      return null;
    }
  }

  private TaskOutcome executeTask(OffloadSession session, ScenarioTask task)
      throws InterruptedException {
    var startTime = System.nanoTime();
    try {
      var response = session.call(task.toRequest());
      return TaskOutcome.fromResponse(task.name(), task.parameters(), response);
    } catch (OffloadException ex) {
      return TaskOutcome.failure(
          task.name(), task.parameters(), Duration.ofNanos(System.nanoTime() - startTime), describe(ex));
    } catch (RuntimeException ex) {
      log.warn("Task {} failed unexpectedly: {}", task.name(), ex.getMessage(), ex);
      return TaskOutcome.failure(
          task.name(), task.parameters(), Duration.ofNanos(System.nanoTime() - startTime), describe(ex));
    }
  }

  /** Waits until every submitted device has ended or the run must stop. */
  private void waitForDevices(List<Future<?>> futures, BooleanSupplier stop)
      throws InterruptedException {
    while (!stop.getAsBoolean()) {
      if (futures.stream().allMatch(Future::isDone)) {
        return;
      }
      TimeUnit.MILLISECONDS.sleep(POLL_MILLIS);
    }
  }

  /** Bounded join: devices get the join timeout to finish their task, then are interrupted. */
  private void join(ExecutorService executor, RunContext context) throws InterruptedException {
    executor.shutdown();
    if (executor.awaitTermination(joinTimeout.toMillis(), TimeUnit.MILLISECONDS)) {
      return;
    }
    log.warn(
        "Run {} devices still busy after {} ms, interrupting", context.runId(), joinTimeout.toMillis());
    executor.shutdownNow();
    if (!executor.awaitTermination(joinTimeout.toMillis(), TimeUnit.MILLISECONDS)) {
      log.error("Run {} devices did not terminate after interruption", context.runId());
    }
  }

  private static ThreadFactory threadFactory(RunContext context) {
    return runnable -> {
      Thread thread = new Thread(runnable);
      thread.setName("device-" + context.scenarioName() + "-" + thread.getId());
      thread.setDaemon(true);
      return thread;
    };
  }

  /**
   * Waits for the spawn limiter to admit the next device. Returns false if the run must stop
   * instead.
   */
  private static boolean awaitSpawnPermit(RateLimiter limiter, BooleanSupplier stop)
      throws InterruptedException {
    if (limiter == null) {
      return !stop.getAsBoolean();
    }
    // tryAcquire gives up at once when the permit is further away than the timeout
    while (!limiter.tryAcquire(POLL_MILLIS, TimeUnit.MILLISECONDS)) {
      if (stop.getAsBoolean()) {
        return false;
      }
      TimeUnit.MILLISECONDS.sleep(POLL_MILLIS);
    }
    return !stop.getAsBoolean();
  }

  private static String describe(Exception ex) {
    var message = ex.getMessage();
    return message != null && !message.isBlank() ? message : ex.getClass().getSimpleName();
  }
}
