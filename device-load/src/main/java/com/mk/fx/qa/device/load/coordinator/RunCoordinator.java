package com.mk.fx.qa.device.load.coordinator;

import com.mk.fx.qa.device.load.identity.DeviceProfile;
import com.mk.fx.qa.device.load.identity.IdentityAllocator;
import com.mk.fx.qa.device.load.scenario.ScenarioDefinition;
import com.mk.fx.qa.device.load.store.MetricRecord;
import com.mk.fx.qa.device.load.store.MetricStore;
import com.mk.fx.qa.device.load.store.StoreWriteException;
import java.time.Instant;
import java.util.Objects;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.atomic.AtomicReference;
import lombok.extern.slf4j.Slf4j;

/**
 * Ties one run's lifecycle to the identity allocator and the metric store.
 *
 * <p>State flows IDLE, VALIDATING, RUNNING, DRAINING and back to IDLE. A run only reaches RUNNING
 * once the allocator accepted the worker count, so no worker ever starts for a misconfigured run.
 * Worker callbacks ({@link #onWorkerStart}, {@link #onTaskCompleted}, {@link #onWorkerStop}) are
 * called concurrently from device threads. A failed metric write never reaches the worker; it is
 * logged and counted as dropped. A run left with live workers after its driver gave up on them
 * returns to IDLE when the last of them stops.
 */
@Slf4j
public class RunCoordinator {

  private final IdentityAllocator allocator;
  private final MetricStore store;

  private final AtomicReference<RunState> state = new AtomicReference<>(RunState.IDLE);
  private final AtomicInteger liveWorkers = new AtomicInteger();
  private final AtomicLong recorded = new AtomicLong();
  private final AtomicLong dropped = new AtomicLong();
  private final AtomicBoolean completeOnLastStop = new AtomicBoolean();

  private volatile RunContext context;
  private volatile RunOutcome lastOutcome;

  public RunCoordinator(IdentityAllocator allocator, MetricStore store) {
    this.allocator = Objects.requireNonNull(allocator, "allocator");
    this.store = Objects.requireNonNull(store, "store");
  }

  /**
   * Configures identities for the scenario and opens a new run.
   *
   * @return the context of the new run
   * @throws IllegalStateException if another run is active
   * @throws com.mk.fx.qa.device.load.identity.ConfigurationException if the scenario cannot serve
   *     the requested number of workers
   */
  public RunContext startRun(ScenarioDefinition scenario, int expectedWorkerCount) {
    Objects.requireNonNull(scenario, "scenario");
    if (!state.compareAndSet(RunState.IDLE, RunState.VALIDATING)) {
      throw new IllegalStateException("A run is already active (state " + state.get() + ")");
    }
    try {
      if (expectedWorkerCount < 1) {
        throw new IllegalArgumentException("At least one worker is required");
      }
      allocator.configure(scenario.identityMode(), scenario.baseDevice(), scenario.pool());
      allocator.validate(expectedWorkerCount);
    } catch (RuntimeException e) {
      state.set(RunState.IDLE);
      log.warn("Run for scenario {} rejected: {}", scenario.name(), e.getMessage());
      throw e;
    }

    liveWorkers.set(0);
    completeOnLastStop.set(false);
    recorded.set(0);
    dropped.set(0);
    var newContext =
        new RunContext(
            UUID.randomUUID().toString(), scenario.name(), expectedWorkerCount, Instant.now());
    context = newContext;
    state.set(RunState.RUNNING);
    log.info(
        "Run {} started for scenario {} with {} workers",
        newContext.runId(),
        newContext.scenarioName(),
        expectedWorkerCount);
    return newContext;
  }

  /**
   * Registers a starting worker and allocates its device profile.
   *
   * @throws IllegalStateException if the run is not accepting workers
   * @throws com.mk.fx.qa.device.load.identity.PoolExhaustedException if no pooled identity is left
   */
  public DeviceProfile onWorkerStart() {
    if (state.get() != RunState.RUNNING) {
      throw new IllegalStateException("Workers cannot start in state " + state.get());
    }
    liveWorkers.incrementAndGet();
    try {
      var profile = allocator.nextIdentity();
      log.debug("Worker started as device {}", profile.id());
      return profile;
    } catch (RuntimeException e) {
      liveWorkers.decrementAndGet();
      throw e;
    }
  }

  /** Persists the outcome of one task. Store failures are logged and counted, never rethrown. */
  public void onTaskCompleted(DeviceProfile device, TaskOutcome outcome) {
    Objects.requireNonNull(device, "device");
    Objects.requireNonNull(outcome, "outcome");
    var current = context;
    if (current == null) {
      log.warn("Task {} of device {} completed outside a run, ignoring", outcome.taskName(), device.id());
      return;
    }

    var record =
        MetricRecord.builder()
            .runId(current.runId())
            .timestamp(outcome.completedAt())
            .scenarioName(current.scenarioName())
            .deviceId(device.id())
            .deviceRequirements(device.requirements())
            .taskName(outcome.taskName())
            .taskParameters(outcome.parameters())
            .latency(outcome.latency())
            .status(outcome.status())
            .errorMessage(outcome.errorMessage())
            .metricValue(outcome.metricValue())
            .build();
    try {
      store.record(record);
      recorded.incrementAndGet();
    } catch (StoreWriteException e) {
      var total = dropped.incrementAndGet();
      log.warn(
          "Run {} dropped metric of device {} task {} ({} dropped so far): {}",
          current.runId(),
          device.id(),
          outcome.taskName(),
          total,
          e.getMessage());
    }
  }

  /** Unregisters a worker. The last one to stop finishes a run whose completion was deferred. */
  public void onWorkerStop(DeviceProfile device) {
    var remaining = liveWorkers.decrementAndGet();
    log.debug("Worker {} stopped, {} still live", device != null ? device.id() : "-", remaining);
    if (remaining == 0 && completeOnLastStop.get()) {
      completeDeferredRun();
    }
  }

  /** Moves a running run to DRAINING. Returns false if there was nothing to stop. */
  public boolean requestStop() {
    var stopped = state.compareAndSet(RunState.RUNNING, RunState.DRAINING);
    if (stopped) {
      log.info("Run {} draining", context != null ? context.runId() : "-");
    }
    return stopped;
  }

  public boolean isStopRequested() {
    return state.get() != RunState.RUNNING;
  }

  /**
   * Finishes a drained run: identities are released and the coordinator returns to IDLE.
   *
   * @throws IllegalStateException unless the run is draining with no live worker left
   */
  public synchronized RunOutcome completeRun() {
    if (state.get() != RunState.DRAINING) {
      throw new IllegalStateException("Run cannot complete in state " + state.get());
    }
    var live = liveWorkers.get();
    if (live != 0) {
      throw new IllegalStateException("Run cannot complete while " + live + " workers are live");
    }

    completeOnLastStop.set(false);
    allocator.reset();
    var outcome = new RunOutcome(context, recorded.get(), dropped.get(), Instant.now());
    lastOutcome = outcome;
    context = null;
    state.set(RunState.IDLE);

    if (outcome.degraded()) {
      log.warn(
          "Run {} completed degraded: {} records persisted, {} dropped",
          outcome.context().runId(),
          outcome.recordedCount(),
          outcome.droppedCount());
    } else {
      log.info(
          "Run {} completed: {} records persisted",
          outcome.context().runId(),
          outcome.recordedCount());
    }
    return outcome;
  }

  /**
   * Finishes a draining run now if no worker is live, otherwise as soon as the last live worker
   * calls {@link #onWorkerStop}.
   *
   * @return the outcome, empty while completion is deferred
   * @throws IllegalStateException unless the run is draining
   */
  public synchronized Optional<RunOutcome> completeWhenDrained() {
    if (state.get() != RunState.DRAINING) {
      throw new IllegalStateException("Run cannot complete in state " + state.get());
    }
    // set before reading the count so a worker stopping in between still sees the flag
    completeOnLastStop.set(true);
    var live = liveWorkers.get();
    if (live == 0) {
      return Optional.of(completeRun());
    }
    log.warn(
        "Run {} still has {} live workers, completing once they stop",
        context != null ? context.runId() : "-",
        live);
    return Optional.empty();
  }

  private synchronized void completeDeferredRun() {
    if (completeOnLastStop.get()
        && state.get() == RunState.DRAINING
        && liveWorkers.get() == 0) {
      completeRun();
    }
  }

  public Optional<RunContext> currentRun() {
    return Optional.ofNullable(context);
  }

  public Optional<RunOutcome> lastOutcome() {
    return Optional.ofNullable(lastOutcome);
  }

  public RunState getState() {
    return state.get();
  }

  public int getLiveWorkers() {
    return liveWorkers.get();
  }

  public long getRecordedCount() {
    return recorded.get();
  }

  public long getDroppedCount() {
    return dropped.get();
  }
}
