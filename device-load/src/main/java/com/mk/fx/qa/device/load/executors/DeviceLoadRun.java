package com.mk.fx.qa.device.load.executors;

import com.mk.fx.qa.device.load.coordinator.RunContext;
import java.time.Duration;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicBoolean;

/** Handle on a run driven in the background by {@link DeviceLoadExecutor}. */
public final class DeviceLoadRun {

  private final RunContext context;
  private final AtomicBoolean stopRequested = new AtomicBoolean(false);
  private final CompletableFuture<DeviceLoadResult> result = new CompletableFuture<>();

  public DeviceLoadRun(RunContext context) {
    this.context = context;
  }

  public RunContext context() {
    return context;
  }

  /** Asks every device to stop after its current task. */
  public void stop() {
    stopRequested.set(true);
  }

  public boolean isStopRequested() {
    return stopRequested.get();
  }

  public CompletableFuture<DeviceLoadResult> result() {
    return result;
  }

  /** Blocks until the run has completed. */
  public DeviceLoadResult await(Duration timeout)
      throws InterruptedException, ExecutionException, TimeoutException {
    return result.get(timeout.toMillis(), TimeUnit.MILLISECONDS);
  }

  public void complete(DeviceLoadResult value) {
    result.complete(value);
  }

  public void fail(Throwable error) {
    result.completeExceptionally(error);
  }
}
