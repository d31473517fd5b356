package com.mk.fx.qa.device.load.identity;

import lombok.Getter;

/** Pool-mode run requested with a worker count different from the configured pool size. */
@Getter
public class WorkerCountMismatchException extends ConfigurationException {

  private final int poolSize;
  private final int expectedWorkerCount;

  public WorkerCountMismatchException(int poolSize, int expectedWorkerCount) {
    super(
        "Device pool size is "
            + poolSize
            + " but "
            + expectedWorkerCount
            + " workers were requested; the number of users must exactly match the pool size");
    this.poolSize = poolSize;
    this.expectedWorkerCount = expectedWorkerCount;
  }
}
