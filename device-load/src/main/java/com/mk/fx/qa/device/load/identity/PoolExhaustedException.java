package com.mk.fx.qa.device.load.identity;

/** Every pooled identity is already checked out for the current run. */
public class PoolExhaustedException extends RuntimeException {

  public PoolExhaustedException(int poolSize) {
    super("All " + poolSize + " pooled device identities are checked out");
  }
}
