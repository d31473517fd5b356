package com.mk.fx.qa.device.load.coordinator;

/** Lifecycle of the single run a process executes at a time. */
public enum RunState {
  IDLE,
  VALIDATING,
  RUNNING,
  DRAINING
}
