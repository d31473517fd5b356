package com.mk.fx.qa.device.load.identity;

import java.util.Arrays;

/** How devices obtain their identity for a run. */
public enum IdentityMode {
  /** Base id plus a random suffix; any number of workers. */
  RANDOM,
  /** Checked out from a fixed pool; worker count must equal pool size. */
  POOL;

  public static IdentityMode fromValue(String value) {
    return Arrays.stream(values())
        .filter(mode -> mode.name().equalsIgnoreCase(value))
        .findFirst()
        .orElseThrow(() -> new IllegalArgumentException("Unsupported identity mode: " + value));
  }
}
