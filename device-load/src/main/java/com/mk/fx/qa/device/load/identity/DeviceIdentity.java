package com.mk.fx.qa.device.load.identity;

import java.util.Objects;

/**
 * Token identifying one simulated device for the duration of a run. Pooled identities are also
 * stable across runs, which is what makes per-device history comparable.
 *
 * @param value the identifier sent to the offload platform as the device {@code ID}
 */
public record DeviceIdentity(String value) {

  public DeviceIdentity {
    Objects.requireNonNull(value, "value");
    if (value.isBlank()) {
      throw new IllegalArgumentException("Device identity must not be blank");
    }
  }

  @Override
  public String toString() {
    return value;
  }
}
