package com.mk.fx.qa.device.load.identity;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * A device identity together with the hardware requirements it announces to the offload platform
 * (flavour, providers, geolocation, ...). The requirements always carry {@link #ID_KEY} equal to
 * the identity value.
 */
public record DeviceProfile(DeviceIdentity identity, Map<String, Object> requirements) {

  public static final String ID_KEY = "ID";

  public DeviceProfile {
    Objects.requireNonNull(identity, "identity");
    var copy = new LinkedHashMap<String, Object>(requirements != null ? requirements : Map.of());
    copy.put(ID_KEY, identity.value());
    requirements = Collections.unmodifiableMap(copy);
  }

  /** Builds a profile whose identity is taken from the {@code ID} entry of the requirements. */
  public static DeviceProfile fromRequirements(Map<String, Object> requirements) {
    Objects.requireNonNull(requirements, "requirements");
    Object id = requirements.get(ID_KEY);
    if (id == null) {
      throw new IllegalArgumentException("Device requirements must define " + ID_KEY);
    }
    return new DeviceProfile(new DeviceIdentity(id.toString()), requirements);
  }

  /** Returns a copy of these requirements re-keyed to another identity. */
  public DeviceProfile withIdentity(DeviceIdentity other) {
    return new DeviceProfile(other, requirements);
  }

  public String id() {
    return identity.value();
  }
}
