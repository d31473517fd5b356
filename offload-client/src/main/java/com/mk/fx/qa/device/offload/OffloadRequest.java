package com.mk.fx.qa.device.offload;

import java.time.Duration;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Workload descriptor sent to the offload platform.
 *
 * @param function name of the workload function to execute remotely
 * @param parameters arguments for the function
 * @param timeout optional per-call timeout, {@code null} to use the client default
 */
public record OffloadRequest(String function, Map<String, Object> parameters, Duration timeout) {

    public OffloadRequest {
        Objects.requireNonNull(function, "function");
        parameters =
                parameters == null || parameters.isEmpty()
                        ? Map.of()
                        : Collections.unmodifiableMap(new LinkedHashMap<>(parameters));
    }

    public static OffloadRequest of(String function, Map<String, Object> parameters) {
        return new OffloadRequest(function, parameters, null);
    }
}
