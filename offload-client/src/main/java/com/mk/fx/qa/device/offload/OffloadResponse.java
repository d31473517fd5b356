package com.mk.fx.qa.device.offload;

import java.time.Duration;
import java.util.Objects;
import java.util.Optional;

/**
 * Outcome of a single offload call.
 *
 * @param latency time spent waiting for the platform
 * @param status whether the workload executed successfully
 * @param errorMessage failure description, {@code null} on success
 * @param result raw result returned by the workload, may be {@code null}
 */
public record OffloadResponse(
        Duration latency, OffloadStatus status, String errorMessage, String result) {

    public OffloadResponse {
        Objects.requireNonNull(latency, "latency");
        Objects.requireNonNull(status, "status");
    }

    public static OffloadResponse success(Duration latency, String result) {
        return new OffloadResponse(latency, OffloadStatus.SUCCESS, null, result);
    }

    public static OffloadResponse failure(Duration latency, String errorMessage) {
        return new OffloadResponse(latency, OffloadStatus.FAILURE, errorMessage, null);
    }

    public boolean isSuccess() {
        return status == OffloadStatus.SUCCESS;
    }

    /** Numeric value of the result when the workload returned a plain number. */
    public Optional<Double> numericResult() {
        if (result == null || result.isBlank()) {
            return Optional.empty();
        }
        try {
            return Optional.of(Double.parseDouble(result.trim()));
        } catch (NumberFormatException ignored) {
            return Optional.empty();
        }
    }
}
