package com.mk.fx.qa.device.load.dto.api;

import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.PositiveOrZero;
import lombok.Data;

/**
 * Request to start a run. {@code runTime} accepts values such as {@code 90s}, {@code 5m} or plain
 * seconds; omitted, the run lasts until stopped.
 */
@Data
public class RunRequest {

  @NotBlank
  @JsonProperty("scenario")
  private String scenario;

  @Min(1)
  @JsonProperty("users")
  private int users = 1;

  @PositiveOrZero
  @JsonProperty("spawnRate")
  private Double spawnRate;

  @JsonProperty("runTime")
  private String runTime;
}
