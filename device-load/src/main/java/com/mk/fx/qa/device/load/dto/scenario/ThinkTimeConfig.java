package com.mk.fx.qa.device.load.dto.scenario;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Data;

/** Pause between two tasks of the same device, in milliseconds. */
@Data
@JsonIgnoreProperties(ignoreUnknown = true)
public class ThinkTimeConfig {

  @JsonProperty("minMs")
  private Long minMs;

  @JsonProperty("maxMs")
  private Long maxMs;

  @JsonProperty("fixedMs")
  private Long fixedMs;
}
