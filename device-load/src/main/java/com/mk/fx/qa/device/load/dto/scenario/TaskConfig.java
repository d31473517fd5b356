package com.mk.fx.qa.device.load.dto.scenario;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import java.util.Map;
import lombok.Data;

/** A workload a device offloads, with its relative selection weight. */
@Data
@JsonIgnoreProperties(ignoreUnknown = true)
public class TaskConfig {

  @JsonProperty("name")
  private String name;

  @JsonProperty("parameters")
  private Map<String, Object> parameters;

  @JsonProperty("weight")
  private Integer weight;

  @JsonProperty("timeoutMs")
  private Long timeoutMs;
}
