package com.mk.fx.qa.device.load.dto.scenario;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import java.util.List;
import java.util.Map;
import lombok.Data;

/**
 * Scenario as declared in the scenarios file.
 *
 * <p>{@code device} holds the base requirements; its {@code ID} is the prefix of random
 * identities. A pooled scenario either lists its devices under {@code pool} or asks for
 * {@code poolSize} devices named after {@code poolIdPattern}.
 */
@Data
@JsonIgnoreProperties(ignoreUnknown = true)
public class ScenarioConfig {

  @JsonProperty("name")
  private String name;

  @JsonProperty("identityMode")
  private String identityMode;

  @JsonProperty("device")
  private Map<String, Object> device;

  @JsonProperty("pool")
  private List<Map<String, Object>> pool;

  @JsonProperty("poolSize")
  private Integer poolSize;

  @JsonProperty("poolIdPattern")
  private String poolIdPattern;

  @JsonProperty("tasks")
  private List<TaskConfig> tasks;

  @JsonProperty("thinkTime")
  private ThinkTimeConfig thinkTime;

  @JsonProperty("initialDelayMaxMs")
  private Long initialDelayMaxMs;
}
