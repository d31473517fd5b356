package com.mk.fx.qa.device.load.cfg;

import jakarta.validation.Valid;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.PositiveOrZero;
import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.Map;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;
import org.springframework.validation.annotation.Validated;

@Data
@Validated
@Configuration
@ConfigurationProperties(prefix = "device.load")
public class DeviceLoadCfg {

  /** Scenario catalog resource, any Spring resource location. */
  @NotBlank private String scenariosLocation = "classpath:scenarios.json";

  @Valid private Store store = new Store();
  @Valid private Offload offload = new Offload();
  @Valid private Engine engine = new Engine();

  @Data
  public static class Store {
    @NotBlank private String path = "results/metrics.db";

    @NotNull private Duration writeLockTimeout = Duration.ofSeconds(5);

    @Min(0)
    private int writeRetries = 3;
  }

  @Data
  public static class Offload {
    @NotBlank private String baseUrl = "http://localhost:1338";

    @Min(1)
    private int connectionTimeoutSeconds = 5;

    @Min(1)
    private int requestTimeoutSeconds = 30;

    private Map<String, String> headers = new LinkedHashMap<>();
  }

  @Data
  public static class Engine {
    @NotNull private Duration joinTimeout = Duration.ofSeconds(30);

    /** Devices started per second when a run request gives none; 0 starts all at once. */
    @PositiveOrZero private double defaultSpawnRate = 1.0;
  }
}
