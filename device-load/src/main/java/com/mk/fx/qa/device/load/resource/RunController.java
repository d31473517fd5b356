package com.mk.fx.qa.device.load.resource;

import com.mk.fx.qa.device.load.coordinator.RunContext;
import com.mk.fx.qa.device.load.dto.api.RunRequest;
import com.mk.fx.qa.device.load.dto.api.RunStatusResponse;
import com.mk.fx.qa.device.load.service.DeviceRunService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import java.util.Set;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@Slf4j
@Tag(name = "Runs", description = "Start, stop and inspect simulated device runs")
@RestController
@RequestMapping("/api")
@RequiredArgsConstructor
public class RunController {

  private final DeviceRunService runService;
  private final ApiResponseFactory responseFactory;

  @Operation(
      summary = "Start a run",
      description =
          "Validates the scenario against the requested users and starts the devices in the"
              + " background.")
  @PostMapping("/runs")
  public ResponseEntity<RunContext> startRun(@Valid @RequestBody RunRequest request) {
    log.info(
        "Received run request scenario={} users={}", request.getScenario(), request.getUsers());
    return responseFactory.accepted(runService.startRun(request));
  }

  @Operation(summary = "Current run", description = "Coordinator state and run counters.")
  @GetMapping("/runs/current")
  public ResponseEntity<RunStatusResponse> currentRun() {
    return responseFactory.ok(runService.status());
  }

  @Operation(summary = "Stop the current run", description = "Devices stop after their task.")
  @DeleteMapping("/runs/current")
  public ResponseEntity<?> stopRun() {
    return runService
        .stopRun()
        .<ResponseEntity<?>>map(responseFactory::accepted)
        .orElseGet(
            () -> responseFactory.error(HttpStatus.NOT_FOUND, "Not Found", "No run is active"));
  }

  @Operation(summary = "Scenarios", description = "Names of the configured scenarios.")
  @GetMapping("/scenarios")
  public ResponseEntity<Set<String>> scenarios() {
    return responseFactory.ok(runService.scenarioNames());
  }
}
