package com.mk.fx.qa.device.load.resource;

import com.mk.fx.qa.device.load.store.MetricQuery;
import com.mk.fx.qa.device.load.store.MetricRecord;
import com.mk.fx.qa.device.load.store.MetricStore;
import com.mk.fx.qa.device.load.store.RunSummary;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import java.time.Instant;
import java.util.List;
import lombok.RequiredArgsConstructor;
import org.springframework.format.annotation.DateTimeFormat;
import org.springframework.http.ResponseEntity;
import org.springframework.validation.annotation.Validated;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

@Tag(name = "Metrics", description = "Read back recorded device executions")
@RestController
@RequestMapping("/api/metrics")
@Validated
@RequiredArgsConstructor
public class MetricsController {

  private final MetricStore metricStore;
  private final ApiResponseFactory responseFactory;

  @Operation(
      summary = "Metric records",
      description = "Records ordered by time; from is inclusive and to exclusive.")
  @GetMapping
  public ResponseEntity<List<MetricRecord>> records(
      @RequestParam(required = false) String runId,
      @RequestParam(required = false) String scenario,
      @RequestParam(required = false) String deviceId,
      @RequestParam(required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE_TIME)
          Instant from,
      @RequestParam(required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE_TIME)
          Instant to,
      @RequestParam(defaultValue = "1000") @Min(1) @Max(100_000) int limit) {
    var query =
        MetricQuery.builder()
            .runId(runId)
            .scenarioName(scenario)
            .deviceId(deviceId)
            .from(from)
            .to(to)
            .limit(limit)
            .build();
    try (var records = metricStore.query(query)) {
      return responseFactory.ok(records.toList());
    }
  }

  @Operation(
      summary = "Run summaries",
      description = "Requests, distinct devices, average latency and success rate per run.")
  @GetMapping("/summary")
  public ResponseEntity<List<RunSummary>> summary(
      @RequestParam(required = false) String runId,
      @RequestParam(required = false) String scenario) {
    var query = MetricQuery.builder().runId(runId).scenarioName(scenario).build();
    return responseFactory.ok(metricStore.summarize(query));
  }
}
