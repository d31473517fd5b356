package com.mk.fx.qa.device.load.store;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;

import java.nio.file.Path;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class SqliteMetricStoreTest {

  @TempDir Path tempDir;

  private SqliteMetricStore store;

  @BeforeEach
  void setUp() {
    store = SqliteMetricStore.open(tempDir.resolve("nested/metrics.db"));
  }

  @AfterEach
  void tearDown() {
    store.close();
  }

  private static MetricRecord.MetricRecordBuilder record(String runId, String deviceId) {
    return MetricRecord.builder()
        .runId(runId)
        .scenarioName("device-pool")
        .deviceId(deviceId)
        .deviceRequirements(Map.of("ID", deviceId, "FLAVOUR", "GlobalOptimizer"))
        .taskName("compute_metrics")
        .taskParameters(Map.of("duration", 2))
        .latency(Duration.ofMillis(120))
        .status(MetricStatus.SUCCESS);
  }

  @Test
  void record_thenQuery_returnsEveryField() {
    var timestamp = Instant.parse("2025-03-01T10:15:30.123Z");
    store.record(
        record("run-1", "device-pool-01")
            .timestamp(timestamp)
            .status(MetricStatus.FAILURE)
            .errorMessage("HTTP 500: node crashed")
            .metricValue(3.5)
            .build());

    List<MetricRecord> records;
    try (var stream = store.query(MetricQuery.all())) {
      records = stream.toList();
    }

    assertThat(records).hasSize(1);
    var stored = records.get(0);
    assertThat(stored.runId()).isEqualTo("run-1");
    assertThat(stored.timestamp()).isEqualTo(timestamp);
    assertThat(stored.deviceId()).isEqualTo("device-pool-01");
    assertThat(stored.deviceRequirements()).containsEntry("FLAVOUR", "GlobalOptimizer");
    assertThat(stored.taskParameters()).containsEntry("duration", 2);
    assertThat(stored.latency()).isEqualTo(Duration.ofMillis(120));
    assertThat(stored.status()).isEqualTo(MetricStatus.FAILURE);
    assertThat(stored.errorMessage()).isEqualTo("HTTP 500: node crashed");
    assertThat(stored.metricValue()).isEqualTo(3.5);
  }

  @Test
  void record_withoutMetricValue_readsBackNull() {
    store.record(record("run-1", "device-pool-01").build());

    try (var stream = store.query(MetricQuery.forRun("run-1"))) {
      assertThat(stream.toList()).singleElement().satisfies(r -> assertThat(r.metricValue()).isNull());
    }
  }

  @Test
  void record_concurrentWriters_persistsEveryRecord() throws Exception {
    int writers = 32;
    int perWriter = 25;
    var start = new CountDownLatch(1);
    var failures = new AtomicInteger();
    var executor = Executors.newFixedThreadPool(writers);
    try {
      for (int w = 0; w < writers; w++) {
        var deviceId = "device-" + w;
        executor.submit(
            () -> {
              try {
                start.await();
                for (int i = 0; i < perWriter; i++) {
                  store.record(record("run-concurrent", deviceId).metricValue((double) i).build());
                }
              } catch (Exception e) {
                failures.incrementAndGet();
              }
            });
      }
      start.countDown();
      executor.shutdown();
      assertThat(executor.awaitTermination(60, TimeUnit.SECONDS)).isTrue();
    } finally {
      executor.shutdownNow();
    }

    assertThat(failures.get()).isZero();
    assertThat(store.count(MetricQuery.forRun("run-concurrent"))).isEqualTo(writers * perWriter);
    try (var stream = store.query(MetricQuery.forRun("run-concurrent"))) {
      assertThat(stream.map(MetricRecord::deviceId).distinct().count()).isEqualTo(writers);
    }
  }

  @Test
  void query_filtersByRunDeviceAndTimeWindow() {
    var t0 = Instant.parse("2025-03-01T10:00:00Z");
    store.record(record("run-1", "device-a").timestamp(t0).build());
    store.record(record("run-1", "device-b").timestamp(t0.plusSeconds(10)).build());
    store.record(record("run-2", "device-a").timestamp(t0.plusSeconds(20)).build());

    assertThat(store.count(MetricQuery.forRun("run-1"))).isEqualTo(2);
    assertThat(store.count(MetricQuery.builder().deviceId("device-a").build())).isEqualTo(2);
    assertThat(
            store.count(
                MetricQuery.builder().from(t0.plusSeconds(10)).to(t0.plusSeconds(20)).build()))
        .isEqualTo(1);

    try (var stream = store.query(MetricQuery.builder().limit(2).build())) {
      assertThat(stream.map(MetricRecord::timestamp).toList())
          .containsExactly(t0, t0.plusSeconds(10));
    }
  }

  @Test
  void query_whileWriting_seesCommittedRecords() {
    store.record(record("run-1", "device-a").build());

    try (var stream = store.query(MetricQuery.forRun("run-1"))) {
      var iterator = stream.iterator();
      store.record(record("run-1", "device-b").build());
      assertThat(iterator.hasNext()).isTrue();
      assertThat(iterator.next().deviceId()).isEqualTo("device-a");
    }
    assertThat(store.count(MetricQuery.forRun("run-1"))).isEqualTo(2);
  }

  @Test
  void summarize_groupsByRunAndScenario() {
    store.record(record("run-1", "device-a").latency(Duration.ofMillis(100)).build());
    store.record(record("run-1", "device-a").latency(Duration.ofMillis(300)).build());
    store.record(
        record("run-1", "device-b")
            .status(MetricStatus.FAILURE)
            .errorMessage("timeout")
            .latency(Duration.ofMillis(200))
            .build());
    store.record(record("run-2", "device-a").build());

    var summaries = store.summarize(MetricQuery.forRun("run-1"));

    assertThat(summaries).hasSize(1);
    var summary = summaries.get(0);
    assertThat(summary.scenarioName()).isEqualTo("device-pool");
    assertThat(summary.totalRequests()).isEqualTo(3);
    assertThat(summary.deviceCount()).isEqualTo(2);
    assertThat(summary.avgLatencyMs()).isEqualTo(200.0);
    assertThat(summary.successCount()).isEqualTo(2);
    assertThat(summary.successRatePct()).isCloseTo(66.67, within(0.01));
  }

  @Test
  void open_existingFile_keepsPreviousRecords() {
    store.record(record("run-1", "device-a").build());
    store.close();

    store = SqliteMetricStore.open(tempDir.resolve("nested/metrics.db"));

    assertThat(store.count(MetricQuery.all())).isEqualTo(1);
  }

  @Test
  void record_fromInterruptedThread_isStillWritten() {
    Thread.currentThread().interrupt();
    try {
      store.record(record("run-1", "device-a").build());

      assertThat(Thread.currentThread().isInterrupted()).isTrue();
    } finally {
      Thread.interrupted();
    }
    assertThat(store.count(MetricQuery.forRun("run-1"))).isEqualTo(1);
  }

  @Test
  void record_afterClose_throwsStoreWriteException() {
    store.close();

    assertThatThrownBy(() -> store.record(record("run-1", "device-a").build()))
        .isInstanceOf(StoreWriteException.class);
  }

  @Test
  void record_missingRunId_rejected() {
    assertThatThrownBy(() -> record(null, "device-a").build())
        .isInstanceOf(NullPointerException.class);
  }
}
