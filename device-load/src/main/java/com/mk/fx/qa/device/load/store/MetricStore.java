package com.mk.fx.qa.device.load.store;

import java.util.List;
import java.util.stream.Stream;

/**
 * Durable, append-only log of {@link MetricRecord}s. Writes from many device threads are
 * serialised internally; reads may run while a load test is still writing.
 */
public interface MetricStore extends AutoCloseable {

  /**
   * Appends one record.
   *
   * @throws StoreWriteException if the record could not be persisted
   */
  void record(MetricRecord record);

  /**
   * Streams matching records ordered by timestamp. The stream holds a database connection and
   * must be closed, typically with try-with-resources.
   */
  Stream<MetricRecord> query(MetricQuery query);

  long count(MetricQuery query);

  /** Per run and scenario aggregates of the matching records. */
  List<RunSummary> summarize(MetricQuery query);

  @Override
  void close();
}
