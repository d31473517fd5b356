package com.mk.fx.qa.device.load.store;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.google.common.util.concurrent.Uninterruptibles;
import com.mk.fx.qa.device.offload.JsonUtil;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.sql.Connection;
import java.sql.DriverManager;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Statement;
import java.sql.Types;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Spliterator;
import java.util.Spliterators;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Consumer;
import java.util.stream.Stream;
import java.util.stream.StreamSupport;
import lombok.extern.slf4j.Slf4j;

/**
 * {@link MetricStore} on an embedded SQLite file.
 *
 * <p>All inserts go through one writer connection guarded by a fair lock that is acquired with a
 * bounded wait; each insert is a single auto-committed row. Reads open their own connection and
 * rely on WAL journaling so an analysis query never blocks the writer. {@code SQLITE_BUSY} and
 * {@code SQLITE_LOCKED} are retried a bounded number of times before giving up.
 */
@Slf4j
public final class SqliteMetricStore implements MetricStore {

  static final String TABLE = "execution_metrics";

  private static final int SQLITE_BUSY = 5;
  private static final int SQLITE_LOCKED = 6;
  private static final long BUSY_TIMEOUT_MS = 5_000L;
  private static final long RETRY_BACKOFF_MS = 50L;
  private static final TypeReference<Map<String, Object>> MAP_TYPE = new TypeReference<>() {};

  private static final String INSERT_SQL =
      "INSERT INTO "
          + TABLE
          + " (run_id, timestamp_ms, scenario_name, device_id, device_requirements_json,"
          + " task_name, task_parameters_json, status, latency_ms, metric_value, error_msg)"
          + " VALUES (?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?)";

  private static final String SELECT_COLUMNS =
      "SELECT run_id, timestamp_ms, scenario_name, device_id, device_requirements_json, task_name,"
          + " task_parameters_json, status, latency_ms, metric_value, error_msg FROM "
          + TABLE;

  private final Path dbFile;
  private final String jdbcUrl;
  private final ObjectMapper mapper;
  private final Duration writeLockTimeout;
  private final int writeRetries;
  private final ReentrantLock writeLock = new ReentrantLock(true);
  private final Connection writer;
  private final PreparedStatement insert;
  private volatile boolean closed;

  private SqliteMetricStore(
      Path dbFile, ObjectMapper mapper, Duration writeLockTimeout, int writeRetries)
      throws SQLException {
    this.dbFile = dbFile;
    this.jdbcUrl = "jdbc:sqlite:" + dbFile;
    this.mapper = mapper;
    this.writeLockTimeout = writeLockTimeout;
    this.writeRetries = Math.max(0, writeRetries);
    this.writer = openConnection();
    initSchema(writer);
    applyAndValidatePragmas(writer);
    this.insert = writer.prepareStatement(INSERT_SQL);
  }

  public static SqliteMetricStore open(Path dbFile) {
    return open(dbFile, JsonUtil.mapper(), Duration.ofSeconds(5), 3);
  }

  /**
   * Opens the store, creating the parent directory, the table and its indexes when missing.
   *
   * @param dbFile SQLite database file
   * @param mapper mapper for the JSON columns
   * @param writeLockTimeout longest a writer waits for its turn
   * @param writeRetries extra attempts on {@code SQLITE_BUSY}/{@code SQLITE_LOCKED}
   * @throws MetricStoreException if the file cannot be created or initialised
   */
  public static SqliteMetricStore open(
      Path dbFile, ObjectMapper mapper, Duration writeLockTimeout, int writeRetries) {
    Objects.requireNonNull(dbFile, "dbFile");
    Objects.requireNonNull(mapper, "mapper");
    Objects.requireNonNull(writeLockTimeout, "writeLockTimeout");
    var absolute = dbFile.toAbsolutePath().normalize();
    try {
      if (absolute.getParent() != null) {
        Files.createDirectories(absolute.getParent());
      }
      var store = new SqliteMetricStore(absolute, mapper, writeLockTimeout, writeRetries);
      log.info("Metric store opened at {}", absolute);
      return store;
    } catch (IOException | SQLException e) {
      throw new MetricStoreException("Failed to open metric store at " + absolute, e);
    }
  }

  private Connection openConnection() throws SQLException {
    var connection = DriverManager.getConnection(jdbcUrl);
    try (Statement st = connection.createStatement()) {
      st.execute("PRAGMA busy_timeout=" + BUSY_TIMEOUT_MS);
    }
    return connection;
  }

  private void initSchema(Connection conn) throws SQLException {
    try (Statement st = conn.createStatement()) {
      st.execute(
          """
          CREATE TABLE IF NOT EXISTS execution_metrics (
              id INTEGER PRIMARY KEY AUTOINCREMENT,
              run_id TEXT NOT NULL,
              timestamp_ms INTEGER NOT NULL,
              scenario_name TEXT NOT NULL,
              device_id TEXT NOT NULL,
              device_requirements_json TEXT,
              task_name TEXT NOT NULL,
              task_parameters_json TEXT,
              status TEXT NOT NULL,
              latency_ms INTEGER NOT NULL,
              metric_value REAL,
              error_msg TEXT
          )
          """);
      st.execute(
          "CREATE INDEX IF NOT EXISTS idx_metrics_run_scenario ON "
              + TABLE
              + "(run_id, scenario_name)");
      st.execute("CREATE INDEX IF NOT EXISTS idx_metrics_device ON " + TABLE + "(device_id)");
      st.execute(
          "CREATE INDEX IF NOT EXISTS idx_metrics_scenario_timestamp ON "
              + TABLE
              + "(scenario_name, timestamp_ms)");
    }
  }

  private void applyAndValidatePragmas(Connection conn) throws SQLException {
    try (Statement st = conn.createStatement()) {
      st.execute("PRAGMA journal_mode=WAL");
      st.execute("PRAGMA synchronous=NORMAL");
      validatePragma(st, "journal_mode", "wal");
      validatePragma(st, "synchronous", "1");
    }
  }

  private void validatePragma(Statement st, String pragma, String expected) throws SQLException {
    try (ResultSet rs = st.executeQuery("PRAGMA " + pragma)) {
      if (!rs.next()) {
        throw new IllegalStateException("PRAGMA " + pragma + " did not return a value");
      }
      String actual = rs.getString(1);
      if (actual == null || !actual.equalsIgnoreCase(expected)) {
        throw new IllegalStateException(
            "PRAGMA " + pragma + " mismatch, expected=" + expected + ", actual=" + actual);
      }
    }
  }

  @Override
  public void record(MetricRecord record) {
    Objects.requireNonNull(record, "record");
    var requirementsJson = toJson(record.deviceRequirements());
    var parametersJson = toJson(record.taskParameters());

    acquireWriteLock(record);
    try {
      if (closed) {
        throw new StoreWriteException("Metric store at " + dbFile + " is closed");
      }
      insertWithRetry(record, requirementsJson, parametersJson);
    } finally {
      writeLock.unlock();
    }
  }

  /** Interrupts do not cut the wait short: a finished task's record is still written. */
  private void acquireWriteLock(MetricRecord record) {
    var acquired =
        Uninterruptibles.tryLockUninterruptibly(
            writeLock, writeLockTimeout.toMillis(), TimeUnit.MILLISECONDS);
    if (!acquired) {
      throw new StoreWriteException(
          "Timed out after "
              + writeLockTimeout.toMillis()
              + "ms waiting to record "
              + record.taskName()
              + " for "
              + record.deviceId());
    }
  }

  private void insertWithRetry(MetricRecord record, String requirementsJson, String parametersJson) {
    for (int attempt = 0; ; attempt++) {
      try {
        bindInsert(record, requirementsJson, parametersJson);
        insert.executeUpdate();
        return;
      } catch (SQLException e) {
        if (!isTransient(e) || attempt >= writeRetries) {
          throw new StoreWriteException(
              "Failed to record " + record.taskName() + " for " + record.deviceId() + ": "
                  + e.getMessage(),
              e);
        }
        log.debug(
            "Metric insert for {} hit {} (attempt {}/{}), retrying",
            record.deviceId(),
            e.getMessage(),
            attempt + 1,
            writeRetries + 1);
        backoff(attempt);
      }
    }
  }

  private void bindInsert(MetricRecord record, String requirementsJson, String parametersJson)
      throws SQLException {
    insert.clearParameters();
    insert.setString(1, record.runId());
    insert.setLong(2, record.timestamp().toEpochMilli());
    insert.setString(3, record.scenarioName());
    insert.setString(4, record.deviceId());
    insert.setString(5, requirementsJson);
    insert.setString(6, record.taskName());
    insert.setString(7, parametersJson);
    insert.setString(8, record.status().name());
    insert.setLong(9, record.latency().toMillis());
    if (record.metricValue() != null) {
      insert.setDouble(10, record.metricValue());
    } else {
      insert.setNull(10, Types.REAL);
    }
    insert.setString(11, record.errorMessage());
  }

  private static boolean isTransient(SQLException e) {
    var code = e.getErrorCode();
    return code == SQLITE_BUSY || code == SQLITE_LOCKED;
  }

  private static void backoff(int attempt) {
    Uninterruptibles.sleepUninterruptibly(RETRY_BACKOFF_MS * (attempt + 1), TimeUnit.MILLISECONDS);
  }

  @Override
  public Stream<MetricRecord> query(MetricQuery query) {
    Objects.requireNonNull(query, "query");
    var where = new WhereClause(query);
    var sql = SELECT_COLUMNS + where.sql() + " ORDER BY timestamp_ms, id" + limitClause(query);

    Connection conn = null;
    PreparedStatement ps = null;
    try {
      conn = openConnection();
      ps = conn.prepareStatement(sql);
      where.bind(ps);
      var rs = ps.executeQuery();
      var cursor = new RecordCursor(rs);
      var openConn = conn;
      var openPs = ps;
      return StreamSupport.stream(cursor, false).onClose(() -> closeAll(rs, openPs, openConn));
    } catch (SQLException e) {
      closeAll(null, ps, conn);
      throw new MetricStoreException("Failed to query metrics: " + e.getMessage(), e);
    }
  }

  @Override
  public long count(MetricQuery query) {
    Objects.requireNonNull(query, "query");
    var where = new WhereClause(query);
    try (Connection conn = openConnection();
        PreparedStatement ps = conn.prepareStatement("SELECT COUNT(*) FROM " + TABLE + where.sql())) {
      where.bind(ps);
      try (ResultSet rs = ps.executeQuery()) {
        return rs.next() ? rs.getLong(1) : 0L;
      }
    } catch (SQLException e) {
      throw new MetricStoreException("Failed to count metrics: " + e.getMessage(), e);
    }
  }

  @Override
  public List<RunSummary> summarize(MetricQuery query) {
    Objects.requireNonNull(query, "query");
    var where = new WhereClause(query);
    var sql =
        "SELECT run_id, scenario_name, COUNT(*) AS total, COUNT(DISTINCT device_id) AS devices,"
            + " AVG(latency_ms) AS avg_latency,"
            + " SUM(CASE WHEN status = 'SUCCESS' THEN 1 ELSE 0 END) AS successes,"
            + " MIN(timestamp_ms) AS first_ms, MAX(timestamp_ms) AS last_ms FROM "
            + TABLE
            + where.sql()
            + " GROUP BY run_id, scenario_name ORDER BY first_ms";
    try (Connection conn = openConnection(); PreparedStatement ps = conn.prepareStatement(sql)) {
      where.bind(ps);
      List<RunSummary> summaries = new ArrayList<>();
      try (ResultSet rs = ps.executeQuery()) {
        while (rs.next()) {
          summaries.add(
              new RunSummary(
                  rs.getString("run_id"),
                  rs.getString("scenario_name"),
                  rs.getLong("total"),
                  rs.getLong("devices"),
                  rs.getDouble("avg_latency"),
                  rs.getLong("successes"),
                  Instant.ofEpochMilli(rs.getLong("first_ms")),
                  Instant.ofEpochMilli(rs.getLong("last_ms"))));
        }
      }
      return summaries;
    } catch (SQLException e) {
      throw new MetricStoreException("Failed to summarise metrics: " + e.getMessage(), e);
    }
  }

  @Override
  public void close() {
    writeLock.lock();
    try {
      if (closed) {
        return;
      }
      closed = true;
      closeAll(null, insert, writer);
      log.info("Metric store at {} closed", dbFile);
    } finally {
      writeLock.unlock();
    }
  }

  private String limitClause(MetricQuery query) {
    return query.limit() != null && query.limit() > 0 ? " LIMIT " + query.limit() : "";
  }

  private String toJson(Map<String, Object> value) {
    if (value == null || value.isEmpty()) {
      return null;
    }
    try {
      return mapper.writeValueAsString(value);
    } catch (JsonProcessingException e) {
      throw new StoreWriteException("Failed to serialise metric column: " + e.getMessage(), e);
    }
  }

  private Map<String, Object> fromJson(String json) {
    if (json == null || json.isBlank()) {
      return Map.of();
    }
    try {
      return mapper.readValue(json, MAP_TYPE);
    } catch (JsonProcessingException e) {
      throw new MetricStoreException("Corrupt JSON column in " + TABLE + ": " + e.getMessage(), e);
    }
  }

  private MetricRecord mapRow(ResultSet rs) throws SQLException {
    var rawMetricValue = rs.getDouble("metric_value");
    Double metricValue = rs.wasNull() ? null : rawMetricValue;
    return MetricRecord.builder()
        .runId(rs.getString("run_id"))
        .timestamp(Instant.ofEpochMilli(rs.getLong("timestamp_ms")))
        .scenarioName(rs.getString("scenario_name"))
        .deviceId(rs.getString("device_id"))
        .deviceRequirements(fromJson(rs.getString("device_requirements_json")))
        .taskName(rs.getString("task_name"))
        .taskParameters(fromJson(rs.getString("task_parameters_json")))
        .status(MetricStatus.valueOf(rs.getString("status")))
        .latency(Duration.ofMillis(rs.getLong("latency_ms")))
        .metricValue(metricValue)
        .errorMessage(rs.getString("error_msg"))
        .build();
  }

  private static void closeAll(ResultSet rs, Statement st, Connection conn) {
    for (AutoCloseable resource : new AutoCloseable[] {rs, st, conn}) {
      if (resource == null) {
        continue;
      }
      try {
        resource.close();
      } catch (Exception e) {
        log.warn("Failed to close metric store resource: {}", e.getMessage());
      }
    }
  }

  private final class RecordCursor extends Spliterators.AbstractSpliterator<MetricRecord> {

    private final ResultSet rs;

    private RecordCursor(ResultSet rs) {
      super(Long.MAX_VALUE, Spliterator.ORDERED | Spliterator.NONNULL);
      this.rs = rs;
    }

    @Override
    public boolean tryAdvance(Consumer<? super MetricRecord> action) {
      try {
        if (!rs.next()) {
          return false;
        }
        action.accept(mapRow(rs));
        return true;
      } catch (SQLException e) {
        throw new MetricStoreException("Failed to read metrics: " + e.getMessage(), e);
      }
    }
  }

  /** WHERE clause built from the non-null filters of a query, bound positionally. */
  private static final class WhereClause {

    private final List<String> conditions = new ArrayList<>();
    private final List<Object> params = new ArrayList<>();

    private WhereClause(MetricQuery query) {
      add("run_id = ?", query.runId());
      add("scenario_name = ?", query.scenarioName());
      add("device_id = ?", query.deviceId());
      add("timestamp_ms >= ?", query.from() != null ? query.from().toEpochMilli() : null);
      add("timestamp_ms < ?", query.to() != null ? query.to().toEpochMilli() : null);
    }

    private void add(String condition, Object value) {
      if (value != null) {
        conditions.add(condition);
        params.add(value);
      }
    }

    private String sql() {
      return conditions.isEmpty() ? "" : " WHERE " + String.join(" AND ", conditions);
    }

    private void bind(PreparedStatement ps) throws SQLException {
      for (int i = 0; i < params.size(); i++) {
        ps.setObject(i + 1, params.get(i));
      }
    }
  }
}
