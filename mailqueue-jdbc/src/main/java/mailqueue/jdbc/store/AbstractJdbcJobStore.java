package mailqueue.jdbc.store;

import mailqueue.jdbc.JdbcTemplate;
import mailqueue.model.EnqueueOptions;
import mailqueue.model.Job;
import mailqueue.model.JobPayload;
import mailqueue.model.JobStats;
import mailqueue.model.JobStatus;
import mailqueue.model.JobType;
import mailqueue.spi.JobStore;
import mailqueue.spi.JobStoreException;
import mailqueue.util.JsonCodec;

import java.sql.Connection;
import java.sql.SQLException;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Base JDBC job store with standard SQL implementations.
 *
 * <p>The default claim is an optimistic compare-and-set: select the best candidate, then update
 * it only if it is still pending. When another claimer wins the row the next candidate is tried,
 * so an empty result means no job was eligible.
 * Subclasses override {@link #claimNext} with database-specific row locking. Register custom
 * implementations via {@code META-INF/services/mailqueue.jdbc.store.AbstractJdbcJobStore}.
 *
 * @see JdbcJobStores
 */
public abstract class AbstractJdbcJobStore implements JobStore {
  private static final Logger logger = Logger.getLogger(AbstractJdbcJobStore.class.getName());

  protected static final String DEFAULT_TABLE = "email_job_queue";
  protected static final String COLUMNS = "id, job_type, payload, status, priority, scheduled_for, attempts, "
      + "max_attempts, idempotency_key, connection_id, user_id, created_at, started_at, completed_at, "
      + "error, error_stack, result";
  protected static final String CLAIM_ORDER = " ORDER BY priority DESC, scheduled_for ASC, id ASC";

  // H2 "concurrent update" error code
  private static final int H2_CONCURRENT_UPDATE = 90131;

  private final String tableName;
  private final JsonCodec jsonCodec;
  protected final JdbcTemplate.RowMapper<Job> jobRowMapper;

  protected AbstractJdbcJobStore() {
    this(DEFAULT_TABLE, JsonCodec.getDefault());
  }

  protected AbstractJdbcJobStore(String tableName, JsonCodec jsonCodec) {
    Objects.requireNonNull(tableName, "tableName");
    if (!tableName.matches("[a-zA-Z_][a-zA-Z0-9_]*")) {
      throw new IllegalArgumentException("Invalid table name: " + tableName);
    }
    this.tableName = tableName;
    this.jsonCodec = Objects.requireNonNull(jsonCodec, "jsonCodec");
    this.jobRowMapper = rs -> {
      JobType type = JobType.fromWireName(rs.getString("job_type"));
      return new Job(
          rs.getLong("id"),
          type,
          JobPayload.fromFields(type, this.jsonCodec.parseObject(rs.getString("payload"))),
          JobStatus.fromCode(rs.getString("status")),
          rs.getInt("priority"),
          JdbcTemplate.instant(rs, "scheduled_for"),
          rs.getInt("attempts"),
          rs.getInt("max_attempts"),
          rs.getString("idempotency_key"),
          JdbcTemplate.nullableLong(rs, "connection_id"),
          JdbcTemplate.nullableLong(rs, "user_id"),
          JdbcTemplate.instant(rs, "created_at"),
          JdbcTemplate.instant(rs, "started_at"),
          JdbcTemplate.instant(rs, "completed_at"),
          rs.getString("error"),
          rs.getString("error_stack"),
          this.jsonCodec.parseObject(rs.getString("result")));
    };
  }

  /**
   * Unique identifier for this job store (e.g., "mysql", "postgresql", "h2").
   */
  public abstract String name();

  /**
   * JDBC URL prefixes this job store handles (e.g., "jdbc:mysql:", "jdbc:mariadb:").
   */
  public abstract List<String> jdbcUrlPrefixes();

  /**
   * Returns a copy of this store bound to another table and codec.
   */
  public abstract AbstractJdbcJobStore with(String tableName, JsonCodec jsonCodec);

  protected String tableName() {
    return tableName;
  }

  protected JsonCodec jsonCodec() {
    return jsonCodec;
  }

  @Override
  public long insert(Connection conn, JobPayload payload, EnqueueOptions options, Instant now) {
    String sql = "INSERT INTO " + tableName() + " (" +
        "job_type, payload, status, priority, scheduled_for, attempts, max_attempts, idempotency_key, " +
        "connection_id, user_id, created_at, updated_at" +
        ") VALUES (?,?,?,?,?,?,?,?,?,?,?,?)";
    Instant scheduledFor = options.scheduledFor() != null ? options.scheduledFor() : now;
    return JdbcTemplate.insert(conn, sql,
        payload.type().wireName(), jsonCodec.toJson(payload.toFields()), JobStatus.PENDING.code(),
        options.priority(), scheduledFor, 0, options.maxAttempts(), options.idempotencyKey(),
        payload.connectionId(), payload.ownerUserId(), now, now);
  }

  @Override
  public Optional<Job> findById(Connection conn, long id) {
    return JdbcTemplate.queryOne(conn,
        "SELECT " + COLUMNS + " FROM " + tableName() + " WHERE id=?", jobRowMapper, id);
  }

  @Override
  public Optional<Job> findByIdempotencyKey(Connection conn, String idempotencyKey) {
    return JdbcTemplate.queryOne(conn,
        "SELECT " + COLUMNS + " FROM " + tableName() + " WHERE idempotency_key=?", jobRowMapper, idempotencyKey);
  }

  @Override
  public Optional<Job> claimNext(Connection conn, Set<JobType> jobTypes, Instant now) {
    String selectSql = "SELECT id FROM " + tableName() + " WHERE " + eligibleClause(jobTypes) + CLAIM_ORDER +
        " LIMIT 1";
    String claimSql = "UPDATE " + tableName() +
        " SET status='processing', attempts=attempts+1, started_at=?, updated_at=?" +
        " WHERE id=? AND status='pending'";
    Object[] selectParams = eligibleParams(jobTypes, now);
    // every lost race is another caller's successful claim, so this ends once nothing is eligible
    for (int attempt = 1; ; attempt++) {
      Optional<Long> candidate = JdbcTemplate.queryOne(conn, selectSql, rs -> rs.getLong("id"), selectParams);
      if (candidate.isEmpty()) {
        return Optional.empty();
      }
      try {
        if (JdbcTemplate.update(conn, claimSql, now, now, candidate.get()) == 1) {
          return findById(conn, candidate.get());
        }
      } catch (JobStoreException e) {
        if (!isClaimConflict(e)) {
          throw e;
        }
      }
      logger.log(Level.FINE, "Lost claim race for job {0}, attempt {1}", new Object[]{candidate.get(), attempt});
    }
  }

  @Override
  public int markCompleted(Connection conn, long id, Map<String, String> result, Instant now) {
    String sql = "UPDATE " + tableName() +
        " SET status='completed', completed_at=?, updated_at=?, result=?" +
        " WHERE id=? AND status='processing'";
    return JdbcTemplate.update(conn, sql, now, now, jsonCodec.toJson(result), id);
  }

  @Override
  public int markRetry(Connection conn, long id, Instant nextAt, String error, String errorStack, Instant now) {
    String sql = "UPDATE " + tableName() +
        " SET status='pending', scheduled_for=?, error=?, error_stack=?, started_at=NULL, updated_at=?" +
        " WHERE id=? AND status='processing'";
    return JdbcTemplate.update(conn, sql, nextAt, error, errorStack, now, id);
  }

  @Override
  public int markDead(Connection conn, long id, String error, String errorStack, Instant now) {
    String sql = "UPDATE " + tableName() +
        " SET status='dead', error=?, error_stack=?, completed_at=?, updated_at=?" +
        " WHERE id=? AND status='processing'";
    return JdbcTemplate.update(conn, sql, error, errorStack, now, now, id);
  }

  @Override
  public List<Job> findByStatus(Connection conn, JobStatus status, int limit) {
    String sql = "SELECT " + COLUMNS + " FROM " + tableName() +
        " WHERE status=? ORDER BY created_at DESC, id DESC LIMIT ?";
    return JdbcTemplate.query(conn, sql, jobRowMapper, status.code(), limit);
  }

  @Override
  public JobStats countByStatus(Connection conn) {
    List<Map.Entry<String, Long>> rows = JdbcTemplate.query(conn,
        "SELECT status, COUNT(*) AS cnt FROM " + tableName() + " GROUP BY status",
        rs -> Map.entry(rs.getString("status"), rs.getLong("cnt")));
    long pending = 0;
    long processing = 0;
    long completed = 0;
    long failed = 0;
    long dead = 0;
    for (Map.Entry<String, Long> row : rows) {
      switch (JobStatus.fromCode(row.getKey())) {
        case PENDING -> pending = row.getValue();
        case PROCESSING -> processing = row.getValue();
        case COMPLETED -> completed = row.getValue();
        case FAILED -> failed = row.getValue();
        case DEAD -> dead = row.getValue();
      }
    }
    return new JobStats(pending, processing, completed, failed, dead);
  }

  @Override
  public int deleteCompletedBefore(Connection conn, Instant cutoff) {
    return JdbcTemplate.update(conn,
        "DELETE FROM " + tableName() + " WHERE status='completed' AND completed_at <= ?", cutoff);
  }

  @Override
  public int resetStale(Connection conn, Instant startedBefore, Instant now) {
    return JdbcTemplate.update(conn,
        "UPDATE " + tableName() + " SET status='pending', started_at=NULL, updated_at=?" +
            " WHERE status='processing' AND started_at <= ?", now, startedBefore);
  }

  @Override
  public int resetDead(Connection conn, long id, Instant now) {
    return JdbcTemplate.update(conn,
        "UPDATE " + tableName() + " SET status='pending', attempts=0, error=NULL, error_stack=NULL," +
            " scheduled_for=?, started_at=NULL, completed_at=NULL, updated_at=? WHERE id=? AND status='dead'",
        now, now, id);
  }

  @Override
  public int deletePending(Connection conn, long id) {
    return JdbcTemplate.update(conn, "DELETE FROM " + tableName() + " WHERE id=? AND status='pending'", id);
  }

  /**
   * WHERE clause selecting claimable rows; binds {@code now} first, then each job type.
   */
  protected String eligibleClause(Set<JobType> jobTypes) {
    StringBuilder sb = new StringBuilder("status='pending' AND scheduled_for <= ?");
    if (jobTypes != null && !jobTypes.isEmpty()) {
      sb.append(" AND job_type IN (")
          .append(String.join(",", Collections.nCopies(jobTypes.size(), "?")))
          .append(')');
    }
    return sb.toString();
  }

  protected Object[] eligibleParams(Set<JobType> jobTypes, Instant now) {
    List<Object> params = new ArrayList<>();
    params.add(now);
    if (jobTypes != null) {
      jobTypes.stream().map(JobType::wireName).sorted().forEach(params::add);
    }
    return params.toArray();
  }

  private static boolean isClaimConflict(JobStoreException e) {
    Throwable current = e.getCause();
    while (current != null) {
      if (current instanceof SQLException sql
          && (sql.getErrorCode() == H2_CONCURRENT_UPDATE || "40001".equals(sql.getSQLState()))) {
        return true;
      }
      current = current.getCause();
    }
    return false;
  }
}
