package mailqueue.jdbc.store;

import mailqueue.jdbc.JdbcTemplate;
import mailqueue.model.Job;
import mailqueue.model.JobType;
import mailqueue.util.JsonCodec;

import java.sql.Connection;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * PostgreSQL job store.
 *
 * <p>Uses {@code FOR UPDATE SKIP LOCKED} with {@code RETURNING} for a single-round-trip claim,
 * so concurrent workers never block on or double-claim the same row.
 */
public final class PostgresJobStore extends AbstractJdbcJobStore {

  public PostgresJobStore() {
    super();
  }

  public PostgresJobStore(String tableName, JsonCodec jsonCodec) {
    super(tableName, jsonCodec);
  }

  @Override
  public AbstractJdbcJobStore with(String tableName, JsonCodec jsonCodec) {
    return new PostgresJobStore(tableName, jsonCodec);
  }

  @Override
  public String name() {
    return "postgresql";
  }

  @Override
  public List<String> jdbcUrlPrefixes() {
    return List.of("jdbc:postgresql:");
  }

  @Override
  public Optional<Job> claimNext(Connection conn, Set<JobType> jobTypes, Instant now) {
    String sql = "UPDATE " + tableName() +
        " SET status='processing', attempts=attempts+1, started_at=?, updated_at=?" +
        " WHERE id = (" +
        "SELECT id FROM " + tableName() + " WHERE " + eligibleClause(jobTypes) + CLAIM_ORDER +
        " LIMIT 1 FOR UPDATE SKIP LOCKED" +
        ") RETURNING " + COLUMNS;
    List<Object> params = new ArrayList<>();
    params.add(now);
    params.add(now);
    params.addAll(List.of(eligibleParams(jobTypes, now)));
    List<Job> claimed = JdbcTemplate.updateReturning(conn, sql, jobRowMapper, params.toArray());
    return claimed.isEmpty() ? Optional.empty() : Optional.of(claimed.get(0));
  }
}
