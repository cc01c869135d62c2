package mailqueue.jdbc.store;

import mailqueue.jdbc.JdbcTemplate;
import mailqueue.model.Job;
import mailqueue.model.JobType;
import mailqueue.util.JsonCodec;

import java.sql.Connection;
import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * MySQL job store (8.0+). Also used for MariaDB 10.6+.
 *
 * <p>Locks the candidate row with {@code SELECT ... FOR UPDATE SKIP LOCKED} and then claims it
 * within the same transaction, so the caller must not run in auto-commit mode.
 */
public final class MySqlJobStore extends AbstractJdbcJobStore {

  public MySqlJobStore() {
    super();
  }

  public MySqlJobStore(String tableName, JsonCodec jsonCodec) {
    super(tableName, jsonCodec);
  }

  @Override
  public AbstractJdbcJobStore with(String tableName, JsonCodec jsonCodec) {
    return new MySqlJobStore(tableName, jsonCodec);
  }

  @Override
  public String name() {
    return "mysql";
  }

  @Override
  public List<String> jdbcUrlPrefixes() {
    return List.of("jdbc:mysql:", "jdbc:mariadb:");
  }

  @Override
  public Optional<Job> claimNext(Connection conn, Set<JobType> jobTypes, Instant now) {
    String lockSql = "SELECT id FROM " + tableName() + " WHERE " + eligibleClause(jobTypes) + CLAIM_ORDER +
        " LIMIT 1 FOR UPDATE SKIP LOCKED";
    Optional<Long> locked = JdbcTemplate.queryOne(conn, lockSql, rs -> rs.getLong("id"),
        eligibleParams(jobTypes, now));
    if (locked.isEmpty()) {
      return Optional.empty();
    }
    JdbcTemplate.update(conn, "UPDATE " + tableName() +
        " SET status='processing', attempts=attempts+1, started_at=?, updated_at=? WHERE id=?",
        now, now, locked.get());
    return findById(conn, locked.get());
  }
}
