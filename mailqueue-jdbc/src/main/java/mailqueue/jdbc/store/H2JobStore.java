package mailqueue.jdbc.store;

import mailqueue.util.JsonCodec;

import java.util.List;

/**
 * H2 job store. Primarily for testing.
 *
 * <p>Uses the default compare-and-set claim from {@link AbstractJdbcJobStore}.
 */
public final class H2JobStore extends AbstractJdbcJobStore {

  public H2JobStore() {
    super();
  }

  public H2JobStore(String tableName, JsonCodec jsonCodec) {
    super(tableName, jsonCodec);
  }

  @Override
  public AbstractJdbcJobStore with(String tableName, JsonCodec jsonCodec) {
    return new H2JobStore(tableName, jsonCodec);
  }

  @Override
  public String name() {
    return "h2";
  }

  @Override
  public List<String> jdbcUrlPrefixes() {
    return List.of("jdbc:h2:");
  }
}
