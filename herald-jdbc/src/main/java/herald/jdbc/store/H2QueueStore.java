package herald.jdbc.store;

import herald.util.JsonCodec;

import java.util.List;

/**
 * H2 queue store. Primarily for testing.
 *
 * <p>Uses the default select-then-claim lease from {@link AbstractJdbcQueueStore}.
 */
public final class H2QueueStore extends AbstractJdbcQueueStore {

  public H2QueueStore() {
    super();
  }

  public H2QueueStore(String tableName) {
    super(tableName);
  }

  public H2QueueStore(String tableName, JsonCodec jsonCodec) {
    super(tableName, jsonCodec);
  }

  @Override
  public AbstractJdbcQueueStore withJsonCodec(JsonCodec jsonCodec) {
    return new H2QueueStore(tableName(), jsonCodec);
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
