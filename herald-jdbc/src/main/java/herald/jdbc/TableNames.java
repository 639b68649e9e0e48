package herald.jdbc;

import java.util.Objects;

/**
 * Default table names and identifier validation shared by the JDBC stores.
 */
public final class TableNames {
  public static final String SCHEDULED_JOBS = "scheduled_jobs";
  public static final String NOTIFICATION_QUEUE = "notification_queue";
  public static final String NOTIFICATION_TEMPLATES = "notification_templates";
  public static final String NOTIFICATION_METRICS = "notification_metrics";

  private static final String TABLE_NAME_PATTERN = "[a-zA-Z_][a-zA-Z0-9_]*";

  private TableNames() {}

  /**
   * Returns {@code tableName} if it is a plain SQL identifier.
   *
   * @throws IllegalArgumentException if the name could not be safely spliced into SQL
   */
  public static String validate(String tableName) {
    Objects.requireNonNull(tableName, "tableName");
    if (!tableName.matches(TABLE_NAME_PATTERN)) {
      throw new IllegalArgumentException("Invalid table name: " + tableName);
    }
    return tableName;
  }
}
