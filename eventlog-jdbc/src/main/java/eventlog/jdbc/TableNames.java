package eventlog.jdbc;

import java.util.Objects;

/**
 * Default table names and validation for configurable ones. Table names are concatenated
 * into SQL, so only plain identifiers are accepted.
 */
public final class TableNames {
  public static final String STREAM_TABLE = "event_stream";
  public static final String EVENT_TABLE = "domain_event";
  public static final String POSITION_TABLE = "projection_position";
  private static final String TABLE_NAME_PATTERN = "[a-zA-Z_][a-zA-Z0-9_]*";

  private TableNames() {}

  public static String validate(String tableName) {
    Objects.requireNonNull(tableName, "tableName");
    if (!tableName.matches(TABLE_NAME_PATTERN)) {
      throw new IllegalArgumentException("Invalid table name: " + tableName);
    }
    return tableName;
  }
}
