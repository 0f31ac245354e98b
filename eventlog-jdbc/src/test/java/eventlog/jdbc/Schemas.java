package eventlog.jdbc;

import org.h2.jdbcx.JdbcDataSource;

import javax.sql.DataSource;
import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.sql.Connection;
import java.sql.SQLException;
import java.sql.Statement;
import java.util.UUID;

/**
 * Test helper that creates the bundled schema in a database.
 */
public final class Schemas {

  private Schemas() {
  }

  /** Fresh in-memory H2 database with the event log tables. */
  public static JdbcDataSource h2() {
    JdbcDataSource dataSource = new JdbcDataSource();
    dataSource.setURL("jdbc:h2:mem:" + UUID.randomUUID() + ";DB_CLOSE_DELAY=-1;LOCK_TIMEOUT=10000");
    apply(dataSource, "h2");
    return dataSource;
  }

  public static void apply(DataSource dataSource, String dialect) {
    String schema = load("/eventlog/schema/" + dialect + ".sql");
    try (Connection conn = dataSource.getConnection(); Statement stmt = conn.createStatement()) {
      for (String sql : schema.split(";")) {
        String trimmed = sql.trim();
        if (!trimmed.isEmpty()) {
          stmt.execute(trimmed);
        }
      }
    } catch (SQLException e) {
      throw new IllegalStateException("Failed to apply " + dialect + " schema", e);
    }
  }

  public static void truncate(DataSource dataSource) {
    try (Connection conn = dataSource.getConnection(); Statement stmt = conn.createStatement()) {
      stmt.execute("DELETE FROM " + TableNames.EVENT_TABLE);
      stmt.execute("DELETE FROM " + TableNames.STREAM_TABLE);
      stmt.execute("DELETE FROM " + TableNames.POSITION_TABLE);
    } catch (SQLException e) {
      throw new IllegalStateException("Failed to clear tables", e);
    }
  }

  private static String load(String path) {
    try (InputStream is = Schemas.class.getResourceAsStream(path)) {
      if (is == null) {
        throw new IllegalStateException("Resource not found: " + path);
      }
      return new String(is.readAllBytes(), StandardCharsets.UTF_8);
    } catch (IOException e) {
      throw new IllegalStateException("Failed to read " + path, e);
    }
  }
}
