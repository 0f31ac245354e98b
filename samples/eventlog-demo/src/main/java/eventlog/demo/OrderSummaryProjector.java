package eventlog.demo;

import eventlog.model.DomainEvent;
import eventlog.projection.Projector;
import eventlog.spi.ConnectionProvider;
import eventlog.util.JsonCodec;

import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Statement;
import java.util.Map;

/**
 * Maintains one {@code order_summary} row per order.
 *
 * <p>Each row records the last applied aggregate version; events at or below it are skipped,
 * so redelivered events leave the row unchanged.
 */
public final class OrderSummaryProjector implements Projector {

  public static final String TABLE_DDL = "CREATE TABLE IF NOT EXISTS order_summary (" +
      "order_id VARCHAR(128) PRIMARY KEY," +
      "customer VARCHAR(128)," +
      "status VARCHAR(20) NOT NULL," +
      "item_count INT NOT NULL," +
      "last_version BIGINT NOT NULL)";

  private final ConnectionProvider connectionProvider;
  private final JsonCodec json = JsonCodec.getDefault();

  public OrderSummaryProjector(ConnectionProvider connectionProvider) {
    this.connectionProvider = connectionProvider;
  }

  @Override
  public String name() {
    return "order-summary";
  }

  @Override
  public void apply(DomainEvent event) throws SQLException {
    if (!"Order".equals(event.aggregateType())) {
      return;
    }
    try (Connection conn = connectionProvider.getConnection()) {
      if (event.aggregateVersion() <= lastVersion(conn, event.aggregateId())) {
        return;
      }
      switch (event.eventType()) {
        case "OrderPlaced" -> {
          Map<String, String> payload = json.parseObject(event.payload());
          execute(conn, "INSERT INTO order_summary (order_id, customer, status, item_count, last_version) "
              + "VALUES (?, ?, 'PLACED', 0, ?)", event.aggregateId(), payload.get("customer"),
              event.aggregateVersion());
        }
        case "ItemAdded" -> execute(conn, "UPDATE order_summary SET item_count = item_count + 1, "
            + "last_version = ? WHERE order_id = ?", event.aggregateVersion(), event.aggregateId());
        case "OrderShipped" -> setStatus(conn, event, "SHIPPED");
        case "OrderCancelled" -> setStatus(conn, event, "CANCELLED");
        default -> {
          // other order events do not affect the summary
        }
      }
    }
  }

  @Override
  public void reset() throws SQLException {
    try (Connection conn = connectionProvider.getConnection(); Statement stmt = conn.createStatement()) {
      stmt.execute("DELETE FROM order_summary");
    }
  }

  private static void setStatus(Connection conn, DomainEvent event, String status) throws SQLException {
    execute(conn, "UPDATE order_summary SET status = ?, last_version = ? WHERE order_id = ?",
        status, event.aggregateVersion(), event.aggregateId());
  }

  private static long lastVersion(Connection conn, String orderId) throws SQLException {
    try (PreparedStatement ps = conn.prepareStatement(
        "SELECT last_version FROM order_summary WHERE order_id = ?")) {
      ps.setString(1, orderId);
      try (ResultSet rs = ps.executeQuery()) {
        return rs.next() ? rs.getLong(1) : 0L;
      }
    }
  }

  private static void execute(Connection conn, String sql, Object... params) throws SQLException {
    try (PreparedStatement ps = conn.prepareStatement(sql)) {
      for (int i = 0; i < params.length; i++) {
        ps.setObject(i + 1, params[i]);
      }
      ps.executeUpdate();
    }
  }
}
