package eventlog.demo;

import eventlog.ConcurrencyConflictException;
import eventlog.EventLog;
import eventlog.EventQueryService;
import eventlog.NewEvent;
import eventlog.jdbc.DataSourceConnectionProvider;
import eventlog.jdbc.position.JdbcProjectionPositionStore;
import eventlog.jdbc.store.AbstractJdbcEventLogStore;
import eventlog.jdbc.store.JdbcEventLogStores;
import eventlog.jdbc.tx.JdbcTransactionManager;
import eventlog.jdbc.tx.ThreadLocalTxContext;
import eventlog.projection.ProjectionManager;
import eventlog.projection.ProjectionOrchestrator;
import eventlog.projection.ProjectionRunner;
import eventlog.projection.ProjectionStatus;
import eventlog.projection.RebuildResult;

import org.h2.jdbcx.JdbcDataSource;

import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.sql.Connection;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Statement;
import java.util.List;

/**
 * Appends order events and keeps an order summary read model up to date, without Spring.
 *
 * Run with: mvn -pl samples/eventlog-demo exec:java
 */
public final class EventLogDemo {

  private EventLogDemo() {
  }

  public static void main(String[] args) throws Exception {
    // 1. Setup H2 in-memory database
    JdbcDataSource dataSource = new JdbcDataSource();
    dataSource.setURL("jdbc:h2:mem:eventlog-demo;DB_CLOSE_DELAY=-1");
    createSchema(dataSource);

    // 2. Create core components
    AbstractJdbcEventLogStore store = JdbcEventLogStores.detect(dataSource);
    DataSourceConnectionProvider connectionProvider = new DataSourceConnectionProvider(dataSource);
    ThreadLocalTxContext txContext = new ThreadLocalTxContext();
    EventLog eventLog = EventLog.builder()
        .connectionProvider(connectionProvider)
        .txContext(txContext)
        .store(store)
        .build();
    EventQueryService queries = new EventQueryService(connectionProvider, store);

    System.out.println("=== Event Log Demo ===\n");

    // 3. Append on its own
    eventLog.appendEvent("Order", "order-1", 0, NewEvent.builder("OrderPlaced")
        .payloadJson("{\"customer\":\"alice\"}")
        .correlationId("checkout-1")
        .build());

    // 4. Append to two aggregates in one transaction
    JdbcTransactionManager txManager = new JdbcTransactionManager(connectionProvider, txContext);
    try (JdbcTransactionManager.Transaction tx = txManager.begin()) {
      eventLog.appendEvents("Order", "order-1", 1, List.of(
          NewEvent.ofJson("ItemAdded", "{\"sku\":\"A-1\"}"),
          NewEvent.ofJson("ItemAdded", "{\"sku\":\"B-2\"}")));
      eventLog.appendEvent("Order", "order-2", 0,
          NewEvent.ofJson("OrderPlaced", "{\"customer\":\"bob\"}"));
      tx.commit();
      System.out.println("Transaction committed");
    }

    // 5. Stale expected version is rejected
    try {
      eventLog.appendEvent("Order", "order-1", 1, NewEvent.ofJson("OrderShipped", "{}"));
    } catch (ConcurrencyConflictException e) {
      System.out.println("Rejected stale append: " + e.getMessage());
    }
    eventLog.appendEvent("Order", "order-1", 3, NewEvent.ofJson("OrderShipped", "{}"));

    // 6. Project
    OrderSummaryProjector projector = new OrderSummaryProjector(connectionProvider);
    try (ProjectionManager manager = new ProjectionManager()) {
      manager.register(ProjectionRunner.builder()
          .orchestrator(ProjectionOrchestrator.builder()
              .connectionProvider(connectionProvider)
              .eventLogStore(store)
              .positionStore(new JdbcProjectionPositionStore())
              .projector(projector)
              .build())
          .build());
      manager.start(projector.name());

      eventLog.appendEvent("Order", "order-2", 1, NewEvent.ofJson("OrderCancelled", "{}"));
      manager.runner(projector.name()).poll();
      printStatus(manager.status(projector.name()));

      RebuildResult rebuild = manager.rebuild(projector.name());
      System.out.println("Rebuild: success=" + rebuild.success()
          + ", events=" + rebuild.eventsProcessed() + ", took " + rebuild.duration().toMillis() + " ms");
    }

    // 7. Show final state
    System.out.println("\n=== Event Log ===");
    queries.eventsAfter(null, 100).forEach(e -> System.out.printf("%3d | %-8s | %-8s | v%d | %s%n",
        e.globalSequence(), e.aggregateType(), e.aggregateId(), e.aggregateVersion(), e.eventType()));
    System.out.println("\n=== Order Summary ===");
    showOrderSummary(dataSource);

    System.out.println("\nDemo complete.");
  }

  static void createSchema(JdbcDataSource dataSource) throws SQLException, IOException {
    String schema;
    try (InputStream is = EventLogDemo.class.getResourceAsStream("/eventlog/schema/h2.sql")) {
      if (is == null) {
        throw new IllegalStateException("Bundled H2 schema not found on classpath");
      }
      schema = new String(is.readAllBytes(), StandardCharsets.UTF_8);
    }
    try (Connection conn = dataSource.getConnection(); Statement stmt = conn.createStatement()) {
      for (String sql : schema.split(";")) {
        if (!sql.isBlank()) {
          stmt.execute(sql.trim());
        }
      }
      stmt.execute(OrderSummaryProjector.TABLE_DDL);
    }
  }

  private static void printStatus(ProjectionStatus status) {
    System.out.println("Projection " + status.projectionName() + ": state=" + status.state()
        + ", position=" + status.lastGlobalSequence() + ", lag=" + status.eventLag()
        + ", processed=" + status.eventsProcessed());
  }

  private static void showOrderSummary(JdbcDataSource dataSource) throws SQLException {
    try (Connection conn = dataSource.getConnection();
         Statement stmt = conn.createStatement();
         ResultSet rs = stmt.executeQuery(
             "SELECT order_id, customer, status, item_count FROM order_summary ORDER BY order_id")) {
      System.out.printf("%-10s | %-8s | %-10s | %s%n", "ORDER", "CUSTOMER", "STATUS", "ITEMS");
      System.out.println("-".repeat(44));
      while (rs.next()) {
        System.out.printf("%-10s | %-8s | %-10s | %d%n",
            rs.getString("order_id"), rs.getString("customer"),
            rs.getString("status"), rs.getInt("item_count"));
      }
    }
  }
}
