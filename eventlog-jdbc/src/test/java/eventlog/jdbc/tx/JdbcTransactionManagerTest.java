package eventlog.jdbc.tx;

import eventlog.ConcurrencyConflictException;
import eventlog.EventLog;
import eventlog.EventQueryService;
import eventlog.NewEvent;
import eventlog.jdbc.DataSourceConnectionProvider;
import eventlog.jdbc.Schemas;
import eventlog.jdbc.store.H2EventLogStore;
import org.h2.jdbcx.JdbcDataSource;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.sql.Connection;
import java.sql.ResultSet;
import java.sql.SQLException;

import static org.junit.jupiter.api.Assertions.*;

class JdbcTransactionManagerTest {
  private JdbcDataSource dataSource;
  private ThreadLocalTxContext txContext;
  private JdbcTransactionManager txManager;
  private EventLog eventLog;
  private EventQueryService queries;

  @BeforeEach
  void setUp() throws SQLException {
    dataSource = Schemas.h2();
    try (Connection conn = dataSource.getConnection()) {
      conn.createStatement().execute("CREATE TABLE orders (id VARCHAR(36) PRIMARY KEY, status VARCHAR(20))");
    }
    DataSourceConnectionProvider connectionProvider = new DataSourceConnectionProvider(dataSource);
    H2EventLogStore store = new H2EventLogStore();
    txContext = new ThreadLocalTxContext();
    txManager = new JdbcTransactionManager(connectionProvider, txContext);
    eventLog = EventLog.builder()
        .connectionProvider(connectionProvider)
        .txContext(txContext)
        .store(store)
        .build();
    queries = new EventQueryService(connectionProvider, store);
  }

  @Test
  void constructorRejectsNulls() {
    assertThrows(NullPointerException.class, () -> new JdbcTransactionManager(null, txContext));
    assertThrows(NullPointerException.class,
        () -> new JdbcTransactionManager(new DataSourceConnectionProvider(dataSource), null));
  }

  @Test
  void appendCommitsWithBusinessWrite() throws SQLException {
    try (JdbcTransactionManager.Transaction tx = txManager.begin()) {
      assertTrue(txContext.isTransactionActive());
      assertSame(tx.connection(), txContext.currentConnection());
      insertOrder(tx.connection(), "o-1");
      eventLog.appendEvent("Order", "o-1", 0, NewEvent.ofJson("OrderPlaced", "{}"));
      tx.commit();
    }

    assertFalse(txContext.isTransactionActive());
    assertEquals(1, countOrders());
    assertEquals(1L, queries.countAfter(null));
  }

  @Test
  void closeWithoutCommitRollsBackBoth() throws SQLException {
    try (JdbcTransactionManager.Transaction tx = txManager.begin()) {
      insertOrder(tx.connection(), "o-1");
      eventLog.appendEvent("Order", "o-1", 0, NewEvent.ofJson("OrderPlaced", "{}"));
    }

    assertFalse(txContext.isTransactionActive());
    assertEquals(0, countOrders());
    assertFalse(queries.streamExists("Order", "o-1"));
  }

  @Test
  void conflictInsideTransactionLeavesRollbackToCaller() throws SQLException {
    eventLog.appendEvent("Order", "o-1", 0, NewEvent.ofJson("OrderPlaced", "{}"));

    try (JdbcTransactionManager.Transaction tx = txManager.begin()) {
      insertOrder(tx.connection(), "o-1");
      assertThrows(ConcurrencyConflictException.class,
          () -> eventLog.appendEvent("Order", "o-1", 0, NewEvent.ofJson("OrderPlaced", "{}")));
      tx.rollback();
    }

    assertEquals(0, countOrders());
    assertEquals(1L, eventLog.streamVersion("Order", "o-1"));
  }

  @Test
  void nestedBeginIsRejected() throws SQLException {
    try (JdbcTransactionManager.Transaction ignored = txManager.begin()) {
      assertThrows(IllegalStateException.class, () -> txManager.begin());
    }
    assertFalse(txContext.isTransactionActive());
  }

  @Test
  void currentConnectionWithoutTransactionFails() {
    assertThrows(IllegalStateException.class, () -> txContext.currentConnection());
  }

  private static void insertOrder(Connection conn, String id) throws SQLException {
    conn.createStatement().execute("INSERT INTO orders (id, status) VALUES ('" + id + "', 'PLACED')");
  }

  private int countOrders() throws SQLException {
    try (Connection conn = dataSource.getConnection();
         ResultSet rs = conn.createStatement().executeQuery("SELECT COUNT(*) FROM orders")) {
      rs.next();
      return rs.getInt(1);
    }
  }
}
