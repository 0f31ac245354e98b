package eventlog;

import eventlog.spi.MetricsExporter;
import eventlog.spi.TxContext;
import org.junit.jupiter.api.Test;

import java.sql.Connection;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;

class EventLogTest {

  private final StubConnection connections = new StubConnection();
  private final InMemoryEventLogStore store = new InMemoryEventLogStore();
  private final RecordingMetrics metrics = new RecordingMetrics();

  private EventLog eventLog(TxContext txContext) {
    return EventLog.builder()
        .connectionProvider(connections.provider())
        .txContext(txContext)
        .store(store)
        .metrics(metrics)
        .build();
  }

  @Test
  void appendCommitsOwnTransaction() {
    EventLog log = eventLog(null);

    String streamId = log.appendEvents("Order", "o-1", 0,
        List.of(NewEvent.ofJson("OrderPlaced", "{}"), NewEvent.ofJson("OrderPaid", "{}")));

    assertNotNull(streamId);
    assertEquals(1, connections.commits.get());
    assertEquals(0, connections.rollbacks.get());
    assertEquals(1, connections.closed.get());
    assertEquals(2L, log.streamVersion("Order", "o-1"));
    assertEquals(2, metrics.appended.get());
  }

  @Test
  void conflictRollsBackAndPropagates() {
    EventLog log = eventLog(null);
    log.appendEvent("Order", "o-1", 0, NewEvent.ofJson("OrderPlaced", "{}"));

    ConcurrencyConflictException ex = assertThrows(ConcurrencyConflictException.class,
        () -> log.appendEvent("Order", "o-1", 0, NewEvent.ofJson("OrderPlaced", "{}")));

    assertEquals("Order", ex.aggregateType());
    assertEquals("o-1", ex.aggregateId());
    assertEquals(0, ex.expectedVersion());
    assertEquals(1, ex.actualVersion());
    assertEquals(1, connections.rollbacks.get());
    assertEquals(1, metrics.conflicts.get());
    assertEquals(1L, log.streamVersion("Order", "o-1"));
  }

  @Test
  void validationFailsBeforeTouchingStorage() {
    EventLog log = eventLog(null);
    NewEvent event = NewEvent.ofJson("E", "{}");

    assertThrows(EventValidationException.class, () -> log.appendEvents("", "id", 0, List.of(event)));
    assertThrows(EventValidationException.class, () -> log.appendEvents(null, "id", 0, List.of(event)));
    assertThrows(EventValidationException.class, () -> log.appendEvents("T", " ", 0, List.of(event)));
    assertThrows(EventValidationException.class, () -> log.appendEvents("T", "id", -1, List.of(event)));
    assertThrows(EventValidationException.class, () -> log.appendEvents("T", "id", 0, List.of()));
    assertThrows(EventValidationException.class, () -> log.appendEvents("T", "id", 0, null));
    assertThrows(EventValidationException.class,
        () -> log.appendEvents("T", "id", 0, Arrays.asList(event, null)));
    assertThrows(EventValidationException.class,
        () -> log.appendEvents("T", "id", 0, List.of(event, event)));
    assertThrows(EventValidationException.class,
        () -> log.appendEvents("T".repeat(EventLog.MAX_AGGREGATE_TYPE_LENGTH + 1), "id", 0, List.of(event)));

    assertEquals(0, connections.opened.get());
    assertEquals(0, store.appendCalls.get());
  }

  @Test
  void joinsActiveTransactionWithoutCommitting() {
    Connection txConnection = connections.connection();
    List<Connection> handedOut = new ArrayList<>();
    TxContext active = new TxContext() {
      @Override
      public boolean isTransactionActive() {
        return true;
      }

      @Override
      public Connection currentConnection() {
        handedOut.add(txConnection);
        return txConnection;
      }
    };
    EventLog log = eventLog(active);

    log.appendEvent("Order", "o-1", 0, NewEvent.ofJson("OrderPlaced", "{}"));

    assertEquals(1, handedOut.size());
    assertEquals(0, connections.opened.get());
    assertEquals(0, connections.commits.get());
    assertEquals(0, connections.closed.get());
  }

  @Test
  void builderRequiresStoreAndConnectionProvider() {
    assertThrows(NullPointerException.class, () -> EventLog.builder().store(store).build());
    assertThrows(NullPointerException.class,
        () -> EventLog.builder().connectionProvider(connections.provider()).build());
  }

  @Test
  void streamVersionOfUnknownAggregateIsZero() {
    assertEquals(0L, eventLog(null).streamVersion("Order", "nope"));
  }

  static final class RecordingMetrics implements MetricsExporter {
    final AtomicInteger appended = new AtomicInteger();
    final AtomicInteger conflicts = new AtomicInteger();

    @Override
    public void recordAppended(String aggregateType, int eventCount) {
      appended.addAndGet(eventCount);
    }

    @Override
    public void incrementAppendConflict(String aggregateType) {
      conflicts.incrementAndGet();
    }

    @Override
    public void recordEventApplied(String projectionName, long durationMs) {
    }

    @Override
    public void incrementError(String projectionName) {
    }

    @Override
    public void recordLag(String projectionName, long lag) {
    }
  }
}
