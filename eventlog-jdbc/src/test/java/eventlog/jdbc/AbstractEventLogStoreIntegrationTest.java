package eventlog.jdbc;

import eventlog.ConcurrencyConflictException;
import eventlog.EventLog;
import eventlog.EventQueryService;
import eventlog.EventStoreException;
import eventlog.EventValidationException;
import eventlog.NewEvent;
import eventlog.jdbc.store.AbstractJdbcEventLogStore;
import eventlog.model.DomainEvent;
import eventlog.model.EventStream;
import org.junit.jupiter.api.Test;

import javax.sql.DataSource;
import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.Callable;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Store behavior shared by every database. Subclasses provide an empty schema and the store.
 */
abstract class AbstractEventLogStoreIntegrationTest {

  abstract DataSource dataSource();

  abstract AbstractJdbcEventLogStore store();

  EventLog eventLog() {
    return EventLog.builder()
        .connectionProvider(new DataSourceConnectionProvider(dataSource()))
        .store(store())
        .build();
  }

  EventQueryService queries() {
    return new EventQueryService(new DataSourceConnectionProvider(dataSource()), store());
  }

  @Test
  void appendCreatesStreamAndReadsBackEvents() {
    Instant occurredAt = Instant.now().truncatedTo(ChronoUnit.MILLIS);
    NewEvent placed = NewEvent.builder("OrderPlaced")
        .payloadJson("{\"total\":42}")
        .metadata(Map.of("source", "web"))
        .occurredAt(occurredAt)
        .causationId("cmd-1")
        .correlationId("corr-1")
        .userId("alice")
        .build();

    String streamId = eventLog().appendEvent("Order", "o-1", 0, placed);

    EventStream stream = queries().findStream("Order", "o-1").orElseThrow();
    assertEquals(streamId, stream.streamId());
    assertEquals(1L, stream.version());

    List<DomainEvent> events = queries().readStream("Order", "o-1");
    assertEquals(1, events.size());
    DomainEvent event = events.get(0);
    assertEquals(placed.eventId(), event.eventId());
    assertEquals("Order", event.aggregateType());
    assertEquals("o-1", event.aggregateId());
    assertEquals("OrderPlaced", event.eventType());
    assertEquals(1, event.eventSchemaVersion());
    assertEquals(1L, event.aggregateVersion());
    assertTrue(event.payload().contains("\"total\""), event.payload());
    assertEquals(Map.of("source", "web"), event.metadata());
    assertEquals(occurredAt, event.occurredAt().truncatedTo(ChronoUnit.MILLIS));
    assertEquals("cmd-1", event.causationId());
    assertEquals("corr-1", event.correlationId());
    assertEquals("alice", event.userId());
    assertTrue(event.globalSequence() > 0);
  }

  @Test
  void batchGetsContiguousVersionsAndIncreasingSequences() {
    eventLog().appendEvents("Order", "o-1", 0, List.of(
        NewEvent.ofJson("OrderPlaced", "{}"),
        NewEvent.ofJson("ItemAdded", "{}"),
        NewEvent.ofJson("ItemAdded", "{}")));

    List<DomainEvent> events = queries().readStream("Order", "o-1");
    assertEquals(List.of(1L, 2L, 3L), events.stream().map(DomainEvent::aggregateVersion).toList());
    assertTrue(events.get(0).globalSequence() < events.get(1).globalSequence());
    assertTrue(events.get(1).globalSequence() < events.get(2).globalSequence());
    assertEquals(3L, eventLog().streamVersion("Order", "o-1"));
  }

  @Test
  void staleExpectedVersionIsRejectedWithoutPartialWrites() {
    EventLog log = eventLog();
    log.appendEvent("Order", "o-1", 0, NewEvent.ofJson("OrderPlaced", "{}"));

    ConcurrencyConflictException ex = assertThrows(ConcurrencyConflictException.class,
        () -> log.appendEvents("Order", "o-1", 0,
            List.of(NewEvent.ofJson("ItemAdded", "{}"), NewEvent.ofJson("ItemAdded", "{}"))));

    assertEquals(0L, ex.expectedVersion());
    assertEquals(1L, ex.actualVersion());
    assertEquals(1L, log.streamVersion("Order", "o-1"));
    assertEquals(1L, queries().countAfter(null));
  }

  @Test
  void expectedVersionAheadOfNewStreamLeavesNothingBehind() {
    assertThrows(ConcurrencyConflictException.class,
        () -> eventLog().appendEvent("Order", "o-9", 3, NewEvent.ofJson("OrderPlaced", "{}")));

    assertFalse(queries().streamExists("Order", "o-9"));
    assertTrue(queries().latestSequence().isEmpty());
  }

  @Test
  void duplicateEventIdFailsWholeAppend() {
    NewEvent first = NewEvent.ofJson("OrderPlaced", "{}");
    eventLog().appendEvent("Order", "o-1", 0, first);

    NewEvent reused = NewEvent.builder("OrderPlaced").eventId(first.eventId()).payloadJson("{}").build();
    EventStoreException ex = assertThrows(EventStoreException.class,
        () -> eventLog().appendEvent("Order", "o-2", 0, reused));
    assertTrue(ex.getMessage().contains(first.eventId()), ex.getMessage());

    assertFalse(queries().streamExists("Order", "o-2"));
    assertEquals(1L, queries().countAfter(null));
  }

  @Test
  void eventsAfterPagesInGlobalOrderAcrossStreams() {
    EventLog log = eventLog();
    log.appendEvent("Order", "o-1", 0, NewEvent.ofJson("OrderPlaced", "{}"));
    log.appendEvent("Customer", "c-1", 0, NewEvent.ofJson("CustomerRegistered", "{}"));
    log.appendEvent("Order", "o-1", 1, NewEvent.ofJson("OrderPaid", "{}"));

    List<DomainEvent> firstPage = queries().eventsAfter(null, 2);
    assertEquals(List.of("OrderPlaced", "CustomerRegistered"),
        firstPage.stream().map(DomainEvent::eventType).toList());

    List<DomainEvent> secondPage = queries().eventsAfter(firstPage.get(1).globalSequence(), 2);
    assertEquals(1, secondPage.size());
    assertEquals("OrderPaid", secondPage.get(0).eventType());
    assertEquals(secondPage.get(0).globalSequence(), queries().latestSequence().getAsLong());
    assertEquals(0L, queries().countAfter(secondPage.get(0).globalSequence()));
    assertEquals(1L, queries().countAfter(firstPage.get(1).globalSequence()));
  }

  @Test
  void emptyLogHasNoLatestSequence() {
    assertTrue(queries().latestSequence().isEmpty());
    assertEquals(0L, queries().countAfter(null));
    assertTrue(queries().eventsAfter(null, 10).isEmpty());
  }

  @Test
  void readStreamFromVersionAndByCorrelation() {
    EventLog log = eventLog();
    log.appendEvents("Order", "o-1", 0, List.of(
        NewEvent.builder("OrderPlaced").payloadJson("{}").correlationId("flow-1").build(),
        NewEvent.ofJson("ItemAdded", "{}"),
        NewEvent.ofJson("OrderPaid", "{}")));
    log.appendEvent("Payment", "p-1", 0,
        NewEvent.builder("PaymentCaptured").payloadJson("{}").correlationId("flow-1").build());

    assertEquals(List.of(2L, 3L),
        queries().readStream("Order", "o-1", 1).stream().map(DomainEvent::aggregateVersion).toList());
    assertEquals(List.of("OrderPlaced", "PaymentCaptured"),
        queries().eventsByCorrelationId("flow-1").stream().map(DomainEvent::eventType).toList());
    assertTrue(queries().readStream("Order", "missing").isEmpty());
  }

  @Test
  void concurrentAppendsAtSameVersionHaveOneWinner() throws Exception {
    EventLog log = eventLog();
    log.appendEvent("Order", "o-1", 0, NewEvent.ofJson("OrderPlaced", "{}"));

    List<Throwable> failures = race(8, i -> () ->
        log.appendEvent("Order", "o-1", 1, NewEvent.ofJson("ItemAdded", "{\"i\":" + i + "}")));

    assertEquals(7, failures.size(), "failures: " + failures);
    for (Throwable failure : failures) {
      assertInstanceOf(ConcurrencyConflictException.class, failure);
    }
    assertEquals(2L, log.streamVersion("Order", "o-1"));
    assertEquals(2, queries().readStream("Order", "o-1").size());
  }

  @Test
  void concurrentFirstAppendsToNewAggregateHaveOneWinner() throws Exception {
    EventLog log = eventLog();

    List<Throwable> failures = race(8, i -> () ->
        log.appendEvent("Order", "o-new", 0, NewEvent.ofJson("OrderPlaced", "{\"i\":" + i + "}")));

    assertEquals(7, failures.size(), "failures: " + failures);
    for (Throwable failure : failures) {
      assertInstanceOf(ConcurrencyConflictException.class, failure);
    }
    assertEquals(1L, log.streamVersion("Order", "o-new"));
    assertEquals(1, queries().readStream("Order", "o-new").size());
    assertEquals(1L, queries().countAfter(null));
  }

  @Test
  void overlongCausationIdIsRejectedBeforeAnyWrite() {
    EventLog log = eventLog();

    assertThrows(EventValidationException.class, () -> log.appendEvent("Order", "o-1", 0,
        NewEvent.builder("OrderPlaced").payloadJson("{}").causationId("c".repeat(65)).build()));

    assertFalse(queries().streamExists("Order", "o-1"));
  }

  @Test
  void concurrentAppendsToDifferentStreamsGetDistinctSequences() throws Exception {
    EventLog log = eventLog();

    List<Throwable> failures = race(8, i -> () ->
        log.appendEvents("Order", "o-" + i, 0,
            List.of(NewEvent.ofJson("OrderPlaced", "{}"), NewEvent.ofJson("OrderPaid", "{}"))));

    assertTrue(failures.isEmpty(), "failures: " + failures);
    List<DomainEvent> all = queries().eventsAfter(null, 100);
    assertEquals(16, all.size());
    Set<Long> sequences = new HashSet<>();
    all.forEach(e -> sequences.add(e.globalSequence()));
    assertEquals(16, sequences.size());
  }

  interface TaskFactory {
    Callable<String> create(int index);
  }

  private static List<Throwable> race(int threads, TaskFactory factory) throws Exception {
    ExecutorService executor = Executors.newFixedThreadPool(threads);
    CountDownLatch ready = new CountDownLatch(1);
    try {
      List<Future<String>> futures = new ArrayList<>();
      for (int i = 0; i < threads; i++) {
        Callable<String> task = factory.create(i);
        futures.add(executor.submit(() -> {
          ready.await();
          return task.call();
        }));
      }
      ready.countDown();
      List<Throwable> failures = new ArrayList<>();
      for (Future<String> future : futures) {
        try {
          future.get(30, TimeUnit.SECONDS);
        } catch (ExecutionException e) {
          failures.add(e.getCause());
        }
      }
      return failures;
    } finally {
      executor.shutdownNow();
    }
  }
}
