package eventlog;

import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.HashMap;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class NewEventTest {

  @Test
  void defaults() {
    NewEvent event = NewEvent.ofJson("OrderPlaced", "{\"id\":1}");

    assertEquals(26, event.eventId().length(), "ULID");
    assertEquals("OrderPlaced", event.eventType());
    assertEquals(1, event.eventSchemaVersion());
    assertTrue(event.metadata().isEmpty());
    assertNotNull(event.occurredAt());
    assertNull(event.correlationId());
  }

  @Test
  void builderSetsAllFields() {
    Instant at = Instant.parse("2024-01-01T00:00:00Z");
    NewEvent event = NewEvent.builder("OrderPlaced")
        .eventId("e-1")
        .eventSchemaVersion(2)
        .payloadJson("{}")
        .metadata(Map.of("source", "api"))
        .occurredAt(at)
        .causationId("cmd-1")
        .correlationId("corr-1")
        .userId("user-1")
        .build();

    assertEquals("e-1", event.eventId());
    assertEquals(2, event.eventSchemaVersion());
    assertEquals(Map.of("source", "api"), event.metadata());
    assertEquals(at, event.occurredAt());
    assertEquals("cmd-1", event.causationId());
    assertEquals("corr-1", event.correlationId());
    assertEquals("user-1", event.userId());
  }

  @Test
  void idsAreUnique() {
    assertNotEquals(NewEvent.ofJson("E", "{}").eventId(), NewEvent.ofJson("E", "{}").eventId());
  }

  @Test
  void metadataIsCopied() {
    Map<String, String> metadata = new HashMap<>();
    metadata.put("k", "v");
    NewEvent event = NewEvent.builder("E").payloadJson("{}").metadata(metadata).build();
    metadata.put("k2", "v2");

    assertEquals(1, event.metadata().size());
    assertThrows(UnsupportedOperationException.class, () -> event.metadata().put("x", "y"));
  }

  @Test
  void rejectsInvalidInput() {
    assertThrows(EventValidationException.class, () -> NewEvent.ofJson("", "{}"));
    assertThrows(EventValidationException.class, () -> NewEvent.ofJson(null, "{}"));
    assertThrows(EventValidationException.class, () -> NewEvent.ofJson("E", null));
    assertThrows(EventValidationException.class, () -> NewEvent.ofJson("E", " "));
    assertThrows(EventValidationException.class, () -> NewEvent.ofJson("E".repeat(129), "{}"));
    assertThrows(EventValidationException.class,
        () -> NewEvent.builder("E").payloadJson("{}").eventSchemaVersion(0).build());
    Map<String, String> nullValue = new HashMap<>();
    nullValue.put("k", null);
    assertThrows(EventValidationException.class,
        () -> NewEvent.builder("E").payloadJson("{}").metadata(nullValue).build());
    assertThrows(EventValidationException.class,
        () -> NewEvent.builder("E").payloadJson("{}").eventId("e".repeat(65)).build());
    assertThrows(EventValidationException.class,
        () -> NewEvent.builder("E").payloadJson("{}").causationId("c".repeat(65)).build());
    assertThrows(EventValidationException.class,
        () -> NewEvent.builder("E").payloadJson("{}").correlationId("c".repeat(65)).build());
    assertThrows(EventValidationException.class,
        () -> NewEvent.builder("E").payloadJson("{}").userId("u".repeat(129)).build());
  }

  @Test
  void acceptsIdsAtTheirColumnWidths() {
    NewEvent event = NewEvent.builder("E")
        .payloadJson("{}")
        .eventId("e".repeat(NewEvent.MAX_ID_LENGTH))
        .causationId("c".repeat(NewEvent.MAX_ID_LENGTH))
        .correlationId("c".repeat(NewEvent.MAX_ID_LENGTH))
        .userId("u".repeat(NewEvent.MAX_USER_ID_LENGTH))
        .build();

    assertEquals(64, event.eventId().length());
    assertEquals(128, event.userId().length());
  }

  @Test
  void rejectsOversizedPayload() {
    String big = "\"" + "x".repeat(NewEvent.MAX_PAYLOAD_BYTES) + "\"";
    assertThrows(EventValidationException.class, () -> NewEvent.ofJson("E", big));
  }

  @Test
  void validationErrorIsAnIllegalArgument() {
    assertThrows(IllegalArgumentException.class, () -> NewEvent.ofJson("", "{}"));
  }
}
