package eventlog;

import com.github.f4b6a3.ulid.UlidCreator;

import java.nio.charset.StandardCharsets;
import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * An event to be appended to an aggregate's stream.
 *
 * <p>Each event is assigned a ULID-based {@code eventId} by default. The JSON payload
 * is limited to {@value #MAX_PAYLOAD_BYTES} bytes. The stream version and global sequence
 * are assigned by the event log at append time.
 *
 * @see EventLog#appendEvents
 */
public final class NewEvent {
    public static final int MAX_PAYLOAD_BYTES = 1024 * 1024; // 1MB
    public static final int MAX_EVENT_TYPE_LENGTH = 128;
    public static final int MAX_ID_LENGTH = 64;
    public static final int MAX_USER_ID_LENGTH = 128;

    private final String eventId;
    private final String eventType;
    private final int eventSchemaVersion;
    private final String payloadJson;
    private final Map<String, String> metadata;
    private final Instant occurredAt;
    private final String causationId;
    private final String correlationId;
    private final String userId;

    private NewEvent(Builder builder) {
        this.eventId = builder.eventId == null ? newEventId() : builder.eventId;
        if (this.eventId.isBlank()) {
            throw new EventValidationException("eventId cannot be blank");
        }
        checkLength("eventId", this.eventId, MAX_ID_LENGTH);
        if (builder.eventType == null || builder.eventType.isBlank()) {
            throw new EventValidationException("eventType cannot be empty");
        }
        if (builder.eventType.length() > MAX_EVENT_TYPE_LENGTH) {
            throw new EventValidationException("eventType exceeds " + MAX_EVENT_TYPE_LENGTH + " characters");
        }
        this.eventType = builder.eventType;
        if (builder.eventSchemaVersion < 1) {
            throw new EventValidationException("eventSchemaVersion must be >= 1, got: " + builder.eventSchemaVersion);
        }
        this.eventSchemaVersion = builder.eventSchemaVersion;

        if (builder.payloadJson == null || builder.payloadJson.isBlank()) {
            throw new EventValidationException("payloadJson is required");
        }
        if (builder.payloadJson.getBytes(StandardCharsets.UTF_8).length > MAX_PAYLOAD_BYTES) {
            throw new EventValidationException("Payload exceeds maximum size of " + MAX_PAYLOAD_BYTES + " bytes");
        }
        this.payloadJson = builder.payloadJson;

        Map<String, String> metadataCopy = builder.metadata == null
                ? Collections.emptyMap()
                : Collections.unmodifiableMap(new LinkedHashMap<>(builder.metadata));
        if (metadataCopy.containsKey(null)) {
            throw new EventValidationException("metadata cannot contain null keys");
        }
        if (metadataCopy.containsValue(null)) {
            throw new EventValidationException("metadata cannot contain null values");
        }
        this.metadata = metadataCopy;

        this.occurredAt = builder.occurredAt == null ? Instant.now() : builder.occurredAt;
        this.causationId = checkLength("causationId", builder.causationId, MAX_ID_LENGTH);
        this.correlationId = checkLength("correlationId", builder.correlationId, MAX_ID_LENGTH);
        this.userId = checkLength("userId", builder.userId, MAX_USER_ID_LENGTH);
    }

    private static String checkLength(String field, String value, int max) {
        if (value != null && value.length() > max) {
            throw new EventValidationException(field + " exceeds " + max + " characters");
        }
        return value;
    }

    public static Builder builder(String eventType) {
        return new Builder(eventType);
    }

    /**
     * Creates an event with the given type and JSON payload and all other fields defaulted.
     */
    public static NewEvent ofJson(String eventType, String payloadJson) {
        return builder(eventType).payloadJson(payloadJson).build();
    }

    public String eventId() {
        return eventId;
    }

    public String eventType() {
        return eventType;
    }

    public int eventSchemaVersion() {
        return eventSchemaVersion;
    }

    public String payloadJson() {
        return payloadJson;
    }

    public Map<String, String> metadata() {
        return metadata;
    }

    public Instant occurredAt() {
        return occurredAt;
    }

    public String causationId() {
        return causationId;
    }

    public String correlationId() {
        return correlationId;
    }

    public String userId() {
        return userId;
    }

    @Override
    public String toString() {
        return "NewEvent{eventId=" + eventId + ", eventType=" + eventType
                + ", eventSchemaVersion=" + eventSchemaVersion + '}';
    }

    /**
     * Builder for {@link NewEvent}.
     */
    public static final class Builder {
        private final String eventType;
        private String eventId;
        private int eventSchemaVersion = 1;
        private String payloadJson;
        private Map<String, String> metadata;
        private Instant occurredAt;
        private String causationId;
        private String correlationId;
        private String userId;

        private Builder(String eventType) {
            this.eventType = eventType;
        }

        /**
         * Sets a custom event identifier.
         *
         * <p>Optional. Defaults to a monotonic ULID.
         *
         * @param eventId the event identifier
         * @return this builder
         */
        public Builder eventId(String eventId) {
            this.eventId = eventId;
            return this;
        }

        /**
         * Sets the payload schema version.
         *
         * <p>Optional. Defaults to {@code 1}.
         *
         * @param eventSchemaVersion the schema version (must be >= 1)
         * @return this builder
         */
        public Builder eventSchemaVersion(int eventSchemaVersion) {
            this.eventSchemaVersion = eventSchemaVersion;
            return this;
        }

        /**
         * Sets the event payload as a JSON document.
         *
         * <p><b>Required.</b> Maximum size: {@value NewEvent#MAX_PAYLOAD_BYTES} bytes (UTF-8).
         *
         * @param payloadJson the JSON payload
         * @return this builder
         */
        public Builder payloadJson(String payloadJson) {
            this.payloadJson = payloadJson;
            return this;
        }

        /**
         * Sets flat key-value metadata. The map is defensively copied at build time.
         *
         * <p>Optional. Defaults to an empty map.
         *
         * @param metadata the metadata
         * @return this builder
         */
        public Builder metadata(Map<String, String> metadata) {
            this.metadata = metadata;
            return this;
        }

        /**
         * Sets the business timestamp.
         *
         * <p>Optional. Defaults to {@link Instant#now()}.
         *
         * @param occurredAt the event timestamp
         * @return this builder
         */
        public Builder occurredAt(Instant occurredAt) {
            this.occurredAt = occurredAt;
            return this;
        }

        public Builder causationId(String causationId) {
            this.causationId = causationId;
            return this;
        }

        public Builder correlationId(String correlationId) {
            this.correlationId = correlationId;
            return this;
        }

        public Builder userId(String userId) {
            this.userId = userId;
            return this;
        }

        /**
         * Builds an immutable {@link NewEvent}.
         *
         * @return a new event
         * @throws EventValidationException if {@code eventType} or the payload is missing,
         *                                  the payload is too large, or metadata contains nulls
         */
        public NewEvent build() {
            return new NewEvent(this);
        }
    }

    private static String newEventId() {
        return UlidCreator.getMonotonicUlid().toString();
    }
}
