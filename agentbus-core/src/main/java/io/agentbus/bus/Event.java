package io.agentbus.bus;

import io.agentbus.util.Ids;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Immutable record of something that happened: type, payload and delivery metadata.
 *
 * <p>Each event gets a ULID {@code id} unless one is supplied. {@code correlationId} groups
 * causally related events and defaults to a fresh ULID, so two unrelated events never share
 * one by accident. The payload is a JSON-compatible map (strings, numbers, booleans, lists,
 * nested maps); it is shallow-copied on construction.
 *
 * @see EventBus#publish(String, Map, PublishOptions)
 */
public final class Event {
  public static final String DEFAULT_SOURCE = "agentbus";

  private final String id;
  private final String type;
  private final Map<String, Object> payload;
  private final Instant timestamp;
  private final String source;
  private final String correlationId;
  private final EventMetadata metadata;

  private Event(Builder builder) {
    this.id = builder.id == null ? Ids.next() : builder.id;
    this.type = Objects.requireNonNull(builder.type, "type");
    if (type.isBlank()) {
      throw new IllegalArgumentException("type cannot be blank");
    }
    this.payload = builder.payload == null
        ? Collections.emptyMap()
        : Collections.unmodifiableMap(new LinkedHashMap<>(builder.payload));
    this.timestamp = builder.timestamp == null ? Instant.now() : builder.timestamp;
    this.source = builder.source == null ? DEFAULT_SOURCE : builder.source;
    this.correlationId = builder.correlationId == null ? Ids.next() : builder.correlationId;
    this.metadata = builder.metadata == null ? EventMetadata.defaults() : builder.metadata;
  }

  public static Builder builder(String type) {
    return new Builder(type);
  }

  public String id() {
    return id;
  }

  public String type() {
    return type;
  }

  public Map<String, Object> payload() {
    return payload;
  }

  public Instant timestamp() {
    return timestamp;
  }

  public String source() {
    return source;
  }

  public String correlationId() {
    return correlationId;
  }

  public EventMetadata metadata() {
    return metadata;
  }

  /**
   * Returns {@code true} if the event carries a ttl and it has elapsed at {@code now}.
   *
   * @param now the reference instant
   * @return whether the event has expired
   */
  public boolean isExpired(Instant now) {
    return metadata.ttlMs() > 0 && timestamp.plusMillis(metadata.ttlMs()).isBefore(now);
  }

  public Event withPayload(Map<String, Object> newPayload) {
    return toBuilder().payload(newPayload).build();
  }

  public Event withMetadata(EventMetadata newMetadata) {
    return toBuilder().metadata(newMetadata).build();
  }

  public Event withRetryCount(int retryCount) {
    return withMetadata(metadata.withRetryCount(retryCount));
  }

  public Event withAttribute(String key, String value) {
    return withMetadata(metadata.withAttribute(key, value));
  }

  /**
   * Returns a builder pre-populated with every field of this event, including its id.
   *
   * @return a new builder
   */
  public Builder toBuilder() {
    return new Builder(type)
        .id(id)
        .payload(payload)
        .timestamp(timestamp)
        .source(source)
        .correlationId(correlationId)
        .metadata(metadata);
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) return true;
    if (!(o instanceof Event other)) return false;
    return id.equals(other.id)
        && type.equals(other.type)
        && payload.equals(other.payload)
        && timestamp.equals(other.timestamp)
        && source.equals(other.source)
        && correlationId.equals(other.correlationId)
        && metadata.equals(other.metadata);
  }

  @Override
  public int hashCode() {
    return Objects.hash(id, type, payload, timestamp, source, correlationId, metadata);
  }

  @Override
  public String toString() {
    return "Event{id=" + id + ", type=" + type + ", source=" + source
        + ", correlationId=" + correlationId + ", retryCount=" + metadata.retryCount() + '}';
  }

  /**
   * Builder for {@link Event}.
   */
  public static final class Builder {
    private final String type;
    private String id;
    private Map<String, Object> payload;
    private Instant timestamp;
    private String source;
    private String correlationId;
    private EventMetadata metadata;

    private Builder(String type) {
      this.type = type;
    }

    /**
     * Optional. Defaults to a monotonic ULID.
     */
    public Builder id(String id) {
      this.id = id;
      return this;
    }

    public Builder payload(Map<String, Object> payload) {
      this.payload = payload;
      return this;
    }

    /**
     * Optional. Defaults to {@link Instant#now()}.
     */
    public Builder timestamp(Instant timestamp) {
      this.timestamp = timestamp;
      return this;
    }

    /**
     * Optional. Defaults to {@value Event#DEFAULT_SOURCE}.
     */
    public Builder source(String source) {
      this.source = source;
      return this;
    }

    /**
     * Optional. Defaults to a fresh ULID.
     */
    public Builder correlationId(String correlationId) {
      this.correlationId = correlationId;
      return this;
    }

    public Builder metadata(EventMetadata metadata) {
      this.metadata = metadata;
      return this;
    }

    public Event build() {
      return new Event(this);
    }
  }
}
