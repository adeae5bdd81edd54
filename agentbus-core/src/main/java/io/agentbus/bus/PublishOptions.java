package io.agentbus.bus;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Optional settings for {@link EventBus#publish(String, Map, PublishOptions)}.
 *
 * <p>Every field is optional; unset fields fall back to the {@link Event} defaults.
 */
public final class PublishOptions {
  private static final PublishOptions DEFAULTS = builder().build();

  private final String eventId;
  private final String source;
  private final String correlationId;
  private final Priority priority;
  private final long ttlMs;
  private final String schemaVersion;
  private final int retryCount;
  private final Map<String, String> attributes;

  private PublishOptions(Builder builder) {
    if (builder.ttlMs < 0) {
      throw new IllegalArgumentException("ttlMs must be >= 0");
    }
    if (builder.retryCount < 0) {
      throw new IllegalArgumentException("retryCount must be >= 0");
    }
    this.eventId = builder.eventId;
    this.source = builder.source;
    this.correlationId = builder.correlationId;
    this.priority = builder.priority;
    this.ttlMs = builder.ttlMs;
    this.schemaVersion = builder.schemaVersion;
    this.retryCount = builder.retryCount;
    this.attributes = Map.copyOf(builder.attributes);
  }

  public static PublishOptions defaults() {
    return DEFAULTS;
  }

  public static Builder builder() {
    return new Builder();
  }

  public static PublishOptions correlatedWith(String correlationId) {
    return builder().correlationId(correlationId).build();
  }

  public String eventId() {
    return eventId;
  }

  public String source() {
    return source;
  }

  public String correlationId() {
    return correlationId;
  }

  public Priority priority() {
    return priority;
  }

  public long ttlMs() {
    return ttlMs;
  }

  public String schemaVersion() {
    return schemaVersion;
  }

  public int retryCount() {
    return retryCount;
  }

  public Map<String, String> attributes() {
    return attributes;
  }

  EventMetadata toMetadata() {
    return new EventMetadata(schemaVersion, retryCount, priority, ttlMs, attributes);
  }

  public static final class Builder {
    private String eventId;
    private String source;
    private String correlationId;
    private Priority priority;
    private long ttlMs;
    private String schemaVersion;
    private int retryCount;
    private final Map<String, String> attributes = new LinkedHashMap<>();

    private Builder() {
    }

    public Builder eventId(String eventId) {
      this.eventId = eventId;
      return this;
    }

    public Builder source(String source) {
      this.source = source;
      return this;
    }

    public Builder correlationId(String correlationId) {
      this.correlationId = correlationId;
      return this;
    }

    public Builder priority(Priority priority) {
      this.priority = priority;
      return this;
    }

    public Builder ttlMs(long ttlMs) {
      this.ttlMs = ttlMs;
      return this;
    }

    public Builder schemaVersion(String schemaVersion) {
      this.schemaVersion = schemaVersion;
      return this;
    }

    public Builder retryCount(int retryCount) {
      this.retryCount = retryCount;
      return this;
    }

    public Builder attribute(String key, String value) {
      attributes.put(Objects.requireNonNull(key, "key"), Objects.requireNonNull(value, "value"));
      return this;
    }

    public Builder attributes(Map<String, String> attributes) {
      attributes.forEach(this::attribute);
      return this;
    }

    public PublishOptions build() {
      return new PublishOptions(this);
    }
  }
}
