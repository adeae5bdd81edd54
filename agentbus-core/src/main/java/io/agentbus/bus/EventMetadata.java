package io.agentbus.bus;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Delivery metadata attached to every {@link Event}: schema version, retry count, priority,
 * time-to-live and free-form string attributes.
 *
 * <p>Instances are immutable; the {@code with*} methods return modified copies.
 */
public final class EventMetadata {
  public static final String DEFAULT_SCHEMA_VERSION = "1.0";

  private static final EventMetadata DEFAULTS =
      new EventMetadata(DEFAULT_SCHEMA_VERSION, 0, Priority.NORMAL, 0L, Map.of());

  private final String schemaVersion;
  private final int retryCount;
  private final Priority priority;
  private final long ttlMs;
  private final Map<String, String> attributes;

  public EventMetadata(String schemaVersion, int retryCount, Priority priority, long ttlMs,
      Map<String, String> attributes) {
    this.schemaVersion = schemaVersion == null ? DEFAULT_SCHEMA_VERSION : schemaVersion;
    if (retryCount < 0) {
      throw new IllegalArgumentException("retryCount must be >= 0");
    }
    if (ttlMs < 0) {
      throw new IllegalArgumentException("ttlMs must be >= 0");
    }
    this.retryCount = retryCount;
    this.priority = priority == null ? Priority.NORMAL : priority;
    this.ttlMs = ttlMs;
    Map<String, String> copy = attributes == null
        ? Collections.emptyMap()
        : Collections.unmodifiableMap(new LinkedHashMap<>(attributes));
    if (copy.containsKey(null) || copy.containsValue(null)) {
      throw new IllegalArgumentException("attributes cannot contain null keys or values");
    }
    this.attributes = copy;
  }

  public static EventMetadata defaults() {
    return DEFAULTS;
  }

  public String schemaVersion() {
    return schemaVersion;
  }

  public int retryCount() {
    return retryCount;
  }

  public Priority priority() {
    return priority;
  }

  /**
   * Returns the time-to-live in milliseconds, measured from the event timestamp.
   * Zero means the event never expires.
   *
   * @return ttl in milliseconds
   */
  public long ttlMs() {
    return ttlMs;
  }

  public Map<String, String> attributes() {
    return attributes;
  }

  public String attribute(String key) {
    return attributes.get(key);
  }

  public EventMetadata withRetryCount(int retryCount) {
    return new EventMetadata(schemaVersion, retryCount, priority, ttlMs, attributes);
  }

  public EventMetadata withAttribute(String key, String value) {
    Map<String, String> copy = new LinkedHashMap<>(attributes);
    copy.put(Objects.requireNonNull(key, "key"), Objects.requireNonNull(value, "value"));
    return new EventMetadata(schemaVersion, retryCount, priority, ttlMs, copy);
  }

  public EventMetadata withAttributes(Map<String, String> extra) {
    Map<String, String> copy = new LinkedHashMap<>(attributes);
    copy.putAll(extra);
    return new EventMetadata(schemaVersion, retryCount, priority, ttlMs, copy);
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) return true;
    if (!(o instanceof EventMetadata other)) return false;
    return retryCount == other.retryCount
        && ttlMs == other.ttlMs
        && schemaVersion.equals(other.schemaVersion)
        && priority == other.priority
        && attributes.equals(other.attributes);
  }

  @Override
  public int hashCode() {
    return Objects.hash(schemaVersion, retryCount, priority, ttlMs, attributes);
  }

  @Override
  public String toString() {
    return "EventMetadata{schemaVersion=" + schemaVersion + ", retryCount=" + retryCount
        + ", priority=" + priority + ", ttlMs=" + ttlMs + ", attributes=" + attributes + '}';
  }
}
