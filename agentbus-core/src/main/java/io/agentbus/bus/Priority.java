package io.agentbus.bus;

import java.util.Locale;

/**
 * Delivery priority advertised in {@link EventMetadata}. Informational for the bus; routes
 * and consumers may act on it.
 */
public enum Priority {
  LOW,
  NORMAL,
  HIGH,
  CRITICAL;

  public String wireName() {
    return name().toLowerCase(Locale.ROOT);
  }

  public static Priority fromString(String raw) {
    if (raw == null || raw.isBlank()) {
      return NORMAL;
    }
    for (Priority value : values()) {
      if (value.name().equalsIgnoreCase(raw)) {
        return value;
      }
    }
    throw new IllegalArgumentException("Unknown priority: " + raw);
  }
}
