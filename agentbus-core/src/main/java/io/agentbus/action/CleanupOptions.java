package io.agentbus.action;

import java.time.Duration;
import java.util.Objects;

/**
 * Bounds applied by {@link ActionRegistry#cleanup(CleanupOptions)}: entries older than
 * {@code maxAge} are dropped, then the oldest are dropped until each collection fits its limit.
 *
 * @param maxAge        maximum age of history and rollback entries
 * @param historyLimit  maximum retained history entries
 * @param rollbackLimit maximum retained rollback entries
 */
public record CleanupOptions(Duration maxAge, int historyLimit, int rollbackLimit) {

  public static final Duration DEFAULT_MAX_AGE = Duration.ofHours(24);

  public CleanupOptions {
    Objects.requireNonNull(maxAge, "maxAge");
    if (maxAge.isNegative()) {
      throw new IllegalArgumentException("maxAge must be >= 0");
    }
    if (historyLimit < 0 || rollbackLimit < 0) {
      throw new IllegalArgumentException("limits must be >= 0");
    }
  }

  public static CleanupOptions maxAge(Duration maxAge) {
    return new CleanupOptions(maxAge, Integer.MAX_VALUE, Integer.MAX_VALUE);
  }
}
