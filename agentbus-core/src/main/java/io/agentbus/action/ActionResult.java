package io.agentbus.action;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * What an action body returns: a logical result plus, for compensable actions, the data its
 * compensator needs.
 *
 * <p>The registry splits the two: callers see only {@link #result()}, and
 * {@link #rollbackData()} goes to the rollback ledger when the action is rollbackable.
 */
public final class ActionResult {
  private static final ActionResult EMPTY = new ActionResult(null, null);

  private final Object result;
  private final Map<String, Object> rollbackData;

  private ActionResult(Object result, Map<String, Object> rollbackData) {
    this.result = result;
    this.rollbackData = rollbackData == null
        ? null
        : Collections.unmodifiableMap(new LinkedHashMap<>(rollbackData));
  }

  public static ActionResult empty() {
    return EMPTY;
  }

  public static ActionResult of(Object result) {
    return new ActionResult(result, null);
  }

  public static ActionResult withRollback(Object result, Map<String, Object> rollbackData) {
    return new ActionResult(result, rollbackData);
  }

  public Object result() {
    return result;
  }

  /**
   * Returns the compensation data, or {@code null} if the body produced none.
   */
  public Map<String, Object> rollbackData() {
    return rollbackData;
  }

  public boolean hasRollbackData() {
    return rollbackData != null;
  }
}
