package io.agentbus.action;

import io.agentbus.AgentBusException;

/**
 * Receives execution outcomes from an {@link ActionRegistry}.
 *
 * <p>Callbacks run on the registry's notification thread, never on the caller's, so a slow
 * listener cannot delay an execution. Exceptions thrown by a listener are logged and ignored.
 */
public interface ActionListener {

  default void onCompleted(Execution execution) {
  }

  default void onFailed(Execution execution, AgentBusException error) {
  }

  /**
   * Called when a call is refused before an execution is created: unknown action, conflict
   * or capacity.
   */
  default void onRejected(String actionId, AgentBusException error) {
  }

  default void onRolledBack(Execution execution, Object rollbackResult) {
  }
}
