package io.agentbus;

import java.util.List;

/**
 * Thrown when one or more declared dependencies of an action cannot be resolved.
 */
public class DependencyException extends AgentBusException {

  private final List<String> unresolved;

  public DependencyException(String actionId, List<String> unresolved) {
    super(ErrorCode.DEPENDENCY,
        "Unresolved dependencies for action " + actionId + ": " + String.join(", ", unresolved), true);
    this.unresolved = List.copyOf(unresolved);
  }

  public List<String> unresolved() {
    return unresolved;
  }
}
