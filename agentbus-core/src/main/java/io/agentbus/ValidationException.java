package io.agentbus;

import java.util.List;

/**
 * Thrown when an action definition, action parameters or an event payload are invalid.
 *
 * <p>Carries every violation found, not just the first one.
 */
public class ValidationException extends AgentBusException {

  private final List<String> violations;

  public ValidationException(String message, List<String> violations) {
    super(ErrorCode.VALIDATION, message + ": " + String.join("; ", violations), false);
    this.violations = List.copyOf(violations);
  }

  public List<String> violations() {
    return violations;
  }
}
