package io.agentbus;

/**
 * Thrown when an action, execution, subscription, route or rollback entry does not exist.
 */
public class NotFoundException extends AgentBusException {

  public NotFoundException(String message) {
    super(ErrorCode.NOT_FOUND, message, false);
  }
}
