package io.agentbus;

/**
 * Thrown when an action body fails. The original failure is kept as the cause.
 */
public class ActionExecutionException extends AgentBusException {

  public ActionExecutionException(String message, Throwable cause) {
    super(ErrorCode.EXECUTION, message, true, cause);
  }

  public ActionExecutionException(String message, Throwable cause, boolean retryable) {
    super(ErrorCode.EXECUTION, message, retryable, cause);
  }
}
