package io.agentbus;

/**
 * Thrown when an operation overlaps with one already in progress, for example a second
 * execution of a non-concurrent action or a duplicate registration.
 */
public class ConflictException extends AgentBusException {

  public ConflictException(String message) {
    super(ErrorCode.CONFLICT, message, true);
  }

  public ConflictException(String message, boolean retryable) {
    super(ErrorCode.CONFLICT, message, retryable);
  }
}
