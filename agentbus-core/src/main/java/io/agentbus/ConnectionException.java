package io.agentbus;

/**
 * Thrown when the pub/sub transport is not connected. Publishes fail fast instead of
 * being buffered.
 */
public class ConnectionException extends AgentBusException {

  public ConnectionException(String message) {
    super(ErrorCode.CONNECTION, message, true);
  }

  public ConnectionException(String message, Throwable cause) {
    super(ErrorCode.CONNECTION, message, true, cause);
  }
}
