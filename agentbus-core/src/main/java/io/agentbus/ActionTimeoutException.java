package io.agentbus;

/**
 * Thrown when an action body does not finish before its configured deadline.
 */
public class ActionTimeoutException extends AgentBusException {

  private final long timeoutMs;

  public ActionTimeoutException(String actionId, long timeoutMs) {
    super(ErrorCode.TIMEOUT, "Action " + actionId + " timed out after " + timeoutMs + "ms", true);
    this.timeoutMs = timeoutMs;
  }

  public long timeoutMs() {
    return timeoutMs;
  }
}
