package io.agentbus;

/**
 * Thrown when a compensation cannot run or fails. A failed compensation keeps its ledger
 * entry so it can be attempted again.
 */
public class RollbackException extends AgentBusException {

  public RollbackException(String message) {
    super(ErrorCode.ROLLBACK, message, false);
  }

  public RollbackException(String message, Throwable cause) {
    super(ErrorCode.ROLLBACK, message, false, cause);
  }
}
