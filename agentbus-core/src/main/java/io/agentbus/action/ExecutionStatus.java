package io.agentbus.action;

/**
 * Lifecycle of an {@link Execution}: {@code RUNNING} resolves once to {@code COMPLETED} or
 * {@code FAILED}; a completed execution may later become {@code ROLLED_BACK}.
 */
public enum ExecutionStatus {
  RUNNING,
  COMPLETED,
  FAILED,
  ROLLED_BACK;

  public boolean isTerminal() {
    return this != RUNNING;
  }
}
