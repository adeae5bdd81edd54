package io.agentbus;

/**
 * Failure categories surfaced by the bus, the router and the action registry.
 *
 * @see AgentBusException#code()
 */
public enum ErrorCode {
  VALIDATION,
  NOT_FOUND,
  CAPACITY_EXCEEDED,
  CONFLICT,
  TIMEOUT,
  DEPENDENCY,
  EXECUTION,
  ROLLBACK,
  CONNECTION
}
