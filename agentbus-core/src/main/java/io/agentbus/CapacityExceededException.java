package io.agentbus;

/**
 * Thrown when the action registry is already running its maximum number of executions.
 *
 * <p>Excess load is rejected, never queued.
 */
public class CapacityExceededException extends AgentBusException {

  private final int limit;

  public CapacityExceededException(int limit) {
    super(ErrorCode.CAPACITY_EXCEEDED, "Maximum concurrent actions reached: " + limit, true);
    this.limit = limit;
  }

  public int limit() {
    return limit;
  }
}
