package io.agentbus.action;

/**
 * Returned by a successful {@link ActionRegistry#executeAction}.
 *
 * @param executionId id of the recorded execution, the key for {@link ActionRegistry#rollbackAction}
 * @param result      the logical result, with any rollback data split off
 * @param durationMs  wall-clock duration in milliseconds
 */
public record ExecutionReceipt(String executionId, Object result, long durationMs) {
}
