package io.agentbus.action;

import java.time.Instant;

/**
 * Identifies the execution a compensator is undoing.
 *
 * @param executionId       the completed execution
 * @param originalTimestamp when its rollback entry was recorded
 */
public record RollbackMeta(String executionId, Instant originalTimestamp) {
}
