package io.agentbus.action;

import java.time.Instant;
import java.util.Map;

/**
 * Ledger entry for a completed, rollbackable execution that produced compensation data.
 * Removed when {@link ActionRegistry#rollbackAction} succeeds.
 */
public record RollbackEntry(String executionId, String actionId, Map<String, Object> rollbackData,
    Instant timestamp) {
}
