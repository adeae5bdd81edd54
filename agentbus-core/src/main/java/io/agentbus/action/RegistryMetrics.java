package io.agentbus.action;

/**
 * Point-in-time snapshot of {@link ActionRegistry} counters.
 */
public record RegistryMetrics(
    int registeredActions,
    int running,
    int maxConcurrentActions,
    long executions,
    long successes,
    long failures,
    long timeouts,
    long rejected,
    long rolledBack,
    int pendingRollbacks,
    int historySize
) {
}
