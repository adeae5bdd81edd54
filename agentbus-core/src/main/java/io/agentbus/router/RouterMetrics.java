package io.agentbus.router;

/**
 * Point-in-time counters aggregated across every route of an {@link EventRouter}.
 */
public record RouterMetrics(
    long routed,
    long handled,
    long filtered,
    long vetoed,
    long transformed,
    long failed,
    long retried,
    long deadLettered,
    int routes) {
}
