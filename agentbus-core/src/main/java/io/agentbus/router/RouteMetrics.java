package io.agentbus.router;

import java.time.Instant;

/**
 * Point-in-time counters of one route.
 *
 * @param routed        events that entered the route's pipeline, retries included
 * @param handled       handler invocations that completed
 * @param filtered      events dropped by a filter or middleware veto
 * @param transformed   events that went through at least one transformer
 * @param errors        deliveries whose pipeline or handler threw
 * @param retried       retries scheduled
 * @param deadLettered  deliveries given up on
 * @param lastHandledAt completion time of the last successful delivery, {@code null} if none
 */
public record RouteMetrics(
    long routed,
    long handled,
    long filtered,
    long transformed,
    long errors,
    long retried,
    long deadLettered,
    Instant lastHandledAt) {
}
