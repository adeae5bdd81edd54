package io.agentbus.action;

import java.time.Instant;

/**
 * Point-in-time snapshot of an action's execution statistics.
 *
 * <p>{@code executions == successes + failures} holds for every snapshot.
 * {@code avgDurationMs} is the mean duration of successful executions.
 *
 * @param executions     finished executions
 * @param successes      completed executions
 * @param failures       failed executions, including validation, dependency and timeout failures
 * @param avgDurationMs  mean duration of successful executions in milliseconds
 * @param lastResult     result of the most recent successful execution, or {@code null}
 * @param lastExecutedAt when the most recent execution finished, or {@code null}
 */
public record ActionStats(
    long executions,
    long successes,
    long failures,
    double avgDurationMs,
    Object lastResult,
    Instant lastExecutedAt
) {
  static final ActionStats ZERO = new ActionStats(0, 0, 0, 0.0, null, null);

  ActionStats recordSuccess(long durationMs, Object result, Instant at) {
    long n = successes + 1;
    double avg = avgDurationMs + (durationMs - avgDurationMs) / n;
    return new ActionStats(executions + 1, n, failures, avg, result, at);
  }

  ActionStats recordFailure(Instant at) {
    return new ActionStats(executions + 1, successes, failures + 1, avgDurationMs, lastResult, at);
  }
}
