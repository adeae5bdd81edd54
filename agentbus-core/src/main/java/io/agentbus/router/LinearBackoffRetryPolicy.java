package io.agentbus.router;

/**
 * Retry policy whose delay grows linearly with the attempt number.
 *
 * <p>Delay formula: {@code baseDelay * attempt}, capped at {@code maxDelay}. With the router
 * passing {@code retryCount + 1}, the first retry waits {@code baseDelay}, the second twice
 * that, and so on; delays are strictly increasing until the cap. No jitter is applied, so the
 * schedule is deterministic.
 */
public final class LinearBackoffRetryPolicy implements RetryPolicy {
  private final long baseDelayMs;
  private final long maxDelayMs;

  public LinearBackoffRetryPolicy(long baseDelayMs) {
    this(baseDelayMs, Long.MAX_VALUE);
  }

  /**
   * @param baseDelayMs delay for the first retry (milliseconds)
   * @param maxDelayMs  upper bound for any delay (milliseconds)
   */
  public LinearBackoffRetryPolicy(long baseDelayMs, long maxDelayMs) {
    if (baseDelayMs < 0) {
      throw new IllegalArgumentException("baseDelayMs must be >= 0, got: " + baseDelayMs);
    }
    if (maxDelayMs < baseDelayMs) {
      throw new IllegalArgumentException("maxDelayMs must be >= baseDelayMs, got: " + maxDelayMs);
    }
    this.baseDelayMs = baseDelayMs;
    this.maxDelayMs = maxDelayMs;
  }

  public long baseDelayMs() {
    return baseDelayMs;
  }

  @Override
  public long computeDelayMs(int attempt) {
    if (attempt <= 0) {
      return 0L;
    }
    if (baseDelayMs != 0 && attempt > maxDelayMs / baseDelayMs) {
      return maxDelayMs;
    }
    return baseDelayMs * attempt;
  }
}
