package io.agentbus.router;

/**
 * Strategy for computing the delay before a failed delivery is attempted again.
 *
 * @see LinearBackoffRetryPolicy
 */
@FunctionalInterface
public interface RetryPolicy {

  /**
   * Computes the delay before the given retry.
   *
   * @param attempt the retry about to be scheduled (1-based)
   * @return delay in milliseconds (non-negative)
   */
  long computeDelayMs(int attempt);
}
