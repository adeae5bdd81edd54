package io.agentbus.router;

import io.agentbus.bus.Event;

/**
 * Predicate deciding whether a routed event reaches its handler. A {@code false} result drops
 * the event; it is counted as filtered and never retried.
 */
@FunctionalInterface
public interface EventFilter {

  /**
   * @param event the candidate event
   * @return {@code true} to keep the event
   * @throws Exception to fail the delivery (retry / dead-letter handling applies)
   */
  boolean test(Event event) throws Exception;
}
