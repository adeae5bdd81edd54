package io.agentbus.router;

import io.agentbus.bus.Event;

/**
 * Maps a routed event to the event its handler receives. Transformers run after all filters,
 * the route's own transformer first, then the global ones in registration order.
 */
@FunctionalInterface
public interface EventTransformer {

  /**
   * @param event the current event
   * @return the replacement event, never {@code null}
   * @throws Exception to fail the delivery (retry / dead-letter handling applies)
   */
  Event apply(Event event) throws Exception;
}
