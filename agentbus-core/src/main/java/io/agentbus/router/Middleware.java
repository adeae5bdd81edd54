package io.agentbus.router;

import io.agentbus.bus.Event;

/**
 * Pipeline stage that runs before any filtering, in the order registered with
 * {@link EventRouter#use(Middleware)}.
 *
 * <p>A middleware may pass the event through unchanged, return a modified copy, or veto it by
 * returning {@code null}; a veto stops all further processing for that route. Throwing short
 * circuits the delivery to retry / dead-letter handling, the same as a handler failure.
 *
 * <h2>Example</h2>
 * <pre>{@code
 * router.use(event -> event.withAttribute("receivedBy", nodeName));
 * router.use(event -> blockedSources.contains(event.source()) ? null : event);
 * }</pre>
 */
@FunctionalInterface
public interface Middleware {

  /**
   * @param event the current event
   * @return the event to continue with, or {@code null} to veto
   * @throws Exception to fail the delivery
   */
  Event process(Event event) throws Exception;
}
