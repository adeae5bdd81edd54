package io.agentbus.bus;

/**
 * Reacts to events delivered by the {@link EventBus} or routed by the
 * {@linkplain io.agentbus.router.EventRouter router}.
 *
 * <h2>Idempotency</h2>
 * <p>Delivery is at-least-once: the same event may arrive more than once, for example around
 * a transport reconnect or after a router retry. Handlers with side effects must be
 * idempotent; use {@link Event#id()} (and {@code metadata().retryCount()}) to deduplicate.
 */
@FunctionalInterface
public interface EventHandler {

  /**
   * @param event the delivered event
   * @throws Exception if processing fails; the router retries or dead-letters the event
   */
  void onEvent(Event event) throws Exception;
}
