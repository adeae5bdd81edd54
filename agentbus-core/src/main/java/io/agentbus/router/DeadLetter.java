package io.agentbus.router;

import io.agentbus.bus.Event;

import java.time.Instant;

/**
 * A delivery the router gave up on.
 *
 * @param id            identifier of the dead-letter event published to the DLQ channel
 * @param routeId       route whose handler failed
 * @param originalEvent the event as originally delivered, before middleware and transforms
 * @param error         failure message of the last attempt
 * @param stackTrace    stack trace of the last attempt
 * @param attempts      number of attempts made, the first delivery included
 * @param failedAt      when the router gave up
 */
public record DeadLetter(
    String id,
    String routeId,
    Event originalEvent,
    String error,
    String stackTrace,
    int attempts,
    Instant failedAt) {
}
