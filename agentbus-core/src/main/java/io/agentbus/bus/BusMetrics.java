package io.agentbus.bus;

/**
 * Point-in-time counters of an {@link EventBus}.
 *
 * @param published     events handed to the transport
 * @param received      messages received from the transport
 * @param delivered     handler invocations that completed
 * @param handlerErrors handler invocations that threw
 * @param decodeErrors  inbound messages that could not be decoded
 * @param expired       inbound events dropped because their ttl elapsed
 * @param reconnections times the transport entered the reconnecting state
 * @param subscriptions live subscriptions
 * @param storedEvents  events currently held in the event store
 * @param state         connection state
 */
public record BusMetrics(
    long published,
    long received,
    long delivered,
    long handlerErrors,
    long decodeErrors,
    long expired,
    long reconnections,
    int subscriptions,
    int storedEvents,
    ConnectionState state) {
}
