package io.agentbus.spi;

/**
 * Pub/sub transport underneath the {@linkplain io.agentbus.bus.EventBus event bus}.
 *
 * <p>Implementations wrap a broker (Redis, NATS, an in-process loopback, ...). Delivery is
 * expected to be at-least-once: a message may arrive twice around a reconnect, so the bus
 * never assumes uniqueness. Subscriptions must survive reconnects.
 *
 * @see io.agentbus.transport.InMemoryTransport
 */
public interface PubSubTransport extends AutoCloseable {

  /**
   * Opens the connection. Calling it on a connected transport is a no-op.
   */
  void connect();

  boolean isConnected();

  /**
   * Sends a message to every subscriber of {@code channel}.
   *
   * @throws io.agentbus.ConnectionException if the transport is not connected
   */
  void publish(String channel, byte[] message);

  TransportSubscription subscribe(String channel, MessageHandler handler);

  void addConnectionListener(ConnectionListener listener);

  @Override
  void close();
}
