package io.agentbus.spi;

/**
 * Handle for one channel subscription. Closing it stops delivery to its handler.
 */
public interface TransportSubscription extends AutoCloseable {

  String channel();

  @Override
  void close();
}
