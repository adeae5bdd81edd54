package io.agentbus.spi;

/**
 * Connection lifecycle signals emitted by a {@link PubSubTransport}.
 *
 * <p>All methods default to no-ops so listeners implement only what they need.
 */
public interface ConnectionListener {

  default void onConnected() {
  }

  default void onError(Throwable error) {
  }

  /**
   * The connection was lost and the transport is trying to restore it.
   */
  default void onReconnecting() {
  }
}
