package io.agentbus.spi;

/**
 * Receives raw messages delivered on a transport channel.
 */
@FunctionalInterface
public interface MessageHandler {

  /**
   * @param channel the channel the message arrived on
   * @param message the encoded message
   */
  void onMessage(String channel, byte[] message);
}
