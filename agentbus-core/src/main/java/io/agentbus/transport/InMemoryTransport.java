package io.agentbus.transport;

import io.agentbus.ConnectionException;
import io.agentbus.spi.ConnectionListener;
import io.agentbus.spi.MessageHandler;
import io.agentbus.spi.PubSubTransport;
import io.agentbus.spi.TransportSubscription;

import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.function.Consumer;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * In-process loopback transport.
 *
 * <p>Messages are delivered synchronously on the publishing thread to every handler
 * subscribed to the channel at the time of the publish. Subscriptions survive
 * {@link #simulateDisconnect()} / {@link #simulateReconnect()} cycles, which drive the
 * same lifecycle signals a networked transport emits.
 *
 * <p>This class is thread-safe.
 */
public final class InMemoryTransport implements PubSubTransport {
  private static final Logger logger = Logger.getLogger(InMemoryTransport.class.getName());

  private final Map<String, CopyOnWriteArrayList<LocalSubscription>> channels = new ConcurrentHashMap<>();
  private final List<ConnectionListener> listeners = new CopyOnWriteArrayList<>();
  private final AtomicBoolean connected = new AtomicBoolean(false);
  private final AtomicBoolean closed = new AtomicBoolean(false);

  @Override
  public void connect() {
    if (closed.get()) {
      throw new ConnectionException("Transport has been closed");
    }
    if (connected.compareAndSet(false, true)) {
      notifyListeners(ConnectionListener::onConnected);
    }
  }

  @Override
  public boolean isConnected() {
    return connected.get();
  }

  @Override
  public void publish(String channel, byte[] message) {
    Objects.requireNonNull(channel, "channel");
    Objects.requireNonNull(message, "message");
    if (!connected.get()) {
      throw new ConnectionException("Transport not connected, cannot publish to " + channel);
    }
    List<LocalSubscription> subscribers = channels.get(channel);
    if (subscribers == null) {
      return;
    }
    for (LocalSubscription subscription : subscribers) {
      try {
        subscription.handler.onMessage(channel, message.clone());
      } catch (RuntimeException e) {
        logger.log(Level.WARNING, "Subscriber on channel " + channel + " failed", e);
      }
    }
  }

  @Override
  public TransportSubscription subscribe(String channel, MessageHandler handler) {
    Objects.requireNonNull(channel, "channel");
    Objects.requireNonNull(handler, "handler");
    LocalSubscription subscription = new LocalSubscription(channel, handler);
    channels.computeIfAbsent(channel, ignored -> new CopyOnWriteArrayList<>()).add(subscription);
    return subscription;
  }

  @Override
  public void addConnectionListener(ConnectionListener listener) {
    listeners.add(Objects.requireNonNull(listener, "listener"));
  }

  /**
   * Drops the connection and signals {@link ConnectionListener#onReconnecting()}.
   */
  public void simulateDisconnect() {
    if (connected.compareAndSet(true, false)) {
      notifyListeners(ConnectionListener::onReconnecting);
    }
  }

  /**
   * Restores a dropped connection and signals {@link ConnectionListener#onConnected()}.
   */
  public void simulateReconnect() {
    if (!closed.get() && connected.compareAndSet(false, true)) {
      notifyListeners(ConnectionListener::onConnected);
    }
  }

  /**
   * Signals a transport error without changing the connection state.
   *
   * @param error the error to report
   */
  public void simulateError(Throwable error) {
    notifyListeners(listener -> listener.onError(error));
  }

  /**
   * Returns the number of live subscriptions on a channel.
   *
   * @param channel the channel name
   * @return subscriber count, zero if none
   */
  public int subscriberCount(String channel) {
    List<LocalSubscription> subscribers = channels.get(channel);
    return subscribers == null ? 0 : subscribers.size();
  }

  @Override
  public void close() {
    if (closed.compareAndSet(false, true)) {
      connected.set(false);
      channels.clear();
    }
  }

  private void notifyListeners(Consumer<ConnectionListener> signal) {
    for (ConnectionListener listener : listeners) {
      try {
        signal.accept(listener);
      } catch (RuntimeException e) {
        logger.log(Level.WARNING, "Connection listener failed", e);
      }
    }
  }

  private final class LocalSubscription implements TransportSubscription {
    private final String channel;
    private final MessageHandler handler;

    private LocalSubscription(String channel, MessageHandler handler) {
      this.channel = channel;
      this.handler = handler;
    }

    @Override
    public String channel() {
      return channel;
    }

    @Override
    public void close() {
      List<LocalSubscription> subscribers = channels.get(channel);
      if (subscribers != null) {
        subscribers.remove(this);
      }
    }
  }
}
