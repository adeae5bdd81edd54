package io.agentbus.transport;

import io.agentbus.ConnectionException;
import io.agentbus.spi.ConnectionListener;
import io.agentbus.spi.TransportSubscription;
import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class InMemoryTransportTest {

  @Test
  void deliversToChannelSubscribersOnly() {
    InMemoryTransport transport = new InMemoryTransport();
    transport.connect();
    List<String> received = new ArrayList<>();
    transport.subscribe("a", (channel, message) -> received.add(channel + "=" + text(message)));
    transport.subscribe("b", (channel, message) -> received.add(channel + "=" + text(message)));

    transport.publish("a", bytes("one"));

    assertEquals(List.of("a=one"), received);
  }

  @Test
  void publishWhileDisconnectedFails() {
    InMemoryTransport transport = new InMemoryTransport();

    assertThrows(ConnectionException.class, () -> transport.publish("a", bytes("x")));
  }

  @Test
  void failingSubscriberDoesNotBlockOthers() {
    InMemoryTransport transport = new InMemoryTransport();
    transport.connect();
    List<String> received = new ArrayList<>();
    transport.subscribe("a", (channel, message) -> {
      throw new IllegalStateException("boom");
    });
    transport.subscribe("a", (channel, message) -> received.add(text(message)));

    transport.publish("a", bytes("still delivered"));

    assertEquals(List.of("still delivered"), received);
  }

  @Test
  void closingSubscriptionStopsDelivery() {
    InMemoryTransport transport = new InMemoryTransport();
    transport.connect();
    List<String> received = new ArrayList<>();
    TransportSubscription subscription =
        transport.subscribe("a", (channel, message) -> received.add(text(message)));

    subscription.close();
    transport.publish("a", bytes("dropped"));

    assertTrue(received.isEmpty());
    assertEquals(0, transport.subscriberCount("a"));
  }

  @Test
  void lifecycleSignals() {
    InMemoryTransport transport = new InMemoryTransport();
    List<String> signals = new ArrayList<>();
    transport.addConnectionListener(new ConnectionListener() {
      @Override
      public void onConnected() {
        signals.add("connected");
      }

      @Override
      public void onReconnecting() {
        signals.add("reconnecting");
      }

      @Override
      public void onError(Throwable error) {
        signals.add("error:" + error.getMessage());
      }
    });

    transport.connect();
    transport.connect();
    transport.simulateDisconnect();
    transport.simulateError(new RuntimeException("socket reset"));
    transport.simulateReconnect();

    assertEquals(List.of("connected", "reconnecting", "error:socket reset", "connected"), signals);
  }

  @Test
  void subscriptionsSurviveReconnect() {
    InMemoryTransport transport = new InMemoryTransport();
    transport.connect();
    List<String> received = new ArrayList<>();
    transport.subscribe("a", (channel, message) -> received.add(text(message)));

    transport.simulateDisconnect();
    assertFalse(transport.isConnected());
    transport.simulateReconnect();
    transport.publish("a", bytes("after"));

    assertEquals(List.of("after"), received);
  }

  @Test
  void closedTransportCannotReconnect() {
    InMemoryTransport transport = new InMemoryTransport();
    transport.connect();
    transport.close();

    assertFalse(transport.isConnected());
    assertThrows(ConnectionException.class, transport::connect);
  }

  private static byte[] bytes(String text) {
    return text.getBytes(StandardCharsets.UTF_8);
  }

  private static String text(byte[] message) {
    return new String(message, StandardCharsets.UTF_8);
  }
}
