package io.agentbus.bus;

import java.time.Instant;
import java.util.Set;

/**
 * A registered interest in one or more event types. Created by {@link EventBus#subscribe},
 * destroyed by {@link EventBus#unsubscribe}.
 */
public final class Subscription {
  private final String id;
  private final Set<String> eventTypes;
  private final EventHandler handler;
  private final Instant createdAt;

  Subscription(String id, Set<String> eventTypes, EventHandler handler) {
    this.id = id;
    this.eventTypes = Set.copyOf(eventTypes);
    this.handler = handler;
    this.createdAt = Instant.now();
  }

  public String id() {
    return id;
  }

  public Set<String> eventTypes() {
    return eventTypes;
  }

  public Instant createdAt() {
    return createdAt;
  }

  EventHandler handler() {
    return handler;
  }

  boolean matches(String eventType) {
    return eventTypes.contains(eventType);
  }

  @Override
  public String toString() {
    return "Subscription{id=" + id + ", eventTypes=" + eventTypes + '}';
  }
}
