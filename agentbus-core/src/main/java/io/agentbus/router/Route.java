package io.agentbus.router;

import io.agentbus.bus.EventHandler;

import java.time.Instant;
import java.util.Set;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Binding of one or more event types to a handler, created by {@link EventRouter#addRoute}
 * and live until {@link EventRouter#removeRoute}.
 */
public final class Route {
  private final String id;
  private final Set<String> eventTypes;
  private final EventHandler handler;
  private final RouteOptions options;
  private final Instant createdAt = Instant.now();
  private volatile String subscriptionId;

  private final AtomicLong routed = new AtomicLong();
  private final AtomicLong handled = new AtomicLong();
  private final AtomicLong filtered = new AtomicLong();
  private final AtomicLong transformed = new AtomicLong();
  private final AtomicLong errors = new AtomicLong();
  private final AtomicLong retried = new AtomicLong();
  private final AtomicLong deadLettered = new AtomicLong();
  private volatile Instant lastHandledAt;

  Route(String id, Set<String> eventTypes, EventHandler handler, RouteOptions options) {
    this.id = id;
    this.eventTypes = Set.copyOf(eventTypes);
    this.handler = handler;
    this.options = options;
  }

  public String id() {
    return id;
  }

  public Set<String> eventTypes() {
    return eventTypes;
  }

  public RouteOptions options() {
    return options;
  }

  public Instant createdAt() {
    return createdAt;
  }

  public RouteMetrics metrics() {
    return new RouteMetrics(routed.get(), handled.get(), filtered.get(), transformed.get(),
        errors.get(), retried.get(), deadLettered.get(), lastHandledAt);
  }

  EventHandler handler() {
    return handler;
  }

  String subscriptionId() {
    return subscriptionId;
  }

  void subscriptionId(String subscriptionId) {
    this.subscriptionId = subscriptionId;
  }

  void recordRouted() {
    routed.incrementAndGet();
  }

  void recordHandled() {
    handled.incrementAndGet();
    lastHandledAt = Instant.now();
  }

  void recordFiltered() {
    filtered.incrementAndGet();
  }

  void recordTransformed() {
    transformed.incrementAndGet();
  }

  void recordError() {
    errors.incrementAndGet();
  }

  void recordRetried() {
    retried.incrementAndGet();
  }

  void recordDeadLettered() {
    deadLettered.incrementAndGet();
  }

  @Override
  public String toString() {
    return "Route{id=" + id + ", eventTypes=" + eventTypes + ", priority=" + options.priority() + '}';
  }
}
