package io.agentbus.bus;

import io.agentbus.ConnectionException;
import io.agentbus.NotFoundException;
import io.agentbus.ValidationException;
import io.agentbus.spi.ConnectionListener;
import io.agentbus.spi.MetricsExporter;
import io.agentbus.spi.PubSubTransport;
import io.agentbus.spi.TransportSubscription;
import io.agentbus.util.Ids;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentSkipListMap;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.atomic.AtomicReference;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Publishes typed events to named transport channels and dispatches inbound events to local
 * subscriptions.
 *
 * <p>Every event type maps to the channel {@code <namespace>:events:<type>}. The bus opens one
 * transport subscription per channel, reference-counted across local subscriptions, and fans
 * inbound events out to every subscription whose type set contains the event's type, in
 * subscription order. Handler failures are logged and counted; they never reach the
 * transport.
 *
 * <h2>Delivery</h2>
 * <p>At-least-once, no deduplication. While the transport is disconnected, {@link #publish}
 * fails fast with {@link ConnectionException} instead of buffering.
 *
 * <h2>Event store</h2>
 * <p>When persistence is enabled (the default) published and received events are kept in a
 * bounded {@link EventStore} for {@link #getEvent}, {@link #getEventsByCorrelation} and
 * {@link #getEventsByType}.
 *
 * <p>Create instances via {@link #builder()}. This class is thread-safe.
 */
public final class EventBus implements AutoCloseable {
  private static final Logger logger = Logger.getLogger(EventBus.class.getName());

  private final PubSubTransport transport;
  private final String namespace;
  private final EventStore store;
  private final EventCodec codec;
  private final MetricsExporter metrics;

  private final Map<String, Subscription> subscriptions = new ConcurrentSkipListMap<>();
  private final Map<String, ChannelBinding> channels = new HashMap<>();
  private final Map<String, EventSchema> schemas = new ConcurrentHashMap<>();
  private final AtomicReference<ConnectionState> state = new AtomicReference<>(ConnectionState.DISCONNECTED);

  private final AtomicLong published = new AtomicLong();
  private final AtomicLong received = new AtomicLong();
  private final AtomicLong delivered = new AtomicLong();
  private final AtomicLong handlerErrors = new AtomicLong();
  private final AtomicLong decodeErrors = new AtomicLong();
  private final AtomicLong expired = new AtomicLong();
  private final AtomicLong reconnections = new AtomicLong();

  private EventBus(Builder builder) {
    this.transport = Objects.requireNonNull(builder.transport, "transport");
    this.namespace = Objects.requireNonNull(builder.namespace, "namespace");
    if (namespace.isBlank()) {
      throw new IllegalArgumentException("namespace cannot be blank");
    }
    if (builder.maxStoredEvents <= 0) {
      throw new IllegalArgumentException("maxStoredEvents must be > 0");
    }
    this.store = builder.persistEvents ? new EventStore(builder.maxStoredEvents) : null;
    this.codec = builder.codec != null ? builder.codec : new EventCodec();
    this.metrics = builder.metrics != null ? builder.metrics : MetricsExporter.NOOP;
    transport.addConnectionListener(new LifecycleListener());
  }

  public static Builder builder() {
    return new Builder();
  }

  /**
   * Connects the underlying transport. Idempotent.
   *
   * @throws ConnectionException if the bus has been closed or the transport refuses
   */
  public void connect() {
    if (state.get() == ConnectionState.CLOSED) {
      throw new ConnectionException("EventBus has been closed");
    }
    transport.connect();
    if (transport.isConnected()) {
      state.compareAndSet(ConnectionState.DISCONNECTED, ConnectionState.CONNECTED);
    }
  }

  public ConnectionState state() {
    return state.get();
  }

  public String namespace() {
    return namespace;
  }

  /**
   * Returns the transport channel that carries events of the given type.
   *
   * @param eventType the event type
   * @return {@code <namespace>:events:<eventType>}
   */
  public String channelFor(String eventType) {
    return namespace + ":events:" + eventType;
  }

  /**
   * Registers the payload schema enforced on publish for {@code schema.eventType()},
   * replacing any previous one.
   *
   * @param schema the schema
   */
  public void registerSchema(EventSchema schema) {
    schemas.put(schema.eventType(), schema);
  }

  public Optional<EventSchema> schemaFor(String eventType) {
    return Optional.ofNullable(schemas.get(eventType));
  }

  public String publish(String type, Map<String, Object> payload) {
    return publish(type, payload, PublishOptions.defaults());
  }

  /**
   * Builds an event and sends it to the channel for {@code type}.
   *
   * @param type    the event type
   * @param payload the event payload, may be {@code null}
   * @param options optional id, source, correlation and metadata settings
   * @return the id of the published event
   * @throws ConnectionException if the transport is not connected
   * @throws ValidationException if the payload violates the schema registered for {@code type}
   *     or cannot be serialized
   */
  public String publish(String type, Map<String, Object> payload, PublishOptions options) {
    Objects.requireNonNull(options, "options");
    Event event = Event.builder(type)
        .id(options.eventId())
        .payload(payload)
        .source(options.source())
        .correlationId(options.correlationId())
        .metadata(options.toMetadata())
        .build();
    publishEvent(event);
    return event.id();
  }

  /**
   * Sends an already-built event, keeping its id, timestamp and metadata. Used to republish
   * dead letters and action outcomes.
   *
   * @param event the event to send
   * @throws ConnectionException if the transport is not connected
   * @throws ValidationException if the payload violates the schema registered for its type or
   *     cannot be serialized; nothing is stored or sent in that case
   */
  public void publishEvent(Event event) {
    Objects.requireNonNull(event, "event");
    if (state.get() != ConnectionState.CONNECTED || !transport.isConnected()) {
      throw new ConnectionException("EventBus not connected (state=" + state.get()
          + "), cannot publish " + event.type());
    }
    EventSchema schema = schemas.get(event.type());
    if (schema != null) {
      List<String> violations = schema.validate(event.payload());
      if (!violations.isEmpty()) {
        throw new ValidationException("Invalid payload for " + event.type(), violations);
      }
    }
    byte[] message;
    try {
      message = codec.encode(event);
    } catch (EventCodec.CodecException e) {
      throw new ValidationException("Unserializable payload for " + event.type(),
          List.of(String.valueOf(e.getMessage())));
    }
    if (store != null) {
      store.put(event);
    }
    transport.publish(channelFor(event.type()), message);
    published.incrementAndGet();
    metrics.incrementPublished();
    if (logger.isLoggable(Level.FINE)) {
      logger.fine("Published " + event);
    }
  }

  public String subscribe(String eventType, EventHandler handler) {
    return subscribe(Set.of(eventType), handler);
  }

  /**
   * Registers {@code handler} for every type in {@code eventTypes}.
   *
   * @param eventTypes one or more event types
   * @param handler    the handler to invoke
   * @return the subscription id
   */
  public String subscribe(Collection<String> eventTypes, EventHandler handler) {
    Objects.requireNonNull(handler, "handler");
    Set<String> types = new LinkedHashSet<>(Objects.requireNonNull(eventTypes, "eventTypes"));
    if (types.isEmpty()) {
      throw new IllegalArgumentException("eventTypes cannot be empty");
    }
    for (String type : types) {
      if (type == null || type.isBlank()) {
        throw new IllegalArgumentException("eventTypes cannot contain blank types");
      }
    }
    Subscription subscription = new Subscription(Ids.next(), types, handler);
    synchronized (channels) {
      for (String type : types) {
        ChannelBinding binding = channels.get(type);
        if (binding == null) {
          TransportSubscription ts = transport.subscribe(channelFor(type), this::onMessage);
          binding = new ChannelBinding(ts);
          channels.put(type, binding);
        }
        binding.refCount++;
      }
      subscriptions.put(subscription.id(), subscription);
    }
    logger.log(Level.FINE, "Subscribed {0} to {1}", new Object[]{subscription.id(), types});
    return subscription.id();
  }

  /**
   * Removes a subscription and releases its transport channels.
   *
   * @param subscriptionId the id returned by {@link #subscribe}
   * @throws NotFoundException if the id is unknown
   */
  public void unsubscribe(String subscriptionId) {
    synchronized (channels) {
      Subscription removed = subscriptions.remove(subscriptionId);
      if (removed == null) {
        throw new NotFoundException("Subscription not found: " + subscriptionId);
      }
      for (String type : removed.eventTypes()) {
        ChannelBinding binding = channels.get(type);
        if (binding != null && --binding.refCount == 0) {
          channels.remove(type);
          binding.subscription.close();
        }
      }
    }
  }

  public List<Subscription> subscriptions() {
    return new ArrayList<>(subscriptions.values());
  }

  public Optional<Event> getEvent(String eventId) {
    return store == null ? Optional.empty() : store.get(eventId);
  }

  public List<Event> getEventsByCorrelation(String correlationId) {
    return store == null ? List.of() : store.byCorrelation(correlationId);
  }

  public List<Event> getEventsByType(String eventType) {
    return store == null ? List.of() : store.byType(eventType);
  }

  public List<Event> recentEvents(int limit) {
    return store == null ? List.of() : store.recent(limit);
  }

  public BusMetrics metrics() {
    return new BusMetrics(
        published.get(),
        received.get(),
        delivered.get(),
        handlerErrors.get(),
        decodeErrors.get(),
        expired.get(),
        reconnections.get(),
        subscriptions.size(),
        store == null ? 0 : store.size(),
        state.get());
  }

  private void onMessage(String channel, byte[] message) {
    received.incrementAndGet();
    Event event;
    try {
      event = codec.decode(message);
    } catch (EventCodec.CodecException e) {
      decodeErrors.incrementAndGet();
      logger.log(Level.WARNING, "Dropping undecodable message on " + channel, e);
      return;
    }
    if (event.isExpired(Instant.now())) {
      expired.incrementAndGet();
      logger.log(Level.FINE, "Dropping expired event {0}", event.id());
      return;
    }
    if (store != null) {
      store.put(event);
    }
    for (Subscription subscription : subscriptions.values()) {
      if (!subscription.matches(event.type())) {
        continue;
      }
      try {
        subscription.handler().onEvent(event);
        delivered.incrementAndGet();
        metrics.incrementDelivered();
      } catch (Exception e) {
        handlerErrors.incrementAndGet();
        metrics.incrementHandlerErrors();
        logger.log(Level.WARNING, "Subscription " + subscription.id()
            + " failed handling " + event, e);
      }
    }
  }

  /**
   * Releases every transport subscription. The transport itself stays open; its owner
   * closes it.
   */
  @Override
  public void close() {
    if (state.getAndSet(ConnectionState.CLOSED) == ConnectionState.CLOSED) {
      return;
    }
    synchronized (channels) {
      for (ChannelBinding binding : channels.values()) {
        try {
          binding.subscription.close();
        } catch (RuntimeException e) {
          logger.log(Level.WARNING, "Failed to close channel " + binding.subscription.channel(), e);
        }
      }
      channels.clear();
      subscriptions.clear();
    }
  }

  private static final class ChannelBinding {
    private final TransportSubscription subscription;
    private int refCount;

    private ChannelBinding(TransportSubscription subscription) {
      this.subscription = subscription;
    }
  }

  private final class LifecycleListener implements ConnectionListener {
    @Override
    public void onConnected() {
      ConnectionState previous = state.get();
      if (previous == ConnectionState.CLOSED) {
        return;
      }
      if (state.compareAndSet(previous, ConnectionState.CONNECTED)
          && previous == ConnectionState.RECONNECTING) {
        logger.info("Transport reconnected for namespace " + namespace);
      }
    }

    @Override
    public void onReconnecting() {
      ConnectionState previous = state.get();
      if (previous == ConnectionState.CLOSED) {
        return;
      }
      if (state.compareAndSet(previous, ConnectionState.RECONNECTING)) {
        reconnections.incrementAndGet();
        metrics.incrementReconnections();
        logger.warning("Transport connection lost for namespace " + namespace + ", reconnecting");
      }
    }

    @Override
    public void onError(Throwable error) {
      logger.log(Level.WARNING, "Transport error for namespace " + namespace, error);
    }
  }

  /** Builder for {@link EventBus}. */
  public static final class Builder {
    private PubSubTransport transport;
    private String namespace = "agentbus";
    private boolean persistEvents = true;
    private int maxStoredEvents = 1000;
    private EventCodec codec;
    private MetricsExporter metrics;

    private Builder() {
    }

    /**
     * <b>Required.</b>
     */
    public Builder transport(PubSubTransport transport) {
      this.transport = transport;
      return this;
    }

    /**
     * Optional. Defaults to {@code "agentbus"}.
     */
    public Builder namespace(String namespace) {
      this.namespace = namespace;
      return this;
    }

    /**
     * Optional. Defaults to {@code true}.
     */
    public Builder persistEvents(boolean persistEvents) {
      this.persistEvents = persistEvents;
      return this;
    }

    /**
     * Optional. Defaults to {@code 1000}. Must be &gt; 0.
     */
    public Builder maxStoredEvents(int maxStoredEvents) {
      this.maxStoredEvents = maxStoredEvents;
      return this;
    }

    public Builder codec(EventCodec codec) {
      this.codec = codec;
      return this;
    }

    /**
     * Optional. Defaults to {@link MetricsExporter#NOOP}.
     */
    public Builder metrics(MetricsExporter metrics) {
      this.metrics = metrics;
      return this;
    }

    /**
     * Builds the bus. The transport is not connected until {@link EventBus#connect()}.
     *
     * @return a new event bus
     * @throws NullPointerException     if {@code transport} or {@code namespace} is null
     * @throws IllegalArgumentException if {@code maxStoredEvents <= 0} or the namespace is blank
     */
    public EventBus build() {
      return new EventBus(this);
    }
  }
}
