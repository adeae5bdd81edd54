package io.agentbus.router;

import io.agentbus.AgentBusException;
import io.agentbus.NotFoundException;
import io.agentbus.bus.Event;
import io.agentbus.bus.EventBus;
import io.agentbus.bus.EventHandler;
import io.agentbus.spi.MetricsExporter;
import io.agentbus.util.DaemonThreadFactory;
import io.agentbus.util.Ids;

import java.io.PrintWriter;
import java.io.StringWriter;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.Executors;
import java.util.concurrent.PriorityBlockingQueue;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ThreadPoolExecutor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicLong;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Binds event types to handlers on top of an {@link EventBus} and owns retry and
 * dead-lettering.
 *
 * <h2>Pipeline</h2>
 * <p>Every event a route receives is processed on a router worker thread, in this order:
 * <ol>
 *   <li>middleware chain ({@link #use}); the first veto stops processing</li>
 *   <li>the route's own filter, then every global filter; any {@code false} drops the event</li>
 *   <li>the route's own transformer, then every global transformer, in registration order</li>
 *   <li>the route handler, with the final event</li>
 * </ol>
 *
 * <h2>Failures</h2>
 * <p>If any stage throws and the route has retry enabled, the original event is scheduled
 * again after {@link RetryPolicy#computeDelayMs(int) retryPolicy.computeDelayMs(retryCount + 1)}
 * carrying {@code retryCount + 1} in its metadata. Retries of one delivery are strictly
 * sequential. Once {@code maxRetries} retries have failed, when retry is disabled, or when the
 * failure is an {@link AgentBusException} that is not {@linkplain AgentBusException#retryable()
 * retryable}, the original event is published to {@code <deadLetterPrefix>.<type>} with failure
 * attributes and recorded in the {@link DeadLetterLog}.
 *
 * <p>Routes for different event types run concurrently on the worker pool; queued work is
 * ordered by route priority. Create instances via {@link #builder()}. This class is thread-safe.
 */
public final class EventRouter implements AutoCloseable {
  private static final Logger logger = Logger.getLogger(EventRouter.class.getName());

  public static final String ATTR_ORIGINAL_EVENT_ID = "dlq.originalEventId";
  public static final String ATTR_ORIGINAL_TYPE = "dlq.originalType";
  public static final String ATTR_ROUTE_ID = "dlq.routeId";
  public static final String ATTR_FAILED_AT = "dlq.failedAt";
  public static final String ATTR_ERROR = "dlq.error";
  public static final String ATTR_STACK = "dlq.stack";
  public static final String ATTR_ATTEMPTS = "dlq.attempts";

  private final EventBus eventBus;
  private final RetryPolicy retryPolicy;
  private final int defaultMaxRetries;
  private final String deadLetterPrefix;
  private final DeadLetterLog deadLetters;
  private final MetricsExporter metrics;
  private final long drainTimeoutMs;

  private final ThreadPoolExecutor workers;
  private final ScheduledExecutorService retryScheduler;
  private final AtomicLong taskSequence = new AtomicLong();
  private final AtomicBoolean closed = new AtomicBoolean(false);

  private final Map<String, Route> routes = new ConcurrentHashMap<>();
  private final List<Middleware> middleware = new CopyOnWriteArrayList<>();
  private volatile Map<String, EventFilter> filters = Map.of();
  private volatile Map<String, EventTransformer> transformers = Map.of();

  private final AtomicLong routed = new AtomicLong();
  private final AtomicLong handled = new AtomicLong();
  private final AtomicLong filtered = new AtomicLong();
  private final AtomicLong vetoed = new AtomicLong();
  private final AtomicLong transformed = new AtomicLong();
  private final AtomicLong failed = new AtomicLong();
  private final AtomicLong retried = new AtomicLong();
  private final AtomicLong deadLettered = new AtomicLong();

  private EventRouter(Builder builder) {
    this.eventBus = Objects.requireNonNull(builder.eventBus, "eventBus");
    if (builder.workerCount <= 0) {
      throw new IllegalArgumentException("workerCount must be > 0");
    }
    if (builder.defaultMaxRetries < 0) {
      throw new IllegalArgumentException("defaultMaxRetries must be >= 0");
    }
    if (builder.deadLetterPrefix == null || builder.deadLetterPrefix.isBlank()) {
      throw new IllegalArgumentException("deadLetterPrefix cannot be blank");
    }
    this.retryPolicy = builder.retryPolicy != null
        ? builder.retryPolicy : new LinearBackoffRetryPolicy(builder.baseDelayMs);
    this.defaultMaxRetries = builder.defaultMaxRetries;
    this.deadLetterPrefix = builder.deadLetterPrefix;
    this.deadLetters = new DeadLetterLog(eventBus, builder.deadLetterCapacity);
    this.metrics = builder.metrics != null ? builder.metrics : MetricsExporter.NOOP;
    this.drainTimeoutMs = builder.drainTimeoutMs;

    this.workers = new ThreadPoolExecutor(builder.workerCount, builder.workerCount,
        0L, TimeUnit.MILLISECONDS, new PriorityBlockingQueue<>(),
        new DaemonThreadFactory("agentbus-router-"));
    this.retryScheduler = Executors.newSingleThreadScheduledExecutor(
        new DaemonThreadFactory("agentbus-router-retry-"));
  }

  public static Builder builder() {
    return new Builder();
  }

  public String addRoute(String eventType, EventHandler handler) {
    return addRoute(Set.of(eventType), handler, RouteOptions.defaults());
  }

  /**
   * Subscribes {@code handler} to the given event types through the bus.
   *
   * @param eventTypes one or more event types
   * @param handler    the handler invoked with the final event
   * @param options    priority, filter, transform and retry settings
   * @return the route id
   */
  public String addRoute(Collection<String> eventTypes, EventHandler handler, RouteOptions options) {
    ensureOpen();
    Objects.requireNonNull(handler, "handler");
    Objects.requireNonNull(options, "options");
    Set<String> types = new LinkedHashSet<>(Objects.requireNonNull(eventTypes, "eventTypes"));
    Route route = new Route(Ids.next(), types, handler,
        options.withResolvedMaxRetries(defaultMaxRetries));
    routes.put(route.id(), route);
    try {
      route.subscriptionId(eventBus.subscribe(types, event -> dispatch(route, event)));
    } catch (RuntimeException e) {
      routes.remove(route.id());
      throw e;
    }
    logger.log(Level.FINE, "Added route {0}", route);
    return route.id();
  }

  /**
   * Removes a route. Pending retries for it are dropped when they come due.
   *
   * @param routeId the id returned by {@link #addRoute}
   * @throws NotFoundException if the id is unknown
   */
  public void removeRoute(String routeId) {
    Route route = routes.remove(routeId);
    if (route == null) {
      throw new NotFoundException("Route not found: " + routeId);
    }
    eventBus.unsubscribe(route.subscriptionId());
  }

  public Optional<Route> route(String routeId) {
    return Optional.ofNullable(routes.get(routeId));
  }

  public List<Route> routes() {
    return new ArrayList<>(routes.values());
  }

  public synchronized void addFilter(String name, EventFilter filter) {
    Objects.requireNonNull(name, "name");
    Objects.requireNonNull(filter, "filter");
    Map<String, EventFilter> copy = new LinkedHashMap<>(filters);
    copy.put(name, filter);
    filters = Collections.unmodifiableMap(copy);
  }

  public synchronized boolean removeFilter(String name) {
    if (!filters.containsKey(name)) {
      return false;
    }
    Map<String, EventFilter> copy = new LinkedHashMap<>(filters);
    copy.remove(name);
    filters = Collections.unmodifiableMap(copy);
    return true;
  }

  public synchronized void addTransformer(String name, EventTransformer transformer) {
    Objects.requireNonNull(name, "name");
    Objects.requireNonNull(transformer, "transformer");
    Map<String, EventTransformer> copy = new LinkedHashMap<>(transformers);
    copy.put(name, transformer);
    transformers = Collections.unmodifiableMap(copy);
  }

  public synchronized boolean removeTransformer(String name) {
    if (!transformers.containsKey(name)) {
      return false;
    }
    Map<String, EventTransformer> copy = new LinkedHashMap<>(transformers);
    copy.remove(name);
    transformers = Collections.unmodifiableMap(copy);
    return true;
  }

  /**
   * Appends a middleware to the pipeline. Middleware runs before any filter, in the order added.
   *
   * @param stage the middleware
   * @return this router
   */
  public EventRouter use(Middleware stage) {
    middleware.add(Objects.requireNonNull(stage, "middleware"));
    return this;
  }

  public DeadLetterLog deadLetters() {
    return deadLetters;
  }

  public String deadLetterTypeFor(String eventType) {
    return deadLetterPrefix + "." + eventType;
  }

  public RouterMetrics metrics() {
    return new RouterMetrics(routed.get(), handled.get(), filtered.get(), vetoed.get(),
        transformed.get(), failed.get(), retried.get(), deadLettered.get(), routes.size());
  }

  /**
   * @throws NotFoundException if the route does not exist
   */
  public RouteMetrics routeMetrics(String routeId) {
    Route route = routes.get(routeId);
    if (route == null) {
      throw new NotFoundException("Route not found: " + routeId);
    }
    return route.metrics();
  }

  private void dispatch(Route route, Event event) {
    if (closed.get()) {
      logger.log(Level.WARNING, "Router closed, dropping {0} for route {1}",
          new Object[]{event, route.id()});
      return;
    }
    try {
      workers.execute(new RouteTask(route, event, taskSequence.getAndIncrement()));
    } catch (RejectedExecutionException e) {
      logger.log(Level.WARNING, "Router rejected " + event + " for route " + route.id(), e);
    }
  }

  private void process(Route route, Event original) {
    if (!routes.containsKey(route.id())) {
      logger.log(Level.FINE, "Route {0} removed, dropping {1}", new Object[]{route.id(), original});
      return;
    }
    routed.incrementAndGet();
    route.recordRouted();
    metrics.incrementRouted();
    try {
      Event current = original;
      for (Middleware stage : middleware) {
        current = stage.process(current);
        if (current == null) {
          vetoed.incrementAndGet();
          metrics.incrementVetoed();
          drop(route);
          return;
        }
      }

      EventFilter routeFilter = route.options().filter();
      if (routeFilter != null && !routeFilter.test(current)) {
        drop(route);
        return;
      }
      for (EventFilter filter : filters.values()) {
        if (!filter.test(current)) {
          drop(route);
          return;
        }
      }

      boolean wasTransformed = false;
      EventTransformer routeTransform = route.options().transform();
      if (routeTransform != null) {
        current = Objects.requireNonNull(routeTransform.apply(current), "transformer returned null");
        wasTransformed = true;
      }
      for (EventTransformer transformer : transformers.values()) {
        current = Objects.requireNonNull(transformer.apply(current), "transformer returned null");
        wasTransformed = true;
      }
      if (wasTransformed) {
        transformed.incrementAndGet();
        route.recordTransformed();
        metrics.incrementTransformed();
      }

      route.handler().onEvent(current);
      handled.incrementAndGet();
      route.recordHandled();
    } catch (Exception e) {
      failed.incrementAndGet();
      route.recordError();
      metrics.incrementRouteFailures();
      handleFailure(route, original, e);
    }
  }

  private void drop(Route route) {
    filtered.incrementAndGet();
    route.recordFiltered();
    metrics.incrementFiltered();
  }

  private void handleFailure(Route route, Event original, Exception failure) {
    int retryCount = original.metadata().retryCount();
    boolean retryable = !(failure instanceof AgentBusException abe) || abe.retryable();
    RouteOptions options = route.options();

    if (options.retry() && retryable && retryCount < options.maxRetries() && !closed.get()) {
      int nextRetry = retryCount + 1;
      long delayMs = retryPolicy.computeDelayMs(nextRetry);
      Event next = original.withRetryCount(nextRetry);
      retried.incrementAndGet();
      route.recordRetried();
      metrics.incrementRetried();
      logger.log(Level.WARNING, "Route " + route.id() + " failed on " + original
          + ", retry " + nextRetry + "/" + options.maxRetries() + " in " + delayMs + "ms", failure);
      try {
        retryScheduler.schedule(() -> dispatch(route, next), delayMs, TimeUnit.MILLISECONDS);
      } catch (RejectedExecutionException e) {
        logger.log(Level.WARNING, "Retry scheduler shut down, dead-lettering " + original, e);
        deadLetter(route, original, failure);
      }
      return;
    }
    deadLetter(route, original, failure);
  }

  private void deadLetter(Route route, Event original, Exception failure) {
    int attempts = original.metadata().retryCount() + 1;
    Instant failedAt = Instant.now();
    String stack = stackTraceOf(failure);
    String error = failure.getMessage() != null ? failure.getMessage() : failure.getClass().getName();

    Map<String, String> attributes = new LinkedHashMap<>();
    attributes.put(ATTR_ORIGINAL_EVENT_ID, original.id());
    attributes.put(ATTR_ORIGINAL_TYPE, original.type());
    attributes.put(ATTR_ROUTE_ID, route.id());
    attributes.put(ATTR_FAILED_AT, failedAt.toString());
    attributes.put(ATTR_ERROR, error);
    attributes.put(ATTR_STACK, stack);
    attributes.put(ATTR_ATTEMPTS, Integer.toString(attempts));

    Event dead = Event.builder(deadLetterTypeFor(original.type()))
        .payload(original.payload())
        .source(original.source())
        .correlationId(original.correlationId())
        .metadata(original.metadata().withAttributes(attributes))
        .build();

    deadLettered.incrementAndGet();
    route.recordDeadLettered();
    metrics.incrementDeadLettered();
    deadLetters.record(new DeadLetter(dead.id(), route.id(), original, error, stack, attempts, failedAt));
    logger.log(Level.SEVERE, "Route " + route.id() + " gave up on " + original
        + " after " + attempts + " attempt(s)", failure);

    if (original.type().startsWith(deadLetterPrefix + ".")) {
      logger.log(Level.SEVERE, "Not republishing failed dead letter {0}", original.id());
      return;
    }
    try {
      eventBus.publishEvent(dead);
    } catch (RuntimeException e) {
      logger.log(Level.SEVERE, "Failed to publish dead letter for " + original.id(), e);
    }
  }

  private static String stackTraceOf(Throwable failure) {
    StringWriter out = new StringWriter();
    failure.printStackTrace(new PrintWriter(out));
    return out.toString();
  }

  private void ensureOpen() {
    if (closed.get()) {
      throw new IllegalStateException("EventRouter has been closed");
    }
  }

  /**
   * Unsubscribes every route, cancels pending retries and waits up to the drain timeout for
   * deliveries already running.
   */
  @Override
  public void close() {
    if (!closed.compareAndSet(false, true)) {
      return;
    }
    for (Route route : routes.values()) {
      try {
        eventBus.unsubscribe(route.subscriptionId());
      } catch (RuntimeException e) {
        logger.log(Level.FINE, "Route " + route.id() + " already unsubscribed", e);
      }
    }
    routes.clear();
    List<Runnable> pendingRetries = retryScheduler.shutdownNow();
    if (!pendingRetries.isEmpty()) {
      logger.log(Level.WARNING, "Cancelled {0} pending retries", pendingRetries.size());
    }
    workers.shutdown();
    try {
      if (!workers.awaitTermination(drainTimeoutMs, TimeUnit.MILLISECONDS)) {
        logger.log(Level.WARNING, "Drain timeout exceeded; forcing shutdown with "
            + workers.getQueue().size() + " queued deliveries");
        workers.shutdownNow();
      }
    } catch (InterruptedException e) {
      workers.shutdownNow();
      Thread.currentThread().interrupt();
    }
  }

  private final class RouteTask implements Runnable, Comparable<RouteTask> {
    private final Route route;
    private final Event event;
    private final long sequence;

    private RouteTask(Route route, Event event, long sequence) {
      this.route = route;
      this.event = event;
      this.sequence = sequence;
    }

    @Override
    public void run() {
      try {
        process(route, event);
      } catch (Throwable t) {
        logger.log(Level.SEVERE, "Router worker error on " + event, t);
      }
    }

    @Override
    public int compareTo(RouteTask other) {
      int byPriority = Integer.compare(other.route.options().priority(), route.options().priority());
      return byPriority != 0 ? byPriority : Long.compare(sequence, other.sequence);
    }
  }

  /** Builder for {@link EventRouter}. */
  public static final class Builder {
    private EventBus eventBus;
    private RetryPolicy retryPolicy;
    private long baseDelayMs = 1000;
    private int defaultMaxRetries = 3;
    private String deadLetterPrefix = "dlq";
    private int deadLetterCapacity = 1000;
    private int workerCount = 4;
    private MetricsExporter metrics;
    private long drainTimeoutMs = 5000;

    private Builder() {
    }

    /**
     * <b>Required.</b>
     */
    public Builder eventBus(EventBus eventBus) {
      this.eventBus = eventBus;
      return this;
    }

    /**
     * Optional. Defaults to {@link LinearBackoffRetryPolicy} with {@link #baseDelayMs}.
     */
    public Builder retryPolicy(RetryPolicy retryPolicy) {
      this.retryPolicy = retryPolicy;
      return this;
    }

    /**
     * Base delay of the default linear retry policy. Optional. Defaults to {@code 1000} ms.
     */
    public Builder baseDelayMs(long baseDelayMs) {
      this.baseDelayMs = baseDelayMs;
      return this;
    }

    /**
     * Max retries for routes that do not set their own. Optional. Defaults to {@code 3}.
     */
    public Builder defaultMaxRetries(int defaultMaxRetries) {
      this.defaultMaxRetries = defaultMaxRetries;
      return this;
    }

    /**
     * Optional. Defaults to {@code "dlq"}, so failures of {@code x} go to {@code dlq.x}.
     */
    public Builder deadLetterPrefix(String deadLetterPrefix) {
      this.deadLetterPrefix = deadLetterPrefix;
      return this;
    }

    /**
     * Optional. Defaults to {@code 1000}.
     */
    public Builder deadLetterCapacity(int deadLetterCapacity) {
      this.deadLetterCapacity = deadLetterCapacity;
      return this;
    }

    /**
     * Optional. Defaults to {@code 4}. Must be &gt; 0.
     */
    public Builder workerCount(int workerCount) {
      this.workerCount = workerCount;
      return this;
    }

    public Builder metrics(MetricsExporter metrics) {
      this.metrics = metrics;
      return this;
    }

    /**
     * Optional. Defaults to {@code 5000} ms.
     */
    public Builder drainTimeoutMs(long drainTimeoutMs) {
      this.drainTimeoutMs = drainTimeoutMs;
      return this;
    }

    /**
     * Builds the router and starts its worker threads.
     *
     * @return a new router
     * @throws NullPointerException     if {@code eventBus} is null
     * @throws IllegalArgumentException if {@code workerCount <= 0}, {@code defaultMaxRetries < 0}
     *     or the dead-letter prefix is blank
     */
    public EventRouter build() {
      return new EventRouter(this);
    }
  }
}
