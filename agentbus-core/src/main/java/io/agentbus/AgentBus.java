package io.agentbus;

import io.agentbus.action.ActionConfig;
import io.agentbus.action.ActionEventPublisher;
import io.agentbus.action.ActionListener;
import io.agentbus.action.ActionRegistry;
import io.agentbus.action.ActionRouteHandler;
import io.agentbus.action.CleanupOptions;
import io.agentbus.action.DependencyType;
import io.agentbus.action.RegistryMaintenanceScheduler;
import io.agentbus.bus.EventBus;
import io.agentbus.router.DeadLetterLog;
import io.agentbus.router.EventRouter;
import io.agentbus.router.RetryPolicy;
import io.agentbus.router.RouteOptions;
import io.agentbus.spi.DependencyChecker;
import io.agentbus.spi.MetricsExporter;
import io.agentbus.spi.PubSubTransport;
import io.agentbus.transport.InMemoryTransport;

import java.time.Duration;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Main entry point wiring a transport, {@link EventBus}, {@link EventRouter} and
 * {@link ActionRegistry} into one closed loop: events are routed to actions, and action
 * outcomes are published back as events.
 *
 * <pre>{@code
 * try (AgentBus agentBus = AgentBus.builder()
 *     .config(new AgentBusConfig().setMaxConcurrentActions(4))
 *     .build()) {
 *   String actionId = agentBus.registry().registerAction(definition);
 *   agentBus.routeToAction("document.uploaded", actionId);
 *   agentBus.bus().publish("document.uploaded", Map.of("path", "/tmp/a.pdf"));
 * }
 * }</pre>
 *
 * <p>The transport is connected on build and closed with the composite.
 */
public final class AgentBus implements AutoCloseable {
  private static final Logger logger = Logger.getLogger(AgentBus.class.getName());

  private final PubSubTransport transport;
  private final EventBus bus;
  private final EventRouter router;
  private final ActionRegistry registry;
  private final RegistryMaintenanceScheduler maintenance;
  private final MetricsExporter metrics;

  private AgentBus(PubSubTransport transport, EventBus bus, EventRouter router,
      ActionRegistry registry, RegistryMaintenanceScheduler maintenance, MetricsExporter metrics) {
    this.transport = transport;
    this.bus = bus;
    this.router = router;
    this.registry = registry;
    this.maintenance = maintenance;
    this.metrics = metrics;
  }

  public static Builder builder() {
    return new Builder();
  }

  public EventBus bus() {
    return bus;
  }

  public EventRouter router() {
    return router;
  }

  public ActionRegistry registry() {
    return registry;
  }

  public DeadLetterLog deadLetters() {
    return router.deadLetters();
  }

  /**
   * Adds a route that runs {@code actionId} for every event of {@code eventType}. Retries
   * follow the action's own {@code retryable} and {@code maxRetries} settings.
   *
   * @return the route id
   * @throws NotFoundException if the action is not registered
   */
  public String routeToAction(String eventType, String actionId) {
    ActionConfig config = registry.getAction(actionId)
        .orElseThrow(() -> new NotFoundException("Action not found: " + actionId))
        .config();
    RouteOptions options = RouteOptions.builder()
        .retry(config.retryable())
        .maxRetries(config.maxRetries())
        .build();
    return routeToAction(Set.of(eventType), actionId, options);
  }

  public String routeToAction(Set<String> eventTypes, String actionId, RouteOptions options) {
    if (registry.getAction(actionId).isEmpty()) {
      throw new NotFoundException("Action not found: " + actionId);
    }
    return router.addRoute(eventTypes, new ActionRouteHandler(registry, actionId), options);
  }

  /**
   * Shuts down components in order: maintenance, router, registry, bus, transport. Every
   * component is closed even if an earlier one fails; the first failure is rethrown.
   */
  @Override
  public void close() {
    RuntimeException first = null;
    for (AutoCloseable component : closeOrder()) {
      try {
        component.close();
      } catch (Exception e) {
        RuntimeException re = (e instanceof RuntimeException r) ? r : new RuntimeException(e);
        if (first == null) first = re; else first.addSuppressed(re);
      }
    }
    if (first != null) {
      throw first;
    }
    logger.log(Level.INFO, "AgentBus {0} closed", bus.namespace());
  }

  private List<AutoCloseable> closeOrder() {
    List<AutoCloseable> order = new ArrayList<>();
    if (maintenance != null) {
      order.add(maintenance);
    }
    order.add(router);
    order.add(registry);
    order.add(bus);
    order.add(transport);
    if (metrics instanceof AutoCloseable closeable) {
      order.add(closeable);
    }
    return order;
  }

  /** Builder for {@link AgentBus}. */
  public static final class Builder {
    private AgentBusConfig config;
    private PubSubTransport transport;
    private MetricsExporter metrics;
    private RetryPolicy retryPolicy;
    private final Map<DependencyType, DependencyChecker> checkers =
        new EnumMap<>(DependencyType.class);
    private final List<ActionListener> listeners = new ArrayList<>();

    private Builder() {}

    /**
     * Optional. Defaults to {@code new AgentBusConfig()}.
     */
    public Builder config(AgentBusConfig config) {
      this.config = config;
      return this;
    }

    /**
     * Sets the pub/sub transport. It is connected on build and closed with the bus.
     *
     * <p>Optional. Defaults to a new {@link InMemoryTransport}.
     */
    public Builder transport(PubSubTransport transport) {
      this.transport = transport;
      return this;
    }

    /** Optional. Defaults to {@link MetricsExporter#NOOP}. */
    public Builder metrics(MetricsExporter metrics) {
      this.metrics = metrics;
      return this;
    }

    /**
     * Optional. Defaults to linear backoff from {@link AgentBusConfig#getRetryBaseDelayMs()}.
     */
    public Builder retryPolicy(RetryPolicy retryPolicy) {
      this.retryPolicy = retryPolicy;
      return this;
    }

    public Builder dependencyChecker(DependencyType type, DependencyChecker checker) {
      checkers.put(Objects.requireNonNull(type, "type"),
          Objects.requireNonNull(checker, "checker"));
      return this;
    }

    public Builder actionListener(ActionListener listener) {
      listeners.add(Objects.requireNonNull(listener, "listener"));
      return this;
    }

    /**
     * Builds and connects the composite. Components started before a failure are closed again.
     *
     * @throws ConnectionException      if the transport cannot connect
     * @throws IllegalArgumentException if a config value is out of range
     */
    public AgentBus build() {
      AgentBusConfig cfg = config != null ? config : new AgentBusConfig();
      MetricsExporter exporter = metrics != null ? metrics : MetricsExporter.NOOP;
      PubSubTransport pubSub = transport != null ? transport : new InMemoryTransport();

      List<AutoCloseable> started = new ArrayList<>();
      started.add(pubSub);
      try {
        EventBus bus = EventBus.builder()
            .transport(pubSub)
            .namespace(cfg.getNamespace())
            .persistEvents(cfg.isPersistEvents())
            .maxStoredEvents(cfg.getMaxStoredEvents())
            .metrics(exporter)
            .build();
        started.add(0, bus);
        bus.connect();

        EventRouter router = EventRouter.builder()
            .eventBus(bus)
            .retryPolicy(retryPolicy)
            .baseDelayMs(cfg.getRetryBaseDelayMs())
            .defaultMaxRetries(cfg.getMaxRetries())
            .deadLetterPrefix(cfg.getDeadLetterPrefix())
            .deadLetterCapacity(cfg.getDeadLetterCapacity())
            .workerCount(cfg.getRouterWorkers())
            .metrics(exporter)
            .build();
        started.add(0, router);

        ActionRegistry.Builder registryBuilder = ActionRegistry.builder()
            .maxConcurrentActions(cfg.getMaxConcurrentActions())
            .historyLimit(cfg.getHistoryLimit())
            .rollbackLimit(cfg.getRollbackLimit())
            .listeners(listeners)
            .metrics(exporter);
        checkers.forEach(registryBuilder::dependencyChecker);
        if (cfg.isPublishOutcomes()) {
          registryBuilder.listener(new ActionEventPublisher(bus));
        }
        ActionRegistry registry = registryBuilder.build();
        started.add(0, registry);

        RegistryMaintenanceScheduler maintenance = null;
        if (cfg.isMaintenanceEnabled()) {
          maintenance = RegistryMaintenanceScheduler.builder()
              .registry(registry)
              .options(new CleanupOptions(
                  Duration.ofSeconds(cfg.getMaintenanceMaxAgeSeconds()),
                  cfg.getHistoryLimit(), cfg.getRollbackLimit()))
              .intervalSeconds(cfg.getMaintenanceIntervalSeconds())
              .build();
          maintenance.start();
        }

        logger.log(Level.INFO, "AgentBus {0} started", cfg.getNamespace());
        return new AgentBus(pubSub, bus, router, registry, maintenance, exporter);
      } catch (RuntimeException e) {
        for (AutoCloseable component : started) {
          try {
            component.close();
          } catch (Exception suppressed) {
            e.addSuppressed(suppressed);
          }
        }
        throw e;
      }
    }
  }
}
