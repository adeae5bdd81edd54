package io.agentbus.micrometer;

import io.agentbus.spi.MetricsExporter;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.Meter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Micrometer-based implementation of {@link MetricsExporter}.
 *
 * <h3>Counters</h3>
 * <ul>
 *   <li>{@code agentbus.bus.published}, {@code agentbus.bus.delivered},
 *       {@code agentbus.bus.handler.errors}, {@code agentbus.bus.reconnections}</li>
 *   <li>{@code agentbus.router.routed}, {@code agentbus.router.filtered},
 *       {@code agentbus.router.vetoed}, {@code agentbus.router.transformed},
 *       {@code agentbus.router.failures}, {@code agentbus.router.retried},
 *       {@code agentbus.router.dead}</li>
 *   <li>{@code agentbus.actions.timeouts}, {@code agentbus.actions.rejected},
 *       {@code agentbus.actions.rolledback}</li>
 * </ul>
 *
 * <h3>Timers</h3>
 * <ul>
 *   <li>{@code agentbus.actions.executions} tagged {@code action} and
 *       {@code outcome=success|failure}</li>
 * </ul>
 *
 * <h3>Gauges</h3>
 * <ul>
 *   <li>{@code agentbus.actions.running}, {@code agentbus.actions.rollbacks.pending}</li>
 * </ul>
 *
 * @see MetricsExporter
 */
public final class MicrometerMetricsExporter implements MetricsExporter, AutoCloseable {

  private final MeterRegistry registry;
  private final String namePrefix;

  private final Counter published;
  private final Counter delivered;
  private final Counter handlerErrors;
  private final Counter reconnections;
  private final Counter routed;
  private final Counter filtered;
  private final Counter vetoed;
  private final Counter transformed;
  private final Counter routeFailures;
  private final Counter retried;
  private final Counter deadLettered;
  private final Counter timeouts;
  private final Counter rejected;
  private final Counter rolledBack;
  private final Gauge runningGauge;
  private final Gauge pendingRollbacksGauge;
  private final Map<String, Timer> executionTimers = new ConcurrentHashMap<>();

  private final AtomicInteger running = new AtomicInteger();
  private final AtomicInteger pendingRollbacks = new AtomicInteger();
  private volatile boolean closed;

  /**
   * Creates an exporter with the default metric name prefix {@code "agentbus"}.
   *
   * @param registry the Micrometer meter registry
   */
  public MicrometerMetricsExporter(MeterRegistry registry) {
    this(registry, "agentbus");
  }

  /**
   * Creates an exporter with a custom metric name prefix for multi-instance use.
   *
   * @param registry   the Micrometer meter registry
   * @param namePrefix prefix for all meter names (e.g. {@code "orders.agentbus"})
   */
  public MicrometerMetricsExporter(MeterRegistry registry, String namePrefix) {
    Objects.requireNonNull(registry, "registry");
    Objects.requireNonNull(namePrefix, "namePrefix");
    if (namePrefix.isEmpty()) {
      throw new IllegalArgumentException("namePrefix must not be empty");
    }
    if (namePrefix.endsWith(".")) {
      throw new IllegalArgumentException("namePrefix must not end with '.'");
    }

    this.registry = registry;
    this.namePrefix = namePrefix;
    this.published = counter(".bus.published", "Events handed to the transport");
    this.delivered = counter(".bus.delivered", "Events delivered to subscription handlers");
    this.handlerErrors = counter(".bus.handler.errors", "Subscription handler failures");
    this.reconnections = counter(".bus.reconnections", "Transport reconnect attempts");
    this.routed = counter(".router.routed", "Events entering a route pipeline");
    this.filtered = counter(".router.filtered", "Events dropped by filters or middleware");
    this.vetoed = counter(".router.vetoed", "Events vetoed by middleware");
    this.transformed = counter(".router.transformed", "Routed events rewritten by transformers");
    this.routeFailures = counter(".router.failures", "Route handler failures");
    this.retried = counter(".router.retried", "Deliveries scheduled for retry");
    this.deadLettered = counter(".router.dead", "Deliveries published to the dead-letter channel");
    this.timeouts = counter(".actions.timeouts", "Action executions past their deadline");
    this.rejected = counter(".actions.rejected", "Executions rejected (not found, conflict, capacity)");
    this.rolledBack = counter(".actions.rolledback", "Completed compensations");

    this.runningGauge = Gauge.builder(namePrefix + ".actions.running", running, AtomicInteger::get)
        .description("Executions currently running")
        .register(registry);
    this.pendingRollbacksGauge = Gauge.builder(namePrefix + ".actions.rollbacks.pending",
            pendingRollbacks, AtomicInteger::get)
        .description("Rollback ledger entries awaiting compensation")
        .register(registry);
  }

  private Counter counter(String suffix, String description) {
    return Counter.builder(namePrefix + suffix)
        .description(description)
        .register(registry);
  }

  @Override
  public void incrementPublished() {
    if (closed) return;
    published.increment();
  }

  @Override
  public void incrementDelivered() {
    if (closed) return;
    delivered.increment();
  }

  @Override
  public void incrementHandlerErrors() {
    if (closed) return;
    handlerErrors.increment();
  }

  @Override
  public void incrementReconnections() {
    if (closed) return;
    reconnections.increment();
  }

  @Override
  public void incrementRouted() {
    if (closed) return;
    routed.increment();
  }

  @Override
  public void incrementFiltered() {
    if (closed) return;
    filtered.increment();
  }

  @Override
  public void incrementVetoed() {
    if (closed) return;
    vetoed.increment();
  }

  @Override
  public void incrementTransformed() {
    if (closed) return;
    transformed.increment();
  }

  @Override
  public void incrementRouteFailures() {
    if (closed) return;
    routeFailures.increment();
  }

  @Override
  public void incrementRetried() {
    if (closed) return;
    retried.increment();
  }

  @Override
  public void incrementDeadLettered() {
    if (closed) return;
    deadLettered.increment();
  }

  @Override
  public void recordExecution(String actionId, boolean success, long durationMs) {
    if (closed) return;
    String outcome = success ? "success" : "failure";
    Timer timer = executionTimers.computeIfAbsent(actionId + '|' + outcome,
        key -> Timer.builder(namePrefix + ".actions.executions")
            .description("Action execution durations")
            .tag("action", actionId)
            .tag("outcome", outcome)
            .register(registry));
    timer.record(durationMs, TimeUnit.MILLISECONDS);
  }

  @Override
  public void incrementTimeouts() {
    if (closed) return;
    timeouts.increment();
  }

  @Override
  public void incrementRejected() {
    if (closed) return;
    rejected.increment();
  }

  @Override
  public void incrementRolledBack() {
    if (closed) return;
    rolledBack.increment();
  }

  @Override
  public void recordRegistryGauges(int running, int pendingRollbacks) {
    if (closed) return;
    this.running.set(running);
    this.pendingRollbacks.set(pendingRollbacks);
  }

  /**
   * Removes all meters registered by this exporter from the registry.
   *
   * <p>{@link io.agentbus.AgentBus#close()} calls this for its exporter.
   */
  @Override
  public void close() {
    closed = true;
    List<Meter> meters = new ArrayList<>(List.of(published, delivered, handlerErrors,
        reconnections, routed, filtered, vetoed, transformed, routeFailures, retried, deadLettered,
        timeouts, rejected, rolledBack, runningGauge, pendingRollbacksGauge));
    meters.addAll(executionTimers.values());
    executionTimers.clear();
    RuntimeException first = null;
    for (Meter meter : meters) {
      try {
        registry.remove(meter);
      } catch (RuntimeException e) {
        if (first == null) first = e; else first.addSuppressed(e);
      }
    }
    if (first != null) throw first;
  }
}
