package io.agentbus.spi;

/**
 * Observability hook for exporting bus, router and registry counters to a metrics backend.
 *
 * <p>The {@link #NOOP} instance discards everything. {@code agentbus-micrometer} provides a
 * Micrometer-backed implementation.
 */
public interface MetricsExporter {

  MetricsExporter NOOP = new Noop();

  /** An event was handed to the transport. */
  void incrementPublished();

  /** An inbound event was delivered to a subscription handler. */
  void incrementDelivered();

  /** A subscription handler threw. */
  void incrementHandlerErrors();

  /** The transport started reconnecting. */
  void incrementReconnections();

  /** An event entered a route's pipeline. */
  void incrementRouted();

  /** A filter or middleware dropped an event. */
  void incrementFiltered();

  /** A middleware vetoed an event. Also counted by {@link #incrementFiltered()}. */
  default void incrementVetoed() {
  }

  /** At least one transformer was applied to a routed event. */
  default void incrementTransformed() {
  }

  /** A route handler (or its pipeline) threw. */
  void incrementRouteFailures();

  /** A failed delivery was scheduled for another attempt. */
  void incrementRetried();

  /** A delivery was published to the dead-letter channel. */
  void incrementDeadLettered();

  /**
   * Records a finished action execution.
   *
   * @param actionId   the action that ran
   * @param success    whether it completed
   * @param durationMs wall-clock duration in milliseconds
   */
  void recordExecution(String actionId, boolean success, long durationMs);

  /** An execution exceeded its deadline. */
  default void incrementTimeouts() {
  }

  /** An execution was rejected for capacity or conflict. */
  void incrementRejected();

  /** A compensation completed. */
  void incrementRolledBack();

  /**
   * Records the current number of running executions and pending compensations.
   */
  void recordRegistryGauges(int running, int pendingRollbacks);

  /**
   * Discards all metrics.
   */
  final class Noop implements MetricsExporter {
    @Override
    public void incrementPublished() {
    }

    @Override
    public void incrementDelivered() {
    }

    @Override
    public void incrementHandlerErrors() {
    }

    @Override
    public void incrementReconnections() {
    }

    @Override
    public void incrementRouted() {
    }

    @Override
    public void incrementFiltered() {
    }

    @Override
    public void incrementRouteFailures() {
    }

    @Override
    public void incrementRetried() {
    }

    @Override
    public void incrementDeadLettered() {
    }

    @Override
    public void recordExecution(String actionId, boolean success, long durationMs) {
    }

    @Override
    public void incrementRejected() {
    }

    @Override
    public void incrementRolledBack() {
    }

    @Override
    public void recordRegistryGauges(int running, int pendingRollbacks) {
    }
  }
}
