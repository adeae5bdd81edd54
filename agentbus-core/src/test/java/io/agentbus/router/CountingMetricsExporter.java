package io.agentbus.router;

import io.agentbus.spi.MetricsExporter;

import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicInteger;

/** Counts every exporter call by name. */
final class CountingMetricsExporter implements MetricsExporter {
  private final Map<String, AtomicInteger> counts = new ConcurrentHashMap<>();

  int count(String name) {
    AtomicInteger count = counts.get(name);
    return count == null ? 0 : count.get();
  }

  private void hit(String name) {
    counts.computeIfAbsent(name, n -> new AtomicInteger()).incrementAndGet();
  }

  @Override public void incrementPublished() { hit("published"); }
  @Override public void incrementDelivered() { hit("delivered"); }
  @Override public void incrementHandlerErrors() { hit("handlerErrors"); }
  @Override public void incrementReconnections() { hit("reconnections"); }
  @Override public void incrementRouted() { hit("routed"); }
  @Override public void incrementFiltered() { hit("filtered"); }
  @Override public void incrementVetoed() { hit("vetoed"); }
  @Override public void incrementTransformed() { hit("transformed"); }
  @Override public void incrementRouteFailures() { hit("routeFailures"); }
  @Override public void incrementRetried() { hit("retried"); }
  @Override public void incrementDeadLettered() { hit("deadLettered"); }
  @Override public void recordExecution(String actionId, boolean success, long durationMs) {
    hit("executions");
  }
  @Override public void incrementRejected() { hit("rejected"); }
  @Override public void incrementRolledBack() { hit("rolledBack"); }
  @Override public void recordRegistryGauges(int running, int pendingRollbacks) { }
}
