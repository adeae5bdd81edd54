package io.agentbus.micrometer;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.Timer;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

class MicrometerMetricsExporterTest {

  private SimpleMeterRegistry registry;
  private MicrometerMetricsExporter exporter;

  @BeforeEach
  void setUp() {
    registry = new SimpleMeterRegistry();
    exporter = new MicrometerMetricsExporter(registry);
  }

  @Test
  void busCounters() {
    exporter.incrementPublished();
    exporter.incrementPublished();
    exporter.incrementDelivered();
    exporter.incrementHandlerErrors();
    exporter.incrementReconnections();

    assertEquals(2.0, counter("agentbus.bus.published").count());
    assertEquals(1.0, counter("agentbus.bus.delivered").count());
    assertEquals(1.0, counter("agentbus.bus.handler.errors").count());
    assertEquals(1.0, counter("agentbus.bus.reconnections").count());
  }

  @Test
  void routerCounters() {
    exporter.incrementRouted();
    exporter.incrementFiltered();
    exporter.incrementVetoed();
    exporter.incrementTransformed();
    exporter.incrementRouteFailures();
    exporter.incrementRetried();
    exporter.incrementRetried();
    exporter.incrementRetried();
    exporter.incrementDeadLettered();

    assertEquals(1.0, counter("agentbus.router.routed").count());
    assertEquals(1.0, counter("agentbus.router.filtered").count());
    assertEquals(1.0, counter("agentbus.router.vetoed").count());
    assertEquals(1.0, counter("agentbus.router.transformed").count());
    assertEquals(1.0, counter("agentbus.router.failures").count());
    assertEquals(3.0, counter("agentbus.router.retried").count());
    assertEquals(1.0, counter("agentbus.router.dead").count());
  }

  @Test
  void executionsAreTimedPerActionAndOutcome() {
    exporter.recordExecution("createFile", true, 40);
    exporter.recordExecution("createFile", true, 60);
    exporter.recordExecution("createFile", false, 5);

    Timer success = registry.find("agentbus.actions.executions")
        .tags("action", "createFile", "outcome", "success").timer();
    Timer failure = registry.find("agentbus.actions.executions")
        .tags("action", "createFile", "outcome", "failure").timer();
    assertNotNull(success);
    assertNotNull(failure);
    assertEquals(2, success.count());
    assertEquals(100.0, success.totalTime(TimeUnit.MILLISECONDS), 0.001);
    assertEquals(1, failure.count());
  }

  @Test
  void registryGauges() {
    exporter.recordRegistryGauges(3, 2);
    assertEquals(3.0, gauge("agentbus.actions.running").value());
    assertEquals(2.0, gauge("agentbus.actions.rollbacks.pending").value());

    exporter.recordRegistryGauges(0, 0);
    assertEquals(0.0, gauge("agentbus.actions.running").value());
  }

  @Test
  void registryCounters() {
    exporter.incrementTimeouts();
    exporter.incrementRejected();
    exporter.incrementRolledBack();

    assertEquals(1.0, counter("agentbus.actions.timeouts").count());
    assertEquals(1.0, counter("agentbus.actions.rejected").count());
    assertEquals(1.0, counter("agentbus.actions.rolledback").count());
  }

  @Test
  void customNamePrefix() {
    var custom = new MicrometerMetricsExporter(registry, "agents.bus");
    custom.incrementPublished();
    custom.recordRegistryGauges(4, 1);

    assertEquals(1.0, counter("agents.bus.bus.published").count());
    assertEquals(4.0, gauge("agents.bus.actions.running").value());
  }

  @Test
  void closeRemovesMeters() {
    exporter.incrementPublished();
    exporter.recordExecution("a", true, 1);
    exporter.close();

    assertNull(registry.find("agentbus.bus.published").counter());
    assertNull(registry.find("agentbus.actions.running").gauge());
    assertNull(registry.find("agentbus.actions.executions").timer());

    exporter.incrementPublished();
    assertNull(registry.find("agentbus.bus.published").counter());
  }

  @Test
  void invalidPrefixRejected() {
    assertThrows(IllegalArgumentException.class, () -> new MicrometerMetricsExporter(registry, ""));
    assertThrows(IllegalArgumentException.class,
        () -> new MicrometerMetricsExporter(registry, "agentbus."));
  }

  @Test
  void nullRegistryThrows() {
    assertThrows(NullPointerException.class, () -> new MicrometerMetricsExporter(null));
  }

  private Counter counter(String name) {
    Counter c = registry.find(name).counter();
    assertNotNull(c, "Counter not found: " + name);
    return c;
  }

  private Gauge gauge(String name) {
    Gauge g = registry.find(name).gauge();
    assertNotNull(g, "Gauge not found: " + name);
    return g;
  }
}
