package io.agentbus.action;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.Map;

import static io.agentbus.action.ActionTestSupport.action;
import static org.junit.jupiter.api.Assertions.*;

class RegistryMaintenanceSchedulerTest {

  private final ActionRegistry registry = ActionRegistry.builder().build();

  @AfterEach
  void tearDown() {
    registry.close();
  }

  private void runRollbackable(int times) {
    registry.registerAction(action("undoable")
        .config(ActionConfig.builder().rollbackable(true).build())
        .execute((params, context, execution) -> ActionResult.withRollback("ok", Map.of("n", 1)))
        .rollback((data, meta) -> null)
        .build());
    for (int i = 0; i < times; i++) {
      registry.executeAction("undoable", Map.of());
    }
  }

  @Test
  void cleanupDropsEntriesOlderThanMaxAge() throws Exception {
    runRollbackable(3);
    Thread.sleep(20);

    CleanupResult result = registry.cleanup(CleanupOptions.maxAge(Duration.ofMillis(1)));

    assertEquals(3, result.historyRemoved());
    assertEquals(3, result.rollbacksRemoved());
    assertEquals(6, result.total());
    assertTrue(registry.getExecutionHistory(null, 10).isEmpty());
    assertTrue(registry.rollbackEntries().isEmpty());
  }

  @Test
  void cleanupKeepsRecentEntries() {
    runRollbackable(2);

    CleanupResult result = registry.cleanup(CleanupOptions.maxAge(Duration.ofHours(1)));

    assertEquals(0, result.total());
    assertEquals(2, registry.getExecutionHistory(null, 10).size());
  }

  @Test
  void cleanupAppliesCountLimitsOldestFirst() {
    runRollbackable(5);
    String newest = registry.getExecutionHistory(null, 1).get(0).id();

    CleanupResult result = registry.cleanup(new CleanupOptions(Duration.ofHours(1), 1, 2));

    assertEquals(4, result.historyRemoved());
    assertEquals(3, result.rollbacksRemoved());
    assertEquals(newest, registry.getExecutionHistory(null, 10).get(0).id());
    assertEquals(newest, registry.rollbackEntries().get(1).executionId());
  }

  @Test
  void runOnceDelegatesToRegistry() throws Exception {
    runRollbackable(2);
    Thread.sleep(20);
    try (RegistryMaintenanceScheduler scheduler = RegistryMaintenanceScheduler.builder()
        .registry(registry)
        .maxAge(Duration.ofMillis(1))
        .build()) {
      assertEquals(4, scheduler.runOnce().total());
      assertEquals(0, scheduler.runOnce().total());
    }
  }

  @Test
  void closedSchedulerDoesNothing() {
    runRollbackable(1);
    RegistryMaintenanceScheduler scheduler = RegistryMaintenanceScheduler.builder()
        .registry(registry)
        .options(new CleanupOptions(Duration.ZERO, 0, 0))
        .build();
    scheduler.start();
    scheduler.start();
    scheduler.close();

    assertEquals(0, scheduler.runOnce().total());
    assertEquals(1, registry.getExecutionHistory(null, 10).size());
    assertThrows(IllegalStateException.class, scheduler::start);
  }

  @Test
  void builderValidation() {
    assertThrows(NullPointerException.class,
        () -> RegistryMaintenanceScheduler.builder().build());
    assertThrows(IllegalArgumentException.class,
        () -> RegistryMaintenanceScheduler.builder().registry(registry).intervalSeconds(0).build());
    assertThrows(IllegalArgumentException.class,
        () -> new CleanupOptions(Duration.ofSeconds(-1), 1, 1));
  }
}
