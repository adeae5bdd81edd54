package io.agentbus.action;

import io.agentbus.ConflictException;
import io.agentbus.NotFoundException;
import io.agentbus.RollbackException;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;

import static io.agentbus.action.ActionTestSupport.action;
import static io.agentbus.action.ActionTestSupport.awaitCondition;
import static org.junit.jupiter.api.Assertions.*;

class ActionRollbackTest {

  @TempDir
  Path dir;

  private ActionRegistry registry = ActionRegistry.builder().build();

  @AfterEach
  void tearDown() {
    registry.close();
  }

  private static ActionDefinition createFile(ActionCompensator compensator) {
    return action("createFile")
        .category("filesystem")
        .config(ActionConfig.builder().rollbackable(true).build())
        .execute((params, context, execution) -> {
          Path path = Path.of((String) params.get("path"));
          Files.writeString(path, (String) params.get("content"));
          return ActionResult.withRollback(path.toString(), Map.of("path", path.toString()));
        })
        .rollback(compensator)
        .build();
  }

  private static Object deleteFile(Map<String, Object> data, RollbackMeta meta) throws IOException {
    return Files.deleteIfExists(Path.of((String) data.get("path")));
  }

  @Test
  void createThenRollbackRemovesFile() throws Exception {
    List<String> rolledBack = new CopyOnWriteArrayList<>();
    registry.addListener(new ActionListener() {
      @Override
      public void onRolledBack(Execution execution, Object rollbackResult) {
        rolledBack.add(execution.id() + "=" + rollbackResult);
      }
    });
    registry.registerAction(createFile(ActionRollbackTest::deleteFile));
    Path file = dir.resolve("notes.txt");

    ExecutionReceipt receipt = registry.executeAction("createFile",
        Map.of("path", file.toString(), "content", "hello"));

    assertTrue(Files.exists(file));
    assertEquals(1, registry.rollbackEntries().size());
    RollbackEntry entry = registry.rollbackEntries().get(0);
    assertEquals(receipt.executionId(), entry.executionId());
    assertEquals("createFile", entry.actionId());
    assertEquals(Map.of("path", file.toString()), entry.rollbackData());

    assertEquals(true, registry.rollbackAction(receipt.executionId()));

    assertFalse(Files.exists(file));
    assertTrue(registry.rollbackEntries().isEmpty());
    assertEquals(ExecutionStatus.ROLLED_BACK,
        registry.getExecution(receipt.executionId()).orElseThrow().status());
    assertEquals(1, registry.metrics().rolledBack());
    awaitCondition(() -> rolledBack.size() == 1);
    assertEquals(receipt.executionId() + "=true", rolledBack.get(0));

    assertThrows(NotFoundException.class, () -> registry.rollbackAction(receipt.executionId()));
  }

  @Test
  void compensatorReceivesExecutionMetadata() {
    AtomicBoolean matched = new AtomicBoolean();
    registry.registerAction(createFile((data, meta) -> {
      matched.set(meta.executionId() != null && meta.originalTimestamp() != null);
      return null;
    }));
    String executionId = registry.executeAction("createFile",
        Map.of("path", dir.resolve("a.txt").toString(), "content", "")).executionId();

    assertNull(registry.rollbackAction(executionId));
    assertTrue(matched.get());
  }

  @Test
  void nothingIsRecordedWithoutRollbackData() {
    registry.registerAction(action("plain")
        .config(ActionConfig.builder().rollbackable(true).build())
        .rollback((data, meta) -> "unused")
        .build());
    registry.registerAction(action("notRollbackable")
        .execute((params, context, execution) -> ActionResult.withRollback("x", Map.of("k", "v")))
        .build());

    String plain = registry.executeAction("plain", Map.of()).executionId();
    String other = registry.executeAction("notRollbackable", Map.of()).executionId();

    assertTrue(registry.rollbackEntries().isEmpty());
    assertThrows(NotFoundException.class, () -> registry.rollbackAction(plain));
    assertThrows(NotFoundException.class, () -> registry.rollbackAction(other));
  }

  @Test
  void failedCompensationKeepsEntryForRetry() throws Exception {
    AtomicBoolean broken = new AtomicBoolean(true);
    registry.registerAction(createFile((data, meta) -> {
      if (broken.get()) {
        throw new IOException("device busy");
      }
      return deleteFile(data, meta);
    }));
    Path file = dir.resolve("retry.txt");
    String executionId = registry.executeAction("createFile",
        Map.of("path", file.toString(), "content", "x")).executionId();

    RollbackException e = assertThrows(RollbackException.class,
        () -> registry.rollbackAction(executionId));
    assertInstanceOf(IOException.class, e.getCause());
    assertFalse(e.retryable());
    assertEquals(1, registry.rollbackEntries().size());
    assertEquals(ExecutionStatus.COMPLETED,
        registry.getExecution(executionId).orElseThrow().status());

    broken.set(false);
    assertEquals(true, registry.rollbackAction(executionId));
    assertFalse(Files.exists(file));
  }

  @Test
  void missingCompensatorFailsAndKeepsEntry() {
    registry.registerAction(action("oneWay")
        .config(ActionConfig.builder().rollbackable(true).build())
        .execute((params, context, execution) -> ActionResult.withRollback(null, Map.of("k", 1)))
        .build());
    String executionId = registry.executeAction("oneWay", Map.of()).executionId();

    assertThrows(RollbackException.class, () -> registry.rollbackAction(executionId));
    assertEquals(1, registry.rollbackEntries().size());
  }

  @Test
  void unregisteredActionCannotBeRolledBack() {
    registry.registerAction(createFile(ActionRollbackTest::deleteFile));
    String executionId = registry.executeAction("createFile",
        Map.of("path", dir.resolve("b.txt").toString(), "content", "")).executionId();
    registry.unregisterAction("createFile");

    assertThrows(RollbackException.class, () -> registry.rollbackAction(executionId));
    assertEquals(1, registry.rollbackEntries().size());
  }

  @Test
  void concurrentRollbackOfSameExecutionConflicts() throws Exception {
    CountDownLatch entered = new CountDownLatch(1);
    CountDownLatch release = new CountDownLatch(1);
    registry.registerAction(createFile((data, meta) -> {
      entered.countDown();
      release.await();
      return deleteFile(data, meta);
    }));
    String executionId = registry.executeAction("createFile",
        Map.of("path", dir.resolve("c.txt").toString(), "content", "")).executionId();

    ExecutorService caller = Executors.newSingleThreadExecutor();
    try {
      Future<Object> first = caller.submit(() -> registry.rollbackAction(executionId));
      assertTrue(entered.await(5, TimeUnit.SECONDS));

      ConflictException e = assertThrows(ConflictException.class,
          () -> registry.rollbackAction(executionId));
      assertFalse(e.retryable());

      release.countDown();
      assertEquals(true, first.get(5, TimeUnit.SECONDS));
      assertEquals(1, registry.metrics().rolledBack());
    } finally {
      caller.shutdownNow();
    }
  }

  @Test
  void ledgerLimitEvictsOldestEntry() {
    registry.close();
    registry = ActionRegistry.builder().rollbackLimit(2).build();
    registry.registerAction(createFile(ActionRollbackTest::deleteFile));

    String first = null;
    for (int i = 0; i < 3; i++) {
      String id = registry.executeAction("createFile",
          Map.of("path", dir.resolve("f" + i).toString(), "content", "")).executionId();
      if (first == null) {
        first = id;
      }
    }

    assertEquals(2, registry.rollbackEntries().size());
    assertEquals(2, registry.metrics().pendingRollbacks());
    String evicted = first;
    assertThrows(NotFoundException.class, () -> registry.rollbackAction(evicted));
  }
}
