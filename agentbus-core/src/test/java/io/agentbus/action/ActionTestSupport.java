package io.agentbus.action;

import java.time.Duration;
import java.util.function.BooleanSupplier;

import static org.junit.jupiter.api.Assertions.fail;

final class ActionTestSupport {

  private ActionTestSupport() {
  }

  static ActionDefinition.Builder action(String id) {
    return ActionDefinition.builder()
        .id(id)
        .name(id)
        .description("test action " + id)
        .category("test")
        .execute((params, context, execution) -> ActionResult.of(params.get("value")));
  }

  static void awaitCondition(BooleanSupplier condition) throws InterruptedException {
    long deadline = System.nanoTime() + Duration.ofSeconds(5).toNanos();
    while (!condition.getAsBoolean()) {
      if (System.nanoTime() > deadline) {
        fail("Condition not met within 5s");
      }
      Thread.sleep(5);
    }
  }
}
