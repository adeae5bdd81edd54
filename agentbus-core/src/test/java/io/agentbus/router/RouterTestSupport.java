package io.agentbus.router;

import java.time.Duration;
import java.util.function.BooleanSupplier;

import static org.junit.jupiter.api.Assertions.fail;

final class RouterTestSupport {

  private RouterTestSupport() {
  }

  static void awaitCondition(BooleanSupplier condition) throws InterruptedException {
    awaitCondition(condition, Duration.ofSeconds(5));
  }

  static void awaitCondition(BooleanSupplier condition, Duration timeout)
      throws InterruptedException {
    long deadline = System.nanoTime() + timeout.toNanos();
    while (!condition.getAsBoolean()) {
      if (System.nanoTime() > deadline) {
        fail("Condition not met within " + timeout);
      }
      Thread.sleep(5);
    }
  }
}
