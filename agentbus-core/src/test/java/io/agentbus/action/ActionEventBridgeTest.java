package io.agentbus.action;

import io.agentbus.ValidationException;
import io.agentbus.bus.Event;
import io.agentbus.bus.EventBus;
import io.agentbus.bus.PublishOptions;
import io.agentbus.router.DeadLetter;
import io.agentbus.router.EventRouter;
import io.agentbus.router.RouteOptions;
import io.agentbus.transport.InMemoryTransport;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicInteger;

import static io.agentbus.action.ActionTestSupport.action;
import static io.agentbus.action.ActionTestSupport.awaitCondition;
import static org.junit.jupiter.api.Assertions.*;

/**
 * Routes bus events into the registry and publishes action outcomes back onto the bus.
 */
class ActionEventBridgeTest {

  private InMemoryTransport transport;
  private EventBus bus;
  private EventRouter router;
  private ActionRegistry registry;
  private final List<Event> outcomes = new CopyOnWriteArrayList<>();

  @BeforeEach
  void setUp() {
    transport = new InMemoryTransport();
    bus = EventBus.builder().transport(transport).build();
    bus.connect();
    router = EventRouter.builder().eventBus(bus).baseDelayMs(10).defaultMaxRetries(2).build();
    registry = ActionRegistry.builder().listener(new ActionEventPublisher(bus)).build();
    bus.subscribe(List.of(ActionEventPublisher.COMPLETED, ActionEventPublisher.FAILED,
        ActionEventPublisher.ROLLED_BACK), outcomes::add);
  }

  @AfterEach
  void tearDown() {
    router.close();
    registry.close();
    bus.close();
    transport.close();
  }

  private Event awaitOutcome(String type) throws InterruptedException {
    awaitCondition(() -> outcomes.stream().anyMatch(e -> e.type().equals(type)));
    return outcomes.stream().filter(e -> e.type().equals(type)).findFirst().orElseThrow();
  }

  // ── Outcome publishing ──────────────────────────────────────────

  @Test
  void completionIsPublishedWithCallerCorrelation() throws Exception {
    registry.registerAction(action("echo").build());
    ActionContext context = ActionContext.builder()
        .executedBy("planner")
        .agentId("agent-7")
        .correlationId("corr-1")
        .build();

    String executionId = registry.executeAction("echo", Map.of("value", "done"), context)
        .executionId();

    Event completed = awaitOutcome(ActionEventPublisher.COMPLETED);
    assertEquals("corr-1", completed.correlationId());
    assertEquals(ActionEventPublisher.SOURCE, completed.source());
    assertEquals(executionId, completed.payload().get("executionId"));
    assertEquals("echo", completed.payload().get("actionId"));
    assertEquals("planner", completed.payload().get("executedBy"));
    assertEquals("agent-7", completed.payload().get("agentId"));
    assertEquals("done", completed.payload().get("result"));
    assertTrue(completed.payload().containsKey("durationMs"));
  }

  @Test
  void failureIsPublishedWithErrorCode() throws Exception {
    registry.registerAction(action("picky")
        .validate((params, context) -> ValidationResult.invalid("path is required"))
        .build());

    assertThrows(ValidationException.class, () -> registry.executeAction("picky", Map.of()));

    Event failed = awaitOutcome(ActionEventPublisher.FAILED);
    assertEquals("VALIDATION", failed.payload().get("code"));
    assertEquals(false, failed.payload().get("retryable"));
    assertTrue(String.valueOf(failed.payload().get("error")).contains("path is required"));
    assertFalse(failed.payload().containsKey("agentId"));
  }

  @Test
  void rollbackIsPublished() throws Exception {
    registry.registerAction(action("undoable")
        .config(ActionConfig.builder().rollbackable(true).build())
        .execute((params, context, execution) -> ActionResult.withRollback("x", Map.of("k", "v")))
        .rollback((data, meta) -> "undone")
        .build());
    String executionId = registry.executeAction("undoable", Map.of()).executionId();

    registry.rollbackAction(executionId);

    Event rolledBack = awaitOutcome(ActionEventPublisher.ROLLED_BACK);
    assertEquals(executionId, rolledBack.payload().get("executionId"));
  }

  @Test
  void publishFailureDoesNotFailExecution() {
    registry.registerAction(action("echo").build());
    bus.close();

    assertEquals("ok", registry.executeAction("echo", Map.of("value", "ok")).result());
  }

  // ── Event to action routing ─────────────────────────────────────

  @Test
  void routedEventRunsActionWithEventContext() throws Exception {
    List<ActionContext> contexts = new CopyOnWriteArrayList<>();
    registry.registerAction(action("index")
        .execute((params, context, execution) -> {
          contexts.add(context);
          return ActionResult.of(params.get("path"));
        })
        .build());
    router.addRoute(Set.of("document.uploaded"), new ActionRouteHandler(registry, "index"),
        RouteOptions.defaults());

    String eventId = bus.publish("document.uploaded", Map.of("path", "/tmp/a.pdf"),
        PublishOptions.builder()
            .source("uploader")
            .correlationId("corr-9")
            .attribute(ActionRouteHandler.AGENT_ID_ATTRIBUTE, "agent-1")
            .build());

    Event completed = awaitOutcome(ActionEventPublisher.COMPLETED);
    assertEquals("corr-9", completed.correlationId());
    assertEquals("/tmp/a.pdf", completed.payload().get("result"));
    ActionContext context = contexts.get(0);
    assertEquals("uploader", context.executedBy());
    assertEquals("agent-1", context.agentId());
    assertEquals(eventId, context.attributes().get("eventId"));
    assertEquals("document.uploaded", context.attributes().get("eventType"));
  }

  @Test
  void nonRetryableActionIsDeadLetteredOnFirstFailure() throws Exception {
    AtomicInteger attempts = new AtomicInteger();
    registry.registerAction(action("charge")
        .config(ActionConfig.builder().retryable(false).build())
        .execute((params, context, execution) -> {
          attempts.incrementAndGet();
          throw new IllegalStateException("card declined");
        })
        .build());
    String routeId = router.addRoute(Set.of("payment.requested"),
        new ActionRouteHandler(registry, "charge"), RouteOptions.defaults());

    bus.publish("payment.requested", Map.of("amount", 10));

    awaitCondition(() -> router.deadLetters().count("payment.requested") == 1);
    DeadLetter deadLetter = router.deadLetters().query("payment.requested", 1).get(0);
    assertEquals(routeId, deadLetter.routeId());
    assertTrue(deadLetter.error().contains("card declined"));
    assertEquals(1, attempts.get());
    assertEquals(0, router.routeMetrics(routeId).retried());
  }

  @Test
  void retryableActionIsRetriedBeforeDeadLettering() throws Exception {
    AtomicInteger attempts = new AtomicInteger();
    registry.registerAction(action("fetch")
        .execute((params, context, execution) -> {
          attempts.incrementAndGet();
          throw new IllegalStateException("upstream unavailable");
        })
        .build());
    String routeId = router.addRoute(Set.of("page.requested"),
        new ActionRouteHandler(registry, "fetch"), RouteOptions.builder().maxRetries(2).build());

    bus.publish("page.requested", Map.of());

    awaitCondition(() -> router.deadLetters().count("page.requested") == 1);
    assertEquals(3, attempts.get());
    assertEquals(2, router.routeMetrics(routeId).retried());
    assertEquals(3, registry.getAction("fetch").orElseThrow().stats().failures());
  }

  @Test
  void retryableErrorFromNonRetryableActionIsNotRetried() throws Exception {
    registry.registerAction(action("once")
        .config(ActionConfig.builder().retryable(false).timeoutMs(50).build())
        .execute((params, context, execution) -> {
          Thread.sleep(5_000);
          return ActionResult.empty();
        })
        .build());
    String routeId = router.addRoute(Set.of("job.requested"),
        new ActionRouteHandler(registry, "once"), RouteOptions.defaults());

    bus.publish("job.requested", Map.of());

    awaitCondition(() -> router.deadLetters().count("job.requested") == 1);
    assertEquals(0, router.routeMetrics(routeId).retried());
    assertEquals(1, registry.metrics().timeouts());
  }
}
