package io.agentbus.action;

import io.agentbus.ActionExecutionException;
import io.agentbus.AgentBusException;
import io.agentbus.bus.Event;
import io.agentbus.bus.EventHandler;

import java.util.Objects;

/**
 * Route handler that runs one registered action per routed event.
 *
 * <p>The event payload becomes the parameters; the context takes {@code executedBy} from the
 * event source, {@code agentId} from the {@value #AGENT_ID_ATTRIBUTE} metadata attribute and
 * the event's correlation id. Failures of an action configured as not retryable are rethrown
 * as non-retryable so the router dead-letters them without further attempts.
 */
public final class ActionRouteHandler implements EventHandler {
  public static final String AGENT_ID_ATTRIBUTE = "agentId";

  private final ActionRegistry registry;
  private final String actionId;

  public ActionRouteHandler(ActionRegistry registry, String actionId) {
    this.registry = Objects.requireNonNull(registry, "registry");
    this.actionId = Objects.requireNonNull(actionId, "actionId");
  }

  public String actionId() {
    return actionId;
  }

  @Override
  public void onEvent(Event event) {
    ActionContext context = ActionContext.builder()
        .executedBy(event.source())
        .agentId(event.metadata().attribute(AGENT_ID_ATTRIBUTE))
        .correlationId(event.correlationId())
        .attribute("eventId", event.id())
        .attribute("eventType", event.type())
        .build();
    try {
      registry.executeAction(actionId, event.payload(), context);
    } catch (AgentBusException e) {
      boolean actionRetryable = registry.getAction(actionId)
          .map(action -> action.config().retryable())
          .orElse(true);
      if (e.retryable() && !actionRetryable) {
        throw new ActionExecutionException(e.getMessage(), e, false);
      }
      throw e;
    }
  }

  @Override
  public String toString() {
    return "ActionRouteHandler{actionId=" + actionId + '}';
  }
}
