package io.agentbus.action;

import io.agentbus.AgentBusException;
import io.agentbus.bus.EventBus;
import io.agentbus.bus.PublishOptions;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Republishes execution outcomes on the bus so routes can react to them.
 *
 * <p>Events carry the execution's correlation id, so the outcome joins the chain of events
 * that caused it. Publishing runs on the registry's notification thread; a failed publish is
 * logged and dropped.
 *
 * <table>
 *   <caption>Published events</caption>
 *   <tr><th>type</th><th>payload</th></tr>
 *   <tr><td>{@value #COMPLETED}</td><td>executionId, actionId, executedBy, durationMs, result</td></tr>
 *   <tr><td>{@value #FAILED}</td><td>executionId, actionId, executedBy, durationMs, code, error,
 *       retryable</td></tr>
 *   <tr><td>{@value #ROLLED_BACK}</td><td>executionId, actionId, executedBy</td></tr>
 * </table>
 */
public final class ActionEventPublisher implements ActionListener {
  private static final Logger logger = Logger.getLogger(ActionEventPublisher.class.getName());

  public static final String COMPLETED = "action.completed";
  public static final String FAILED = "action.failed";
  public static final String ROLLED_BACK = "action.rolledback";
  public static final String SOURCE = "action-registry";

  private final EventBus eventBus;

  public ActionEventPublisher(EventBus eventBus) {
    this.eventBus = Objects.requireNonNull(eventBus, "eventBus");
  }

  @Override
  public void onCompleted(Execution execution) {
    Map<String, Object> payload = basePayload(execution);
    payload.put("durationMs", execution.durationMs());
    if (execution.result() != null) {
      payload.put("result", execution.result());
    }
    publish(COMPLETED, execution, payload);
  }

  @Override
  public void onFailed(Execution execution, AgentBusException error) {
    Map<String, Object> payload = basePayload(execution);
    payload.put("durationMs", execution.durationMs());
    payload.put("code", error.code().name());
    payload.put("error", String.valueOf(error.getMessage()));
    payload.put("retryable", error.retryable());
    publish(FAILED, execution, payload);
  }

  @Override
  public void onRolledBack(Execution execution, Object rollbackResult) {
    publish(ROLLED_BACK, execution, basePayload(execution));
  }

  private static Map<String, Object> basePayload(Execution execution) {
    Map<String, Object> payload = new LinkedHashMap<>();
    payload.put("executionId", execution.id());
    payload.put("actionId", execution.actionId());
    payload.put("executedBy", execution.context().executedBy());
    if (execution.context().agentId() != null) {
      payload.put("agentId", execution.context().agentId());
    }
    return payload;
  }

  private void publish(String type, Execution execution, Map<String, Object> payload) {
    PublishOptions options = PublishOptions.builder()
        .source(SOURCE)
        .correlationId(execution.context().correlationId())
        .build();
    try {
      eventBus.publish(type, payload, options);
    } catch (AgentBusException e) {
      logger.log(Level.WARNING, "Could not publish " + type + " for " + execution, e);
    } catch (RuntimeException e) {
      logger.log(Level.SEVERE, "Failed to encode " + type + " for " + execution, e);
    }
  }
}
