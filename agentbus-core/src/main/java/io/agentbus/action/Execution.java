package io.agentbus.action;

import io.agentbus.AgentBusException;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * One tracked invocation of an action.
 *
 * <p>Status moves {@code RUNNING -> COMPLETED | FAILED} exactly once; a completed execution may
 * later move to {@code ROLLED_BACK}. Bodies use {@link #onCancel(Runnable)} to release
 * out-of-process work when the deadline passes.
 */
public final class Execution {
  private static final Logger logger = Logger.getLogger(Execution.class.getName());

  private final String id;
  private final String actionId;
  private final Map<String, Object> parameters;
  private final ActionContext context;
  private final Instant startedAt;
  private final Instant deadline;
  private final List<Runnable> cancelHooks = new CopyOnWriteArrayList<>();

  private ExecutionStatus status = ExecutionStatus.RUNNING;
  private Object result;
  private AgentBusException error;
  private Map<String, Object> rollbackData;
  private Instant completedAt;
  private long durationMs;
  private volatile boolean cancelled;

  Execution(String id, String actionId, Map<String, Object> parameters, ActionContext context,
      long timeoutMs) {
    this.id = id;
    this.actionId = actionId;
    this.parameters = Collections.unmodifiableMap(new LinkedHashMap<>(parameters));
    this.context = context;
    this.startedAt = Instant.now();
    this.deadline = startedAt.plusMillis(timeoutMs);
  }

  public String id() {
    return id;
  }

  public String actionId() {
    return actionId;
  }

  public Map<String, Object> parameters() {
    return parameters;
  }

  public ActionContext context() {
    return context;
  }

  public Instant startedAt() {
    return startedAt;
  }

  public Instant deadline() {
    return deadline;
  }

  public synchronized ExecutionStatus status() {
    return status;
  }

  public synchronized Object result() {
    return result;
  }

  /**
   * Returns the failure, or {@code null} unless the status is {@link ExecutionStatus#FAILED}.
   */
  public synchronized AgentBusException error() {
    return error;
  }

  public synchronized Map<String, Object> rollbackData() {
    return rollbackData;
  }

  public synchronized Instant completedAt() {
    return completedAt;
  }

  public synchronized long durationMs() {
    return durationMs;
  }

  /**
   * Returns {@code true} once the deadline passed and the execution was cancelled. Long-running
   * bodies that do not respond to interrupts should poll this.
   */
  public boolean isCancelled() {
    return cancelled;
  }

  /**
   * Registers a hook run when the execution is cancelled on timeout. A hook registered after
   * cancellation runs immediately.
   */
  public void onCancel(Runnable hook) {
    cancelHooks.add(hook);
    if (cancelled && cancelHooks.remove(hook)) {
      runHook(hook);
    }
  }

  void cancel() {
    cancelled = true;
    for (Runnable hook : cancelHooks) {
      if (cancelHooks.remove(hook)) {
        runHook(hook);
      }
    }
  }

  private void runHook(Runnable hook) {
    try {
      hook.run();
    } catch (RuntimeException e) {
      logger.log(Level.WARNING, "Cancellation hook failed for execution " + id, e);
    }
  }

  synchronized void complete(Object result, Map<String, Object> rollbackData, long durationMs) {
    requireStatus(ExecutionStatus.RUNNING);
    this.status = ExecutionStatus.COMPLETED;
    this.result = result;
    this.rollbackData = rollbackData;
    finish(durationMs);
  }

  synchronized void fail(AgentBusException error, long durationMs) {
    requireStatus(ExecutionStatus.RUNNING);
    this.status = ExecutionStatus.FAILED;
    this.error = error;
    finish(durationMs);
  }

  synchronized void markRolledBack() {
    requireStatus(ExecutionStatus.COMPLETED);
    this.status = ExecutionStatus.ROLLED_BACK;
  }

  private void finish(long durationMs) {
    this.durationMs = durationMs;
    this.completedAt = Instant.now();
  }

  private void requireStatus(ExecutionStatus expected) {
    if (status != expected) {
      throw new IllegalStateException(
          "Execution " + id + " is " + status + ", expected " + expected);
    }
  }

  @Override
  public synchronized String toString() {
    return "Execution{id=" + id + ", actionId=" + actionId + ", status=" + status
        + ", durationMs=" + durationMs + '}';
  }
}
