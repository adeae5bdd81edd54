package io.agentbus.action;

import java.util.Map;

/**
 * Body of an action. The registry treats it as opaque: it validates before, times and
 * records around it, and never looks inside.
 *
 * <h2>Cancellation</h2>
 * <p>When the deadline passes, the registry interrupts the thread running the body and runs
 * every hook registered with {@link Execution#onCancel(Runnable)}. Bodies that start
 * subprocesses or other out-of-process work must register a hook that terminates it:
 * <pre>{@code
 * (params, context, execution) -> {
 *   Process process = new ProcessBuilder("git", "clone", url).start();
 *   execution.onCancel(process::destroyForcibly);
 *   return ActionResult.of(process.waitFor());
 * }
 * }</pre>
 */
@FunctionalInterface
public interface ActionExecutor {

  /**
   * @param params    validated parameters
   * @param context   caller context
   * @param execution the tracked execution, for its id, deadline and cancellation hooks
   * @return the result, optionally carrying rollback data
   * @throws Exception on failure; recorded and rethrown as an
   *     {@link io.agentbus.ActionExecutionException}
   */
  ActionResult execute(Map<String, Object> params, ActionContext context, Execution execution)
      throws Exception;
}
