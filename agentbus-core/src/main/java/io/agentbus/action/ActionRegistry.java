package io.agentbus.action;

import io.agentbus.ActionExecutionException;
import io.agentbus.ActionTimeoutException;
import io.agentbus.AgentBusException;
import io.agentbus.CapacityExceededException;
import io.agentbus.ConflictException;
import io.agentbus.DependencyException;
import io.agentbus.NotFoundException;
import io.agentbus.RollbackException;
import io.agentbus.ValidationException;
import io.agentbus.spi.DependencyChecker;
import io.agentbus.spi.MetricsExporter;
import io.agentbus.util.DaemonThreadFactory;
import io.agentbus.util.Ids;

import java.time.Instant;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Deque;
import java.util.EnumMap;
import java.util.HashMap;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.TreeSet;
import java.util.concurrent.CancellationException;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicLong;
import java.util.function.Consumer;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Registers actions and runs them under validation, dependency, concurrency and deadline
 * constraints, keeping execution history and a rollback ledger.
 *
 * <h2>Execution</h2>
 * <ol>
 *   <li>Unknown action: {@link NotFoundException}.</li>
 *   <li>Non-concurrent action already running: {@link ConflictException}.</li>
 *   <li>{@code maxConcurrentActions} executions running: {@link CapacityExceededException}.</li>
 *   <li>Parameters rejected by the validator: {@link ValidationException}.</li>
 *   <li>Unresolved dependency or permission: {@link DependencyException}.</li>
 *   <li>Body exceeds {@link ActionConfig#timeoutMs()}: {@link ActionTimeoutException}; the
 *       body thread is interrupted and its cancellation hooks run.</li>
 *   <li>Body throws: {@link ActionExecutionException}, retryable per
 *       {@link ActionConfig#retryable()}.</li>
 * </ol>
 * Rejections in steps 1-3 create no execution and leave stats untouched. Every later outcome
 * is recorded in stats and history before it reaches the caller. The registry never retries.
 *
 * <p>The running set, rollback ledger, history and category index are guarded by one lock.
 * Listener callbacks run on a dedicated notification thread.
 *
 * <p>Create instances via {@link #builder()}.
 */
public final class ActionRegistry implements AutoCloseable {
  private static final Logger logger = Logger.getLogger(ActionRegistry.class.getName());

  private final int maxConcurrentActions;
  private final int historyLimit;
  private final int rollbackLimit;
  private final Map<DependencyType, DependencyChecker> checkers;
  private final MetricsExporter metrics;
  private final long drainTimeoutMs;

  private final Map<String, ActionDefinition> actions = new ConcurrentHashMap<>();
  private final Object lock = new Object();
  private final Map<String, Set<String>> categories = new HashMap<>();
  private final Map<String, Execution> running = new LinkedHashMap<>();
  private final Map<String, Integer> runningPerAction = new HashMap<>();
  private final Deque<Execution> history = new ArrayDeque<>();
  private final LinkedHashMap<String, LedgerSlot> ledger = new LinkedHashMap<>();
  private final Set<String> rollbacksInFlight = ConcurrentHashMap.newKeySet();

  private final List<ActionListener> listeners = new CopyOnWriteArrayList<>();
  private final ExecutorService bodies;
  private final ExecutorService notifier;
  private final AtomicBoolean closed = new AtomicBoolean(false);

  private final AtomicLong executions = new AtomicLong();
  private final AtomicLong successes = new AtomicLong();
  private final AtomicLong failures = new AtomicLong();
  private final AtomicLong timeouts = new AtomicLong();
  private final AtomicLong rejected = new AtomicLong();
  private final AtomicLong rolledBack = new AtomicLong();

  private ActionRegistry(Builder builder) {
    if (builder.maxConcurrentActions <= 0) {
      throw new IllegalArgumentException("maxConcurrentActions must be > 0");
    }
    if (builder.historyLimit <= 0) {
      throw new IllegalArgumentException("historyLimit must be > 0");
    }
    if (builder.rollbackLimit <= 0) {
      throw new IllegalArgumentException("rollbackLimit must be > 0");
    }
    if (builder.drainTimeoutMs < 0) {
      throw new IllegalArgumentException("drainTimeoutMs must be >= 0");
    }
    this.maxConcurrentActions = builder.maxConcurrentActions;
    this.historyLimit = builder.historyLimit;
    this.rollbackLimit = builder.rollbackLimit;
    this.checkers = new EnumMap<>(builder.checkers);
    this.metrics = builder.metrics != null ? builder.metrics : MetricsExporter.NOOP;
    this.drainTimeoutMs = builder.drainTimeoutMs;
    this.listeners.addAll(builder.listeners);
    this.bodies = Executors.newCachedThreadPool(new DaemonThreadFactory("agentbus-action-"));
    this.notifier = Executors.newSingleThreadExecutor(
        new DaemonThreadFactory("agentbus-action-events-"));
  }

  public static Builder builder() {
    return new Builder();
  }

  // ---------------------------------------------------------------- registration

  /**
   * Registers an action.
   *
   * @return the action id
   * @throws ValidationException if name, description, category or execute is missing; every
   *     missing field is listed
   * @throws ConflictException   if an action with the same id is already registered
   */
  public String registerAction(ActionDefinition definition) {
    Objects.requireNonNull(definition, "definition");
    ensureOpen();
    List<String> violations = new ArrayList<>();
    if (isBlank(definition.name())) {
      violations.add("name is required");
    }
    if (isBlank(definition.description())) {
      violations.add("description is required");
    }
    if (isBlank(definition.category())) {
      violations.add("category is required");
    }
    if (definition.executor() == null) {
      violations.add("execute is required");
    }
    if (!violations.isEmpty()) {
      throw new ValidationException("Invalid action definition", violations);
    }
    synchronized (lock) {
      if (actions.putIfAbsent(definition.id(), definition) != null) {
        throw new ConflictException("Action already registered: " + definition.id(), false);
      }
      categories.computeIfAbsent(definition.category(), c -> new TreeSet<>()).add(definition.id());
    }
    logger.log(Level.INFO, "Registered action {0}", definition);
    return definition.id();
  }

  /**
   * Removes an action. Its history and rollback entries are kept; rolling those back fails
   * until an action with the same id is registered again.
   *
   * @throws NotFoundException if the action is unknown
   * @throws ConflictException if the action has running executions
   */
  public void unregisterAction(String actionId) {
    synchronized (lock) {
      ActionDefinition definition = actions.get(actionId);
      if (definition == null) {
        throw new NotFoundException("Action not found: " + actionId);
      }
      if (runningPerAction.getOrDefault(actionId, 0) > 0) {
        throw new ConflictException("Action " + actionId + " has running executions");
      }
      actions.remove(actionId);
      Set<String> ids = categories.get(definition.category());
      if (ids != null) {
        ids.remove(actionId);
        if (ids.isEmpty()) {
          categories.remove(definition.category());
        }
      }
    }
    logger.log(Level.INFO, "Unregistered action {0}", actionId);
  }

  public Optional<ActionDefinition> getAction(String actionId) {
    return Optional.ofNullable(actions.get(actionId));
  }

  public List<ActionDefinition> listActions() {
    return List.copyOf(actions.values());
  }

  public List<ActionDefinition> getActionsByCategory(String category) {
    List<ActionDefinition> result = new ArrayList<>();
    synchronized (lock) {
      for (String id : categories.getOrDefault(category, Set.of())) {
        ActionDefinition definition = actions.get(id);
        if (definition != null) {
          result.add(definition);
        }
      }
    }
    return result;
  }

  public Set<String> categories() {
    synchronized (lock) {
      return Set.copyOf(categories.keySet());
    }
  }

  public void addListener(ActionListener listener) {
    listeners.add(Objects.requireNonNull(listener, "listener"));
  }

  public void removeListener(ActionListener listener) {
    listeners.remove(listener);
  }

  // ---------------------------------------------------------------- execution

  /**
   * Runs an action with a system context.
   *
   * @see #executeAction(String, Map, ActionContext)
   */
  public ExecutionReceipt executeAction(String actionId, Map<String, Object> params) {
    return executeAction(actionId, params, ActionContext.system());
  }

  /**
   * Runs an action and waits for its outcome.
   *
   * @param actionId the action to run
   * @param params   parameters; {@code null} means none
   * @param context  caller context; {@code null} means {@link ActionContext#system()}
   * @return the execution id, logical result and duration
   * @throws AgentBusException typed by failure, see the class documentation
   */
  public ExecutionReceipt executeAction(String actionId, Map<String, Object> params,
      ActionContext context) {
    ensureOpen();
    Map<String, Object> parameters = params != null ? params : Map.of();
    ActionContext ctx = context != null ? context : ActionContext.system();

    ActionDefinition action = actions.get(actionId);
    if (action == null) {
      throw reject(actionId, new NotFoundException("Action not found: " + actionId));
    }

    Execution execution;
    synchronized (lock) {
      if (!action.config().concurrent() && runningPerAction.getOrDefault(actionId, 0) > 0) {
        throw reject(actionId, new ConflictException(
            "Action " + actionId + " is already running and does not allow concurrent execution"));
      }
      if (running.size() >= maxConcurrentActions) {
        throw reject(actionId, new CapacityExceededException(maxConcurrentActions));
      }
      execution = new Execution(Ids.next(), actionId, parameters, ctx, action.config().timeoutMs());
      running.put(execution.id(), execution);
      runningPerAction.merge(actionId, 1, Integer::sum);
    }
    publishGauges();
    logger.log(Level.FINE, "Started {0}", execution);

    long startNanos = System.nanoTime();
    try {
      validate(action, parameters, ctx);
      resolveDependencies(action, ctx);
      ActionResult outcome = runWithDeadline(action, parameters, ctx, execution);
      long durationMs = elapsedMs(startNanos);
      return succeed(action, execution, outcome, durationMs);
    } catch (AgentBusException e) {
      fail(action, execution, e, elapsedMs(startNanos));
      throw e;
    } catch (RuntimeException e) {
      ActionExecutionException wrapped = new ActionExecutionException(
          "Action " + actionId + " failed: " + e.getMessage(), e, action.config().retryable());
      fail(action, execution, wrapped, elapsedMs(startNanos));
      throw wrapped;
    } finally {
      synchronized (lock) {
        running.remove(execution.id());
        runningPerAction.computeIfPresent(actionId, (id, count) -> count > 1 ? count - 1 : null);
      }
      publishGauges();
    }
  }

  private void validate(ActionDefinition action, Map<String, Object> params, ActionContext ctx) {
    ValidationResult result;
    try {
      result = action.validator().validate(params, ctx);
    } catch (AgentBusException e) {
      throw e;
    } catch (Exception e) {
      throw new ValidationException("Validator failed for action " + action.id(),
          List.of(String.valueOf(e.getMessage())));
    }
    if (result != null && !result.valid()) {
      throw new ValidationException("Invalid parameters for action " + action.id(),
          result.errors().isEmpty() ? List.of("rejected by validator") : result.errors());
    }
  }

  private void resolveDependencies(ActionDefinition action, ActionContext ctx) {
    List<Dependency> required = new ArrayList<>(action.config().dependencies());
    for (String permission : action.config().permissions()) {
      required.add(Dependency.permission(permission));
    }
    List<String> unresolved = new ArrayList<>();
    for (Dependency dependency : required) {
      if (dependency.type() == DependencyType.ACTION) {
        if (!isRegistered(dependency.target())) {
          unresolved.add(dependency.toString());
        }
        continue;
      }
      DependencyChecker checker =
          checkers.getOrDefault(dependency.type(), DependencyChecker.ALWAYS_SATISFIED);
      try {
        if (!checker.isSatisfied(dependency, ctx)) {
          unresolved.add(dependency.toString());
        }
      } catch (Exception e) {
        logger.log(Level.WARNING, "Dependency check failed for " + dependency, e);
        unresolved.add(dependency + " (" + e.getMessage() + ")");
      }
    }
    if (!unresolved.isEmpty()) {
      throw new DependencyException(action.id(), unresolved);
    }
  }

  private boolean isRegistered(String idOrName) {
    if (actions.containsKey(idOrName)) {
      return true;
    }
    for (ActionDefinition definition : actions.values()) {
      if (idOrName.equals(definition.name())) {
        return true;
      }
    }
    return false;
  }

  private ActionResult runWithDeadline(ActionDefinition action, Map<String, Object> params,
      ActionContext ctx, Execution execution) {
    Future<ActionResult> future;
    try {
      future = bodies.submit(() -> action.executor().execute(params, ctx, execution));
    } catch (RejectedExecutionException e) {
      throw new ActionExecutionException("Registry is shutting down", e, false);
    }
    long timeoutMs = action.config().timeoutMs();
    try {
      ActionResult result = future.get(timeoutMs, TimeUnit.MILLISECONDS);
      return result != null ? result : ActionResult.empty();
    } catch (TimeoutException e) {
      future.cancel(true);
      execution.cancel();
      timeouts.incrementAndGet();
      metrics.incrementTimeouts();
      logger.log(Level.WARNING, "{0} exceeded its {1}ms deadline",
          new Object[]{execution, timeoutMs});
      throw new ActionTimeoutException(action.id(), timeoutMs);
    } catch (ExecutionException e) {
      Throwable cause = e.getCause();
      if (cause instanceof AgentBusException abe) {
        throw abe;
      }
      throw new ActionExecutionException(
          "Action " + action.id() + " failed: " + cause.getMessage(), cause,
          action.config().retryable());
    } catch (CancellationException e) {
      execution.cancel();
      throw new ActionExecutionException("Action " + action.id() + " was cancelled", e, false);
    } catch (InterruptedException e) {
      future.cancel(true);
      execution.cancel();
      Thread.currentThread().interrupt();
      throw new ActionExecutionException(
          "Interrupted while waiting for action " + action.id(), e, false);
    }
  }

  private ExecutionReceipt succeed(ActionDefinition action, Execution execution,
      ActionResult outcome, long durationMs) {
    execution.complete(outcome.result(), outcome.rollbackData(), durationMs);
    action.recordSuccess(durationMs, outcome.result());
    executions.incrementAndGet();
    successes.incrementAndGet();
    synchronized (lock) {
      appendHistory(execution);
      if (action.config().rollbackable() && outcome.hasRollbackData()) {
        RollbackEntry entry = new RollbackEntry(execution.id(), action.id(),
            outcome.rollbackData(), Instant.now());
        ledger.put(execution.id(), new LedgerSlot(entry, execution));
        trimLedger(rollbackLimit);
      }
    }
    metrics.recordExecution(action.id(), true, durationMs);
    logger.log(Level.FINE, "Completed {0}", execution);
    notifyListeners(listener -> listener.onCompleted(execution));
    return new ExecutionReceipt(execution.id(), outcome.result(), durationMs);
  }

  private void fail(ActionDefinition action, Execution execution, AgentBusException error,
      long durationMs) {
    execution.fail(error, durationMs);
    action.recordFailure();
    executions.incrementAndGet();
    failures.incrementAndGet();
    synchronized (lock) {
      appendHistory(execution);
    }
    metrics.recordExecution(action.id(), false, durationMs);
    logger.log(Level.WARNING, execution + " failed: " + error.getMessage());
    notifyListeners(listener -> listener.onFailed(execution, error));
  }

  private AgentBusException reject(String actionId, AgentBusException error) {
    rejected.incrementAndGet();
    metrics.incrementRejected();
    logger.log(Level.FINE, "Rejected {0}: {1}", new Object[]{actionId, error.getMessage()});
    notifyListeners(listener -> listener.onRejected(actionId, error));
    return error;
  }

  // ---------------------------------------------------------------- history

  /**
   * Returns recorded executions, most recent first.
   *
   * @param actionId only executions of this action, or {@code null} for all
   * @param limit    maximum number returned
   */
  public List<Execution> getExecutionHistory(String actionId, int limit) {
    List<Execution> result = new ArrayList<>();
    synchronized (lock) {
      Iterator<Execution> it = history.descendingIterator();
      while (it.hasNext() && result.size() < limit) {
        Execution execution = it.next();
        if (actionId == null || actionId.equals(execution.actionId())) {
          result.add(execution);
        }
      }
    }
    return result;
  }

  /**
   * Looks up a running or recorded execution.
   */
  public Optional<Execution> getExecution(String executionId) {
    synchronized (lock) {
      Execution execution = running.get(executionId);
      if (execution != null) {
        return Optional.of(execution);
      }
      for (Execution recorded : history) {
        if (recorded.id().equals(executionId)) {
          return Optional.of(recorded);
        }
      }
      LedgerSlot slot = ledger.get(executionId);
      return slot != null ? Optional.of(slot.execution()) : Optional.empty();
    }
  }

  public List<Execution> runningExecutions() {
    synchronized (lock) {
      return List.copyOf(running.values());
    }
  }

  private void appendHistory(Execution execution) {
    history.addLast(execution);
    while (history.size() > historyLimit) {
      history.removeFirst();
    }
  }

  // ---------------------------------------------------------------- rollback

  /**
   * Compensates a completed execution.
   *
   * @return whatever the compensator returned
   * @throws NotFoundException if no ledger entry exists for the execution, including after a
   *     successful rollback
   * @throws ConflictException if a rollback of the same execution is already in progress
   * @throws RollbackException if the action cannot be rolled back or the compensator fails; the
   *     ledger entry is kept for another attempt
   */
  public Object rollbackAction(String executionId) {
    LedgerSlot slot;
    synchronized (lock) {
      slot = ledger.get(executionId);
      if (slot == null) {
        throw new NotFoundException("No rollback entry for execution " + executionId);
      }
      if (!rollbacksInFlight.add(executionId)) {
        throw new ConflictException("Rollback already in progress for execution " + executionId,
            false);
      }
    }
    try {
      RollbackEntry entry = slot.entry();
      ActionDefinition action = actions.get(entry.actionId());
      if (action == null) {
        throw new RollbackException("Action " + entry.actionId() + " is no longer registered");
      }
      if (action.compensator() == null) {
        throw new RollbackException("Action " + action.id() + " does not support rollback");
      }
      Object result;
      try {
        result = action.compensator().rollback(entry.rollbackData(),
            new RollbackMeta(executionId, entry.timestamp()));
      } catch (AgentBusException e) {
        throw e;
      } catch (Exception e) {
        logger.log(Level.WARNING, "Rollback of execution " + executionId + " failed", e);
        throw new RollbackException("Rollback failed for execution " + executionId
            + ": " + e.getMessage(), e);
      }
      synchronized (lock) {
        ledger.remove(executionId);
      }
      slot.execution().markRolledBack();
      rolledBack.incrementAndGet();
      metrics.incrementRolledBack();
      publishGauges();
      logger.log(Level.INFO, "Rolled back execution {0} of {1}",
          new Object[]{executionId, action.id()});
      notifyListeners(listener -> listener.onRolledBack(slot.execution(), result));
      return result;
    } finally {
      rollbacksInFlight.remove(executionId);
    }
  }

  /**
   * Returns pending compensations, oldest first.
   */
  public List<RollbackEntry> rollbackEntries() {
    synchronized (lock) {
      List<RollbackEntry> entries = new ArrayList<>(ledger.size());
      for (LedgerSlot slot : ledger.values()) {
        entries.add(slot.entry());
      }
      return entries;
    }
  }

  private int trimLedger(int limit) {
    int removed = 0;
    Iterator<Map.Entry<String, LedgerSlot>> it = ledger.entrySet().iterator();
    while (ledger.size() > limit && it.hasNext()) {
      Map.Entry<String, LedgerSlot> oldest = it.next();
      if (rollbacksInFlight.contains(oldest.getKey())) {
        continue;
      }
      it.remove();
      removed++;
      logger.log(Level.WARNING, "Dropped rollback entry for execution {0}; ledger is full",
          oldest.getKey());
    }
    return removed;
  }

  // ---------------------------------------------------------------- maintenance

  /**
   * Drops history and rollback entries older than {@code maxAge}, then the oldest remaining
   * until each collection fits its limit. Running executions and rollbacks in progress are
   * never touched.
   */
  public CleanupResult cleanup(CleanupOptions options) {
    Objects.requireNonNull(options, "options");
    Instant cutoff = Instant.now().minus(options.maxAge());
    int historyRemoved = 0;
    int rollbacksRemoved = 0;
    synchronized (lock) {
      Iterator<Execution> executionsIt = history.iterator();
      while (executionsIt.hasNext()) {
        Execution execution = executionsIt.next();
        if (execution.status().isTerminal() && execution.completedAt().isBefore(cutoff)) {
          executionsIt.remove();
          historyRemoved++;
        }
      }
      while (history.size() > options.historyLimit()) {
        history.removeFirst();
        historyRemoved++;
      }

      Iterator<Map.Entry<String, LedgerSlot>> ledgerIt = ledger.entrySet().iterator();
      while (ledgerIt.hasNext()) {
        Map.Entry<String, LedgerSlot> entry = ledgerIt.next();
        if (entry.getValue().entry().timestamp().isBefore(cutoff)
            && !rollbacksInFlight.contains(entry.getKey())) {
          ledgerIt.remove();
          rollbacksRemoved++;
        }
      }
      rollbacksRemoved += trimLedger(options.rollbackLimit());
    }
    publishGauges();
    if (historyRemoved + rollbacksRemoved > 0) {
      logger.log(Level.INFO, "Cleanup removed {0} history and {1} rollback entries",
          new Object[]{historyRemoved, rollbacksRemoved});
    }
    return new CleanupResult(historyRemoved, rollbacksRemoved);
  }

  public RegistryMetrics metrics() {
    int runningCount;
    int pending;
    int historySize;
    synchronized (lock) {
      runningCount = running.size();
      pending = ledger.size();
      historySize = history.size();
    }
    return new RegistryMetrics(actions.size(), runningCount, maxConcurrentActions,
        executions.get(), successes.get(), failures.get(), timeouts.get(), rejected.get(),
        rolledBack.get(), pending, historySize);
  }

  public int maxConcurrentActions() {
    return maxConcurrentActions;
  }

  // ---------------------------------------------------------------- lifecycle

  /**
   * Stops accepting executions and waits up to the drain timeout for running bodies and
   * pending notifications.
   */
  @Override
  public void close() {
    if (!closed.compareAndSet(false, true)) {
      return;
    }
    bodies.shutdown();
    notifier.shutdown();
    try {
      if (!bodies.awaitTermination(drainTimeoutMs, TimeUnit.MILLISECONDS)) {
        logger.log(Level.WARNING, "Drain timeout exceeded; interrupting {0} running executions",
            runningExecutions().size());
        bodies.shutdownNow();
      }
      if (!notifier.awaitTermination(drainTimeoutMs, TimeUnit.MILLISECONDS)) {
        notifier.shutdownNow();
      }
    } catch (InterruptedException e) {
      bodies.shutdownNow();
      notifier.shutdownNow();
      Thread.currentThread().interrupt();
    }
  }

  private void ensureOpen() {
    if (closed.get()) {
      throw new IllegalStateException("ActionRegistry has been closed");
    }
  }

  private void notifyListeners(Consumer<ActionListener> callback) {
    if (listeners.isEmpty()) {
      return;
    }
    try {
      notifier.execute(() -> {
        for (ActionListener listener : listeners) {
          try {
            callback.accept(listener);
          } catch (RuntimeException e) {
            logger.log(Level.WARNING, "Action listener " + listener + " failed", e);
          }
        }
      });
    } catch (RejectedExecutionException e) {
      logger.log(Level.FINE, "Registry closed, notification dropped", e);
    }
  }

  private void publishGauges() {
    int runningCount;
    int pending;
    synchronized (lock) {
      runningCount = running.size();
      pending = ledger.size();
    }
    metrics.recordRegistryGauges(runningCount, pending);
  }

  private static long elapsedMs(long startNanos) {
    return TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - startNanos);
  }

  private static boolean isBlank(String value) {
    return value == null || value.isBlank();
  }

  private record LedgerSlot(RollbackEntry entry, Execution execution) {
  }

  /** Builder for {@link ActionRegistry}. */
  public static final class Builder {
    private int maxConcurrentActions = 10;
    private int historyLimit = 1000;
    private int rollbackLimit = 1000;
    private final Map<DependencyType, DependencyChecker> checkers =
        new EnumMap<>(DependencyType.class);
    private final List<ActionListener> listeners = new ArrayList<>();
    private MetricsExporter metrics;
    private long drainTimeoutMs = 5000;

    private Builder() {}

    /**
     * Sets the ceiling on executions running at once. Calls beyond it are rejected with
     * {@link CapacityExceededException}; nothing is queued.
     *
     * <p>Optional. Defaults to {@code 10}. Must be &gt; 0.
     */
    public Builder maxConcurrentActions(int maxConcurrentActions) {
      this.maxConcurrentActions = maxConcurrentActions;
      return this;
    }

    /**
     * Sets how many finished executions are kept, oldest evicted first.
     *
     * <p>Optional. Defaults to {@code 1000}. Must be &gt; 0.
     */
    public Builder historyLimit(int historyLimit) {
      this.historyLimit = historyLimit;
      return this;
    }

    /**
     * Sets how many pending compensations are kept. When full, the oldest entry is dropped
     * and a warning logged.
     *
     * <p>Optional. Defaults to {@code 1000}. Must be &gt; 0.
     */
    public Builder rollbackLimit(int rollbackLimit) {
      this.rollbackLimit = rollbackLimit;
      return this;
    }

    /**
     * Registers the checker for a dependency kind. {@link DependencyType#ACTION} dependencies
     * are always resolved by the registry itself.
     *
     * <p>Optional. Unregistered kinds use {@link DependencyChecker#ALWAYS_SATISFIED}.
     */
    public Builder dependencyChecker(DependencyType type, DependencyChecker checker) {
      if (type == DependencyType.ACTION) {
        throw new IllegalArgumentException("ACTION dependencies are resolved by the registry");
      }
      checkers.put(Objects.requireNonNull(type, "type"),
          Objects.requireNonNull(checker, "checker"));
      return this;
    }

    public Builder listener(ActionListener listener) {
      listeners.add(Objects.requireNonNull(listener, "listener"));
      return this;
    }

    public Builder listeners(Collection<? extends ActionListener> listeners) {
      listeners.forEach(this::listener);
      return this;
    }

    /** Optional. Defaults to {@link MetricsExporter#NOOP}. */
    public Builder metrics(MetricsExporter metrics) {
      this.metrics = metrics;
      return this;
    }

    /**
     * Sets how long {@link ActionRegistry#close()} waits for running bodies.
     *
     * <p>Optional. Defaults to {@code 5000}. Must be &ge; 0.
     */
    public Builder drainTimeoutMs(long drainTimeoutMs) {
      this.drainTimeoutMs = drainTimeoutMs;
      return this;
    }

    public ActionRegistry build() {
      return new ActionRegistry(this);
    }
  }
}
