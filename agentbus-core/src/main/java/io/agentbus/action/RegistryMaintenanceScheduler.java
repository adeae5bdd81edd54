package io.agentbus.action;

import io.agentbus.util.DaemonThreadFactory;

import java.time.Duration;
import java.util.Objects;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Runs {@link ActionRegistry#cleanup(CleanupOptions)} on a fixed delay.
 *
 * <p>Create instances via {@link #builder()}, then call {@link #start()}.
 *
 * @see RegistryMaintenanceScheduler.Builder
 */
public final class RegistryMaintenanceScheduler implements AutoCloseable {
  private static final Logger logger =
      Logger.getLogger(RegistryMaintenanceScheduler.class.getName());

  private final ActionRegistry registry;
  private final CleanupOptions options;
  private final long intervalSeconds;

  private ScheduledExecutorService scheduler;
  private volatile ScheduledFuture<?> cleanupTask;
  private volatile boolean closed;

  private RegistryMaintenanceScheduler(Builder builder) {
    this.registry = Objects.requireNonNull(builder.registry, "registry");
    if (builder.intervalSeconds <= 0L) {
      throw new IllegalArgumentException("intervalSeconds must be > 0");
    }
    this.options = builder.options != null
        ? builder.options
        : CleanupOptions.maxAge(CleanupOptions.DEFAULT_MAX_AGE);
    this.intervalSeconds = builder.intervalSeconds;
  }

  public static Builder builder() {
    return new Builder();
  }

  /**
   * Starts the cleanup loop. Subsequent calls are no-ops if already started.
   */
  public synchronized void start() {
    if (closed) {
      throw new IllegalStateException("RegistryMaintenanceScheduler has been closed");
    }
    if (cleanupTask != null) {
      return;
    }
    scheduler = Executors.newSingleThreadScheduledExecutor(
        new DaemonThreadFactory("agentbus-maintenance-"));
    cleanupTask = scheduler.scheduleWithFixedDelay(
        this::runOnce, intervalSeconds, intervalSeconds, TimeUnit.SECONDS);
  }

  /**
   * Runs a single cleanup pass. May be invoked directly for tests or one-off maintenance.
   *
   * @return what was removed, or an empty result if the scheduler is closed or the pass failed
   */
  public CleanupResult runOnce() {
    if (closed) {
      return new CleanupResult(0, 0);
    }
    try {
      return registry.cleanup(options);
    } catch (RuntimeException e) {
      logger.log(Level.SEVERE, "Registry cleanup failed", e);
      return new CleanupResult(0, 0);
    }
  }

  /** Cancels the schedule and shuts down the scheduler thread. */
  @Override
  public synchronized void close() {
    closed = true;
    if (cleanupTask != null) {
      cleanupTask.cancel(false);
      cleanupTask = null;
    }
    if (scheduler != null) {
      scheduler.shutdownNow();
      try {
        scheduler.awaitTermination(5, TimeUnit.SECONDS);
      } catch (InterruptedException e) {
        Thread.currentThread().interrupt();
      }
    }
  }

  /** Builder for {@link RegistryMaintenanceScheduler}. */
  public static final class Builder {
    private ActionRegistry registry;
    private CleanupOptions options;
    private long intervalSeconds = 3600;

    private Builder() {}

    /**
     * <p><b>Required.</b>
     */
    public Builder registry(ActionRegistry registry) {
      this.registry = registry;
      return this;
    }

    /**
     * Sets the bounds applied on every pass.
     *
     * <p>Optional. Defaults to entries older than 24 hours, no count limits beyond the
     * registry's own.
     */
    public Builder options(CleanupOptions options) {
      this.options = options;
      return this;
    }

    /** Shorthand for {@code options(CleanupOptions.maxAge(maxAge))}. */
    public Builder maxAge(Duration maxAge) {
      this.options = CleanupOptions.maxAge(maxAge);
      return this;
    }

    /**
     * Sets the interval in seconds between passes.
     *
     * <p>Optional. Defaults to {@code 3600} (1 hour). Must be &gt; 0.
     */
    public Builder intervalSeconds(long intervalSeconds) {
      this.intervalSeconds = intervalSeconds;
      return this;
    }

    public RegistryMaintenanceScheduler build() {
      return new RegistryMaintenanceScheduler(this);
    }
  }
}
