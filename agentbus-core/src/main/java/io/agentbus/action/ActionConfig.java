package io.agentbus.action;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Execution policy of an action. Unset fields take the documented defaults.
 */
public final class ActionConfig {
  public static final long DEFAULT_TIMEOUT_MS = 30_000L;
  public static final int DEFAULT_MAX_RETRIES = 3;

  private static final ActionConfig DEFAULTS = builder().build();

  private final long timeoutMs;
  private final boolean retryable;
  private final int maxRetries;
  private final boolean rollbackable;
  private final boolean concurrent;
  private final List<Dependency> dependencies;
  private final List<String> permissions;

  private ActionConfig(Builder builder) {
    if (builder.timeoutMs <= 0) {
      throw new IllegalArgumentException("timeoutMs must be > 0");
    }
    if (builder.maxRetries < 0) {
      throw new IllegalArgumentException("maxRetries must be >= 0");
    }
    this.timeoutMs = builder.timeoutMs;
    this.retryable = builder.retryable;
    this.maxRetries = builder.maxRetries;
    this.rollbackable = builder.rollbackable;
    this.concurrent = builder.concurrent;
    this.dependencies = List.copyOf(builder.dependencies);
    this.permissions = List.copyOf(builder.permissions);
  }

  public static ActionConfig defaults() {
    return DEFAULTS;
  }

  public static Builder builder() {
    return new Builder();
  }

  public long timeoutMs() {
    return timeoutMs;
  }

  /**
   * Whether a failed execution may be retried by the caller. The registry never retries;
   * {@link ActionRouteHandler} uses this to let the router retry or dead-letter at once.
   */
  public boolean retryable() {
    return retryable;
  }

  public int maxRetries() {
    return maxRetries;
  }

  public boolean rollbackable() {
    return rollbackable;
  }

  /**
   * Whether several executions of the action may run at once. Overlapping calls to a
   * non-concurrent action are rejected, not queued.
   */
  public boolean concurrent() {
    return concurrent;
  }

  public List<Dependency> dependencies() {
    return dependencies;
  }

  public List<String> permissions() {
    return permissions;
  }

  @Override
  public String toString() {
    return "ActionConfig{timeoutMs=" + timeoutMs + ", retryable=" + retryable
        + ", maxRetries=" + maxRetries + ", rollbackable=" + rollbackable
        + ", concurrent=" + concurrent + ", dependencies=" + dependencies
        + ", permissions=" + permissions + '}';
  }

  /** Builder for {@link ActionConfig}. */
  public static final class Builder {
    private long timeoutMs = DEFAULT_TIMEOUT_MS;
    private boolean retryable = true;
    private int maxRetries = DEFAULT_MAX_RETRIES;
    private boolean rollbackable;
    private boolean concurrent = true;
    private final List<Dependency> dependencies = new ArrayList<>();
    private final List<String> permissions = new ArrayList<>();

    private Builder() {}

    /**
     * Sets the execution deadline.
     *
     * <p>Optional. Defaults to {@code 30000}. Must be &gt; 0.
     */
    public Builder timeoutMs(long timeoutMs) {
      this.timeoutMs = timeoutMs;
      return this;
    }

    /** Optional. Defaults to {@code true}. */
    public Builder retryable(boolean retryable) {
      this.retryable = retryable;
      return this;
    }

    /** Optional. Defaults to {@code 3}. Must be &ge; 0. */
    public Builder maxRetries(int maxRetries) {
      this.maxRetries = maxRetries;
      return this;
    }

    /**
     * Marks the action as compensable. Only rollbackable executions that return rollback
     * data get a ledger entry.
     *
     * <p>Optional. Defaults to {@code false}.
     */
    public Builder rollbackable(boolean rollbackable) {
      this.rollbackable = rollbackable;
      return this;
    }

    /** Optional. Defaults to {@code true}. */
    public Builder concurrent(boolean concurrent) {
      this.concurrent = concurrent;
      return this;
    }

    public Builder dependency(Dependency dependency) {
      dependencies.add(Objects.requireNonNull(dependency, "dependency"));
      return this;
    }

    /** Shorthand for {@code dependency(Dependency.action(actionIdOrName))}. */
    public Builder dependsOn(String actionIdOrName) {
      return dependency(Dependency.action(actionIdOrName));
    }

    /**
     * Adds a permission the caller must hold, checked through the registry's
     * {@link DependencyType#PERMISSION} checker.
     */
    public Builder permission(String permission) {
      permissions.add(Objects.requireNonNull(permission, "permission"));
      return this;
    }

    public ActionConfig build() {
      return new ActionConfig(this);
    }
  }
}
