package io.agentbus.action;

import io.agentbus.util.Ids;

import java.time.Instant;
import java.util.concurrent.atomic.AtomicReference;

/**
 * A named, versioned unit of work. Identity fields are immutable once built; statistics are
 * updated by the registry as executions finish.
 *
 * <p>Required fields ({@code name}, {@code description}, {@code category}, {@code execute}) are
 * checked by {@link ActionRegistry#registerAction}, which reports every missing one at once.
 *
 * @see ActionDefinition.Builder
 */
public final class ActionDefinition {
  public static final String DEFAULT_VERSION = "1.0.0";

  private final String id;
  private final String name;
  private final String description;
  private final String category;
  private final String version;
  private final ActionExecutor executor;
  private final ActionValidator validator;
  private final ActionCompensator compensator;
  private final ActionConfig config;
  private final Instant createdAt;
  private final AtomicReference<ActionStats> stats = new AtomicReference<>(ActionStats.ZERO);

  private ActionDefinition(Builder builder) {
    this.id = builder.id != null ? builder.id : Ids.next();
    this.name = builder.name;
    this.description = builder.description;
    this.category = builder.category;
    this.version = builder.version != null ? builder.version : DEFAULT_VERSION;
    this.executor = builder.executor;
    this.validator = builder.validator != null ? builder.validator : ActionValidator.ACCEPT_ALL;
    this.compensator = builder.compensator;
    this.config = builder.config != null ? builder.config : ActionConfig.defaults();
    this.createdAt = Instant.now();
  }

  public static Builder builder() {
    return new Builder();
  }

  public String id() {
    return id;
  }

  public String name() {
    return name;
  }

  public String description() {
    return description;
  }

  public String category() {
    return category;
  }

  public String version() {
    return version;
  }

  public ActionExecutor executor() {
    return executor;
  }

  public ActionValidator validator() {
    return validator;
  }

  /**
   * Returns the compensator, or {@code null} if the action cannot be rolled back.
   */
  public ActionCompensator compensator() {
    return compensator;
  }

  public ActionConfig config() {
    return config;
  }

  public Instant createdAt() {
    return createdAt;
  }

  public ActionStats stats() {
    return stats.get();
  }

  void recordSuccess(long durationMs, Object result) {
    Instant now = Instant.now();
    stats.updateAndGet(s -> s.recordSuccess(durationMs, result, now));
  }

  void recordFailure() {
    Instant now = Instant.now();
    stats.updateAndGet(s -> s.recordFailure(now));
  }

  @Override
  public String toString() {
    return "ActionDefinition{id=" + id + ", name=" + name + ", category=" + category
        + ", version=" + version + '}';
  }

  /** Builder for {@link ActionDefinition}. */
  public static final class Builder {
    private String id;
    private String name;
    private String description;
    private String category;
    private String version;
    private ActionExecutor executor;
    private ActionValidator validator;
    private ActionCompensator compensator;
    private ActionConfig config;

    private Builder() {}

    /**
     * Optional. Defaults to a generated ULID.
     */
    public Builder id(String id) {
      this.id = id;
      return this;
    }

    /** <b>Required.</b> */
    public Builder name(String name) {
      this.name = name;
      return this;
    }

    /** <b>Required.</b> */
    public Builder description(String description) {
      this.description = description;
      return this;
    }

    /** <b>Required.</b> Actions are indexed by category. */
    public Builder category(String category) {
      this.category = category;
      return this;
    }

    /** Optional. Defaults to {@value ActionDefinition#DEFAULT_VERSION}. */
    public Builder version(String version) {
      this.version = version;
      return this;
    }

    /** <b>Required.</b> The action body. */
    public Builder execute(ActionExecutor executor) {
      this.executor = executor;
      return this;
    }

    /** Optional. Defaults to accepting every parameter set. */
    public Builder validate(ActionValidator validator) {
      this.validator = validator;
      return this;
    }

    /** Optional. Without one, {@link ActionRegistry#rollbackAction} fails. */
    public Builder rollback(ActionCompensator compensator) {
      this.compensator = compensator;
      return this;
    }

    /** Optional. Defaults to {@link ActionConfig#defaults()}. */
    public Builder config(ActionConfig config) {
      this.config = config;
      return this;
    }

    public ActionDefinition build() {
      return new ActionDefinition(this);
    }
  }
}
