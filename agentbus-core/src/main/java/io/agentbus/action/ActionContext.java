package io.agentbus.action;

import io.agentbus.util.Ids;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Who is running an action and on whose behalf.
 *
 * <p>{@code correlationId} ties the execution to the events that caused it and to the
 * outcome events it produces; it defaults to a fresh ULID.
 */
public final class ActionContext {
  public static final String SYSTEM = "system";

  private final String executedBy;
  private final String agentId;
  private final String correlationId;
  private final Map<String, Object> attributes;

  private ActionContext(Builder builder) {
    this.executedBy = builder.executedBy == null ? SYSTEM : builder.executedBy;
    this.agentId = builder.agentId;
    this.correlationId = builder.correlationId == null ? Ids.next() : builder.correlationId;
    this.attributes = Map.copyOf(builder.attributes);
  }

  public static Builder builder() {
    return new Builder();
  }

  /**
   * Returns a context attributed to {@value #SYSTEM} with a fresh correlation id.
   */
  public static ActionContext system() {
    return builder().build();
  }

  public String executedBy() {
    return executedBy;
  }

  /**
   * Returns the agent worker the execution runs for, or {@code null}.
   */
  public String agentId() {
    return agentId;
  }

  public String correlationId() {
    return correlationId;
  }

  public Map<String, Object> attributes() {
    return attributes;
  }

  @Override
  public String toString() {
    return "ActionContext{executedBy=" + executedBy + ", agentId=" + agentId
        + ", correlationId=" + correlationId + '}';
  }

  public static final class Builder {
    private String executedBy;
    private String agentId;
    private String correlationId;
    private final Map<String, Object> attributes = new LinkedHashMap<>();

    private Builder() {
    }

    public Builder executedBy(String executedBy) {
      this.executedBy = executedBy;
      return this;
    }

    public Builder agentId(String agentId) {
      this.agentId = agentId;
      return this;
    }

    public Builder correlationId(String correlationId) {
      this.correlationId = correlationId;
      return this;
    }

    public Builder attribute(String key, Object value) {
      attributes.put(Objects.requireNonNull(key, "key"), Objects.requireNonNull(value, "value"));
      return this;
    }

    public ActionContext build() {
      return new ActionContext(this);
    }
  }
}
