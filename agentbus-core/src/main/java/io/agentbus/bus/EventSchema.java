package io.agentbus.bus;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * Required and optional payload fields for one event type.
 *
 * <p>This is the only payload schema the bus enforces. A {@linkplain Builder#strict() strict}
 * schema additionally rejects fields that are neither required nor optional.
 *
 * <pre>{@code
 * bus.registerSchema(EventSchema.forType("document.uploaded")
 *     .required("documentId", "path")
 *     .optional("mimeType")
 *     .build());
 * }</pre>
 */
public final class EventSchema {
  private final String eventType;
  private final Set<String> required;
  private final Set<String> optional;
  private final boolean strict;

  private EventSchema(Builder builder) {
    this.eventType = Objects.requireNonNull(builder.eventType, "eventType");
    this.required = Set.copyOf(builder.required);
    this.optional = Set.copyOf(builder.optional);
    this.strict = builder.strict;
  }

  public static Builder forType(String eventType) {
    return new Builder(eventType);
  }

  public String eventType() {
    return eventType;
  }

  public Set<String> required() {
    return required;
  }

  public Set<String> optional() {
    return optional;
  }

  public boolean isStrict() {
    return strict;
  }

  /**
   * Checks a payload against this schema.
   *
   * @param payload the payload to check
   * @return every violation found; empty when the payload conforms
   */
  public List<String> validate(Map<String, Object> payload) {
    List<String> violations = new ArrayList<>();
    for (String field : required) {
      if (payload.get(field) == null) {
        violations.add("missing required field '" + field + "'");
      }
    }
    if (strict) {
      for (String field : payload.keySet()) {
        if (!required.contains(field) && !optional.contains(field)) {
          violations.add("unexpected field '" + field + "'");
        }
      }
    }
    return violations;
  }

  public static final class Builder {
    private final String eventType;
    private final Set<String> required = new LinkedHashSet<>();
    private final Set<String> optional = new LinkedHashSet<>();
    private boolean strict;

    private Builder(String eventType) {
      this.eventType = eventType;
    }

    public Builder required(String... fields) {
      required.addAll(List.of(fields));
      return this;
    }

    public Builder optional(String... fields) {
      optional.addAll(List.of(fields));
      return this;
    }

    public Builder strict() {
      this.strict = true;
      return this;
    }

    public EventSchema build() {
      return new EventSchema(this);
    }
  }
}
