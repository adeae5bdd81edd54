package io.agentbus.action;

import java.util.List;

/**
 * Outcome of {@link ActionValidator#validate}.
 *
 * @param valid  whether the parameters are acceptable
 * @param errors the reasons they are not; empty when valid
 */
public record ValidationResult(boolean valid, List<String> errors) {

  private static final ValidationResult VALID = new ValidationResult(true, List.of());

  public ValidationResult {
    errors = errors == null ? List.of() : List.copyOf(errors);
  }

  public static ValidationResult ok() {
    return VALID;
  }

  public static ValidationResult invalid(List<String> errors) {
    return new ValidationResult(false, errors);
  }

  public static ValidationResult invalid(String... errors) {
    return new ValidationResult(false, List.of(errors));
  }
}
