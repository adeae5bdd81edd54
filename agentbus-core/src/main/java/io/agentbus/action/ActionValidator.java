package io.agentbus.action;

import java.util.Map;

/**
 * Checks parameters before an action body runs. An invalid result fails the execution with a
 * {@link io.agentbus.ValidationException} and no side effects.
 */
@FunctionalInterface
public interface ActionValidator {

  ActionValidator ACCEPT_ALL = (params, context) -> ValidationResult.ok();

  ValidationResult validate(Map<String, Object> params, ActionContext context) throws Exception;
}
