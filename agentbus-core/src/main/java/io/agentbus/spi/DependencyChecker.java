package io.agentbus.spi;

import io.agentbus.action.ActionContext;
import io.agentbus.action.Dependency;

/**
 * Resolves structured action dependencies (services, permissions, state).
 *
 * <p>The registry ships with {@link #ALWAYS_SATISFIED} for every kind; production deployments
 * register real checkers through
 * {@link io.agentbus.action.ActionRegistry.Builder#dependencyChecker}.
 */
@FunctionalInterface
public interface DependencyChecker {

  DependencyChecker ALWAYS_SATISFIED = (dependency, context) -> true;

  /**
   * @param dependency the dependency to check
   * @param context    the context of the execution that needs it
   * @return {@code true} if the dependency is available
   * @throws Exception if the check itself fails; treated as unresolved
   */
  boolean isSatisfied(Dependency dependency, ActionContext context) throws Exception;
}
