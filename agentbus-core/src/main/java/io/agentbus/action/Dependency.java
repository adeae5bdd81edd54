package io.agentbus.action;

import java.util.Locale;
import java.util.Objects;

/**
 * Something an action needs before its body may run.
 *
 * <p>{@link #action(String)} dependencies are resolved by the registry itself (the named action
 * must be registered, whether or not it is running). The other kinds are delegated to the
 * {@link io.agentbus.spi.DependencyChecker} registered for their type.
 *
 * @param type   the kind of dependency
 * @param target what is depended on: an action id or name, a service name, a permission, a
 *               state key
 */
public record Dependency(DependencyType type, String target) {

  public Dependency {
    Objects.requireNonNull(type, "type");
    Objects.requireNonNull(target, "target");
    if (target.isBlank()) {
      throw new IllegalArgumentException("target cannot be blank");
    }
  }

  public static Dependency of(DependencyType type, String target) {
    return new Dependency(type, target);
  }

  public static Dependency action(String actionIdOrName) {
    return new Dependency(DependencyType.ACTION, actionIdOrName);
  }

  public static Dependency service(String service) {
    return new Dependency(DependencyType.SERVICE, service);
  }

  public static Dependency permission(String permission) {
    return new Dependency(DependencyType.PERMISSION, permission);
  }

  public static Dependency state(String stateKey) {
    return new Dependency(DependencyType.STATE, stateKey);
  }

  @Override
  public String toString() {
    return type.name().toLowerCase(Locale.ROOT) + ":" + target;
  }
}
