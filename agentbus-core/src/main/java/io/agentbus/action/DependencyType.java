package io.agentbus.action;

public enum DependencyType {
  /** Another registered action; existence check only. */
  ACTION,
  SERVICE,
  PERMISSION,
  STATE
}
