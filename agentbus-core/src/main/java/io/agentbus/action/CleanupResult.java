package io.agentbus.action;

/**
 * Number of entries removed by one {@link ActionRegistry#cleanup} pass.
 */
public record CleanupResult(int historyRemoved, int rollbacksRemoved) {

  public int total() {
    return historyRemoved + rollbacksRemoved;
  }
}
