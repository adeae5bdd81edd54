package io.agentbus.action;

import java.util.Map;

/**
 * Reverse operation that undoes a completed execution, given the rollback data that execution
 * produced. Compensation is best effort and application level; it is not a distributed
 * transaction.
 */
@FunctionalInterface
public interface ActionCompensator {

  /**
   * @param rollbackData the data returned by the execution through {@link ActionResult}
   * @param meta         the execution being compensated
   * @return an optional result describing the compensation
   * @throws Exception if compensation fails; the ledger entry is kept for another attempt
   */
  Object rollback(Map<String, Object> rollbackData, RollbackMeta meta) throws Exception;
}
