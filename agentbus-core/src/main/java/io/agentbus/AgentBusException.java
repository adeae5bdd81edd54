package io.agentbus;

import java.util.Objects;

/**
 * Root of every failure raised by agentbus components.
 *
 * <p>Each subclass maps to one {@link ErrorCode}. The {@link #retryable()} flag tells the
 * {@linkplain io.agentbus.router.EventRouter router} whether a failed delivery may be
 * attempted again or must go straight to the dead-letter channel.
 */
public class AgentBusException extends RuntimeException {

  private final ErrorCode code;
  private final boolean retryable;

  public AgentBusException(ErrorCode code, String message, boolean retryable) {
    this(code, message, retryable, null);
  }

  public AgentBusException(ErrorCode code, String message, boolean retryable, Throwable cause) {
    super(message, cause);
    this.code = Objects.requireNonNull(code, "code");
    this.retryable = retryable;
  }

  public ErrorCode code() {
    return code;
  }

  /**
   * Returns whether the operation that raised this failure may succeed if attempted again.
   *
   * @return {@code true} if a retry is meaningful
   */
  public boolean retryable() {
    return retryable;
  }
}
