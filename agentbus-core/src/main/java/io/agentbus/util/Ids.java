package io.agentbus.util;

import com.github.f4b6a3.ulid.UlidCreator;

/**
 * Identifier generation. Every id is a monotonic ULID, so ids sort by creation time.
 */
public final class Ids {

  private Ids() {
  }

  public static String next() {
    return UlidCreator.getMonotonicUlid().toString();
  }
}
