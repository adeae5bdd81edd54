package io.agentbus.bus;

public enum ConnectionState {
  DISCONNECTED,
  CONNECTED,
  RECONNECTING,
  CLOSED
}
