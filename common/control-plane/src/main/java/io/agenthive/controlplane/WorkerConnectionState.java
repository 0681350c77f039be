package io.agenthive.controlplane;

public enum WorkerConnectionState {
  DISCONNECTED,
  CONNECTING,
  REGISTERED,
  AVAILABLE,
  FULL,
  RECONNECTING,
  DRAINING,
  CLOSED
}
