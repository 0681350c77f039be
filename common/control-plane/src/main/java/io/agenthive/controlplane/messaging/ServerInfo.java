package io.agenthive.controlplane.messaging;

/**
 * Describes the control-plane server a worker registered with. Every field is informational.
 */
public record ServerInfo(String edition, String version, int protocol, String region, String nodeId) {

  public static ServerInfo unknown() {
    return new ServerInfo(null, null, 0, null, null);
  }
}
