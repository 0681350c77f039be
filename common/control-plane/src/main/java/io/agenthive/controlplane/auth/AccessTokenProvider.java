package io.agenthive.controlplane.auth;

/**
 * Mints the bearer token a worker presents when registering with the control plane.
 */
@FunctionalInterface
public interface AccessTokenProvider {

  String workerToken();
}
