package io.agenthive.controlplane.transport;

import java.io.IOException;
import java.net.URI;

/**
 * Opens message-oriented duplex sessions to the control-plane server.
 */
public interface ControlPlaneTransport {

  /**
   * Connect and authenticate.
   *
   * @param uri      full session endpoint, including the {@code /agent} path
   * @param token    bearer token presented during the handshake
   * @param listener receives inbound frames and the end of the session
   * @throws IOException when the session cannot be established
   */
  ControlPlaneSession open(URI uri, String token, SessionListener listener) throws IOException;
}
