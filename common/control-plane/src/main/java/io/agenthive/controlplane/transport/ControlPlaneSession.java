package io.agenthive.controlplane.transport;

import java.util.concurrent.CompletableFuture;

/**
 * One established connection. Sends may be issued from any thread; implementations keep frames in
 * submission order.
 */
public interface ControlPlaneSession extends AutoCloseable {

  CompletableFuture<Void> send(String frame);

  boolean isOpen();

  /**
   * Close the session normally. Listeners are not notified of a locally initiated close.
   */
  @Override
  void close();
}
