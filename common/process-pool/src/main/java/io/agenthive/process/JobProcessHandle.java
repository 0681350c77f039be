package io.agenthive.process;

import io.agenthive.ipc.IpcMessage;
import java.util.concurrent.CompletableFuture;

/**
 * Live connection to a spawned job process.
 */
public interface JobProcessHandle {

  long pid();

  /**
   * Write a frame to the process.
   *
   * @return {@code false} when the frame could not be delivered because the process' input is gone
   */
  boolean send(IpcMessage message);

  /**
   * Forcibly terminate the process. Safe to call repeatedly and after exit.
   */
  void kill();

  boolean isAlive();

  /**
   * Completes with the exit code once the process has terminated, whatever the cause.
   */
  CompletableFuture<Integer> onExit();
}
