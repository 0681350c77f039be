package io.agenthive.controlplane;

/**
 * Fatal failure of the worker's connection to the control plane. Once thrown the worker is closed.
 */
public class WorkerConnectionException extends RuntimeException {

  public WorkerConnectionException(String message) {
    super(message);
  }

  public WorkerConnectionException(String message, Throwable cause) {
    super(message, cause);
  }
}
