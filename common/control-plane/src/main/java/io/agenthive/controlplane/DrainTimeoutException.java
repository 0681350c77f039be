package io.agenthive.controlplane;

public class DrainTimeoutException extends WorkerConnectionException {

  public DrainTimeoutException(String message) {
    super(message);
  }
}
