package io.agenthive.controlplane;

/**
 * The server broke the session protocol, for example by not acknowledging registration first.
 */
public class WorkerProtocolException extends WorkerConnectionException {

  public WorkerProtocolException(String message) {
    super(message);
  }
}
