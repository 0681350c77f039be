package io.agenthive.ipc;

/**
 * Raised when a frame read from the IPC channel is not a valid {@link IpcMessage}.
 */
public class IpcProtocolException extends RuntimeException {

  public IpcProtocolException(String message) {
    super(message);
  }

  public IpcProtocolException(String message, Throwable cause) {
    super(message, cause);
  }
}
