package io.agenthive.process;

/**
 * Raised by a {@link ProcessLauncher} when a job process cannot be spawned.
 */
public class ProcessLaunchException extends RuntimeException {

  public ProcessLaunchException(String message) {
    super(message);
  }

  public ProcessLaunchException(String message, Throwable cause) {
    super(message, cause);
  }
}
