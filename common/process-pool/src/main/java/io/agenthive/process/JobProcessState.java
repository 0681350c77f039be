package io.agenthive.process;

/**
 * Lifecycle of a supervised job process.
 */
public enum JobProcessState {
  /** Spawned; waiting for a job or for the job to report that it started. */
  STARTING,
  RUNNING,
  /** A shutdown was requested or the process announced its exit. */
  SHUTTING_DOWN,
  CLOSED
}
