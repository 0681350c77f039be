package io.agenthive.process;

/**
 * Lifecycle callbacks raised by a {@link JobProcessSupervisor}. Callbacks may run on launcher or
 * timer threads and must not block.
 */
public interface JobProcessListener {

  JobProcessListener NOOP = new JobProcessListener() { };

  default void onJobStarted(JobProcessSupervisor supervisor) {
  }

  default void onFailure(JobProcessSupervisor supervisor, JobProcessFailure failure, String detail) {
  }

  default void onClosed(JobProcessSupervisor supervisor) {
  }
}
