package io.agenthive.jobrunner;

/**
 * The job payload a job process runs. Implementations need a public no-argument constructor; the
 * class is named through {@code AGENTHIVE_JOB_ENTRYPOINT} or registered as a {@link java.util.ServiceLoader}
 * provider.
 */
public interface JobEntrypoint {

  /**
   * Connect to the job's resource. A failure is reported to the supervisor and ends the process.
   */
  void connect(JobContext context) throws Exception;

  /**
   * Do the job's work. Returning ends the job; long-running jobs should return promptly once
   * {@link JobContext#isShuttingDown()} turns true.
   */
  void run(JobContext context) throws Exception;
}
