package io.agenthive.ipc;

/**
 * Environment variables through which a supervisor configures the job process it spawns.
 */
public final class JobProcessEnvironment {

  /** JSON document of the job handed over at spawn time; absent for warm idle processes. */
  public static final String RUNNING_JOB = "AGENTHIVE_RUNNING_JOB";

  public static final String PROCESS_ID = "AGENTHIVE_PROCESS_ID";

  /** Fully qualified class name of the job entrypoint the process runs. */
  public static final String JOB_ENTRYPOINT = "AGENTHIVE_JOB_ENTRYPOINT";

  private JobProcessEnvironment() {
  }
}
