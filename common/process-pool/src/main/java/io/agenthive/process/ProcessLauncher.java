package io.agenthive.process;

/**
 * Port for spawning job processes.
 * <p>
 * The production implementation starts an operating-system process; tests substitute an in-memory
 * fake so supervisor and pool behaviour can be exercised without forking.
 */
public interface ProcessLauncher {

  /**
   * Spawn a job process and start delivering its IPC frames to {@code listener}.
   *
   * @param spec     identifier, optional job and extra environment for the new process
   * @param listener receives every decoded frame written by the process, on a launcher-owned thread
   * @return handle used to talk to and terminate the process
   * @throws ProcessLaunchException if the process could not be started
   */
  JobProcessHandle launch(ProcessLaunchSpec spec, IpcMessageListener listener);
}
