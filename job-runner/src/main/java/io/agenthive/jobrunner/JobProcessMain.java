package io.agenthive.jobrunner;

import io.agenthive.ipc.IpcMessageCodec;
import io.agenthive.ipc.IpcStreamChannel;
import io.agenthive.ipc.JobProcessEnvironment;
import io.agenthive.model.RunningJobInfo;
import java.io.InputStream;
import java.io.OutputStream;
import java.io.PrintStream;
import java.util.Map;
import java.util.ServiceLoader;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Entry point of a job process spawned by the worker. Stdout is reserved for IPC frames; anything
 * the job prints goes to stderr, which the supervisor forwards to its log.
 */
public final class JobProcessMain {

  private static final Logger log = LoggerFactory.getLogger(JobProcessMain.class);

  private JobProcessMain() {
  }

  public static void main(String[] args) {
    PrintStream ipcOut = System.out;
    System.setOut(System.err);
    int code;
    try {
      code = run(System.getenv(), System.in, ipcOut);
    } catch (RuntimeException ex) {
      log.error("Job process failed to start", ex);
      code = 1;
    }
    System.exit(code);
  }

  static int run(Map<String, String> environment, InputStream in, OutputStream out) {
    String processId = environment.getOrDefault(JobProcessEnvironment.PROCESS_ID, "unknown");
    IpcMessageCodec codec = new IpcMessageCodec();
    JobEntrypoint entrypoint = loadEntrypoint(environment.get(JobProcessEnvironment.JOB_ENTRYPOINT));
    String jobJson = environment.get(JobProcessEnvironment.RUNNING_JOB);
    RunningJobInfo job = jobJson == null || jobJson.isBlank() ? null : codec.decodeRunningJob(jobJson);
    IpcStreamChannel channel = new IpcStreamChannel(in, out, codec);
    return new JobProcessRuntime(channel, entrypoint, processId).run(job);
  }

  /**
   * Instantiate the named entrypoint class, or the first {@link ServiceLoader} provider when no class
   * is named.
   *
   * @throws IllegalArgumentException if no usable entrypoint is found
   */
  static JobEntrypoint loadEntrypoint(String className) {
    if (className == null || className.isBlank()) {
      return ServiceLoader.load(JobEntrypoint.class).findFirst()
          .orElseThrow(() -> new IllegalArgumentException(
              JobProcessEnvironment.JOB_ENTRYPOINT + " is not set and no JobEntrypoint provider is registered"));
    }
    Class<?> type;
    try {
      type = Class.forName(className.trim());
    } catch (ClassNotFoundException ex) {
      throw new IllegalArgumentException("Job entrypoint class " + className + " not found", ex);
    }
    if (!JobEntrypoint.class.isAssignableFrom(type)) {
      throw new IllegalArgumentException(className + " does not implement " + JobEntrypoint.class.getName());
    }
    try {
      return (JobEntrypoint) type.getDeclaredConstructor().newInstance();
    } catch (ReflectiveOperationException ex) {
      throw new IllegalArgumentException("Cannot instantiate job entrypoint " + className, ex);
    }
  }
}
