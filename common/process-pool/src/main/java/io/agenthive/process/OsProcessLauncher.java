package io.agenthive.process;

import io.agenthive.ipc.IpcMessage;
import io.agenthive.ipc.IpcMessageCodec;
import io.agenthive.ipc.IpcProtocolException;
import io.agenthive.ipc.IpcStreamChannel;
import io.agenthive.ipc.JobProcessEnvironment;
import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStreamReader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.TimeUnit;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Launches job processes as operating-system processes speaking the IPC protocol over stdin/stdout.
 * <p>
 * Each process gets two daemon threads: one decoding stdout frames for the supervisor and one copying
 * stderr lines into the worker log.
 */
public final class OsProcessLauncher implements ProcessLauncher {

  public static final String JOB_PROCESS_MAIN_CLASS = "io.agenthive.jobrunner.JobProcessMain";
  public static final String JOB_PROCESS_LOGBACK_CONFIG = "job-runner-logback.xml";

  private static final Logger PROCESS_OUTPUT = LoggerFactory.getLogger("io.agenthive.process.output");

  private final List<String> command;
  private final Map<String, String> environment;
  private final Path workingDirectory;
  private final IpcMessageCodec codec;
  private final Logger log;

  public OsProcessLauncher(List<String> command, Map<String, String> environment, Path workingDirectory) {
    this(command, environment, workingDirectory, new IpcMessageCodec(), LoggerFactory.getLogger(OsProcessLauncher.class));
  }

  public OsProcessLauncher(List<String> command,
                           Map<String, String> environment,
                           Path workingDirectory,
                           IpcMessageCodec codec,
                           Logger log) {
    Objects.requireNonNull(command, "command");
    if (command.isEmpty()) {
      throw new IllegalArgumentException("command must not be empty");
    }
    this.command = List.copyOf(command);
    this.environment = environment == null ? Map.of() : Map.copyOf(environment);
    this.workingDirectory = workingDirectory;
    this.codec = Objects.requireNonNull(codec, "codec");
    this.log = Objects.requireNonNull(log, "log");
  }

  /**
   * Runs {@link #JOB_PROCESS_MAIN_CLASS} on the current JVM's classpath with the stderr-only logback
   * configuration.
   */
  public static List<String> defaultCommand() {
    String java = Paths.get(System.getProperty("java.home"), "bin", "java").toString();
    return List.of(
        java,
        "-Dlogback.configurationFile=" + JOB_PROCESS_LOGBACK_CONFIG,
        "-cp",
        System.getProperty("java.class.path"),
        JOB_PROCESS_MAIN_CLASS);
  }

  public List<String> command() {
    return command;
  }

  @Override
  public JobProcessHandle launch(ProcessLaunchSpec spec, IpcMessageListener listener) {
    Objects.requireNonNull(spec, "spec");
    Objects.requireNonNull(listener, "listener");
    ProcessBuilder builder = new ProcessBuilder(command);
    if (workingDirectory != null) {
      builder.directory(workingDirectory.toFile());
    }
    Map<String, String> env = builder.environment();
    env.putAll(environment);
    env.putAll(spec.environment());
    env.put(JobProcessEnvironment.PROCESS_ID, spec.processId());
    spec.job().ifPresent(job -> env.put(JobProcessEnvironment.RUNNING_JOB, codec.encodeRunningJob(job)));
    Process process;
    try {
      process = builder.start();
    } catch (IOException ex) {
      throw new ProcessLaunchException("Error when launching job process " + spec.processId(), ex);
    }
    OsJobProcessHandle handle = new OsJobProcessHandle(spec.processId(), process, listener);
    handle.startPumps();
    return handle;
  }

  private final class OsJobProcessHandle implements JobProcessHandle {

    private final String processId;
    private final Process process;
    private final IpcMessageListener listener;
    private final IpcStreamChannel channel;
    private final CompletableFuture<Void> stdoutDrained = new CompletableFuture<>();
    private final CompletableFuture<Integer> exit;

    private OsJobProcessHandle(String processId, Process process, IpcMessageListener listener) {
      this.processId = processId;
      this.process = process;
      this.listener = listener;
      this.channel = new IpcStreamChannel(process.getInputStream(), process.getOutputStream(), codec);
      // let the reader deliver the final frame before the exit is reported
      this.exit = process.onExit()
          .thenCompose(p -> stdoutDrained.completeOnTimeout(null, 1, TimeUnit.SECONDS))
          .thenApply(ignored -> process.exitValue());
    }

    private void startPumps() {
      Thread reader = new Thread(this::readFrames, "job-process-" + processId + "-ipc");
      reader.setDaemon(true);
      reader.start();
      Thread stderr = new Thread(this::copyStderr, "job-process-" + processId + "-stderr");
      stderr.setDaemon(true);
      stderr.start();
    }

    private void readFrames() {
      try {
        while (true) {
          Optional<IpcMessage> message;
          try {
            message = channel.receive();
          } catch (IpcProtocolException ex) {
            listener.onProtocolError(ex);
            continue;
          }
          if (message.isEmpty()) {
            break;
          }
          listener.onMessage(message.get());
        }
      } catch (IOException ex) {
        log.debug("IPC stream of job process {} closed: {}", processId, ex.getMessage());
      } finally {
        stdoutDrained.complete(null);
      }
    }

    private void copyStderr() {
      try (BufferedReader reader = new BufferedReader(
          new InputStreamReader(process.getErrorStream(), StandardCharsets.UTF_8))) {
        String line;
        while ((line = reader.readLine()) != null) {
          PROCESS_OUTPUT.info("[{}] {}", processId, line);
        }
      } catch (IOException ex) {
        log.debug("stderr of job process {} closed: {}", processId, ex.getMessage());
      }
    }

    @Override
    public long pid() {
      return process.pid();
    }

    @Override
    public boolean send(IpcMessage message) {
      if (!process.isAlive()) {
        return false;
      }
      try {
        channel.send(message);
        return true;
      } catch (IOException ex) {
        log.debug("Unable to write {} to job process {}: {}", message.type().wireName(), processId, ex.getMessage());
        return false;
      }
    }

    @Override
    public void kill() {
      process.descendants().forEach(ProcessHandle::destroyForcibly);
      process.destroyForcibly();
    }

    @Override
    public boolean isAlive() {
      return process.isAlive();
    }

    @Override
    public CompletableFuture<Integer> onExit() {
      return exit;
    }
  }
}
