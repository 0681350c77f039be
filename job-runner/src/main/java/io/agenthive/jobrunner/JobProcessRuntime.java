package io.agenthive.jobrunner;

import io.agenthive.ipc.IpcMessage;
import io.agenthive.ipc.IpcProtocolException;
import io.agenthive.ipc.IpcStreamChannel;
import io.agenthive.model.RunningJobInfo;
import java.io.IOException;
import java.time.Clock;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.atomic.AtomicBoolean;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;

/**
 * Process side of the supervisor protocol: answers pings, starts the job when it is handed over and
 * reports how the process ends.
 * <p>
 * Frames are read on a dedicated daemon thread and the job runs on its own thread, so a busy job
 * never delays a pong. At most one of {@code userExit} and {@code shutdownResponse} is sent.
 */
public final class JobProcessRuntime {

  static final String JOB_ID_MDC_KEY = "job_id";

  private final IpcStreamChannel channel;
  private final JobEntrypoint entrypoint;
  private final String processId;
  private final Clock clock;
  private final Logger log;
  private final CompletableFuture<Integer> exitCode = new CompletableFuture<>();
  private final AtomicBoolean finalMessageSent = new AtomicBoolean();

  private JobContext context;
  private boolean shutdownRequested;

  public JobProcessRuntime(IpcStreamChannel channel, JobEntrypoint entrypoint, String processId) {
    this(channel, entrypoint, processId, Clock.systemUTC(), LoggerFactory.getLogger(JobProcessRuntime.class));
  }

  public JobProcessRuntime(IpcStreamChannel channel,
                           JobEntrypoint entrypoint,
                           String processId,
                           Clock clock,
                           Logger log) {
    this.channel = Objects.requireNonNull(channel, "channel");
    this.entrypoint = Objects.requireNonNull(entrypoint, "entrypoint");
    this.processId = Objects.requireNonNull(processId, "processId");
    this.clock = Objects.requireNonNull(clock, "clock");
    this.log = Objects.requireNonNull(log, "log");
  }

  /**
   * Serve the supervisor until the process should exit.
   *
   * @param initialJob job handed over at spawn time, or {@code null} for a warm idle process
   * @return the process exit code
   */
  public int run(RunningJobInfo initialJob) {
    if (initialJob != null) {
      startJob(initialJob);
    } else {
      log.info("Job process {} idle, waiting for a job", processId);
    }
    Thread reader = new Thread(this::readFrames, "ipc-reader");
    reader.setDaemon(true);
    reader.start();
    int code = exitCode.join();
    log.info("Job process {} exiting with code {}", processId, code);
    return code;
  }

  private void readFrames() {
    try {
      while (!exitCode.isDone()) {
        Optional<IpcMessage> next;
        try {
          next = channel.receive();
        } catch (IpcProtocolException ex) {
          log.warn("Ignoring invalid IPC frame: {}", ex.getMessage());
          continue;
        }
        if (next.isEmpty()) {
          log.info("Supervisor closed the IPC channel");
          requestShutdown("supervisor gone");
          return;
        }
        onMessage(next.get());
      }
    } catch (IOException ex) {
      log.warn("IPC channel failed: {}", ex.getMessage());
      requestShutdown("IPC channel failed");
    }
  }

  private void onMessage(IpcMessage message) {
    switch (message.type()) {
      case PING -> send(new IpcMessage.Pong(((IpcMessage.Ping) message).timestamp(), clock.millis()));
      case START_JOB_REQUEST -> startJob(((IpcMessage.StartJobRequest) message).runningJob());
      case SHUTDOWN_REQUEST -> requestShutdown(((IpcMessage.ShutdownRequest) message).reason());
      default -> log.warn("Ignoring {} message sent to a job process", message.type().wireName());
    }
  }

  private void startJob(RunningJobInfo info) {
    JobContext started;
    synchronized (this) {
      if (context != null) {
        log.warn("Ignoring job {}: process {} already runs job {}", info.jobId(), processId, context.job().id());
        return;
      }
      if (shutdownRequested) {
        log.warn("Ignoring job {}: process {} is shutting down", info.jobId(), processId);
        return;
      }
      started = new JobContext(info, processId);
      context = started;
    }
    Thread worker = new Thread(() -> runJob(started), "job-" + info.jobId());
    worker.start();
  }

  private void runJob(JobContext job) {
    String jobId = job.job().id();
    MDC.put(JOB_ID_MDC_KEY, jobId);
    try {
      log.info("Connecting job {} (room={})", jobId, job.job().room());
      try {
        entrypoint.connect(job);
      } catch (Exception ex) {
        restoreInterrupt(ex);
        log.error("Job {} failed to connect", jobId, ex);
        send(IpcMessage.StartJobResponse.failure(ex.getMessage()));
        exitCode.complete(1);
        return;
      }
      send(IpcMessage.StartJobResponse.success());
      int code = 0;
      String failure = null;
      try {
        entrypoint.run(job);
      } catch (Exception ex) {
        restoreInterrupt(ex);
        log.error("Job {} failed", jobId, ex);
        code = 1;
        failure = ex.getMessage() == null ? ex.getClass().getSimpleName() : ex.getMessage();
      }
      if (job.isShuttingDown()) {
        log.info("Job {} stopped: {}", jobId, job.shutdownReason().orElse("shutdown requested"));
        sendFinal(new IpcMessage.ShutdownResponse());
      } else {
        log.info("Job {} finished", jobId);
        sendFinal(new IpcMessage.UserExit(failure));
      }
      exitCode.complete(code);
    } finally {
      MDC.remove(JOB_ID_MDC_KEY);
    }
  }

  private void requestShutdown(String reason) {
    JobContext running;
    synchronized (this) {
      if (shutdownRequested) {
        return;
      }
      shutdownRequested = true;
      running = context;
    }
    if (running == null) {
      log.info("Shutting down idle job process {}: {}", processId, reason);
      sendFinal(new IpcMessage.ShutdownResponse());
      exitCode.complete(0);
      return;
    }
    log.info("Stopping job {}: {}", running.job().id(), reason);
    running.requestShutdown(reason);
  }

  private void sendFinal(IpcMessage message) {
    if (finalMessageSent.compareAndSet(false, true)) {
      send(message);
    }
  }

  private void send(IpcMessage message) {
    try {
      channel.send(message);
    } catch (IOException ex) {
      log.warn("Failed to send {} to the supervisor: {}", message.type().wireName(), ex.getMessage());
    }
  }

  private static void restoreInterrupt(Exception ex) {
    if (ex instanceof InterruptedException) {
      Thread.currentThread().interrupt();
    }
  }
}
