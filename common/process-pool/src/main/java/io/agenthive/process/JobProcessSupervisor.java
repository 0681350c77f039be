package io.agenthive.process;

import io.agenthive.ipc.IpcMessage;
import io.agenthive.ipc.IpcProtocolException;
import io.agenthive.model.RunningJobInfo;
import java.time.Clock;
import java.time.Duration;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Owns one job process: spawns it, keeps it alive with ping/pong heartbeats, enforces the start
 * deadline and performs the shutdown handshake.
 * <p>
 * All state changes happen under the supervisor's monitor. IPC frames arrive on the launcher's reader
 * thread and timers fire on the shared scheduler; neither ever blocks on the other. Failures are
 * reported through {@link JobProcessListener} and never thrown to callers.
 */
public final class JobProcessSupervisor {

  private final String processId;
  private final ProcessLauncher launcher;
  private final JobProcessOptions options;
  private final ScheduledExecutorService scheduler;
  private final JobProcessListener listener;
  private final Clock clock;
  private final Logger log;
  private final CompletableFuture<Void> joined = new CompletableFuture<>();

  private JobProcessState state = JobProcessState.STARTING;
  private JobProcessHandle handle;
  private RunningJobInfo runningJob;
  private boolean launched;
  private boolean killed;
  private boolean shutdownRequested;
  private ScheduledFuture<?> startTimer;
  private ScheduledFuture<?> pingTimer;
  private ScheduledFuture<?> pongTimer;
  private ScheduledFuture<?> shutdownTimer;

  public JobProcessSupervisor(String processId,
                              ProcessLauncher launcher,
                              JobProcessOptions options,
                              ScheduledExecutorService scheduler,
                              JobProcessListener listener) {
    this(processId, launcher, options, scheduler, listener, Clock.systemUTC(),
        LoggerFactory.getLogger(JobProcessSupervisor.class));
  }

  public JobProcessSupervisor(String processId,
                              ProcessLauncher launcher,
                              JobProcessOptions options,
                              ScheduledExecutorService scheduler,
                              JobProcessListener listener,
                              Clock clock,
                              Logger log) {
    if (processId == null || processId.isBlank()) {
      throw new IllegalArgumentException("processId must not be null or blank");
    }
    this.processId = processId;
    this.launcher = Objects.requireNonNull(launcher, "launcher");
    this.options = Objects.requireNonNull(options, "options");
    this.scheduler = Objects.requireNonNull(scheduler, "scheduler");
    this.listener = Objects.requireNonNull(listener, "listener");
    this.clock = Objects.requireNonNull(clock, "clock");
    this.log = Objects.requireNonNull(log, "log");
  }

  /**
   * Spawn the process. With a job the start deadline is armed immediately; without one the process
   * waits warm until {@link #launchJob(RunningJobInfo)}.
   */
  public void start(RunningJobInfo job) {
    boolean launchFailed = false;
    synchronized (this) {
      if (launched) {
        throw new IllegalStateException("Job process " + processId + " already started");
      }
      launched = true;
      runningJob = job;
      ProcessLaunchSpec spec = new ProcessLaunchSpec(processId, job, null);
      try {
        handle = launcher.launch(spec, new SupervisorMessageListener());
      } catch (RuntimeException ex) {
        log.error("Failed to launch job process {} (job={})", processId, jobIdOrNone(), ex);
        state = JobProcessState.CLOSED;
        listener.onFailure(this, JobProcessFailure.LAUNCH_FAILED, ex.getMessage());
        listener.onClosed(this);
        launchFailed = true;
      }
      if (!launchFailed) {
        log.debug("Job process {} spawned (pid={}, job={})", processId, handle.pid(), jobIdOrNone());
        long pingMs = options.pingInterval().toMillis();
        pingTimer = scheduler.scheduleAtFixedRate(this::sendPing, pingMs, pingMs, TimeUnit.MILLISECONDS);
        armPongDeadline();
        if (job != null) {
          armStartTimer();
        }
      }
    }
    if (launchFailed) {
      joined.complete(null);
      return;
    }
    handle.onExit().whenComplete((code, error) -> onProcessExit(code));
  }

  /**
   * Hand a job to a warm process that was started without one.
   *
   * @throws IllegalStateException if a job is already attached or the process is going away
   */
  public synchronized void launchJob(RunningJobInfo job) {
    Objects.requireNonNull(job, "job");
    if (runningJob != null) {
      throw new IllegalStateException("Job process " + processId + " already runs job " + runningJob.jobId());
    }
    if (!launched || state != JobProcessState.STARTING || shutdownRequested || killed) {
      throw new IllegalStateException("Job process " + processId + " cannot accept a job in state " + state);
    }
    runningJob = job;
    armStartTimer();
    if (!handle.send(new IpcMessage.StartJobRequest(job))) {
      failAndKill(JobProcessFailure.START_FAILED, "unable to deliver job to process");
    }
  }

  /**
   * Ask the process to shut down gracefully, killing it if it has not exited within the shutdown
   * timeout. Repeated calls return the same future.
   */
  public CompletableFuture<Void> close() {
    return close("closing");
  }

  public CompletableFuture<Void> close(String reason) {
    synchronized (this) {
      if (state == JobProcessState.CLOSED || !launched) {
        return joined;
      }
      cancelHeartbeatTimers();
      if (!shutdownRequested && !killed && state != JobProcessState.SHUTTING_DOWN) {
        shutdownRequested = true;
        state = JobProcessState.SHUTTING_DOWN;
        log.debug("Requesting shutdown of job process {} (job={}, reason={})", processId, jobIdOrNone(), reason);
        if (!handle.send(new IpcMessage.ShutdownRequest(reason))) {
          log.debug("Job process {} input closed; waiting for exit", processId);
        }
        if (state != JobProcessState.CLOSED) {
          armShutdownTimer();
        }
      }
    }
    return joined;
  }

  /**
   * Kill the process immediately.
   */
  public synchronized void kill() {
    if (handle == null || state == JobProcessState.CLOSED) {
      return;
    }
    cancelAllTimers();
    killed = true;
    handle.kill();
  }

  /**
   * Completes once the process has exited, whatever the cause.
   */
  public CompletableFuture<Void> join() {
    return joined;
  }

  public String processId() {
    return processId;
  }

  public synchronized long pid() {
    return handle == null ? -1L : handle.pid();
  }

  public synchronized JobProcessState state() {
    return state;
  }

  public synchronized Optional<RunningJobInfo> runningJob() {
    return Optional.ofNullable(runningJob);
  }

  public synchronized boolean isIdle() {
    return runningJob == null && state == JobProcessState.STARTING && !shutdownRequested && !killed;
  }

  synchronized boolean startTimerActive() {
    return isActive(startTimer);
  }

  synchronized boolean pingTimerActive() {
    return isActive(pingTimer);
  }

  synchronized boolean pongDeadlineActive() {
    return isActive(pongTimer);
  }

  synchronized boolean shutdownTimerActive() {
    return isActive(shutdownTimer);
  }

  void onMessage(IpcMessage message) {
    switch (message.type()) {
      case START_JOB_RESPONSE -> onStartJobResponse((IpcMessage.StartJobResponse) message);
      case PONG -> onPong((IpcMessage.Pong) message);
      case USER_EXIT, SHUTDOWN_RESPONSE -> onExitAnnounced(message);
      case START_JOB_REQUEST, PING, SHUTDOWN_REQUEST ->
          log.warn("Ignoring unexpected {} from job process {}", message.type().wireName(), processId);
      default -> log.warn("Unhandled message {} from job process {}", message.type(), processId);
    }
  }

  private synchronized void onStartJobResponse(IpcMessage.StartJobResponse response) {
    if (runningJob == null || state != JobProcessState.STARTING || killed) {
      log.warn("Ignoring startJobResponse from job process {} in state {}", processId, state);
      return;
    }
    cancel(startTimer);
    startTimer = null;
    if (response.isSuccess()) {
      state = JobProcessState.RUNNING;
      log.info("Job {} started in process {} (pid={})", runningJob.jobId(), processId, handle.pid());
      listener.onJobStarted(this);
    } else {
      failAndKill(JobProcessFailure.START_FAILED, response.error());
    }
  }

  private synchronized void onPong(IpcMessage.Pong pong) {
    if (state == JobProcessState.CLOSED || killed || pongTimer == null) {
      return;
    }
    long delay = pong.delayMillis();
    if (delay > options.highPingThreshold().toMillis()) {
      log.warn("Job process {} is unresponsive: pong took {} ms (job={})", processId, delay, jobIdOrNone());
    }
    armPongDeadline();
  }

  private synchronized void onExitAnnounced(IpcMessage message) {
    if (state == JobProcessState.CLOSED) {
      return;
    }
    cancelHeartbeatTimers();
    state = JobProcessState.SHUTTING_DOWN;
    log.debug("Job process {} announced {} (job={})", processId, message.type().wireName(), jobIdOrNone());
    if (!killed && shutdownTimer == null) {
      armShutdownTimer();
    }
  }

  private void sendPing() {
    JobProcessHandle target;
    synchronized (this) {
      if (handle == null || killed || state == JobProcessState.SHUTTING_DOWN || state == JobProcessState.CLOSED) {
        return;
      }
      target = handle;
    }
    if (!target.send(new IpcMessage.Ping(clock.millis()))) {
      log.debug("Ping to job process {} not delivered", processId);
    }
  }

  private synchronized void onStartTimeout() {
    if (state != JobProcessState.STARTING || runningJob == null || killed) {
      return;
    }
    failAndKill(JobProcessFailure.START_TIMEOUT,
        "job did not start within " + options.startTimeout().toMillis() + " ms");
  }

  private synchronized void onPongTimeout() {
    if (state == JobProcessState.CLOSED || killed) {
      return;
    }
    failAndKill(JobProcessFailure.HEARTBEAT_TIMEOUT,
        "no pong within " + options.pingTimeout().toMillis() + " ms");
  }

  private synchronized void onShutdownTimeout() {
    if (state == JobProcessState.CLOSED || killed) {
      return;
    }
    failAndKill(JobProcessFailure.SHUTDOWN_TIMEOUT,
        "process did not exit within " + options.shutdownTimeout().toMillis() + " ms");
  }

  private void onProcessExit(Integer exitCode) {
    synchronized (this) {
      if (state == JobProcessState.CLOSED) {
        return;
      }
      cancelAllTimers();
      boolean unexpected = state != JobProcessState.SHUTTING_DOWN && !killed;
      state = JobProcessState.CLOSED;
      if (unexpected) {
        log.warn("Job process {} exited unexpectedly with code {} (job={})", processId, exitCode, jobIdOrNone());
        listener.onFailure(this, JobProcessFailure.UNEXPECTED_EXIT, "exit code " + exitCode);
      } else {
        log.debug("Job process {} exited with code {} (job={})", processId, exitCode, jobIdOrNone());
      }
      listener.onClosed(this);
    }
    joined.complete(null);
  }

  private void failAndKill(JobProcessFailure failure, String detail) {
    cancelAllTimers();
    killed = true;
    log.error("Killing job process {} (pid={}, job={}): {} ({})",
        processId, handle.pid(), jobIdOrNone(), failure.tag(), detail);
    listener.onFailure(this, failure, detail);
    handle.kill();
  }

  private void armStartTimer() {
    cancel(startTimer);
    startTimer = schedule(this::onStartTimeout, options.startTimeout());
  }

  private void armPongDeadline() {
    cancel(pongTimer);
    pongTimer = schedule(this::onPongTimeout, options.pingTimeout());
  }

  private void armShutdownTimer() {
    cancel(shutdownTimer);
    shutdownTimer = schedule(this::onShutdownTimeout, options.shutdownTimeout());
  }

  private ScheduledFuture<?> schedule(Runnable task, Duration delay) {
    return scheduler.schedule(task, delay.toMillis(), TimeUnit.MILLISECONDS);
  }

  private void cancelHeartbeatTimers() {
    cancel(startTimer);
    cancel(pingTimer);
    cancel(pongTimer);
    startTimer = null;
    pingTimer = null;
    pongTimer = null;
  }

  private void cancelAllTimers() {
    cancelHeartbeatTimers();
    cancel(shutdownTimer);
    shutdownTimer = null;
  }

  private static void cancel(ScheduledFuture<?> timer) {
    if (timer != null) {
      timer.cancel(false);
    }
  }

  private static boolean isActive(ScheduledFuture<?> timer) {
    return timer != null && !timer.isDone();
  }

  private String jobIdOrNone() {
    return runningJob == null ? "-" : runningJob.jobId();
  }

  @Override
  public String toString() {
    return "JobProcessSupervisor{" + processId + "}";
  }

  private final class SupervisorMessageListener implements IpcMessageListener {

    @Override
    public void onMessage(IpcMessage message) {
      JobProcessSupervisor.this.onMessage(message);
    }

    @Override
    public void onProtocolError(IpcProtocolException error) {
      log.warn("Skipping invalid frame from job process {}: {}", processId, error.getMessage());
    }
  }
}
