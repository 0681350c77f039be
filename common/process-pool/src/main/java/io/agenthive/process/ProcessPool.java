package io.agenthive.process;

import io.agenthive.model.RunningJobInfo;
import java.time.Clock;
import java.time.Duration;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Keeps a warm supply of idle job processes and maps running jobs to their supervisors.
 * <p>
 * The pool never holds its own monitor while calling into a supervisor, so supervisor callbacks may
 * freely update pool bookkeeping. Per-process failures are logged and counted, never thrown.
 */
public final class ProcessPool {

  public static final int DEFAULT_NUM_IDLE = 3;
  public static final Duration DEFAULT_IDLE_RESPAWN_DELAY = Duration.ofSeconds(1);

  private final ProcessLauncher launcher;
  private final JobProcessOptions options;
  private final int numIdle;
  private final Duration idleRespawnDelay;
  private final ProcessPoolMetrics metrics;
  private final ScheduledExecutorService scheduler;
  private final Clock clock;
  private final Logger log;
  private final AtomicLong sequence = new AtomicLong();
  private final PoolListener poolListener = new PoolListener();

  private final Deque<JobProcessSupervisor> idle = new ArrayDeque<>();
  private final Map<String, JobProcessSupervisor> byJobId = new LinkedHashMap<>();
  private final Set<JobProcessSupervisor> all = new LinkedHashSet<>();
  private int pendingSpawns;
  private boolean started;
  private boolean draining;
  private boolean closed;
  private CompletableFuture<Void> closeFuture;

  private ProcessPool(Builder builder) {
    this.launcher = Objects.requireNonNull(builder.launcher, "launcher");
    this.options = builder.options;
    this.numIdle = builder.numIdle;
    this.idleRespawnDelay = builder.idleRespawnDelay;
    this.metrics = builder.metrics;
    this.clock = builder.clock;
    this.log = builder.log;
    this.scheduler = Executors.newScheduledThreadPool(2, new ThreadFactory() {
      private final AtomicInteger counter = new AtomicInteger();

      @Override
      public Thread newThread(Runnable r) {
        Thread thread = new Thread(r, "job-process-timer-" + counter.incrementAndGet());
        thread.setDaemon(true);
        return thread;
      }
    });
  }

  public static Builder builder(ProcessLauncher launcher) {
    return new Builder(launcher);
  }

  /**
   * Spawn the configured number of job-less processes.
   */
  public void start() {
    synchronized (this) {
      if (started) {
        return;
      }
      if (closed) {
        throw new IllegalStateException("Process pool is closed");
      }
      started = true;
    }
    log.info("Starting process pool with {} idle processes", numIdle);
    replenish();
  }

  /**
   * Run a job in an idle process, or in a freshly spawned one when none is idle.
   *
   * @return the supervisor now owning the job
   * @throws IllegalStateException when the job id is already running or the pool no longer accepts work
   */
  public JobProcessSupervisor launchJob(RunningJobInfo job) {
    Objects.requireNonNull(job, "job");
    JobProcessSupervisor supervisor;
    boolean cold;
    synchronized (this) {
      if (closed || draining) {
        throw new IllegalStateException("Process pool is " + (closed ? "closed" : "draining"));
      }
      if (byJobId.containsKey(job.jobId())) {
        throw new IllegalStateException("Job " + job.jobId() + " is already running");
      }
      supervisor = idle.pollFirst();
      cold = supervisor == null;
      if (cold) {
        supervisor = newSupervisor();
        all.add(supervisor);
      }
      byJobId.put(job.jobId(), supervisor);
    }
    if (cold) {
      log.info("No idle process available; spawning {} for job {}", supervisor.processId(), job.jobId());
      startSupervisor(supervisor, job);
    } else {
      try {
        supervisor.launchJob(job);
        log.info("Job {} handed to idle process {} (pid={})", job.jobId(), supervisor.processId(), supervisor.pid());
      } catch (IllegalStateException ex) {
        log.warn("Idle process {} went away before job {} could start; spawning a new one",
            supervisor.processId(), job.jobId());
        supervisor = coldReplacement(job, supervisor);
      }
    }
    updatePoolSize();
    submit(this::replenish);
    return supervisor;
  }

  public synchronized Optional<JobProcessSupervisor> getByJobId(String jobId) {
    return Optional.ofNullable(byJobId.get(jobId));
  }

  /**
   * Snapshot of every supervisor the pool owns, idle and running.
   */
  public synchronized List<JobProcessSupervisor> processes() {
    return List.copyOf(all);
  }

  public synchronized int idleCount() {
    return idle.size();
  }

  public synchronized int runningCount() {
    return byJobId.size();
  }

  /**
   * Stop replenishing and close idle processes. The returned future completes when every running
   * job has exited on its own.
   */
  public CompletableFuture<Void> drain() {
    List<JobProcessSupervisor> idleProcesses;
    List<JobProcessSupervisor> running;
    synchronized (this) {
      draining = true;
      idleProcesses = new ArrayList<>(idle);
      idle.clear();
      running = new ArrayList<>(byJobId.values());
    }
    log.info("Draining process pool ({} running jobs, {} idle processes)", running.size(), idleProcesses.size());
    idleProcesses.forEach(supervisor -> supervisor.close("draining"));
    return allJoined(running);
  }

  /**
   * Stop replenishing and gracefully close every process. Repeated calls return the same future.
   */
  public CompletableFuture<Void> close() {
    List<JobProcessSupervisor> snapshot;
    synchronized (this) {
      if (closeFuture != null) {
        return closeFuture;
      }
      closed = true;
      idle.clear();
      snapshot = new ArrayList<>(all);
      closeFuture = new CompletableFuture<>();
    }
    log.info("Closing process pool ({} processes)", snapshot.size());
    List<CompletableFuture<Void>> joins = new ArrayList<>();
    for (JobProcessSupervisor supervisor : snapshot) {
      joins.add(supervisor.close("worker closing"));
    }
    CompletableFuture<Void> result = closeFuture;
    CompletableFuture.allOf(joins.toArray(new CompletableFuture<?>[0]))
        .whenComplete((ignored, error) -> {
          scheduler.shutdownNow();
          metrics.close();
          log.info("Process pool closed");
          result.complete(null);
        });
    return result;
  }

  /**
   * Kill every remaining process without waiting for the shutdown handshake.
   */
  public void terminate() {
    List<JobProcessSupervisor> snapshot;
    synchronized (this) {
      closed = true;
      idle.clear();
      snapshot = new ArrayList<>(all);
    }
    if (!snapshot.isEmpty()) {
      log.warn("Terminating {} job processes", snapshot.size());
    }
    snapshot.forEach(JobProcessSupervisor::kill);
  }

  private void replenish() {
    List<JobProcessSupervisor> spawned = new ArrayList<>();
    synchronized (this) {
      if (!acceptingWork()) {
        return;
      }
      int missing = numIdle - idle.size() - pendingSpawns;
      for (int i = 0; i < missing; i++) {
        JobProcessSupervisor supervisor = newSupervisor();
        all.add(supervisor);
        spawned.add(supervisor);
      }
      pendingSpawns += spawned.size();
    }
    for (JobProcessSupervisor supervisor : spawned) {
      startSupervisor(supervisor, null);
      boolean usable = supervisor.isIdle();
      boolean discard;
      synchronized (this) {
        pendingSpawns--;
        discard = usable && !acceptingWork();
        if (usable && !discard) {
          idle.addLast(supervisor);
        }
      }
      if (discard) {
        supervisor.close("pool no longer accepting work");
      }
    }
    if (!spawned.isEmpty()) {
      updatePoolSize();
    }
  }

  private void startSupervisor(JobProcessSupervisor supervisor, RunningJobInfo job) {
    metrics.processSpawned(job != null);
    supervisor.start(job);
  }

  private JobProcessSupervisor coldReplacement(RunningJobInfo job, JobProcessSupervisor stale) {
    JobProcessSupervisor replacement;
    synchronized (this) {
      replacement = newSupervisor();
      all.add(replacement);
      byJobId.put(job.jobId(), replacement);
    }
    stale.kill();
    startSupervisor(replacement, job);
    return replacement;
  }

  private JobProcessSupervisor newSupervisor() {
    String processId = "proc-" + sequence.incrementAndGet();
    return new JobProcessSupervisor(processId, launcher, options, scheduler, poolListener, clock, log);
  }

  private boolean acceptingWork() {
    return started && !draining && !closed;
  }

  private void scheduleRespawn() {
    try {
      scheduler.schedule(this::replenish, idleRespawnDelay.toMillis(), TimeUnit.MILLISECONDS);
    } catch (RejectedExecutionException ex) {
      log.debug("Process pool scheduler stopped; not respawning idle process");
    }
  }

  private void submit(Runnable task) {
    try {
      scheduler.execute(task);
    } catch (RejectedExecutionException ex) {
      log.debug("Process pool scheduler stopped; skipping replenish");
    }
  }

  private void updatePoolSize() {
    int idleSize;
    int running;
    synchronized (this) {
      idleSize = idle.size();
      running = byJobId.size();
    }
    metrics.updatePoolSize(idleSize, running);
  }

  private static CompletableFuture<Void> allJoined(List<JobProcessSupervisor> supervisors) {
    return CompletableFuture.allOf(supervisors.stream()
        .map(JobProcessSupervisor::join)
        .toArray(CompletableFuture<?>[]::new));
  }

  private final class PoolListener implements JobProcessListener {

    @Override
    public void onJobStarted(JobProcessSupervisor supervisor) {
      metrics.jobStarted();
    }

    @Override
    public void onFailure(JobProcessSupervisor supervisor, JobProcessFailure failure, String detail) {
      metrics.processFailed(failure);
    }

    @Override
    public void onClosed(JobProcessSupervisor supervisor) {
      Optional<String> jobId = supervisor.runningJob().map(RunningJobInfo::jobId);
      boolean respawn;
      synchronized (ProcessPool.this) {
        all.remove(supervisor);
        idle.remove(supervisor);
        jobId.ifPresent(id -> byJobId.remove(id, supervisor));
        respawn = jobId.isEmpty() && acceptingWork();
      }
      metrics.processClosed();
      updatePoolSize();
      if (respawn) {
        log.warn("Idle process {} exited; respawning in {} ms", supervisor.processId(), idleRespawnDelay.toMillis());
        scheduleRespawn();
      }
    }
  }

  public static final class Builder {

    private final ProcessLauncher launcher;
    private JobProcessOptions options = JobProcessOptions.defaults();
    private int numIdle = DEFAULT_NUM_IDLE;
    private Duration idleRespawnDelay = DEFAULT_IDLE_RESPAWN_DELAY;
    private ProcessPoolMetrics metrics = ProcessPoolMetrics.noop();
    private Clock clock = Clock.systemUTC();
    private Logger log = LoggerFactory.getLogger(ProcessPool.class);

    private Builder(ProcessLauncher launcher) {
      this.launcher = Objects.requireNonNull(launcher, "launcher");
    }

    public Builder options(JobProcessOptions options) {
      this.options = Objects.requireNonNull(options, "options");
      return this;
    }

    public Builder numIdle(int numIdle) {
      if (numIdle < 0) {
        throw new IllegalArgumentException("numIdle must be >= 0");
      }
      this.numIdle = numIdle;
      return this;
    }

    public Builder idleRespawnDelay(Duration idleRespawnDelay) {
      Objects.requireNonNull(idleRespawnDelay, "idleRespawnDelay");
      if (idleRespawnDelay.isNegative()) {
        throw new IllegalArgumentException("idleRespawnDelay must be >= 0");
      }
      this.idleRespawnDelay = idleRespawnDelay;
      return this;
    }

    public Builder metrics(ProcessPoolMetrics metrics) {
      this.metrics = Objects.requireNonNull(metrics, "metrics");
      return this;
    }

    public Builder clock(Clock clock) {
      this.clock = Objects.requireNonNull(clock, "clock");
      return this;
    }

    public Builder logger(Logger log) {
      this.log = Objects.requireNonNull(log, "log");
      return this;
    }

    public ProcessPool build() {
      return new ProcessPool(this);
    }
  }
}
