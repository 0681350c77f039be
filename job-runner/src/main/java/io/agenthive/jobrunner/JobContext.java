package io.agenthive.jobrunner;

import io.agenthive.model.Job;
import io.agenthive.model.RunningJobInfo;
import java.time.Duration;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;

/**
 * What a {@link JobEntrypoint} sees of its process: the job it was given and whether the supervisor
 * asked it to stop.
 */
public final class JobContext {

  private final RunningJobInfo runningJob;
  private final String processId;
  private final CountDownLatch shutdown = new CountDownLatch(1);
  private volatile String shutdownReason;

  JobContext(RunningJobInfo runningJob, String processId) {
    this.runningJob = Objects.requireNonNull(runningJob, "runningJob");
    this.processId = Objects.requireNonNull(processId, "processId");
  }

  public RunningJobInfo runningJob() {
    return runningJob;
  }

  public Job job() {
    return runningJob.job();
  }

  /** Server url the job connects to. */
  public String url() {
    return runningJob.url();
  }

  /** Access token issued with the job's assignment. */
  public String token() {
    return runningJob.token();
  }

  public String processId() {
    return processId;
  }

  public boolean isShuttingDown() {
    return shutdown.getCount() == 0;
  }

  public Optional<String> shutdownReason() {
    return Optional.ofNullable(shutdownReason);
  }

  /**
   * Block until the supervisor asks the job to stop.
   */
  public void awaitShutdown() throws InterruptedException {
    shutdown.await();
  }

  /**
   * @return {@code true} if shutdown was requested within {@code timeout}
   */
  public boolean awaitShutdown(Duration timeout) throws InterruptedException {
    return shutdown.await(timeout.toMillis(), TimeUnit.MILLISECONDS);
  }

  void requestShutdown(String reason) {
    if (shutdownReason == null) {
      shutdownReason = reason == null || reason.isBlank() ? "shutdown requested" : reason;
    }
    shutdown.countDown();
  }
}
