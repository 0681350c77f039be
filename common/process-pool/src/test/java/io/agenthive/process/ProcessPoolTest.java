package io.agenthive.process;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.awaitility.Awaitility.await;
import static org.mockito.Mockito.atLeastOnce;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.timeout;
import static org.mockito.Mockito.verify;

import io.agenthive.ipc.IpcMessage;
import io.agenthive.model.Job;
import io.agenthive.model.JobAcceptArguments;
import io.agenthive.model.RunningJobInfo;
import java.time.Duration;
import java.util.concurrent.CompletableFuture;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

class ProcessPoolTest {

  private static final Duration WAIT = Duration.ofSeconds(3);

  private final FakeProcessLauncher launcher = new FakeProcessLauncher();
  private final ProcessPoolMetrics metrics = mock(ProcessPoolMetrics.class);
  private ProcessPool pool;

  @AfterEach
  void tearDown() {
    if (pool != null) {
      pool.terminate();
    }
  }

  @Test
  void startSpawnsJoblessProcesses() {
    pool = pool(3);

    pool.start();

    assertThat(launcher.launched).hasSize(3);
    assertThat(launcher.launched).allSatisfy(process -> assertThat(process.spec.job()).isEmpty());
    assertThat(pool.idleCount()).isEqualTo(3);
    assertThat(pool.processes()).hasSize(3);
  }

  @Test
  void launchJobUsesAnIdleProcessAndRestoresTheIdleTarget() {
    pool = pool(2);
    pool.start();

    JobProcessSupervisor supervisor = pool.launchJob(job("job-1"));

    assertThat(supervisor.pid()).isEqualTo(launcher.get(0).pid());
    assertThat(launcher.get(0).receivedOf(IpcMessage.StartJobRequest.class)).hasSize(1);
    assertThat(pool.getByJobId("job-1")).containsSame(supervisor);
    await().atMost(WAIT).until(() -> pool.idleCount() == 2);
    assertThat(launcher.launched).hasSize(3);
    verify(metrics, timeout(2_000)).jobStarted();
  }

  @Test
  void spawnsColdProcessWhenNoneIsIdle() {
    pool = pool(0);
    pool.start();

    JobProcessSupervisor supervisor = pool.launchJob(job("job-1"));

    assertThat(launcher.launched).hasSize(1);
    assertThat(launcher.get(0).spec.job()).map(RunningJobInfo::jobId).contains("job-1");
    assertThat(launcher.get(0).receivedOf(IpcMessage.StartJobRequest.class)).isEmpty();
    await().atMost(WAIT).until(() -> supervisor.state() == JobProcessState.RUNNING);
    verify(metrics).processSpawned(true);
  }

  @Test
  void rejectsDuplicateJobIds() {
    pool = pool(1);
    pool.start();
    pool.launchJob(job("job-1"));

    assertThatThrownBy(() -> pool.launchJob(job("job-1")))
        .isInstanceOf(IllegalStateException.class)
        .hasMessageContaining("job-1");
  }

  @Test
  void closedPoolRejectsJobs() {
    pool = pool(1);
    pool.start();
    pool.close().join();

    assertThatThrownBy(() -> pool.launchJob(job("job-1")))
        .isInstanceOf(IllegalStateException.class)
        .hasMessageContaining("closed");
  }

  @Test
  void finishedJobIsForgotten() {
    pool = pool(1);
    pool.start();
    JobProcessSupervisor supervisor = pool.launchJob(job("job-1"));
    await().atMost(WAIT).until(() -> supervisor.state() == JobProcessState.RUNNING);

    launcher.get(0).emit(new IpcMessage.UserExit(null));
    launcher.get(0).exit(0);

    assertThat(pool.getByJobId("job-1")).isEmpty();
    assertThat(pool.processes()).doesNotContain(supervisor);
  }

  @Test
  void deadIdleProcessIsReplacedAfterDelay() {
    pool = pool(2);
    pool.start();

    launcher.get(0).exit(1);

    assertThat(pool.idleCount()).isEqualTo(1);
    await().atMost(WAIT).until(() -> pool.idleCount() == 2);
    assertThat(launcher.launched).hasSize(3);
    verify(metrics).processFailed(JobProcessFailure.UNEXPECTED_EXIT);
  }

  @Test
  void brokenLauncherNeverThrowsPastThePool() {
    pool = pool(0);
    pool.start();
    launcher.failLaunches = true;

    JobProcessSupervisor supervisor = pool.launchJob(job("job-1"));

    assertThat(supervisor.state()).isEqualTo(JobProcessState.CLOSED);
    assertThat(pool.getByJobId("job-1")).isEmpty();
    verify(metrics).processFailed(JobProcessFailure.LAUNCH_FAILED);
  }

  @Test
  void drainClosesIdleProcessesAndWaitsForRunningJobs() {
    pool = pool(2);
    pool.start();
    JobProcessSupervisor running = pool.launchJob(job("job-1"));
    await().atMost(WAIT).until(() -> pool.idleCount() == 2);

    CompletableFuture<Void> drained = pool.drain();

    assertThat(pool.idleCount()).isZero();
    assertThat(launcher.get(1).receivedOf(IpcMessage.ShutdownRequest.class)).hasSize(1);
    assertThat(launcher.get(2).receivedOf(IpcMessage.ShutdownRequest.class)).hasSize(1);
    assertThat(launcher.get(0).receivedOf(IpcMessage.ShutdownRequest.class)).isEmpty();
    assertThat(drained).isNotDone();
    assertThatThrownBy(() -> pool.launchJob(job("job-2"))).isInstanceOf(IllegalStateException.class);

    launcher.get(0).emit(new IpcMessage.UserExit(null));
    launcher.get(0).exit(0);

    assertThat(drained).isDone();
    assertThat(running.state()).isEqualTo(JobProcessState.CLOSED);
    assertThat(launcher.launched).hasSize(3);
  }

  @Test
  void closeShutsDownEveryProcess() {
    pool = pool(2);
    pool.start();
    pool.launchJob(job("job-1"));
    await().atMost(WAIT).until(() -> pool.idleCount() == 2);

    CompletableFuture<Void> closed = pool.close();

    assertThat(pool.close()).isSameAs(closed);
    closed.join();
    assertThat(pool.processes()).isEmpty();
    assertThat(launcher.launched)
        .allSatisfy(process -> assertThat(process.receivedOf(IpcMessage.ShutdownRequest.class)).hasSize(1));
    verify(metrics).close();
  }

  @Test
  void terminateKillsEverything() {
    launcher.exitOnShutdown = false;
    pool = pool(2);
    pool.start();
    pool.launchJob(job("job-1"));
    await().atMost(WAIT).until(() -> pool.idleCount() == 2);

    CompletableFuture<Void> closed = pool.close();
    assertThat(closed).isNotDone();
    pool.terminate();

    closed.join();
    assertThat(launcher.launched).allSatisfy(process -> assertThat(process.killed).isTrue());
    verify(metrics, atLeastOnce()).processClosed();
  }

  private ProcessPool pool(int numIdle) {
    return ProcessPool.builder(launcher)
        .numIdle(numIdle)
        .idleRespawnDelay(Duration.ofMillis(50))
        .metrics(metrics)
        .build();
  }

  private static RunningJobInfo job(String id) {
    Job job = Job.room(id, "room-" + id);
    return new RunningJobInfo(job, JobAcceptArguments.defaultsFor(job), "ws://localhost:7880", "token");
  }
}
