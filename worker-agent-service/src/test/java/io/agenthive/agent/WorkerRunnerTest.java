package io.agenthive.agent;

import static org.assertj.core.api.Assertions.assertThat;
import static org.awaitility.Awaitility.await;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.inOrder;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.timeout;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;

import io.agenthive.controlplane.DrainTimeoutException;
import io.agenthive.controlplane.WorkerConnection;
import io.agenthive.controlplane.WorkerConnectionException;
import io.agenthive.model.JobType;
import java.time.Duration;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicInteger;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.mockito.InOrder;

class WorkerRunnerTest {

  private static final Duration DRAIN_TIMEOUT = Duration.ofSeconds(5);

  private final WorkerConnection connection = mock(WorkerConnection.class);
  private final AtomicInteger exitCode = new AtomicInteger(-1);

  @Test
  void runsTheConnectionOnStart() {
    WorkerRunner runner = runner(true, Optional.empty());

    runner.start();

    verify(connection, timeout(1_000)).run();
    assertThat(runner.isRunning()).isTrue();
  }

  @Test
  void productionWorkerDrainsBeforeClosing() {
    WorkerRunner runner = runner(true, Optional.empty());
    runner.start();

    runner.stop();

    InOrder order = inOrder(connection);
    order.verify(connection).drain(DRAIN_TIMEOUT);
    order.verify(connection).close();
    assertThat(runner.isRunning()).isFalse();
  }

  @Test
  void developmentWorkerClosesAtOnce() {
    WorkerRunner runner = runner(false, Optional.empty());
    runner.start();

    runner.stop();

    verify(connection, never()).drain(any());
    verify(connection).close();
  }

  @Test
  void drainTimeoutStillCloses() {
    doThrow(new DrainTimeoutException("Jobs still running after draining for 5 s"))
        .when(connection).drain(DRAIN_TIMEOUT);
    WorkerRunner runner = runner(true, Optional.empty());
    runner.start();

    runner.stop();

    verify(connection).close();
    assertThat(exitCode).hasValue(-1);
  }

  @Test
  void fatalConnectionErrorExitsWithStatusOne() {
    doThrow(new WorkerConnectionException("Failed to connect after 10 retries")).when(connection).run();
    WorkerRunner runner = runner(true, Optional.empty());

    runner.start();

    await().atMost(Duration.ofSeconds(2)).untilAsserted(() -> assertThat(exitCode).hasValue(1));
    runner.stop();
    verify(connection, never()).drain(any());
    verify(connection).close();
  }

  @Test
  void simulatesAJobOnceAfterRegistration() {
    WorkerRunner runner = runner(false, Optional.of("demo"));
    runner.start();

    ArgumentCaptor<WorkerConnection.Listener> listener = ArgumentCaptor.forClass(WorkerConnection.Listener.class);
    verify(connection).addListener(listener.capture());
    listener.getValue().onRegistered("W1", null);
    listener.getValue().onRegistered("W1", null);

    verify(connection, times(1)).simulateJob(JobType.PUBLISHER, "demo", null);
  }

  @Test
  void stopCallbackRunsEvenWhenNotStarted() {
    WorkerRunner runner = runner(true, Optional.empty());
    AtomicInteger callbacks = new AtomicInteger();

    runner.stop(callbacks::incrementAndGet);

    assertThat(callbacks).hasValue(1);
    verify(connection, never()).close();
  }

  private WorkerRunner runner(boolean production, Optional<String> simulateRoom) {
    return new WorkerRunner(connection, production, DRAIN_TIMEOUT, simulateRoom, JobType.PUBLISHER, exitCode::set);
  }
}
