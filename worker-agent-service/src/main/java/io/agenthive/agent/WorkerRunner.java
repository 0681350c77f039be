package io.agenthive.agent;

import io.agenthive.controlplane.DrainTimeoutException;
import io.agenthive.controlplane.WorkerConnection;
import io.agenthive.controlplane.WorkerConnectionException;
import io.agenthive.controlplane.messaging.ServerInfo;
import io.agenthive.model.JobType;
import java.time.Duration;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.function.IntConsumer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.SmartLifecycle;

/**
 * Runs the {@link WorkerConnection} on its own thread for the lifetime of the application context.
 * <p>
 * On shutdown a production worker drains its jobs before closing; otherwise the connection is closed
 * at once. A fatal connection error ends the JVM with status 1.
 */
public final class WorkerRunner implements SmartLifecycle {

  static final int FATAL_EXIT_CODE = 1;

  private final WorkerConnection connection;
  private final boolean production;
  private final Duration drainTimeout;
  private final Optional<String> simulateRoom;
  private final JobType simulateType;
  private final IntConsumer exit;
  private final Logger log;
  private final AtomicBoolean failed = new AtomicBoolean();

  private volatile boolean running;
  private volatile Thread thread;

  public WorkerRunner(WorkerConnection connection,
                      boolean production,
                      Duration drainTimeout,
                      Optional<String> simulateRoom,
                      JobType simulateType,
                      IntConsumer exit) {
    this(connection, production, drainTimeout, simulateRoom, simulateType, exit,
        LoggerFactory.getLogger(WorkerRunner.class));
  }

  WorkerRunner(WorkerConnection connection,
               boolean production,
               Duration drainTimeout,
               Optional<String> simulateRoom,
               JobType simulateType,
               IntConsumer exit,
               Logger log) {
    this.connection = Objects.requireNonNull(connection, "connection");
    this.production = production;
    this.drainTimeout = Objects.requireNonNull(drainTimeout, "drainTimeout");
    this.simulateRoom = Objects.requireNonNull(simulateRoom, "simulateRoom");
    this.simulateType = Objects.requireNonNull(simulateType, "simulateType");
    this.exit = Objects.requireNonNull(exit, "exit");
    this.log = Objects.requireNonNull(log, "log");
  }

  @Override
  public void start() {
    if (running) {
      return;
    }
    simulateRoom.ifPresent(this::simulateOnRegistration);
    Thread worker = new Thread(this::runConnection, "worker-connection");
    thread = worker;
    running = true;
    worker.start();
    log.info("Worker runner started (endpoint={}, production={})", connection.endpoint(), production);
  }

  @Override
  public void stop() {
    if (!running) {
      return;
    }
    if (production && !failed.get()) {
      try {
        connection.drain(drainTimeout);
      } catch (DrainTimeoutException ex) {
        log.error("Closing with jobs still running: {}", ex.getMessage());
      } catch (WorkerConnectionException ex) {
        log.warn("Drain interrupted: {}", ex.getMessage());
      }
    }
    connection.close();
    awaitThread();
    running = false;
    log.info("Worker runner stopped");
  }

  @Override
  public void stop(Runnable callback) {
    try {
      stop();
    } finally {
      callback.run();
    }
  }

  @Override
  public boolean isRunning() {
    return running;
  }

  @Override
  public boolean isAutoStartup() {
    return true;
  }

  @Override
  public int getPhase() {
    return 0;
  }

  private void runConnection() {
    try {
      connection.run();
      log.info("Worker connection finished");
    } catch (WorkerConnectionException ex) {
      failed.set(true);
      log.error("Worker connection failed: {}", ex.getMessage(), ex);
      exit.accept(FATAL_EXIT_CODE);
    } catch (RuntimeException ex) {
      failed.set(true);
      log.error("Worker connection crashed", ex);
      exit.accept(FATAL_EXIT_CODE);
    }
  }

  private void simulateOnRegistration(String room) {
    AtomicBoolean requested = new AtomicBoolean();
    connection.addListener(new WorkerConnection.Listener() {
      @Override
      public void onRegistered(String workerId, ServerInfo serverInfo) {
        if (requested.compareAndSet(false, true)) {
          connection.simulateJob(simulateType, room, null);
        }
      }
    });
  }

  // the runner thread may itself be the one calling exit, which runs this stop from a shutdown hook
  private void awaitThread() {
    Thread worker = thread;
    if (worker == null || worker == Thread.currentThread() || failed.get()) {
      return;
    }
    try {
      worker.join(drainTimeout.toMillis());
    } catch (InterruptedException ex) {
      Thread.currentThread().interrupt();
    }
  }
}
