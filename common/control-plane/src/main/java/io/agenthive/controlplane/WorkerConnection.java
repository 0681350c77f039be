package io.agenthive.controlplane;

import io.agenthive.controlplane.auth.AccessTokenProvider;
import io.agenthive.controlplane.messaging.ControlPlaneMessageCodec;
import io.agenthive.controlplane.messaging.ServerInfo;
import io.agenthive.controlplane.messaging.ServerMessage;
import io.agenthive.controlplane.messaging.ServerMessage.JobAssignment;
import io.agenthive.controlplane.messaging.WorkerMessage;
import io.agenthive.controlplane.messaging.WorkerMessage.AvailabilityResponse;
import io.agenthive.controlplane.transport.ControlPlaneSession;
import io.agenthive.controlplane.transport.ControlPlaneTransport;
import io.agenthive.controlplane.transport.SessionListener;
import io.agenthive.model.JobAcceptArguments;
import io.agenthive.model.JobType;
import io.agenthive.model.RunningJobInfo;
import io.agenthive.process.JobProcessSupervisor;
import io.agenthive.process.ProcessPool;
import java.io.IOException;
import java.net.URI;
import java.time.Duration;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Registers this worker with the control plane and drives the job-assignment protocol.
 * <p>
 * Inbound frames are handled in arrival order on a single dispatch thread. Job request handlers run
 * on their own pool so a slow decision never stalls the session; load reports and assignment
 * timeouts share one scheduler. {@link #run()} blocks until the worker is closed or fails fatally.
 */
public final class WorkerConnection implements AutoCloseable {

  /**
   * Observer of connection milestones. Callbacks run on internal threads and must not block.
   */
  public interface Listener {

    default void onRegistered(String workerId, ServerInfo serverInfo) {
    }

    default void onStateChanged(WorkerConnectionState previous, WorkerConnectionState current) {
    }
  }

  @FunctionalInterface
  interface Sleeper {
    void sleep(Duration delay) throws InterruptedException;
  }

  private final WorkerOptions options;
  private final ProcessPool pool;
  private final JobRequestHandler handler;
  private final ControlPlaneTransport transport;
  private final AccessTokenProvider tokens;
  private final LoadSampler loadSampler;
  private final ControlPlaneMessageCodec codec;
  private final Logger log;
  private final Sleeper sleeper;
  private final URI agentUri;

  private final ExecutorService dispatcher;
  private final ExecutorService handlerExecutor;
  private final ScheduledExecutorService scheduler;
  private final PendingAssignments pendingAssignments;
  private final JobRequest.Responder responder = new AssignmentResponder();
  private final Set<CompletableFuture<?>> inFlight = ConcurrentHashMap.newKeySet();
  private final Set<String> offersInProgress = ConcurrentHashMap.newKeySet();
  private final List<Listener> listeners = new CopyOnWriteArrayList<>();
  private final List<AutoCloseable> auxiliaries = new CopyOnWriteArrayList<>();
  private final AtomicBoolean running = new AtomicBoolean();
  private final AtomicBoolean closing = new AtomicBoolean();
  private final AtomicBoolean draining = new AtomicBoolean();
  private final CountDownLatch closeSignal = new CountDownLatch(1);
  private final CompletableFuture<Void> closed = new CompletableFuture<>();
  private final Object stateLock = new Object();

  private volatile WorkerConnectionState state = WorkerConnectionState.DISCONNECTED;
  private volatile Session current;
  private volatile String workerId;
  private volatile ServerInfo serverInfo;
  private volatile WorkerStatus lastStatus;
  private ScheduledFuture<?> loadTask;
  private CompletableFuture<Void> drained;

  public WorkerConnection(WorkerOptions options,
                          ProcessPool pool,
                          JobRequestHandler handler,
                          ControlPlaneTransport transport,
                          AccessTokenProvider tokens,
                          LoadSampler loadSampler) {
    this(options, pool, handler, transport, tokens, loadSampler, LoggerFactory.getLogger(WorkerConnection.class));
  }

  public WorkerConnection(WorkerOptions options,
                          ProcessPool pool,
                          JobRequestHandler handler,
                          ControlPlaneTransport transport,
                          AccessTokenProvider tokens,
                          LoadSampler loadSampler,
                          Logger log) {
    this(options, pool, handler, transport, tokens, loadSampler, log, null);
  }

  WorkerConnection(WorkerOptions options,
                   ProcessPool pool,
                   JobRequestHandler handler,
                   ControlPlaneTransport transport,
                   AccessTokenProvider tokens,
                   LoadSampler loadSampler,
                   Logger log,
                   Sleeper sleeper) {
    this.options = Objects.requireNonNull(options, "options");
    this.pool = Objects.requireNonNull(pool, "pool");
    this.handler = Objects.requireNonNull(handler, "handler");
    this.transport = Objects.requireNonNull(transport, "transport");
    this.tokens = Objects.requireNonNull(tokens, "tokens");
    this.loadSampler = Objects.requireNonNull(loadSampler, "loadSampler");
    this.log = Objects.requireNonNull(log, "log");
    this.sleeper = sleeper != null ? sleeper : delay -> closeSignal.await(delay.toMillis(), TimeUnit.MILLISECONDS);
    this.codec = new ControlPlaneMessageCodec();
    this.agentUri = agentUri(options.url());
    this.dispatcher = Executors.newSingleThreadExecutor(daemonThreads("worker-connection-dispatch"));
    this.handlerExecutor = Executors.newCachedThreadPool(daemonThreads("job-request-handler"));
    this.scheduler = Executors.newSingleThreadScheduledExecutor(daemonThreads("worker-connection-timer"));
    this.pendingAssignments = new PendingAssignments(scheduler);
  }

  /**
   * Session endpoint for a server url: {@code http(s)} becomes {@code ws(s)} and {@code /agent} is
   * appended.
   */
  public static URI agentUri(String url) {
    Objects.requireNonNull(url, "url");
    String base = url.trim();
    if (base.regionMatches(true, 0, "http", 0, 4)) {
      base = "ws" + base.substring(4);
    }
    if (!base.endsWith("/")) {
      base = base + "/";
    }
    return URI.create(base + "agent");
  }

  public void addListener(Listener listener) {
    listeners.add(Objects.requireNonNull(listener, "listener"));
  }

  /**
   * Register a resource that lives as long as the worker, closed during {@link #close()}.
   */
  public void registerAuxiliary(AutoCloseable resource) {
    auxiliaries.add(Objects.requireNonNull(resource, "resource"));
  }

  /**
   * Start the process pool, connect and serve until closed.
   *
   * @throws WorkerProtocolException   if the server does not acknowledge registration first
   * @throws WorkerConnectionException if the connection cannot be re-established within the retry budget
   */
  public void run() {
    if (!running.compareAndSet(false, true)) {
      throw new IllegalStateException("Worker connection is already running");
    }
    if (closing.get()) {
      return;
    }
    pool.start();
    int attempt = 0;
    try {
      while (!closing.get()) {
        boolean registered = false;
        try {
          registered = runSession();
        } catch (IOException ex) {
          if (!closing.get()) {
            log.warn("Failed to connect to {}: {}", agentUri, ex.getMessage());
          }
        }
        if (closing.get()) {
          break;
        }
        if (registered) {
          attempt = 0;
        }
        attempt++;
        if (attempt > options.maxRetry()) {
          throw new WorkerConnectionException(
              "Failed to connect to " + agentUri + " after " + options.maxRetry() + " retries");
        }
        Duration delay = WorkerOptions.reconnectDelay(attempt);
        setState(WorkerConnectionState.RECONNECTING);
        log.warn("Reconnecting to {} in {} s (attempt {}/{})", agentUri, delay.toSeconds(), attempt, options.maxRetry());
        sleeper.sleep(delay);
      }
    } catch (InterruptedException ex) {
      Thread.currentThread().interrupt();
      log.info("Worker connection interrupted; closing");
      close();
      return;
    } catch (WorkerConnectionException ex) {
      log.error("Worker connection failed: {}", ex.getMessage());
      close();
      throw ex;
    }
    closed.join();
  }

  /**
   * Stop taking jobs, advertise {@link WorkerStatus#FULL} and wait for running jobs to finish.
   * Repeated calls wait on the same drain.
   *
   * @throws DrainTimeoutException if jobs are still running when {@code timeout} elapses
   */
  public void drain(Duration timeout) {
    Objects.requireNonNull(timeout, "timeout");
    CompletableFuture<Void> future;
    synchronized (this) {
      if (drained == null) {
        draining.set(true);
        setState(WorkerConnectionState.DRAINING);
        log.info("Draining worker ({} active jobs)", activeJobs().size());
        Session session = current;
        if (session != null && session.registered) {
          lastStatus = WorkerStatus.FULL;
          send(session, new WorkerMessage.UpdateWorkerStatus(WorkerStatus.FULL, loadSampler.sample(), activeJobs().size()));
        }
        drained = pool.drain();
      }
      future = drained;
    }
    try {
      future.get(timeout.toMillis(), TimeUnit.MILLISECONDS);
      log.info("Worker drained");
    } catch (TimeoutException ex) {
      throw new DrainTimeoutException("Jobs still running after draining for " + timeout.toSeconds() + " s");
    } catch (InterruptedException ex) {
      Thread.currentThread().interrupt();
      throw new WorkerConnectionException("Interrupted while draining", ex);
    } catch (ExecutionException ex) {
      throw new WorkerConnectionException("Draining failed", ex.getCause());
    }
  }

  public void drain() {
    drain(options.drainTimeout());
  }

  /**
   * Shut the worker down: pending assignments are abandoned, job processes closed, auxiliary resources
   * released and the session closed. Safe to call repeatedly and from any thread.
   */
  @Override
  public void close() {
    if (!closing.compareAndSet(false, true)) {
      return;
    }
    log.info("Closing worker connection");
    closeSignal.countDown();
    pendingAssignments.cancelAll();
    stopLoadReporter();
    closePool();
    closeAuxiliaries();
    awaitHandlers();
    Session session = current;
    if (session != null) {
      session.close();
    }
    dispatcher.shutdown();
    handlerExecutor.shutdownNow();
    scheduler.shutdownNow();
    setState(WorkerConnectionState.CLOSED);
    closed.complete(null);
    log.info("Worker connection closed");
  }

  /**
   * Ask the server to create a job as if requested by a client. Development aid.
   *
   * @throws IllegalStateException when the worker is not registered
   */
  public void simulateJob(JobType type, String room, String participantIdentity) {
    Session session = current;
    if (session == null || !session.registered) {
      throw new IllegalStateException("Worker is not registered");
    }
    log.info("Requesting simulated {} job for room {}", type, room);
    send(session, new WorkerMessage.SimulateJobRequest(type, room, participantIdentity));
  }

  /**
   * Jobs currently owned by this worker's processes.
   */
  public List<RunningJobInfo> activeJobs() {
    return pool.processes().stream()
        .map(JobProcessSupervisor::runningJob)
        .flatMap(Optional::stream)
        .toList();
  }

  public WorkerConnectionState state() {
    return state;
  }

  public Optional<String> workerId() {
    return Optional.ofNullable(workerId);
  }

  public Optional<ServerInfo> serverInfo() {
    return Optional.ofNullable(serverInfo);
  }

  public URI endpoint() {
    return agentUri;
  }

  public boolean isDraining() {
    return draining.get();
  }

  public CompletableFuture<Void> closeFuture() {
    return closed;
  }

  int pendingAssignmentCount() {
    return pendingAssignments.size();
  }

  private boolean runSession() throws IOException, InterruptedException {
    if (state != WorkerConnectionState.RECONNECTING) {
      setState(WorkerConnectionState.CONNECTING);
    }
    Session session = new Session();
    current = session;
    ControlPlaneSession channel = transport.open(agentUri, tokens.workerToken(), session);
    session.channel = channel;
    if (closing.get()) {
      session.close();
      return false;
    }
    send(session, new WorkerMessage.RegisterWorkerRequest(
        options.workerType(), options.agentName(), options.permissions(), options.version()));
    try {
      session.ended.get();
    } catch (ExecutionException ex) {
      Throwable cause = ex.getCause();
      if (cause instanceof WorkerConnectionException fatal) {
        throw fatal;
      }
      throw new WorkerConnectionException("Control-plane session failed", cause);
    } finally {
      channel.close();
    }
    return session.registered;
  }

  private void onFrame(Session session, String frame) {
    if (session != current || session.ended.isDone()) {
      return;
    }
    ServerMessage message;
    try {
      message = codec.decodeServerMessage(frame);
    } catch (IllegalArgumentException ex) {
      if (!session.registered) {
        session.fail(new WorkerProtocolException(
            "Expected a register response as first message but received an invalid frame: " + ex.getMessage()));
      } else {
        log.warn("Ignoring malformed control-plane frame: {}", ex.getMessage());
      }
      return;
    }
    if (!session.registered) {
      if (message instanceof ServerMessage.RegisterResponse register) {
        onRegistered(session, register);
      } else {
        session.fail(new WorkerProtocolException(
            "Expected a register response as first message but received " + message.type().wireName()));
      }
      return;
    }
    switch (message.type()) {
      case REGISTER -> log.warn("Ignoring repeated register response");
      case AVAILABILITY -> onAvailability((ServerMessage.AvailabilityRequest) message);
      case ASSIGNMENT -> onAssignment((JobAssignment) message);
      case TERMINATION -> onTermination(((ServerMessage.JobTermination) message).jobId());
      default -> log.warn("Unhandled control-plane message {}", message.type());
    }
  }

  private void onRegistered(Session session, ServerMessage.RegisterResponse register) {
    session.registered = true;
    workerId = register.workerId();
    serverInfo = register.serverInfo();
    log.info("Registered worker {} (server version={}, region={})",
        register.workerId(), register.serverInfo().version(), register.serverInfo().region());
    setState(draining.get() ? WorkerConnectionState.DRAINING : WorkerConnectionState.REGISTERED);
    lastStatus = null;
    startLoadReporter();
    for (Listener listener : listeners) {
      try {
        listener.onRegistered(register.workerId(), register.serverInfo());
      } catch (RuntimeException ex) {
        log.warn("Registration listener failed", ex);
      }
    }
  }

  private void onAvailability(ServerMessage.AvailabilityRequest offer) {
    String jobId = offer.job().id();
    if (closing.get() || draining.get()) {
      log.info("Rejecting job {} while {}", jobId, closing.get() ? "closing" : "draining");
      send(current, AvailabilityResponse.rejected(jobId));
      return;
    }
    if (pendingAssignments.contains(jobId) || !offersInProgress.add(jobId)) {
      log.warn("Ignoring duplicate availability request for job {}", jobId);
      return;
    }
    log.debug("Received availability request for job {} (room={}, resuming={})", jobId, offer.job().room(), offer.resuming());
    JobRequest request = new JobRequest(offer.job(), offer.resuming(), responder, log);
    CompletableFuture<Void> task;
    try {
      task = CompletableFuture.runAsync(() -> decide(request), handlerExecutor);
    } catch (RejectedExecutionException ex) {
      offersInProgress.remove(jobId);
      log.debug("Handler pool stopped; dropping offer for job {}", jobId);
      return;
    }
    inFlight.add(task);
    task.whenComplete((ignored, error) -> inFlight.remove(task));
  }

  private void decide(JobRequest request) {
    try {
      handler.handle(request);
    } catch (RuntimeException ex) {
      log.error("Job request handler failed for job {}", request.id(), ex);
    } finally {
      if (!request.answered()) {
        log.warn("No answer for job {}; rejecting", request.id());
        request.reject();
      }
    }
  }

  private void onAssignment(JobAssignment assignment) {
    if (!pendingAssignments.resolve(assignment)) {
      log.warn("Received assignment for unknown job {}", assignment.job().id());
    }
  }

  private void onTermination(String jobId) {
    pool.getByJobId(jobId).ifPresentOrElse(
        supervisor -> {
          log.info("Terminating job {} at server request (process {})", jobId, supervisor.processId());
          supervisor.close("terminated by server");
        },
        () -> log.debug("Termination for job {} which is not running", jobId));
  }

  private void launch(JobRequest request, JobAcceptArguments arguments, JobAssignment assignment) {
    String url = assignment.url().isBlank() ? options.url() : assignment.url();
    RunningJobInfo info = new RunningJobInfo(request.job(), arguments, url, assignment.token());
    try {
      JobProcessSupervisor supervisor = pool.launchJob(info);
      log.info("Launched job {} in process {}", request.id(), supervisor.processId());
    } catch (IllegalStateException ex) {
      log.warn("Unable to launch job {}: {}", request.id(), ex.getMessage());
    }
  }

  private synchronized void startLoadReporter() {
    if (loadTask != null || closing.get()) {
      return;
    }
    long periodMs = options.loadInterval().toMillis();
    try {
      loadTask = scheduler.scheduleAtFixedRate(this::reportLoad, 0L, periodMs, TimeUnit.MILLISECONDS);
    } catch (RejectedExecutionException ex) {
      log.debug("Scheduler stopped; load reporting not started");
    }
  }

  private synchronized void stopLoadReporter() {
    if (loadTask != null) {
      loadTask.cancel(false);
      loadTask = null;
    }
  }

  private void reportLoad() {
    Session session = current;
    if (session == null || !session.registered || closing.get()) {
      return;
    }
    try {
      double load = loadSampler.sample();
      int jobCount = activeJobs().size();
      boolean drainingNow = draining.get();
      WorkerStatus status = drainingNow ? WorkerStatus.FULL : WorkerStatus.forLoad(load, options.loadThreshold());
      WorkerStatus previous = lastStatus;
      if (status != previous) {
        lastStatus = status;
        log.info("Worker status {} -> {} (load={}, jobs={})",
            previous == null ? "-" : previous, status, formatLoad(load), jobCount);
      } else {
        log.debug("Worker load {} (status={}, jobs={})", formatLoad(load), status, jobCount);
      }
      if (!drainingNow) {
        setState(status == WorkerStatus.AVAILABLE ? WorkerConnectionState.AVAILABLE : WorkerConnectionState.FULL);
      }
      send(session, new WorkerMessage.UpdateWorkerStatus(status, load, jobCount));
    } catch (RuntimeException ex) {
      log.warn("Load report failed", ex);
    }
  }

  private void send(Session session, WorkerMessage message) {
    ControlPlaneSession channel = session == null ? null : session.channel;
    if (channel == null || !channel.isOpen()) {
      log.debug("Dropping {} while disconnected", message.type().wireName());
      return;
    }
    channel.send(codec.encode(message)).whenComplete((ignored, error) -> {
      if (error != null) {
        log.warn("Failed to send {}: {}", message.type().wireName(), error.getMessage());
      }
    });
  }

  private void closePool() {
    CompletableFuture<Void> poolClosed = pool.close();
    long waitMs = options.shutdownTimeout().toMillis() + 1_000L;
    try {
      poolClosed.get(waitMs, TimeUnit.MILLISECONDS);
    } catch (TimeoutException ex) {
      log.warn("Job processes still running after {} ms; terminating", waitMs);
      pool.terminate();
    } catch (InterruptedException ex) {
      Thread.currentThread().interrupt();
      pool.terminate();
    } catch (ExecutionException ex) {
      log.warn("Closing the process pool failed; terminating", ex.getCause());
      pool.terminate();
    }
  }

  private void closeAuxiliaries() {
    for (AutoCloseable resource : auxiliaries) {
      try {
        resource.close();
      } catch (Exception ex) {
        log.warn("Failed to close {}", resource, ex);
      }
    }
  }

  private void awaitHandlers() {
    if (inFlight.isEmpty()) {
      return;
    }
    CompletableFuture<Void> all = CompletableFuture.allOf(inFlight.toArray(new CompletableFuture<?>[0]));
    try {
      all.get(options.shutdownTimeout().toMillis(), TimeUnit.MILLISECONDS);
    } catch (TimeoutException ex) {
      log.warn("{} job request handlers still running at shutdown", inFlight.size());
    } catch (InterruptedException ex) {
      Thread.currentThread().interrupt();
    } catch (ExecutionException ex) {
      log.warn("Job request handler failed during shutdown", ex.getCause());
    }
  }

  private void setState(WorkerConnectionState next) {
    WorkerConnectionState previous;
    synchronized (stateLock) {
      previous = state;
      if (previous == next || previous == WorkerConnectionState.CLOSED) {
        return;
      }
      // draining is left only through a reconnect or close
      if (previous == WorkerConnectionState.DRAINING
          && (next == WorkerConnectionState.REGISTERED
              || next == WorkerConnectionState.AVAILABLE
              || next == WorkerConnectionState.FULL)) {
        return;
      }
      state = next;
    }
    log.debug("Worker connection state {} -> {}", previous, next);
    for (Listener listener : listeners) {
      try {
        listener.onStateChanged(previous, next);
      } catch (RuntimeException ex) {
        log.warn("State listener failed", ex);
      }
    }
  }

  private void dispatch(Runnable task) {
    try {
      dispatcher.execute(() -> {
        try {
          task.run();
        } catch (RuntimeException ex) {
          log.error("Failed to handle control-plane event", ex);
        }
      });
    } catch (RejectedExecutionException ex) {
      log.debug("Dispatcher stopped; dropping control-plane event");
    }
  }

  private static String formatLoad(double load) {
    return String.format(Locale.ROOT, "%.2f", load);
  }

  private static ThreadFactory daemonThreads(String prefix) {
    AtomicInteger counter = new AtomicInteger();
    return runnable -> {
      Thread thread = new Thread(runnable, prefix + "-" + counter.incrementAndGet());
      thread.setDaemon(true);
      return thread;
    };
  }

  /**
   * One transport session. A new instance is created for every (re)connect.
   */
  private final class Session implements SessionListener {

    private final CompletableFuture<Void> ended = new CompletableFuture<>();
    private volatile ControlPlaneSession channel;
    private volatile boolean registered;

    @Override
    public void onFrame(String frame) {
      dispatch(() -> WorkerConnection.this.onFrame(this, frame));
    }

    @Override
    public void onClosed(int statusCode, String reason) {
      dispatch(() -> end("closed by server (" + statusCode + (reason == null || reason.isBlank() ? "" : " " + reason) + ")"));
    }

    @Override
    public void onError(Throwable error) {
      dispatch(() -> end("transport error: " + error.getMessage()));
    }

    private void end(String cause) {
      if (ended.complete(null) && !closing.get()) {
        log.warn("Control-plane session ended: {}", cause);
      }
    }

    private void fail(WorkerProtocolException error) {
      ended.completeExceptionally(error);
    }

    private void close() {
      ControlPlaneSession open = channel;
      if (open != null) {
        open.close();
      }
      ended.complete(null);
    }
  }

  private final class AssignmentResponder implements JobRequest.Responder {

    @Override
    public void accepted(JobRequest request, JobAcceptArguments arguments) {
      String jobId = request.id();
      CompletableFuture<Optional<JobAssignment>> assignment;
      try {
        assignment = pendingAssignments.register(jobId, options.assignmentTimeout());
      } catch (IllegalStateException ex) {
        log.warn("Not accepting job {}: {}", jobId, ex.getMessage());
        return;
      } finally {
        offersInProgress.remove(jobId);
      }
      send(current, AvailabilityResponse.accepted(jobId, arguments));
      assignment.thenAccept(result -> result.ifPresentOrElse(
          received -> launch(request, arguments, received),
          () -> {
            if (closing.get()) {
              log.debug("Abandoning pending assignment for job {}", jobId);
            } else {
              log.warn("Assignment for job {} not received within {} ms", jobId, options.assignmentTimeout().toMillis());
            }
          }));
    }

    @Override
    public void rejected(JobRequest request) {
      offersInProgress.remove(request.id());
      log.debug("Rejecting job {}", request.id());
      send(current, AvailabilityResponse.rejected(request.id()));
    }
  }
}
