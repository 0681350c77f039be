package io.agenthive.controlplane;

import io.agenthive.controlplane.messaging.ServerMessage.JobAssignment;
import java.time.Duration;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;

/**
 * Correlates accepted offers with the assignments that confirm them. Each entry resolves exactly once:
 * with the assignment, or empty on timeout or cancellation.
 */
final class PendingAssignments {

  private final ScheduledExecutorService scheduler;
  private final Map<String, CompletableFuture<Optional<JobAssignment>>> pending = new ConcurrentHashMap<>();

  PendingAssignments(ScheduledExecutorService scheduler) {
    this.scheduler = Objects.requireNonNull(scheduler, "scheduler");
  }

  /**
   * @throws IllegalStateException if an assignment for the job is already pending
   */
  CompletableFuture<Optional<JobAssignment>> register(String jobId, Duration timeout) {
    Objects.requireNonNull(jobId, "jobId");
    Objects.requireNonNull(timeout, "timeout");
    CompletableFuture<Optional<JobAssignment>> future = new CompletableFuture<>();
    if (pending.putIfAbsent(jobId, future) != null) {
      throw new IllegalStateException("Assignment for job " + jobId + " is already pending");
    }
    ScheduledFuture<?> timer = scheduler.schedule(
        () -> future.complete(Optional.empty()), timeout.toMillis(), TimeUnit.MILLISECONDS);
    future.whenComplete((assignment, error) -> {
      timer.cancel(false);
      pending.remove(jobId, future);
    });
    return future;
  }

  boolean contains(String jobId) {
    return pending.containsKey(jobId);
  }

  /**
   * @return {@code false} when no assignment was pending for the job
   */
  boolean resolve(JobAssignment assignment) {
    CompletableFuture<Optional<JobAssignment>> future = pending.remove(assignment.job().id());
    return future != null && future.complete(Optional.of(assignment));
  }

  void cancelAll() {
    pending.values().forEach(future -> future.complete(Optional.empty()));
  }

  int size() {
    return pending.size();
  }
}
