package io.agenthive.controlplane;

/**
 * Decides whether this worker takes an offered job.
 * <p>
 * Implementations must answer through {@link JobRequest#accept(io.agenthive.model.JobAcceptArguments)},
 * {@link JobRequest#accept()} or {@link JobRequest#reject()} before returning; an unanswered request
 * is rejected. Handlers run on a dedicated pool and may block briefly.
 */
@FunctionalInterface
public interface JobRequestHandler {

  void handle(JobRequest request);

  static JobRequestHandler acceptAll() {
    return JobRequest::accept;
  }
}
