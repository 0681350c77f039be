package io.agenthive.controlplane;

import io.agenthive.model.Job;
import io.agenthive.model.JobAcceptArguments;
import io.agenthive.model.ParticipantInfo;
import java.util.Objects;
import java.util.Optional;
import org.slf4j.Logger;

/**
 * A job offer awaiting this worker's decision. Only the first answer counts.
 */
public final class JobRequest {

  interface Responder {

    void accepted(JobRequest request, JobAcceptArguments arguments);

    void rejected(JobRequest request);
  }

  private final Job job;
  private final boolean resuming;
  private final Responder responder;
  private final Logger log;

  private boolean answered;
  private JobAcceptArguments acceptArguments;

  JobRequest(Job job, boolean resuming, Responder responder, Logger log) {
    this.job = Objects.requireNonNull(job, "job");
    this.resuming = resuming;
    this.responder = Objects.requireNonNull(responder, "responder");
    this.log = Objects.requireNonNull(log, "log");
  }

  public Job job() {
    return job;
  }

  public String id() {
    return job.id();
  }

  public String room() {
    return job.room();
  }

  public Optional<ParticipantInfo> participant() {
    return job.participantInfo();
  }

  public boolean resuming() {
    return resuming;
  }

  /**
   * Accept with a generated participant identity.
   */
  public boolean accept() {
    return accept(JobAcceptArguments.defaultsFor(job));
  }

  /**
   * @return {@code false} if the request had already been answered
   */
  public boolean accept(JobAcceptArguments arguments) {
    Objects.requireNonNull(arguments, "arguments");
    synchronized (this) {
      if (!markAnswered("accept")) {
        return false;
      }
      acceptArguments = arguments;
    }
    responder.accepted(this, arguments);
    return true;
  }

  public boolean reject() {
    synchronized (this) {
      if (!markAnswered("reject")) {
        return false;
      }
    }
    responder.rejected(this);
    return true;
  }

  public synchronized boolean answered() {
    return answered;
  }

  public synchronized Optional<JobAcceptArguments> acceptArguments() {
    return Optional.ofNullable(acceptArguments);
  }

  private boolean markAnswered(String answer) {
    if (answered) {
      log.warn("Ignoring {} for job {}: request already answered", answer, job.id());
      return false;
    }
    answered = true;
    return true;
  }
}
