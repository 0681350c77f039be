package io.agenthive.model;

import java.util.Objects;

/**
 * Everything a job process needs to start: the job, the accept-time arguments, and the
 * connection details delivered by the assignment.
 */
public record RunningJobInfo(Job job,
                             JobAcceptArguments acceptArguments,
                             String url,
                             String token) {

  public RunningJobInfo {
    job = Objects.requireNonNull(job, "job");
    acceptArguments = Objects.requireNonNull(acceptArguments, "acceptArguments");
    url = ModelGuards.requireText(url, "url");
    token = ModelGuards.requireText(token, "token");
  }

  public String jobId() {
    return job.id();
  }
}
