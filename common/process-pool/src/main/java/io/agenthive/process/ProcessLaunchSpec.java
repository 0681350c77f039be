package io.agenthive.process;

import io.agenthive.model.RunningJobInfo;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * What to launch: a process identifier, the job to hand over at spawn time (absent for warm idle
 * processes) and additional environment entries.
 */
public record ProcessLaunchSpec(String processId, RunningJobInfo runningJob, Map<String, String> environment) {

  public ProcessLaunchSpec {
    if (processId == null || processId.isBlank()) {
      throw new IllegalArgumentException("processId must not be null or blank");
    }
    environment = environment == null ? Map.of() : Map.copyOf(environment);
  }

  public static ProcessLaunchSpec idle(String processId) {
    return new ProcessLaunchSpec(processId, null, Map.of());
  }

  public static ProcessLaunchSpec withJob(String processId, RunningJobInfo runningJob) {
    return new ProcessLaunchSpec(processId, Objects.requireNonNull(runningJob, "runningJob"), Map.of());
  }

  public Optional<RunningJobInfo> job() {
    return Optional.ofNullable(runningJob);
  }
}
