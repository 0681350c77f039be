package io.agenthive.controlplane.messaging;

import io.agenthive.controlplane.WorkerPermissions;
import io.agenthive.controlplane.WorkerStatus;
import io.agenthive.model.JobAcceptArguments;
import io.agenthive.model.JobType;
import java.util.Map;
import java.util.Objects;

/**
 * Frames a worker sends to the control-plane server.
 */
public sealed interface WorkerMessage
    permits WorkerMessage.RegisterWorkerRequest,
            WorkerMessage.AvailabilityResponse,
            WorkerMessage.UpdateWorkerStatus,
            WorkerMessage.SimulateJobRequest {

  WorkerMessageType type();

  record RegisterWorkerRequest(JobType workerType,
                               String agentName,
                               WorkerPermissions permissions,
                               String version) implements WorkerMessage {

    public RegisterWorkerRequest {
      Objects.requireNonNull(workerType, "workerType");
      agentName = agentName == null ? "" : agentName;
      permissions = permissions == null ? WorkerPermissions.defaults() : permissions;
      version = version == null ? "" : version;
    }

    @Override
    public WorkerMessageType type() {
      return WorkerMessageType.REGISTER;
    }
  }

  /**
   * Answer to an availability request. Participant fields are only meaningful when available.
   */
  record AvailabilityResponse(String jobId,
                              boolean available,
                              String participantIdentity,
                              String participantName,
                              String participantMetadata,
                              Map<String, String> participantAttributes) implements WorkerMessage {

    public AvailabilityResponse {
      if (jobId == null || jobId.isBlank()) {
        throw new IllegalArgumentException("jobId must not be null or blank");
      }
      participantAttributes = participantAttributes == null ? Map.of() : Map.copyOf(participantAttributes);
    }

    public static AvailabilityResponse accepted(String jobId, JobAcceptArguments arguments) {
      Objects.requireNonNull(arguments, "arguments");
      return new AvailabilityResponse(jobId, true, arguments.identity(), arguments.name(), arguments.metadata(),
          arguments.attributes());
    }

    public static AvailabilityResponse rejected(String jobId) {
      return new AvailabilityResponse(jobId, false, null, null, null, Map.of());
    }

    @Override
    public WorkerMessageType type() {
      return WorkerMessageType.AVAILABILITY;
    }
  }

  record UpdateWorkerStatus(WorkerStatus status, double load, int jobCount) implements WorkerMessage {

    public UpdateWorkerStatus {
      Objects.requireNonNull(status, "status");
    }

    @Override
    public WorkerMessageType type() {
      return WorkerMessageType.UPDATE_WORKER;
    }
  }

  /**
   * Development aid: asks the server to create a job as if a client requested one.
   */
  record SimulateJobRequest(JobType jobType, String room, String participantIdentity) implements WorkerMessage {

    public SimulateJobRequest {
      Objects.requireNonNull(jobType, "jobType");
      if (room == null || room.isBlank()) {
        throw new IllegalArgumentException("room must not be null or blank");
      }
    }

    @Override
    public WorkerMessageType type() {
      return WorkerMessageType.SIMULATE_JOB;
    }
  }
}
