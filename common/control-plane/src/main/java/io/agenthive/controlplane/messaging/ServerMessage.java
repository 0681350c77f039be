package io.agenthive.controlplane.messaging;

import io.agenthive.model.Job;
import java.util.Objects;

/**
 * Frames the control-plane server sends to a worker.
 */
public sealed interface ServerMessage
    permits ServerMessage.RegisterResponse,
            ServerMessage.AvailabilityRequest,
            ServerMessage.JobAssignment,
            ServerMessage.JobTermination {

  ServerMessageType type();

  /**
   * Acknowledges registration. Always the first frame of a session.
   */
  record RegisterResponse(String workerId, ServerInfo serverInfo) implements ServerMessage {

    public RegisterResponse {
      if (workerId == null || workerId.isBlank()) {
        throw new IllegalArgumentException("workerId must not be null or blank");
      }
      serverInfo = serverInfo == null ? ServerInfo.unknown() : serverInfo;
    }

    @Override
    public ServerMessageType type() {
      return ServerMessageType.REGISTER;
    }
  }

  /**
   * Offers a job; the worker must answer with an availability response.
   */
  record AvailabilityRequest(Job job, boolean resuming) implements ServerMessage {

    public AvailabilityRequest {
      Objects.requireNonNull(job, "job");
    }

    @Override
    public ServerMessageType type() {
      return ServerMessageType.AVAILABILITY;
    }
  }

  /**
   * Confirms that an accepted job belongs to this worker. An empty url means the worker's own.
   */
  record JobAssignment(Job job, String url, String token) implements ServerMessage {

    public JobAssignment {
      Objects.requireNonNull(job, "job");
      url = url == null ? "" : url;
      if (token == null || token.isBlank()) {
        throw new IllegalArgumentException("token must not be null or blank");
      }
    }

    @Override
    public ServerMessageType type() {
      return ServerMessageType.ASSIGNMENT;
    }
  }

  record JobTermination(String jobId) implements ServerMessage {

    public JobTermination {
      if (jobId == null || jobId.isBlank()) {
        throw new IllegalArgumentException("jobId must not be null or blank");
      }
    }

    @Override
    public ServerMessageType type() {
      return ServerMessageType.TERMINATION;
    }
  }
}
