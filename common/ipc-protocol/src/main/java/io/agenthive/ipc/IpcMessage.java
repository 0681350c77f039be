package io.agenthive.ipc;

import io.agenthive.model.RunningJobInfo;
import java.util.Objects;
import java.util.Optional;

/**
 * Closed set of messages exchanged between a supervisor and the job process it owns.
 *
 * <p>A job process sends at most one of {@link UserExit} and {@link ShutdownResponse}, and it is
 * always the last message it writes before terminating.</p>
 */
public sealed interface IpcMessage
    permits IpcMessage.StartJobRequest,
            IpcMessage.StartJobResponse,
            IpcMessage.Ping,
            IpcMessage.Pong,
            IpcMessage.ShutdownRequest,
            IpcMessage.ShutdownResponse,
            IpcMessage.UserExit {

  IpcMessageType type();

  /**
   * Hands a job to a pre-warmed process that was spawned without one.
   */
  record StartJobRequest(RunningJobInfo runningJob) implements IpcMessage {

    public StartJobRequest {
      runningJob = Objects.requireNonNull(runningJob, "runningJob");
    }

    @Override
    public IpcMessageType type() {
      return IpcMessageType.START_JOB_REQUEST;
    }
  }

  /**
   * Result of the process' attempt to connect to its job's resource. No error means success.
   */
  record StartJobResponse(String error) implements IpcMessage {

    public static StartJobResponse success() {
      return new StartJobResponse(null);
    }

    public static StartJobResponse failure(String error) {
      return new StartJobResponse(error == null || error.isBlank() ? "unknown error" : error);
    }

    public boolean isSuccess() {
      return error == null;
    }

    public Optional<String> errorMessage() {
      return Optional.ofNullable(error);
    }

    @Override
    public IpcMessageType type() {
      return IpcMessageType.START_JOB_RESPONSE;
    }
  }

  record Ping(long timestamp) implements IpcMessage {

    @Override
    public IpcMessageType type() {
      return IpcMessageType.PING;
    }
  }

  /**
   * Liveness reply. {@code lastTimestamp} echoes the ping, {@code timestamp} is the reply time.
   */
  record Pong(long lastTimestamp, long timestamp) implements IpcMessage {

    public long delayMillis() {
      return timestamp - lastTimestamp;
    }

    @Override
    public IpcMessageType type() {
      return IpcMessageType.PONG;
    }
  }

  record ShutdownRequest(String reason) implements IpcMessage {

    @Override
    public IpcMessageType type() {
      return IpcMessageType.SHUTDOWN_REQUEST;
    }
  }

  record ShutdownResponse() implements IpcMessage {

    @Override
    public IpcMessageType type() {
      return IpcMessageType.SHUTDOWN_RESPONSE;
    }
  }

  /**
   * The process is exiting on its own, either because the job finished or because it failed.
   */
  record UserExit(String reason) implements IpcMessage {

    @Override
    public IpcMessageType type() {
      return IpcMessageType.USER_EXIT;
    }
  }
}
