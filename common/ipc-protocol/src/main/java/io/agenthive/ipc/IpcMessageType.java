package io.agenthive.ipc;

import java.util.Arrays;
import java.util.Map;
import java.util.Optional;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * Wire tag of every {@link IpcMessage}, together with the direction it travels in.
 */
public enum IpcMessageType {

  START_JOB_REQUEST("startJobRequest", Direction.TO_PROCESS),
  START_JOB_RESPONSE("startJobResponse", Direction.TO_SUPERVISOR),
  PING("ping", Direction.TO_PROCESS),
  PONG("pong", Direction.TO_SUPERVISOR),
  SHUTDOWN_REQUEST("shutdownRequest", Direction.TO_PROCESS),
  SHUTDOWN_RESPONSE("shutdownResponse", Direction.TO_SUPERVISOR),
  USER_EXIT("userExit", Direction.TO_SUPERVISOR);

  public enum Direction {
    TO_PROCESS,
    TO_SUPERVISOR
  }

  private static final Map<String, IpcMessageType> BY_WIRE_NAME = Arrays.stream(values())
      .collect(Collectors.toUnmodifiableMap(IpcMessageType::wireName, Function.identity()));

  private final String wireName;
  private final Direction direction;

  IpcMessageType(String wireName, Direction direction) {
    this.wireName = wireName;
    this.direction = direction;
  }

  public String wireName() {
    return wireName;
  }

  public Direction direction() {
    return direction;
  }

  public static Optional<IpcMessageType> fromWireName(String wireName) {
    if (wireName == null) {
      return Optional.empty();
    }
    return Optional.ofNullable(BY_WIRE_NAME.get(wireName));
  }
}
