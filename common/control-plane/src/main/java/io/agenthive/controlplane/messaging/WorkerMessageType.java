package io.agenthive.controlplane.messaging;

import java.util.Arrays;
import java.util.Optional;

public enum WorkerMessageType {
  REGISTER("register"),
  AVAILABILITY("availability"),
  UPDATE_WORKER("updateWorker"),
  SIMULATE_JOB("simulateJob");

  private final String wireName;

  WorkerMessageType(String wireName) {
    this.wireName = wireName;
  }

  public String wireName() {
    return wireName;
  }

  public static Optional<WorkerMessageType> fromWireName(String wireName) {
    return Arrays.stream(values()).filter(type -> type.wireName.equals(wireName)).findFirst();
  }
}
