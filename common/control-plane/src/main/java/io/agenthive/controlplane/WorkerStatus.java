package io.agenthive.controlplane;

import java.util.Arrays;
import java.util.Optional;

/**
 * Availability advertised to the control plane with every load report.
 */
public enum WorkerStatus {
  AVAILABLE("available"),
  FULL("full");

  private final String wireName;

  WorkerStatus(String wireName) {
    this.wireName = wireName;
  }

  public String wireName() {
    return wireName;
  }

  public static WorkerStatus forLoad(double load, double threshold) {
    return load >= threshold ? FULL : AVAILABLE;
  }

  public static Optional<WorkerStatus> fromWireName(String wireName) {
    return Arrays.stream(values()).filter(status -> status.wireName.equals(wireName)).findFirst();
  }
}
