package io.agenthive.controlplane.messaging;

import java.util.Arrays;
import java.util.Optional;

public enum ServerMessageType {
  REGISTER("register"),
  AVAILABILITY("availability"),
  ASSIGNMENT("assignment"),
  TERMINATION("termination");

  private final String wireName;

  ServerMessageType(String wireName) {
    this.wireName = wireName;
  }

  public String wireName() {
    return wireName;
  }

  public static Optional<ServerMessageType> fromWireName(String wireName) {
    return Arrays.stream(values()).filter(type -> type.wireName.equals(wireName)).findFirst();
  }
}
