package io.agenthive.process;

public enum JobProcessFailure {
  LAUNCH_FAILED("launch_failed"),
  START_FAILED("start_failed"),
  START_TIMEOUT("start_timeout"),
  HEARTBEAT_TIMEOUT("heartbeat_timeout"),
  SHUTDOWN_TIMEOUT("shutdown_timeout"),
  UNEXPECTED_EXIT("unexpected_exit");

  private final String tag;

  JobProcessFailure(String tag) {
    this.tag = tag;
  }

  /**
   * Short lower-case form used in log lines and metric tags.
   */
  public String tag() {
    return tag;
  }
}
