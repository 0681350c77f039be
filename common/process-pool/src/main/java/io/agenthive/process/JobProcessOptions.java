package io.agenthive.process;

import java.time.Duration;
import java.util.Objects;

/**
 * Timing knobs shared by every supervisor of a pool.
 *
 * @param startTimeout      how long a job may take to report {@code startJobResponse}
 * @param pingInterval      period between heartbeats
 * @param pingTimeout       how long without a pong before the process is considered dead
 * @param highPingThreshold pong delay above which a warning is logged
 * @param shutdownTimeout   grace period between a shutdown request and a kill
 */
public record JobProcessOptions(Duration startTimeout,
                                Duration pingInterval,
                                Duration pingTimeout,
                                Duration highPingThreshold,
                                Duration shutdownTimeout) {

  public static final Duration DEFAULT_START_TIMEOUT = Duration.ofSeconds(90);
  public static final Duration DEFAULT_PING_INTERVAL = Duration.ofSeconds(5);
  public static final Duration DEFAULT_PING_TIMEOUT = Duration.ofSeconds(90);
  public static final Duration DEFAULT_HIGH_PING_THRESHOLD = Duration.ofMillis(10);
  public static final Duration DEFAULT_SHUTDOWN_TIMEOUT = Duration.ofSeconds(60);

  public JobProcessOptions {
    startTimeout = requirePositive(startTimeout, "startTimeout");
    pingInterval = requirePositive(pingInterval, "pingInterval");
    pingTimeout = requirePositive(pingTimeout, "pingTimeout");
    highPingThreshold = Objects.requireNonNull(highPingThreshold, "highPingThreshold");
    if (highPingThreshold.isNegative()) {
      throw new IllegalArgumentException("highPingThreshold must be >= 0");
    }
    shutdownTimeout = requirePositive(shutdownTimeout, "shutdownTimeout");
  }

  public static JobProcessOptions defaults() {
    return new JobProcessOptions(DEFAULT_START_TIMEOUT, DEFAULT_PING_INTERVAL, DEFAULT_PING_TIMEOUT,
        DEFAULT_HIGH_PING_THRESHOLD, DEFAULT_SHUTDOWN_TIMEOUT);
  }

  private static Duration requirePositive(Duration value, String field) {
    Objects.requireNonNull(value, field);
    if (value.isZero() || value.isNegative()) {
      throw new IllegalArgumentException(field + " must be positive");
    }
    return value;
  }
}
