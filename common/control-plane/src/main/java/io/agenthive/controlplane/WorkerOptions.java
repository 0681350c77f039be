package io.agenthive.controlplane;

import io.agenthive.model.JobType;
import java.time.Duration;
import java.util.Objects;

/**
 * Immutable settings of a {@link WorkerConnection}. Use {@link #builder()}.
 */
public final class WorkerOptions {

  public static final double DEFAULT_LOAD_THRESHOLD = 0.65;
  public static final Duration DEFAULT_LOAD_INTERVAL = Duration.ofMillis(2_500);
  public static final Duration DEFAULT_ASSIGNMENT_TIMEOUT = Duration.ofMillis(7_500);
  public static final int DEFAULT_MAX_RETRY = 10;
  public static final Duration DEFAULT_DRAIN_TIMEOUT = Duration.ofMinutes(30);
  public static final Duration DEFAULT_SHUTDOWN_TIMEOUT = Duration.ofSeconds(60);
  public static final Duration MAX_RECONNECT_DELAY = Duration.ofSeconds(10);

  private final String url;
  private final String apiKey;
  private final String apiSecret;
  private final String agentName;
  private final JobType workerType;
  private final WorkerPermissions permissions;
  private final String version;
  private final double loadThreshold;
  private final Duration loadInterval;
  private final Duration assignmentTimeout;
  private final int maxRetry;
  private final Duration drainTimeout;
  private final Duration shutdownTimeout;

  private WorkerOptions(Builder builder) {
    this.url = requireSetting(builder.url, "url", "AGENTHIVE_URL");
    this.apiKey = requireSetting(builder.apiKey, "apiKey", "AGENTHIVE_API_KEY");
    this.apiSecret = requireSetting(builder.apiSecret, "apiSecret", "AGENTHIVE_API_SECRET");
    this.agentName = builder.agentName == null ? "" : builder.agentName;
    this.workerType = builder.workerType;
    this.permissions = builder.permissions;
    this.version = builder.version;
    this.loadThreshold = builder.loadThreshold;
    this.loadInterval = builder.loadInterval;
    this.assignmentTimeout = builder.assignmentTimeout;
    this.maxRetry = builder.maxRetry;
    this.drainTimeout = builder.drainTimeout;
    this.shutdownTimeout = builder.shutdownTimeout;
  }

  public static Builder builder() {
    return new Builder();
  }

  public String url() {
    return url;
  }

  public String apiKey() {
    return apiKey;
  }

  public String apiSecret() {
    return apiSecret;
  }

  public String agentName() {
    return agentName;
  }

  public JobType workerType() {
    return workerType;
  }

  public WorkerPermissions permissions() {
    return permissions;
  }

  public String version() {
    return version;
  }

  public double loadThreshold() {
    return loadThreshold;
  }

  public Duration loadInterval() {
    return loadInterval;
  }

  public Duration assignmentTimeout() {
    return assignmentTimeout;
  }

  public int maxRetry() {
    return maxRetry;
  }

  public Duration drainTimeout() {
    return drainTimeout;
  }

  public Duration shutdownTimeout() {
    return shutdownTimeout;
  }

  /**
   * Delay before reconnect attempt {@code attempt} (1-based): two seconds per attempt, capped.
   */
  public static Duration reconnectDelay(int attempt) {
    Duration delay = Duration.ofSeconds(2L * Math.max(attempt, 1));
    return delay.compareTo(MAX_RECONNECT_DELAY) > 0 ? MAX_RECONNECT_DELAY : delay;
  }

  private static String requireSetting(String value, String field, String environmentVariable) {
    if (value == null || value.isBlank()) {
      throw new IllegalArgumentException(
          field + " is required, either as an option or through the " + environmentVariable + " environment variable");
    }
    return value;
  }

  public static final class Builder {

    private String url;
    private String apiKey;
    private String apiSecret;
    private String agentName = "";
    private JobType workerType = JobType.ROOM;
    private WorkerPermissions permissions = WorkerPermissions.defaults();
    private String version = "";
    private double loadThreshold = DEFAULT_LOAD_THRESHOLD;
    private Duration loadInterval = DEFAULT_LOAD_INTERVAL;
    private Duration assignmentTimeout = DEFAULT_ASSIGNMENT_TIMEOUT;
    private int maxRetry = DEFAULT_MAX_RETRY;
    private Duration drainTimeout = DEFAULT_DRAIN_TIMEOUT;
    private Duration shutdownTimeout = DEFAULT_SHUTDOWN_TIMEOUT;

    private Builder() {
    }

    public Builder url(String url) {
      this.url = url;
      return this;
    }

    public Builder apiKey(String apiKey) {
      this.apiKey = apiKey;
      return this;
    }

    public Builder apiSecret(String apiSecret) {
      this.apiSecret = apiSecret;
      return this;
    }

    public Builder agentName(String agentName) {
      this.agentName = agentName;
      return this;
    }

    public Builder workerType(JobType workerType) {
      this.workerType = Objects.requireNonNull(workerType, "workerType");
      return this;
    }

    public Builder permissions(WorkerPermissions permissions) {
      this.permissions = Objects.requireNonNull(permissions, "permissions");
      return this;
    }

    public Builder version(String version) {
      this.version = version == null ? "" : version;
      return this;
    }

    public Builder loadThreshold(double loadThreshold) {
      if (loadThreshold <= 0 || loadThreshold > 1) {
        throw new IllegalArgumentException("loadThreshold must be in (0, 1]");
      }
      this.loadThreshold = loadThreshold;
      return this;
    }

    public Builder loadInterval(Duration loadInterval) {
      this.loadInterval = requirePositive(loadInterval, "loadInterval");
      return this;
    }

    public Builder assignmentTimeout(Duration assignmentTimeout) {
      this.assignmentTimeout = requirePositive(assignmentTimeout, "assignmentTimeout");
      return this;
    }

    public Builder maxRetry(int maxRetry) {
      if (maxRetry < 0) {
        throw new IllegalArgumentException("maxRetry must be >= 0");
      }
      this.maxRetry = maxRetry;
      return this;
    }

    public Builder drainTimeout(Duration drainTimeout) {
      this.drainTimeout = requirePositive(drainTimeout, "drainTimeout");
      return this;
    }

    public Builder shutdownTimeout(Duration shutdownTimeout) {
      this.shutdownTimeout = requirePositive(shutdownTimeout, "shutdownTimeout");
      return this;
    }

    /**
     * @throws IllegalArgumentException when url, apiKey or apiSecret is missing
     */
    public WorkerOptions build() {
      return new WorkerOptions(this);
    }

    private static Duration requirePositive(Duration value, String field) {
      Objects.requireNonNull(value, field);
      if (value.isZero() || value.isNegative()) {
        throw new IllegalArgumentException(field + " must be positive");
      }
      return value;
    }
  }
}
