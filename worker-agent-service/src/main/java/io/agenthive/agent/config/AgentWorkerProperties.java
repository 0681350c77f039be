package io.agenthive.agent.config;

import io.agenthive.controlplane.WorkerOptions;
import io.agenthive.controlplane.WorkerPermissions;
import io.agenthive.model.JobType;
import io.agenthive.process.JobProcessOptions;
import io.agenthive.process.ProcessPool;
import jakarta.validation.Valid;
import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.PositiveOrZero;
import java.nio.file.Path;
import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

/**
 * Settings of the worker agent, bound from {@code agenthive.worker.*}.
 * <p>
 * Credentials are not validated here: {@link #toWorkerOptions()} rejects missing values and names the
 * environment variable that supplies them.
 */
@Validated
@ConfigurationProperties(prefix = "agenthive.worker")
public class AgentWorkerProperties {

  private final String url;
  private final String apiKey;
  private final String apiSecret;
  private final String agentName;
  private final JobType workerType;
  private final String version;
  private final boolean production;
  private final String simulateRoom;
  private final Load load;
  private final Connection connection;
  private final Pool pool;
  private final JobProcess jobProcess;
  private final Permissions permissions;

  public AgentWorkerProperties(String url,
                               String apiKey,
                               String apiSecret,
                               String agentName,
                               JobType workerType,
                               String version,
                               Boolean production,
                               String simulateRoom,
                               @Valid Load load,
                               @Valid Connection connection,
                               @Valid Pool pool,
                               @Valid JobProcess jobProcess,
                               Permissions permissions) {
    this.url = trimToNull(url);
    this.apiKey = trimToNull(apiKey);
    this.apiSecret = trimToNull(apiSecret);
    this.agentName = agentName == null ? "" : agentName.trim();
    this.workerType = workerType != null ? workerType : JobType.ROOM;
    this.version = version == null ? "" : version.trim();
    this.production = production == null || production;
    this.simulateRoom = trimToNull(simulateRoom);
    this.load = load != null ? load : new Load(null, null);
    this.connection = connection != null ? connection : new Connection(null, null, null, null, null);
    this.pool = pool != null ? pool : new Pool(null, null);
    this.jobProcess = jobProcess != null ? jobProcess : new JobProcess(null, null, null, null, null, null, null, null);
    this.permissions = permissions != null ? permissions : new Permissions(null, null, null, null, null, null);
  }

  public String getUrl() {
    return url;
  }

  public String getApiKey() {
    return apiKey;
  }

  public String getApiSecret() {
    return apiSecret;
  }

  public String getAgentName() {
    return agentName;
  }

  public JobType getWorkerType() {
    return workerType;
  }

  public String getVersion() {
    return version;
  }

  /**
   * Production workers drain their jobs on shutdown; development workers close at once.
   */
  public boolean isProduction() {
    return production;
  }

  public Optional<String> getSimulateRoom() {
    return Optional.ofNullable(simulateRoom);
  }

  public Load getLoad() {
    return load;
  }

  public Connection getConnection() {
    return connection;
  }

  public Pool getPool() {
    return pool;
  }

  public JobProcess getJobProcess() {
    return jobProcess;
  }

  public Permissions getPermissions() {
    return permissions;
  }

  /**
   * @throws IllegalArgumentException when url, api key or api secret is missing
   */
  public WorkerOptions toWorkerOptions() {
    return WorkerOptions.builder()
        .url(url)
        .apiKey(apiKey)
        .apiSecret(apiSecret)
        .agentName(agentName)
        .workerType(workerType)
        .version(version)
        .permissions(permissions.toWorkerPermissions())
        .loadThreshold(load.threshold())
        .loadInterval(load.interval())
        .assignmentTimeout(connection.assignmentTimeout())
        .maxRetry(connection.maxRetry())
        .drainTimeout(connection.drainTimeout())
        .shutdownTimeout(connection.shutdownTimeout())
        .build();
  }

  public JobProcessOptions toJobProcessOptions() {
    return new JobProcessOptions(
        jobProcess.startTimeout(),
        jobProcess.pingInterval(),
        jobProcess.pingTimeout(),
        jobProcess.highPingThreshold(),
        connection.shutdownTimeout());
  }

  @Validated
  public static final class Load {
    private final double threshold;
    private final Duration interval;

    public Load(@DecimalMin(value = "0", inclusive = false) @DecimalMax("1") Double threshold, Duration interval) {
      this.threshold = threshold != null ? threshold : WorkerOptions.DEFAULT_LOAD_THRESHOLD;
      this.interval = interval != null ? interval : WorkerOptions.DEFAULT_LOAD_INTERVAL;
    }

    /**
     * Load at or above which the worker reports itself full.
     */
    public double threshold() {
      return threshold;
    }

    public Duration interval() {
      return interval;
    }
  }

  @Validated
  public static final class Connection {
    private final int maxRetry;
    private final Duration connectTimeout;
    private final Duration assignmentTimeout;
    private final Duration drainTimeout;
    private final Duration shutdownTimeout;

    public Connection(@PositiveOrZero Integer maxRetry,
                      Duration connectTimeout,
                      Duration assignmentTimeout,
                      Duration drainTimeout,
                      Duration shutdownTimeout) {
      this.maxRetry = maxRetry != null ? maxRetry : WorkerOptions.DEFAULT_MAX_RETRY;
      this.connectTimeout = connectTimeout != null ? connectTimeout : Duration.ofSeconds(10);
      this.assignmentTimeout = assignmentTimeout != null ? assignmentTimeout : WorkerOptions.DEFAULT_ASSIGNMENT_TIMEOUT;
      this.drainTimeout = drainTimeout != null ? drainTimeout : WorkerOptions.DEFAULT_DRAIN_TIMEOUT;
      this.shutdownTimeout = shutdownTimeout != null ? shutdownTimeout : WorkerOptions.DEFAULT_SHUTDOWN_TIMEOUT;
    }

    public int maxRetry() {
      return maxRetry;
    }

    public Duration connectTimeout() {
      return connectTimeout;
    }

    public Duration assignmentTimeout() {
      return assignmentTimeout;
    }

    public Duration drainTimeout() {
      return drainTimeout;
    }

    public Duration shutdownTimeout() {
      return shutdownTimeout;
    }
  }

  @Validated
  public static final class Pool {
    private final int numIdle;
    private final Duration idleRespawnDelay;

    public Pool(@PositiveOrZero Integer numIdle, Duration idleRespawnDelay) {
      this.numIdle = numIdle != null ? numIdle : ProcessPool.DEFAULT_NUM_IDLE;
      this.idleRespawnDelay = idleRespawnDelay != null ? idleRespawnDelay : ProcessPool.DEFAULT_IDLE_RESPAWN_DELAY;
    }

    public int numIdle() {
      return numIdle;
    }

    public Duration idleRespawnDelay() {
      return idleRespawnDelay;
    }
  }

  /**
   * How job processes are spawned and health-checked. An empty command runs the job runner on the
   * agent's own classpath.
   */
  @Validated
  public static final class JobProcess {
    private final List<String> command;
    private final String entrypoint;
    private final Path workingDirectory;
    private final Map<String, String> environment;
    private final Duration startTimeout;
    private final Duration pingInterval;
    private final Duration pingTimeout;
    private final Duration highPingThreshold;

    public JobProcess(List<String> command,
                      String entrypoint,
                      String workingDirectory,
                      Map<String, String> environment,
                      Duration startTimeout,
                      Duration pingInterval,
                      Duration pingTimeout,
                      Duration highPingThreshold) {
      this.command = command == null ? List.of() : List.copyOf(command);
      this.entrypoint = entrypoint == null ? "" : entrypoint.trim();
      this.workingDirectory = workingDirectory == null || workingDirectory.isBlank()
          ? null
          : Path.of(workingDirectory.trim());
      this.environment = environment == null ? Map.of() : Map.copyOf(environment);
      this.startTimeout = startTimeout != null ? startTimeout : JobProcessOptions.DEFAULT_START_TIMEOUT;
      this.pingInterval = pingInterval != null ? pingInterval : JobProcessOptions.DEFAULT_PING_INTERVAL;
      this.pingTimeout = pingTimeout != null ? pingTimeout : JobProcessOptions.DEFAULT_PING_TIMEOUT;
      this.highPingThreshold = highPingThreshold != null
          ? highPingThreshold
          : JobProcessOptions.DEFAULT_HIGH_PING_THRESHOLD;
    }

    public List<String> command() {
      return command;
    }

    /**
     * Fully qualified {@code JobEntrypoint} class; blank falls back to the registered provider.
     */
    public String entrypoint() {
      return entrypoint;
    }

    public Optional<Path> workingDirectory() {
      return Optional.ofNullable(workingDirectory);
    }

    public Map<String, String> environment() {
      return environment;
    }

    public Duration startTimeout() {
      return startTimeout;
    }

    public Duration pingInterval() {
      return pingInterval;
    }

    public Duration pingTimeout() {
      return pingTimeout;
    }

    public Duration highPingThreshold() {
      return highPingThreshold;
    }
  }

  public static final class Permissions {
    private final WorkerPermissions resolved;

    public Permissions(Boolean canPublish,
                       Boolean canSubscribe,
                       Boolean canPublishData,
                       Boolean canUpdateMetadata,
                       List<String> canPublishSources,
                       Boolean hidden) {
      WorkerPermissions defaults = WorkerPermissions.defaults();
      this.resolved = new WorkerPermissions(
          canPublish != null ? canPublish : defaults.canPublish(),
          canSubscribe != null ? canSubscribe : defaults.canSubscribe(),
          canPublishData != null ? canPublishData : defaults.canPublishData(),
          canUpdateMetadata != null ? canUpdateMetadata : defaults.canUpdateMetadata(),
          canPublishSources != null ? canPublishSources : defaults.canPublishSources(),
          hidden != null ? hidden : defaults.hidden());
    }

    public WorkerPermissions toWorkerPermissions() {
      return resolved;
    }
  }

  private static String trimToNull(String value) {
    if (value == null) {
      return null;
    }
    String trimmed = value.trim();
    return trimmed.isEmpty() ? null : trimmed;
  }
}
