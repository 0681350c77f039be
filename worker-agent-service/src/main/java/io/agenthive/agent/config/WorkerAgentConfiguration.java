package io.agenthive.agent.config;

import io.agenthive.agent.WorkerRunner;
import io.agenthive.agent.metrics.MicrometerProcessPoolMetrics;
import io.agenthive.controlplane.JobRequestHandler;
import io.agenthive.controlplane.LoadSampler;
import io.agenthive.controlplane.WorkerConnection;
import io.agenthive.controlplane.WorkerOptions;
import io.agenthive.controlplane.auth.AccessTokenProvider;
import io.agenthive.controlplane.auth.ApiKeyAccessTokenProvider;
import io.agenthive.controlplane.transport.ControlPlaneTransport;
import io.agenthive.controlplane.transport.WebSocketControlPlaneTransport;
import io.agenthive.ipc.JobProcessEnvironment;
import io.agenthive.process.OsProcessLauncher;
import io.agenthive.process.ProcessLauncher;
import io.agenthive.process.ProcessPool;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Tags;
import java.util.HashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.function.IntConsumer;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.context.ConfigurableApplicationContext;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class WorkerAgentConfiguration {

  private final AgentWorkerProperties properties;

  public WorkerAgentConfiguration(AgentWorkerProperties properties) {
    this.properties = Objects.requireNonNull(properties, "properties");
  }

  @Bean
  WorkerOptions workerOptions() {
    return properties.toWorkerOptions();
  }

  @Bean
  MicrometerProcessPoolMetrics processPoolMetrics(MeterRegistry meterRegistry) {
    return new MicrometerProcessPoolMetrics(meterRegistry,
        Tags.of("worker_type", properties.getWorkerType().name().toLowerCase(Locale.ROOT)));
  }

  @Bean
  @ConditionalOnMissingBean
  ProcessLauncher processLauncher() {
    AgentWorkerProperties.JobProcess jobProcess = properties.getJobProcess();
    List<String> command = jobProcess.command().isEmpty() ? OsProcessLauncher.defaultCommand() : jobProcess.command();
    Map<String, String> environment = new HashMap<>(jobProcess.environment());
    if (!jobProcess.entrypoint().isEmpty()) {
      environment.put(JobProcessEnvironment.JOB_ENTRYPOINT, jobProcess.entrypoint());
    }
    return new OsProcessLauncher(command, environment, jobProcess.workingDirectory().orElse(null));
  }

  // closed by the worker connection
  @Bean(destroyMethod = "")
  ProcessPool processPool(ProcessLauncher processLauncher, MicrometerProcessPoolMetrics processPoolMetrics) {
    return ProcessPool.builder(processLauncher)
        .options(properties.toJobProcessOptions())
        .numIdle(properties.getPool().numIdle())
        .idleRespawnDelay(properties.getPool().idleRespawnDelay())
        .metrics(processPoolMetrics)
        .build();
  }

  @Bean
  @ConditionalOnMissingBean
  AccessTokenProvider accessTokenProvider(WorkerOptions workerOptions) {
    return new ApiKeyAccessTokenProvider(workerOptions.apiKey(), workerOptions.apiSecret());
  }

  @Bean
  @ConditionalOnMissingBean
  ControlPlaneTransport controlPlaneTransport() {
    return new WebSocketControlPlaneTransport(properties.getConnection().connectTimeout());
  }

  @Bean
  @ConditionalOnMissingBean
  JobRequestHandler jobRequestHandler() {
    return JobRequestHandler.acceptAll();
  }

  @Bean
  @ConditionalOnMissingBean
  LoadSampler loadSampler() {
    return LoadSampler.systemCpu();
  }

  @Bean
  WorkerConnection workerConnection(WorkerOptions workerOptions,
                                    ProcessPool processPool,
                                    JobRequestHandler jobRequestHandler,
                                    ControlPlaneTransport controlPlaneTransport,
                                    AccessTokenProvider accessTokenProvider,
                                    LoadSampler loadSampler) {
    return new WorkerConnection(workerOptions, processPool, jobRequestHandler, controlPlaneTransport,
        accessTokenProvider, loadSampler);
  }

  @Bean
  WorkerRunner workerRunner(WorkerConnection workerConnection, ConfigurableApplicationContext context) {
    IntConsumer exit = code -> System.exit(SpringApplication.exit(context, () -> code));
    return new WorkerRunner(workerConnection,
        properties.isProduction(),
        properties.getConnection().drainTimeout(),
        properties.getSimulateRoom(),
        properties.getWorkerType(),
        exit);
  }
}
