package io.agenthive.agent.metrics;

import static org.assertj.core.api.Assertions.assertThat;

import io.agenthive.process.JobProcessFailure;
import io.micrometer.core.instrument.Tags;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.Test;

class MicrometerProcessPoolMetricsTest {

  private final SimpleMeterRegistry registry = new SimpleMeterRegistry();
  private final MicrometerProcessPoolMetrics metrics =
      new MicrometerProcessPoolMetrics(registry, Tags.of("worker_type", "room"));

  @Test
  void countsProcessActivity() {
    metrics.processSpawned(false);
    metrics.processSpawned(false);
    metrics.processSpawned(true);
    metrics.jobStarted();
    metrics.processClosed();

    assertThat(registry.get("agenthive_process_spawned").tag("kind", "idle").counter().count()).isEqualTo(2.0);
    assertThat(registry.get("agenthive_process_spawned").tag("kind", "job").counter().count()).isEqualTo(1.0);
    assertThat(registry.get("agenthive_process_jobs_started").tag("worker_type", "room").counter().count())
        .isEqualTo(1.0);
    assertThat(registry.get("agenthive_process_closed").counter().count()).isEqualTo(1.0);
  }

  @Test
  void tagsFailuresByReason() {
    metrics.processFailed(JobProcessFailure.START_TIMEOUT);
    metrics.processFailed(JobProcessFailure.START_TIMEOUT);
    metrics.processFailed(JobProcessFailure.HEARTBEAT_TIMEOUT);

    assertThat(registry.get("agenthive_process_failures").tag("reason", "start_timeout").counter().count())
        .isEqualTo(2.0);
    assertThat(registry.get("agenthive_process_failures").tag("reason", "heartbeat_timeout").counter().count())
        .isEqualTo(1.0);
  }

  @Test
  void gaugesFollowPoolSizeAndAreRemovedOnClose() {
    metrics.updatePoolSize(3, 2);

    assertThat(registry.get("agenthive_process_idle").gauge().value()).isEqualTo(3.0);
    assertThat(registry.get("agenthive_process_running").gauge().value()).isEqualTo(2.0);

    metrics.close();

    assertThat(registry.find("agenthive_process_idle").gauge()).isNull();
    assertThat(registry.find("agenthive_process_running").gauge()).isNull();
  }
}
