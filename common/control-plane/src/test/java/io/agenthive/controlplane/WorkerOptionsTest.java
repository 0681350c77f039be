package io.agenthive.controlplane;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import io.agenthive.model.JobType;
import java.time.Duration;
import org.junit.jupiter.api.Test;

class WorkerOptionsTest {

  @Test
  void appliesDefaults() {
    WorkerOptions options = WorkerOptions.builder()
        .url("https://hive.example.com")
        .apiKey("key")
        .apiSecret("secret")
        .build();

    assertThat(options.workerType()).isEqualTo(JobType.ROOM);
    assertThat(options.agentName()).isEmpty();
    assertThat(options.permissions()).isEqualTo(WorkerPermissions.defaults());
    assertThat(options.loadThreshold()).isEqualTo(0.65);
    assertThat(options.loadInterval()).isEqualTo(Duration.ofMillis(2_500));
    assertThat(options.assignmentTimeout()).isEqualTo(Duration.ofMillis(7_500));
    assertThat(options.maxRetry()).isEqualTo(10);
    assertThat(options.drainTimeout()).isEqualTo(Duration.ofMinutes(30));
    assertThat(options.shutdownTimeout()).isEqualTo(Duration.ofSeconds(60));
  }

  @Test
  void missingCredentialsNameTheirEnvironmentVariable() {
    assertThatThrownBy(() -> WorkerOptions.builder().apiKey("key").apiSecret("secret").build())
        .isInstanceOf(IllegalArgumentException.class)
        .hasMessageContaining("AGENTHIVE_URL");
    assertThatThrownBy(() -> WorkerOptions.builder().url("https://h").apiSecret("secret").build())
        .isInstanceOf(IllegalArgumentException.class)
        .hasMessageContaining("AGENTHIVE_API_KEY");
    assertThatThrownBy(() -> WorkerOptions.builder().url("https://h").apiKey("key").apiSecret(" ").build())
        .isInstanceOf(IllegalArgumentException.class)
        .hasMessageContaining("AGENTHIVE_API_SECRET");
  }

  @Test
  void rejectsOutOfRangeSettings() {
    WorkerOptions.Builder builder = WorkerOptions.builder();

    assertThatThrownBy(() -> builder.loadThreshold(0)).isInstanceOf(IllegalArgumentException.class);
    assertThatThrownBy(() -> builder.loadThreshold(1.5)).isInstanceOf(IllegalArgumentException.class);
    assertThatThrownBy(() -> builder.maxRetry(-1)).isInstanceOf(IllegalArgumentException.class);
    assertThatThrownBy(() -> builder.loadInterval(Duration.ZERO)).isInstanceOf(IllegalArgumentException.class);
  }

  @Test
  void reconnectDelayGrowsByTwoSecondsUpToTen() {
    assertThat(WorkerOptions.reconnectDelay(1)).isEqualTo(Duration.ofSeconds(2));
    assertThat(WorkerOptions.reconnectDelay(3)).isEqualTo(Duration.ofSeconds(6));
    assertThat(WorkerOptions.reconnectDelay(5)).isEqualTo(Duration.ofSeconds(10));
    assertThat(WorkerOptions.reconnectDelay(9)).isEqualTo(Duration.ofSeconds(10));
  }

  @Test
  void statusFollowsTheLoadThreshold() {
    assertThat(WorkerStatus.forLoad(0.64, 0.65)).isEqualTo(WorkerStatus.AVAILABLE);
    assertThat(WorkerStatus.forLoad(0.65, 0.65)).isEqualTo(WorkerStatus.FULL);
    assertThat(WorkerStatus.fromWireName("full")).contains(WorkerStatus.FULL);
    assertThat(WorkerStatus.fromWireName("busy")).isEmpty();
  }
}
