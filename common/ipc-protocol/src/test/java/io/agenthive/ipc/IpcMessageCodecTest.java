package io.agenthive.ipc;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.agenthive.model.Job;
import io.agenthive.model.JobAcceptArguments;
import io.agenthive.model.JobType;
import io.agenthive.model.ParticipantInfo;
import io.agenthive.model.RunningJobInfo;
import java.util.Map;
import org.junit.jupiter.api.Test;

class IpcMessageCodecTest {

  private final ObjectMapper mapper = new ObjectMapper();
  private final IpcMessageCodec codec = new IpcMessageCodec(mapper);

  @Test
  void encodesPongWithBothTimestamps() throws Exception {
    JsonNode node = mapper.readTree(codec.encode(new IpcMessage.Pong(1_000L, 1_004L)));

    assertThat(node.get("type").asText()).isEqualTo("pong");
    assertThat(node.get("lastTimestamp").asLong()).isEqualTo(1_000L);
    assertThat(node.get("timestamp").asLong()).isEqualTo(1_004L);
  }

  @Test
  void successfulStartResponseOmitsError() throws Exception {
    String frame = codec.encode(IpcMessage.StartJobResponse.success());

    assertThat(mapper.readTree(frame).has("error")).isFalse();
    IpcMessage decoded = codec.decode(frame);
    assertThat(decoded).isInstanceOfSatisfying(IpcMessage.StartJobResponse.class,
        response -> assertThat(response.isSuccess()).isTrue());
  }

  @Test
  void failedStartResponseCarriesError() {
    IpcMessage decoded = codec.decode("{\"type\":\"startJobResponse\",\"error\":\"room not found\"}");

    assertThat(decoded).isInstanceOfSatisfying(IpcMessage.StartJobResponse.class,
        response -> assertThat(response.errorMessage()).contains("room not found"));
  }

  @Test
  void startJobRequestCarriesTheWholeJob() {
    Job job = new Job("job-1", JobType.PUBLISHER, "lobby", new ParticipantInfo("PA_1", "alice", "Alice"), "{\"k\":1}");
    RunningJobInfo info = new RunningJobInfo(job,
        new JobAcceptArguments("agent-1", "Agent", "", Map.of("lang", "en")),
        "wss://example.test",
        "token-1");

    IpcMessage decoded = codec.decode(codec.encode(new IpcMessage.StartJobRequest(info)));

    assertThat(decoded).isEqualTo(new IpcMessage.StartJobRequest(info));
  }

  @Test
  void runningJobEnvironmentDocumentIsReadable() {
    RunningJobInfo info = new RunningJobInfo(Job.room("job-2", "kitchen"),
        JobAcceptArguments.of("agent-2"), "ws://localhost:7880", "jwt");

    assertThat(codec.decodeRunningJob(codec.encodeRunningJob(info))).isEqualTo(info);
  }

  @Test
  void shutdownRequestReasonIsOptional() {
    assertThat(codec.decode("{\"type\":\"shutdownRequest\"}"))
        .isEqualTo(new IpcMessage.ShutdownRequest(null));
    assertThat(codec.decode("{\"type\":\"shutdownRequest\",\"reason\":\"draining\"}"))
        .isEqualTo(new IpcMessage.ShutdownRequest("draining"));
  }

  @Test
  void rejectsUnknownType() {
    assertThatThrownBy(() -> codec.decode("{\"type\":\"reboot\"}"))
        .isInstanceOf(IpcProtocolException.class)
        .hasMessageContaining("reboot");
  }

  @Test
  void rejectsMalformedFrames() {
    assertThatThrownBy(() -> codec.decode("not json"))
        .isInstanceOf(IpcProtocolException.class);
    assertThatThrownBy(() -> codec.decode("[1,2]"))
        .isInstanceOf(IpcProtocolException.class);
    assertThatThrownBy(() -> codec.decode("{\"type\":\"ping\"}"))
        .isInstanceOf(IpcProtocolException.class)
        .hasMessageContaining("timestamp");
  }

  @Test
  void typeDirectionsSeparateTheTwoPeers() {
    assertThat(IpcMessageType.PING.direction()).isEqualTo(IpcMessageType.Direction.TO_PROCESS);
    assertThat(IpcMessageType.USER_EXIT.direction()).isEqualTo(IpcMessageType.Direction.TO_SUPERVISOR);
    assertThat(IpcMessageType.fromWireName("shutdownResponse")).contains(IpcMessageType.SHUTDOWN_RESPONSE);
    assertThat(IpcMessageType.fromWireName(null)).isEmpty();
  }
}
