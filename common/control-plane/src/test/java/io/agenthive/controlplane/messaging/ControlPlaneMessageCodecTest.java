package io.agenthive.controlplane.messaging;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.agenthive.controlplane.WorkerPermissions;
import io.agenthive.controlplane.WorkerStatus;
import io.agenthive.model.Job;
import io.agenthive.model.JobAcceptArguments;
import io.agenthive.model.JobType;
import io.agenthive.model.ParticipantInfo;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Test;

class ControlPlaneMessageCodecTest {

  private final ObjectMapper mapper = new ObjectMapper();
  private final ControlPlaneMessageCodec codec = new ControlPlaneMessageCodec(mapper);

  @Test
  void encodesRegistrationWithPermissions() throws Exception {
    WorkerPermissions permissions = new WorkerPermissions(true, false, true, false, List.of("camera"), true);

    JsonNode node = mapper.readTree(codec.encode(
        new WorkerMessage.RegisterWorkerRequest(JobType.PUBLISHER, "greeter", permissions, "1.2.0")));

    assertThat(node.path("type").asText()).isEqualTo("register");
    assertThat(node.path("workerType").asText()).isEqualTo("PUBLISHER");
    assertThat(node.path("agentName").asText()).isEqualTo("greeter");
    assertThat(node.path("permissions").path("canSubscribe").asBoolean(true)).isFalse();
    assertThat(node.path("permissions").path("canPublishSources").get(0).asText()).isEqualTo("camera");
    assertThat(node.path("version").asText()).isEqualTo("1.2.0");
  }

  @Test
  void encodesAcceptedAndRejectedAvailability() throws Exception {
    JobAcceptArguments arguments = new JobAcceptArguments("bot", "Bot", "{\"v\":1}", Map.of("role", "agent"));

    JsonNode accepted = mapper.readTree(codec.encode(WorkerMessage.AvailabilityResponse.accepted("J1", arguments)));
    JsonNode rejected = mapper.readTree(codec.encode(WorkerMessage.AvailabilityResponse.rejected("J2")));

    assertThat(accepted.path("type").asText()).isEqualTo("availability");
    assertThat(accepted.path("available").asBoolean()).isTrue();
    assertThat(accepted.path("participantIdentity").asText()).isEqualTo("bot");
    assertThat(accepted.path("participantAttributes").path("role").asText()).isEqualTo("agent");
    assertThat(rejected.path("available").asBoolean(true)).isFalse();
    assertThat(rejected.has("participantIdentity")).isFalse();
    assertThat(rejected.has("participantAttributes")).isFalse();
  }

  @Test
  void encodesStatusUpdateWithWireStatus() throws Exception {
    JsonNode node = mapper.readTree(codec.encode(new WorkerMessage.UpdateWorkerStatus(WorkerStatus.FULL, 0.8, 2)));

    assertThat(node.path("type").asText()).isEqualTo("updateWorker");
    assertThat(node.path("status").asText()).isEqualTo("full");
    assertThat(node.path("load").asDouble()).isEqualTo(0.8);
    assertThat(node.path("jobCount").asInt()).isEqualTo(2);
  }

  @Test
  void decodesServerFramesWithNestedJobs() {
    String frame = """
        {"type":"availability","resuming":true,
         "job":{"id":"J1","type":"PUBLISHER","room":"lobby",
                "participant":{"sid":"PA_1","identity":"alice","name":"Alice"},"metadata":"{}"}}
        """;

    ServerMessage message = codec.decodeServerMessage(frame);

    assertThat(message).isInstanceOf(ServerMessage.AvailabilityRequest.class);
    ServerMessage.AvailabilityRequest request = (ServerMessage.AvailabilityRequest) message;
    assertThat(request.resuming()).isTrue();
    assertThat(request.job()).isEqualTo(
        new Job("J1", JobType.PUBLISHER, "lobby", new ParticipantInfo("PA_1", "alice", "Alice"), "{}"));
  }

  @Test
  void assignmentWithoutUrlDecodesToEmptyUrl() {
    ServerMessage message = codec.decodeServerMessage(
        "{\"type\":\"assignment\",\"job\":{\"id\":\"J1\",\"type\":\"ROOM\"},\"token\":\"t\"}");

    assertThat(message).isEqualTo(new ServerMessage.JobAssignment(Job.room("J1", null), "", "t"));
  }

  @Test
  void registerAckWithoutServerInfoUsesUnknown() {
    ServerMessage message = codec.decodeServerMessage("{\"type\":\"register\",\"workerId\":\"W1\"}");

    assertThat(message).isEqualTo(new ServerMessage.RegisterResponse("W1", ServerInfo.unknown()));
  }

  @Test
  void serverEncodingIsReadBack() {
    ServerMessage termination = new ServerMessage.JobTermination("J9");
    WorkerMessage simulate = new WorkerMessage.SimulateJobRequest(JobType.ROOM, "demo", null);

    assertThat(codec.decodeServerMessage(codec.encode(termination))).isEqualTo(termination);
    assertThat(codec.decodeWorkerMessage(codec.encode(simulate))).isEqualTo(simulate);
  }

  @Test
  void rejectsMalformedFrames() {
    assertThatThrownBy(() -> codec.decodeServerMessage("{oops"))
        .isInstanceOf(IllegalArgumentException.class)
        .hasMessageContaining("not valid JSON");
    assertThatThrownBy(() -> codec.decodeServerMessage("[1,2]"))
        .isInstanceOf(IllegalArgumentException.class);
    assertThatThrownBy(() -> codec.decodeServerMessage("{\"type\":\"shutdown\"}"))
        .isInstanceOf(IllegalArgumentException.class)
        .hasMessageContaining("shutdown");
    assertThatThrownBy(() -> codec.decodeServerMessage("{\"type\":\"assignment\",\"job\":{\"id\":\"J1\",\"type\":\"ROOM\"}}"))
        .isInstanceOf(IllegalArgumentException.class)
        .hasMessageContaining("token");
    assertThatThrownBy(() -> codec.decodeServerMessage("{\"type\":\"termination\"}"))
        .isInstanceOf(IllegalArgumentException.class);
  }
}
