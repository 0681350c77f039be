package io.agenthive.controlplane.messaging;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.agenthive.controlplane.WorkerPermissions;
import io.agenthive.controlplane.WorkerStatus;
import io.agenthive.model.Job;
import io.agenthive.model.JobType;
import java.util.Map;
import java.util.Objects;

/**
 * JSON text-frame codec for the worker/server protocol. Every frame is an object tagged with
 * {@code type}; jobs are embedded as nested objects.
 * <p>
 * Both directions are supported so that in-process servers (tests, local tooling) can reuse it.
 */
public final class ControlPlaneMessageCodec {

  private static final TypeReference<Map<String, String>> ATTRIBUTES_TYPE = new TypeReference<>() { };

  private final ObjectMapper mapper;

  public ControlPlaneMessageCodec() {
    this(new ObjectMapper());
  }

  public ControlPlaneMessageCodec(ObjectMapper mapper) {
    this.mapper = Objects.requireNonNull(mapper, "mapper");
  }

  public String encode(WorkerMessage message) {
    Objects.requireNonNull(message, "message");
    ObjectNode node = mapper.createObjectNode();
    node.put("type", message.type().wireName());
    switch (message.type()) {
      case REGISTER -> {
        WorkerMessage.RegisterWorkerRequest register = (WorkerMessage.RegisterWorkerRequest) message;
        node.put("workerType", register.workerType().name());
        node.put("agentName", register.agentName());
        node.set("permissions", mapper.valueToTree(register.permissions()));
        node.put("version", register.version());
      }
      case AVAILABILITY -> {
        WorkerMessage.AvailabilityResponse response = (WorkerMessage.AvailabilityResponse) message;
        node.put("jobId", response.jobId());
        node.put("available", response.available());
        putIfNotNull(node, "participantIdentity", response.participantIdentity());
        putIfNotNull(node, "participantName", response.participantName());
        putIfNotNull(node, "participantMetadata", response.participantMetadata());
        if (!response.participantAttributes().isEmpty()) {
          node.set("participantAttributes", mapper.valueToTree(response.participantAttributes()));
        }
      }
      case UPDATE_WORKER -> {
        WorkerMessage.UpdateWorkerStatus update = (WorkerMessage.UpdateWorkerStatus) message;
        node.put("status", update.status().wireName());
        node.put("load", update.load());
        node.put("jobCount", update.jobCount());
      }
      case SIMULATE_JOB -> {
        WorkerMessage.SimulateJobRequest simulate = (WorkerMessage.SimulateJobRequest) message;
        node.put("jobType", simulate.jobType().name());
        node.put("room", simulate.room());
        putIfNotNull(node, "participantIdentity", simulate.participantIdentity());
      }
      default -> throw new IllegalStateException("Unhandled message type " + message.type());
    }
    return write(node);
  }

  public String encode(ServerMessage message) {
    Objects.requireNonNull(message, "message");
    ObjectNode node = mapper.createObjectNode();
    node.put("type", message.type().wireName());
    switch (message.type()) {
      case REGISTER -> {
        ServerMessage.RegisterResponse register = (ServerMessage.RegisterResponse) message;
        node.put("workerId", register.workerId());
        node.set("serverInfo", mapper.valueToTree(register.serverInfo()));
      }
      case AVAILABILITY -> {
        ServerMessage.AvailabilityRequest request = (ServerMessage.AvailabilityRequest) message;
        node.set("job", mapper.valueToTree(request.job()));
        node.put("resuming", request.resuming());
      }
      case ASSIGNMENT -> {
        ServerMessage.JobAssignment assignment = (ServerMessage.JobAssignment) message;
        node.set("job", mapper.valueToTree(assignment.job()));
        node.put("url", assignment.url());
        node.put("token", assignment.token());
      }
      case TERMINATION -> node.put("jobId", ((ServerMessage.JobTermination) message).jobId());
      default -> throw new IllegalStateException("Unhandled message type " + message.type());
    }
    return write(node);
  }

  /**
   * @throws IllegalArgumentException if the frame is not a well-formed server message
   */
  public ServerMessage decodeServerMessage(String frame) {
    ObjectNode node = readObject(frame);
    String wireName = textOrNull(node.get("type"));
    ServerMessageType type = ServerMessageType.fromWireName(wireName)
        .orElseThrow(() -> new IllegalArgumentException("Unknown server message type '" + wireName + "'"));
    return switch (type) {
      case REGISTER -> new ServerMessage.RegisterResponse(
          requireText(node, "workerId"),
          node.hasNonNull("serverInfo") ? convert(node.get("serverInfo"), ServerInfo.class) : null);
      case AVAILABILITY -> new ServerMessage.AvailabilityRequest(
          convert(requireObject(node, "job"), Job.class),
          node.path("resuming").asBoolean(false));
      case ASSIGNMENT -> new ServerMessage.JobAssignment(
          convert(requireObject(node, "job"), Job.class),
          textOrNull(node.get("url")),
          requireText(node, "token"));
      case TERMINATION -> new ServerMessage.JobTermination(requireText(node, "jobId"));
    };
  }

  /**
   * @throws IllegalArgumentException if the frame is not a well-formed worker message
   */
  public WorkerMessage decodeWorkerMessage(String frame) {
    ObjectNode node = readObject(frame);
    String wireName = textOrNull(node.get("type"));
    WorkerMessageType type = WorkerMessageType.fromWireName(wireName)
        .orElseThrow(() -> new IllegalArgumentException("Unknown worker message type '" + wireName + "'"));
    return switch (type) {
      case REGISTER -> new WorkerMessage.RegisterWorkerRequest(
          JobType.valueOf(requireText(node, "workerType")),
          textOrNull(node.get("agentName")),
          node.hasNonNull("permissions") ? convert(node.get("permissions"), WorkerPermissions.class) : null,
          textOrNull(node.get("version")));
      case AVAILABILITY -> new WorkerMessage.AvailabilityResponse(
          requireText(node, "jobId"),
          node.path("available").asBoolean(false),
          textOrNull(node.get("participantIdentity")),
          textOrNull(node.get("participantName")),
          textOrNull(node.get("participantMetadata")),
          node.hasNonNull("participantAttributes")
              ? mapper.convertValue(node.get("participantAttributes"), ATTRIBUTES_TYPE)
              : Map.of());
      case UPDATE_WORKER -> new WorkerMessage.UpdateWorkerStatus(
          WorkerStatus.fromWireName(requireText(node, "status"))
              .orElseThrow(() -> new IllegalArgumentException("Unknown worker status " + node.get("status"))),
          node.path("load").asDouble(0.0),
          node.path("jobCount").asInt(0));
      case SIMULATE_JOB -> new WorkerMessage.SimulateJobRequest(
          JobType.valueOf(requireText(node, "jobType")),
          requireText(node, "room"),
          textOrNull(node.get("participantIdentity")));
    };
  }

  private ObjectNode readObject(String frame) {
    Objects.requireNonNull(frame, "frame");
    JsonNode node;
    try {
      node = mapper.readTree(frame);
    } catch (JsonProcessingException ex) {
      throw new IllegalArgumentException("frame is not valid JSON", ex);
    }
    if (node == null || !node.isObject()) {
      throw new IllegalArgumentException("frame must be a JSON object");
    }
    return (ObjectNode) node;
  }

  private <T> T convert(JsonNode node, Class<T> type) {
    try {
      return mapper.treeToValue(node, type);
    } catch (JsonProcessingException ex) {
      throw new IllegalArgumentException("invalid " + type.getSimpleName() + " document", ex);
    }
  }

  private String write(JsonNode node) {
    try {
      return mapper.writeValueAsString(node);
    } catch (JsonProcessingException ex) {
      throw new IllegalStateException("Unable to serialise control-plane frame", ex);
    }
  }

  private static JsonNode requireObject(ObjectNode node, String field) {
    JsonNode value = node.get(field);
    if (value == null || !value.isObject()) {
      throw new IllegalArgumentException(field + " must be a JSON object");
    }
    return value;
  }

  private static String requireText(ObjectNode node, String field) {
    String value = textOrNull(node.get(field));
    if (value == null) {
      throw new IllegalArgumentException(field + " must not be null or blank");
    }
    return value;
  }

  private static void putIfNotNull(ObjectNode node, String field, String value) {
    if (value != null) {
      node.put(field, value);
    }
  }

  private static String textOrNull(JsonNode node) {
    if (node == null || node.isNull()) {
      return null;
    }
    String text = node.asText();
    return text != null && text.isBlank() ? null : text;
  }
}
