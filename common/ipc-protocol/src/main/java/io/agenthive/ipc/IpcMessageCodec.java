package io.agenthive.ipc;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.agenthive.model.RunningJobInfo;
import java.util.Objects;

/**
 * Serialises {@link IpcMessage} instances to single-line JSON objects tagged with a {@code type} field.
 */
public final class IpcMessageCodec {

  static final String TYPE_FIELD = "type";

  private final ObjectMapper mapper;

  public IpcMessageCodec() {
    this(new ObjectMapper());
  }

  public IpcMessageCodec(ObjectMapper mapper) {
    this.mapper = Objects.requireNonNull(mapper, "mapper");
  }

  public String encode(IpcMessage message) {
    return write(encodeToJson(message));
  }

  public ObjectNode encodeToJson(IpcMessage message) {
    Objects.requireNonNull(message, "message");
    ObjectNode node = mapper.createObjectNode();
    node.put(TYPE_FIELD, message.type().wireName());
    switch (message.type()) {
      case START_JOB_REQUEST -> node.set("runningJob",
          mapper.valueToTree(((IpcMessage.StartJobRequest) message).runningJob()));
      case START_JOB_RESPONSE -> putIfNotNull(node, "error", ((IpcMessage.StartJobResponse) message).error());
      case PING -> node.put("timestamp", ((IpcMessage.Ping) message).timestamp());
      case PONG -> {
        IpcMessage.Pong pong = (IpcMessage.Pong) message;
        node.put("lastTimestamp", pong.lastTimestamp());
        node.put("timestamp", pong.timestamp());
      }
      case SHUTDOWN_REQUEST -> putIfNotNull(node, "reason", ((IpcMessage.ShutdownRequest) message).reason());
      case SHUTDOWN_RESPONSE -> {
        // no payload
      }
      case USER_EXIT -> putIfNotNull(node, "reason", ((IpcMessage.UserExit) message).reason());
      default -> throw new IllegalStateException("Unhandled message type " + message.type());
    }
    return node;
  }

  public IpcMessage decode(String line) {
    Objects.requireNonNull(line, "line");
    JsonNode node;
    try {
      node = mapper.readTree(line);
    } catch (JsonProcessingException ex) {
      throw new IpcProtocolException("Malformed IPC frame: " + abbreviate(line), ex);
    }
    return decode(node);
  }

  public IpcMessage decode(JsonNode node) {
    if (node == null || !node.isObject()) {
      throw new IpcProtocolException("IPC frame must be a JSON object");
    }
    String wireName = textOrNull(node.get(TYPE_FIELD));
    IpcMessageType type = IpcMessageType.fromWireName(wireName)
        .orElseThrow(() -> new IpcProtocolException("Unknown IPC message type '" + wireName + "'"));
    try {
      return switch (type) {
        case START_JOB_REQUEST -> new IpcMessage.StartJobRequest(decodeRunningJob(requireObject(node, "runningJob")));
        case START_JOB_RESPONSE -> new IpcMessage.StartJobResponse(textOrNull(node.get("error")));
        case PING -> new IpcMessage.Ping(requireLong(node, "timestamp"));
        case PONG -> new IpcMessage.Pong(requireLong(node, "lastTimestamp"), requireLong(node, "timestamp"));
        case SHUTDOWN_REQUEST -> new IpcMessage.ShutdownRequest(textOrNull(node.get("reason")));
        case SHUTDOWN_RESPONSE -> new IpcMessage.ShutdownResponse();
        case USER_EXIT -> new IpcMessage.UserExit(textOrNull(node.get("reason")));
      };
    } catch (IllegalArgumentException ex) {
      throw new IpcProtocolException("Invalid " + type.wireName() + " frame: " + ex.getMessage(), ex);
    }
  }

  /**
   * Encodes a job for the environment of a cold-spawned process.
   */
  public String encodeRunningJob(RunningJobInfo info) {
    Objects.requireNonNull(info, "info");
    return write(mapper.valueToTree(info));
  }

  public RunningJobInfo decodeRunningJob(String json) {
    Objects.requireNonNull(json, "json");
    try {
      return decodeRunningJob(mapper.readTree(json));
    } catch (JsonProcessingException ex) {
      throw new IpcProtocolException("Malformed running job document", ex);
    }
  }

  private RunningJobInfo decodeRunningJob(JsonNode node) {
    try {
      return mapper.treeToValue(node, RunningJobInfo.class);
    } catch (JsonProcessingException ex) {
      throw new IllegalArgumentException("runningJob is not a valid job document", ex);
    }
  }

  private String write(JsonNode node) {
    try {
      return mapper.writeValueAsString(node);
    } catch (JsonProcessingException ex) {
      throw new IllegalStateException("Unable to serialise IPC frame", ex);
    }
  }

  private static JsonNode requireObject(JsonNode node, String field) {
    JsonNode value = node.get(field);
    if (value == null || !value.isObject()) {
      throw new IllegalArgumentException(field + " must be a JSON object");
    }
    return value;
  }

  private static long requireLong(JsonNode node, String field) {
    JsonNode value = node.get(field);
    if (value == null || !value.canConvertToLong()) {
      throw new IllegalArgumentException(field + " must be an integral number");
    }
    return value.asLong();
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

  private static String abbreviate(String line) {
    return line.length() <= 200 ? line : line.substring(0, 200) + "...";
  }
}
