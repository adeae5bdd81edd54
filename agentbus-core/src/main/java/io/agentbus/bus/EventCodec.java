package io.agentbus.bus;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;

import java.io.IOException;
import java.time.Instant;
import java.time.format.DateTimeParseException;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * JSON wire format for events crossing the transport.
 *
 * <pre>{@code
 * {"id":"01J...","type":"document.uploaded","payload":{...},
 *  "timestamp":"2026-01-01T00:00:00Z","source":"ingest","correlationId":"01J...",
 *  "metadata":{"schemaVersion":"1.0","retryCount":0,"priority":"normal","ttl":0,
 *              "attributes":{}}}
 * }</pre>
 */
public final class EventCodec {
  private static final TypeReference<LinkedHashMap<String, Object>> PAYLOAD_TYPE = new TypeReference<>() {
  };

  private final ObjectMapper mapper;

  public EventCodec() {
    this(new ObjectMapper());
  }

  public EventCodec(ObjectMapper mapper) {
    this.mapper = mapper;
  }

  /**
   * Serializes an event.
   *
   * @throws CodecException if the payload holds values the mapper cannot serialize
   */
  public byte[] encode(Event event) {
    ObjectNode root = mapper.createObjectNode();
    root.put("id", event.id());
    root.put("type", event.type());
    try {
      root.set("payload", mapper.valueToTree(event.payload()));
    } catch (IllegalArgumentException e) {
      throw new CodecException("Payload of event " + event.id() + " is not serializable: "
          + e.getMessage(), e);
    }
    root.put("timestamp", event.timestamp().toString());
    root.put("source", event.source());
    root.put("correlationId", event.correlationId());

    EventMetadata metadata = event.metadata();
    ObjectNode meta = root.putObject("metadata");
    meta.put("schemaVersion", metadata.schemaVersion());
    meta.put("retryCount", metadata.retryCount());
    meta.put("priority", metadata.priority().wireName());
    meta.put("ttl", metadata.ttlMs());
    ObjectNode attributes = meta.putObject("attributes");
    metadata.attributes().forEach(attributes::put);
    try {
      return mapper.writeValueAsBytes(root);
    } catch (JsonProcessingException e) {
      throw new CodecException("Failed to encode event " + event.id(), e);
    }
  }

  public Event decode(byte[] message) {
    JsonNode root;
    try {
      root = mapper.readTree(message);
    } catch (IOException e) {
      throw new CodecException("Malformed event message", e);
    }
    if (root == null || !root.isObject()) {
      throw new CodecException("Event message is not a JSON object", null);
    }
    try {
      Event.Builder builder = Event.builder(requiredText(root, "type"))
          .id(requiredText(root, "id"))
          .source(textOrNull(root, "source"))
          .correlationId(textOrNull(root, "correlationId"));
      String timestamp = textOrNull(root, "timestamp");
      if (timestamp != null) {
        builder.timestamp(Instant.parse(timestamp));
      }
      JsonNode payload = root.get("payload");
      if (payload != null && payload.isObject()) {
        builder.payload(mapper.convertValue(payload, PAYLOAD_TYPE));
      }
      JsonNode meta = root.get("metadata");
      if (meta != null && meta.isObject()) {
        builder.metadata(decodeMetadata(meta));
      }
      return builder.build();
    } catch (DateTimeParseException | IllegalArgumentException e) {
      throw new CodecException("Invalid event message: " + e.getMessage(), e);
    }
  }

  private static EventMetadata decodeMetadata(JsonNode meta) {
    Map<String, String> attributes = new LinkedHashMap<>();
    JsonNode attrs = meta.get("attributes");
    if (attrs != null && attrs.isObject()) {
      Iterator<Map.Entry<String, JsonNode>> fields = attrs.fields();
      while (fields.hasNext()) {
        Map.Entry<String, JsonNode> field = fields.next();
        if (!field.getValue().isNull()) {
          attributes.put(field.getKey(), field.getValue().asText());
        }
      }
    }
    return new EventMetadata(
        textOrNull(meta, "schemaVersion"),
        meta.path("retryCount").asInt(0),
        Priority.fromString(textOrNull(meta, "priority")),
        meta.path("ttl").asLong(0L),
        attributes);
  }

  private static String requiredText(JsonNode node, String field) {
    String value = textOrNull(node, field);
    if (value == null || value.isBlank()) {
      throw new IllegalArgumentException("missing '" + field + "'");
    }
    return value;
  }

  private static String textOrNull(JsonNode node, String field) {
    JsonNode value = node.get(field);
    return value == null || value.isNull() ? null : value.asText();
  }

  /**
   * Raised when an event cannot be encoded or a message cannot be decoded.
   */
  public static final class CodecException extends RuntimeException {
    public CodecException(String message, Throwable cause) {
      super(message, cause);
    }
  }
}
