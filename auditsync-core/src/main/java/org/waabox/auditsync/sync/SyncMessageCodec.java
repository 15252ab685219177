package org.waabox.auditsync.sync;

import java.time.Instant;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.UUID;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;

import org.waabox.auditsync.NodeId;
import org.waabox.auditsync.VectorClock;
import org.waabox.auditsync.audit.AuditRecord;
import org.waabox.auditsync.audit.EventType;

/**
 * Static utility class for serializing and deserializing
 * {@link SyncMessage} instances to and from JSON strings.
 *
 * <p>Uses Jackson's tree model ({@link JsonNode}) so the wire format stays
 * explicit and independent from the Java types. Every message carries a
 * {@code type} discriminator holding the {@link MessageType} name.
 * {@link Instant} values are written as ISO-8601 strings and vector clocks
 * as objects mapping node ids to counters.
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
public final class SyncMessageCodec {

  /** Shared ObjectMapper for tree model operations. */
  private static final ObjectMapper MAPPER = new ObjectMapper();

  /** Private constructor to prevent instantiation. */
  private SyncMessageCodec() {
    throw new UnsupportedOperationException("Utility class");
  }

  /**
   * Serializes a {@link SyncMessage} into a JSON string.
   *
   * @param message the message to serialize, never null.
   * @return the JSON representation of the message, never null.
   */
  public static String serialize(final SyncMessage message) {
    Objects.requireNonNull(message, "message cannot be null");

    final ObjectNode node = MAPPER.createObjectNode();
    node.put("type", message.type().name());
    node.put("fromNode", message.fromNode().value());
    node.set("vectorClock", writeClock(message.vectorClock()));

    switch (message.type()) {
      case REQUEST -> {
        final SyncRequest request = (SyncRequest) message;
        node.put("since", request.since().toString());
        request.afterIdValue().ifPresent(
            id -> node.put("afterId", id.toString()));
      }
      case RESPONSE -> {
        final SyncResponse response = (SyncResponse) message;
        final ArrayNode records = node.putArray("records");
        for (final DistributedRecord record : response.records()) {
          records.add(writeDistributedRecord(record));
        }
        node.put("hasMore", response.hasMore());
      }
      case ACK -> {
        final SyncAck ack = (SyncAck) message;
        final ArrayNode ids = node.putArray("recordIds");
        for (final UUID id : ack.recordIds()) {
          ids.add(id.toString());
        }
      }
      case HEARTBEAT -> {
        final Heartbeat heartbeat = (Heartbeat) message;
        node.put("recordCount", heartbeat.recordCount());
        node.put("lastHash", heartbeat.lastHash());
      }
      default -> throw new IllegalArgumentException(
          "Unsupported message type: " + message.type());
    }

    return node.toString();
  }

  /**
   * Deserializes a JSON string into a {@link SyncMessage}.
   *
   * @param json the JSON string to parse, never null.
   * @return the parsed message, never null.
   * @throws IllegalArgumentException if the JSON is malformed, has an
   *     unknown type or is missing required fields.
   */
  public static SyncMessage deserialize(final String json) {
    Objects.requireNonNull(json, "json cannot be null");

    try {
      final JsonNode node = MAPPER.readTree(json);
      if (node == null || !node.isObject()) {
        throw new IllegalArgumentException(
            "Expected a JSON object but got: " + json);
      }

      final MessageType type = MessageType.valueOf(
          requireField(node, "type").asText());
      final NodeId fromNode = NodeId.of(
          requireField(node, "fromNode").asText());
      final VectorClock clock = readClock(requireField(node, "vectorClock"));

      return switch (type) {
        case REQUEST -> new SyncRequest(fromNode,
            Instant.parse(requireField(node, "since").asText()), clock,
            readOptionalId(node, "afterId"));
        case RESPONSE -> new SyncResponse(fromNode,
            readDistributedRecords(requireField(node, "records")), clock,
            requireBoolean(node, "hasMore"));
        case ACK -> new SyncAck(fromNode,
            readIds(requireField(node, "recordIds")), clock);
        case HEARTBEAT -> new Heartbeat(fromNode, clock,
            requireLong(node, "recordCount"),
            optionalText(node, "lastHash"));
      };
    } catch (final IllegalArgumentException e) {
      throw e;
    } catch (final Exception e) {
      throw new IllegalArgumentException(
          "Failed to deserialize SyncMessage from JSON: " + json, e);
    }
  }

  /** Writes a vector clock as an object of node id to counter.
   *
   * @param clock the clock to write, never null.
   * @return the JSON object, never null.
   */
  private static ObjectNode writeClock(final VectorClock clock) {
    final ObjectNode node = MAPPER.createObjectNode();
    clock.entries().forEach((id, counter) -> node.put(id.value(), counter));
    return node;
  }

  /** Reads a vector clock from an object of node id to counter.
   *
   * @param node the JSON object, never null.
   * @return the clock, never null.
   */
  private static VectorClock readClock(final JsonNode node) {
    if (!node.isObject()) {
      throw new IllegalArgumentException(
          "vectorClock must be a JSON object: " + node);
    }
    final Map<NodeId, Long> counters = new HashMap<>();
    final Iterator<Map.Entry<String, JsonNode>> fields = node.fields();
    while (fields.hasNext()) {
      final Map.Entry<String, JsonNode> field = fields.next();
      if (!field.getValue().canConvertToLong()) {
        throw new IllegalArgumentException("Counter for " + field.getKey()
            + " is not a number: " + field.getValue());
      }
      counters.put(NodeId.of(field.getKey()), field.getValue().asLong());
    }
    return VectorClock.of(counters);
  }

  /** Writes a distributed record.
   *
   * @param record the record to write, never null.
   * @return the JSON object, never null.
   */
  private static ObjectNode writeDistributedRecord(
      final DistributedRecord record) {
    final ObjectNode node = MAPPER.createObjectNode();
    node.put("originNode", record.originNode().value());
    node.set("vectorClock", writeClock(record.vectorClock()));

    final AuditRecord audit = record.record();
    final ObjectNode auditNode = node.putObject("record");
    auditNode.put("id", audit.id().toString());
    auditNode.put("timestamp", audit.timestamp().toString());
    auditNode.put("eventType", audit.eventType().name());
    auditNode.put("actor", audit.actor());
    auditNode.put("statuteId", audit.statuteId());
    auditNode.put("subjectId", audit.subjectId().toString());
    auditNode.put("previousHash", audit.previousHash());
    auditNode.put("recordHash", audit.recordHash());
    return node;
  }

  /** Reads the records array of a response.
   *
   * @param node the JSON array, never null.
   * @return the records, never null.
   */
  private static List<DistributedRecord> readDistributedRecords(
      final JsonNode node) {
    if (!node.isArray()) {
      throw new IllegalArgumentException("records must be a JSON array");
    }
    final List<DistributedRecord> records = new ArrayList<>(node.size());
    for (final JsonNode item : node) {
      final JsonNode audit = requireField(item, "record");
      final AuditRecord record = new AuditRecord(
          UUID.fromString(requireField(audit, "id").asText()),
          Instant.parse(requireField(audit, "timestamp").asText()),
          EventType.valueOf(requireField(audit, "eventType").asText()),
          requireField(audit, "actor").asText(),
          requireField(audit, "statuteId").asText(),
          UUID.fromString(requireField(audit, "subjectId").asText()),
          optionalText(audit, "previousHash"),
          requireField(audit, "recordHash").asText());
      records.add(new DistributedRecord(record,
          NodeId.of(requireField(item, "originNode").asText()),
          readClock(requireField(item, "vectorClock"))));
    }
    return records;
  }

  /** Reads an array of record ids.
   *
   * @param node the JSON array, never null.
   * @return the ids, never null.
   */
  private static List<UUID> readIds(final JsonNode node) {
    if (!node.isArray()) {
      throw new IllegalArgumentException("recordIds must be a JSON array");
    }
    final List<UUID> ids = new ArrayList<>(node.size());
    for (final JsonNode item : node) {
      ids.add(UUID.fromString(item.asText()));
    }
    return ids;
  }

  /** Reads a record id that may be absent or null.
   *
   * @param node the parent JSON node.
   * @param field the field name to look up.
   * @return the id, or null.
   */
  private static UUID readOptionalId(final JsonNode node,
      final String field) {
    final String text = optionalText(node, field);
    return text == null ? null : UUID.fromString(text);
  }

  /** Returns the value of a required boolean field.
   *
   * @param node the parent JSON node.
   * @param field the field name to look up.
   * @return the boolean value.
   * @throws IllegalArgumentException if the field is missing or is not a
   *     JSON boolean.
   */
  private static boolean requireBoolean(final JsonNode node,
      final String field) {
    final JsonNode value = requireField(node, field);
    if (!value.isBoolean()) {
      throw new IllegalArgumentException(
          field + " must be a boolean: " + value);
    }
    return value.booleanValue();
  }

  /** Returns the value of a required integral field.
   *
   * @param node the parent JSON node.
   * @param field the field name to look up.
   * @return the long value.
   * @throws IllegalArgumentException if the field is missing or is not an
   *     integral JSON number.
   */
  private static long requireLong(final JsonNode node, final String field) {
    final JsonNode value = requireField(node, field);
    if (!value.isIntegralNumber() || !value.canConvertToLong()) {
      throw new IllegalArgumentException(
          field + " must be an integer: " + value);
    }
    return value.longValue();
  }

  /** Returns the text of a field that may be absent or null.
   *
   * @param node the parent JSON node.
   * @param field the field name to look up.
   * @return the text, or null.
   */
  private static String optionalText(final JsonNode node,
      final String field) {
    final JsonNode value = node.get(field);
    if (value == null || value.isNull()) {
      return null;
    }
    return value.asText();
  }

  /** Returns the field node for the given key or throws if missing.
   *
   * @param node the parent JSON node.
   * @param field the field name to look up.
   * @return the field node, never null.
   * @throws IllegalArgumentException if the field is missing.
   */
  private static JsonNode requireField(final JsonNode node,
      final String field) {
    final JsonNode value = node.get(field);
    if (value == null || value.isNull()) {
      throw new IllegalArgumentException(
          "Missing field: " + field + " in JSON: " + node
      );
    }
    return value;
  }
}
