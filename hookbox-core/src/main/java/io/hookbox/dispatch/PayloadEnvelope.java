package io.hookbox.dispatch;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;

import java.time.Instant;
import java.time.format.DateTimeFormatter;
import java.time.temporal.ChronoUnit;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * Renders the canonical webhook body:
 * {@code {"event":..., "timestamp":..., "data":{"entityId":..., ...}}}.
 *
 * <p>Top-level keys are always in that order. Extra payload fields follow
 * {@code entityId} sorted by key, nested objects are sorted too, and a payload
 * field named {@code entityId} is ignored. The timestamp is ISO-8601 UTC with
 * millisecond precision.
 */
final class PayloadEnvelope {
  static final String ENTITY_ID = "entityId";

  private final ObjectMapper mapper;

  PayloadEnvelope(ObjectMapper mapper) {
    this.mapper = mapper;
  }

  String render(String eventName, Instant timestamp, String entityId, Map<String, Object> payload) {
    ObjectNode root = mapper.createObjectNode();
    root.put("event", eventName);
    root.put("timestamp", DateTimeFormatter.ISO_INSTANT.format(timestamp.truncatedTo(ChronoUnit.MILLIS)));
    ObjectNode data = root.putObject("data");
    data.put(ENTITY_ID, entityId);
    if (payload != null) {
      for (Map.Entry<String, Object> field : new TreeMap<>(payload).entrySet()) {
        if (!ENTITY_ID.equals(field.getKey())) {
          data.set(field.getKey(), sorted(mapper.valueToTree(field.getValue())));
        }
      }
    }
    try {
      return mapper.writeValueAsString(root);
    } catch (JsonProcessingException e) {
      throw new IllegalArgumentException("Cannot render payload for " + eventName, e);
    }
  }

  private JsonNode sorted(JsonNode node) {
    if (node == null) {
      return mapper.nullNode();
    }
    if (node.isObject()) {
      List<String> names = new ArrayList<>();
      Iterator<String> it = node.fieldNames();
      it.forEachRemaining(names::add);
      Collections.sort(names);
      ObjectNode copy = mapper.createObjectNode();
      for (String name : names) {
        copy.set(name, sorted(node.get(name)));
      }
      return copy;
    }
    if (node.isArray()) {
      ArrayNode copy = mapper.createArrayNode();
      node.forEach(element -> copy.add(sorted(element)));
      return copy;
    }
    return node;
  }
}
