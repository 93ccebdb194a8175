package io.hookbox.util;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * {@link JsonCodec} backed by a shared Jackson {@link ObjectMapper}.
 */
public final class JacksonJsonCodec implements JsonCodec {
  static final JacksonJsonCodec INSTANCE = new JacksonJsonCodec(new ObjectMapper());

  private static final TypeReference<LinkedHashMap<String, String>> STRING_MAP = new TypeReference<>() {
  };
  private static final TypeReference<ArrayList<String>> STRING_LIST = new TypeReference<>() {
  };

  private final ObjectMapper mapper;

  public JacksonJsonCodec(ObjectMapper mapper) {
    this.mapper = mapper;
  }

  @Override
  public String toJson(Map<String, String> headers) {
    if (headers == null || headers.isEmpty()) {
      return null;
    }
    return write(headers);
  }

  @Override
  public Map<String, String> parseObject(String json) {
    if (isAbsent(json)) {
      return Collections.emptyMap();
    }
    try {
      return mapper.readValue(json, STRING_MAP);
    } catch (JsonProcessingException e) {
      throw new IllegalArgumentException("Invalid JSON object: " + e.getOriginalMessage(), e);
    }
  }

  @Override
  public String toJsonArray(List<String> values) {
    return write(values == null ? List.of() : values);
  }

  @Override
  public List<String> parseArray(String json) {
    if (isAbsent(json)) {
      return Collections.emptyList();
    }
    try {
      return mapper.readValue(json, STRING_LIST);
    } catch (JsonProcessingException e) {
      throw new IllegalArgumentException("Invalid JSON array: " + e.getOriginalMessage(), e);
    }
  }

  private String write(Object value) {
    try {
      return mapper.writeValueAsString(value);
    } catch (JsonProcessingException e) {
      throw new IllegalArgumentException("Cannot encode JSON", e);
    }
  }

  private static boolean isAbsent(String json) {
    return json == null || json.isBlank() || "null".equals(json.trim());
  }
}
