package com.task4ge.api.audit;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.util.Map;

@Component
@RequiredArgsConstructor
public class SnapshotJson {

  private static final TypeReference<Map<String, Object>> MAP_TYPE = new TypeReference<>() {
  };

  private final ObjectMapper objectMapper;

  public Map<String, Object> toSnapshot(Object value) {
    if (value == null) {
      return null;
    }
    return objectMapper.convertValue(value, MAP_TYPE);
  }

  public String toJson(Map<String, Object> snapshot) {
    if (snapshot == null) {
      return null;
    }
    try {
      return objectMapper.writeValueAsString(snapshot);
    } catch (JsonProcessingException e) {
      throw new IllegalStateException("Failed to serialize snapshot", e);
    }
  }
}
