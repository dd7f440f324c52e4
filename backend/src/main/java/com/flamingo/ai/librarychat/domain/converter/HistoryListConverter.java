package com.flamingo.ai.librarychat.domain.converter;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.flamingo.ai.librarychat.domain.entity.Answer.HistoryEntry;
import jakarta.persistence.AttributeConverter;
import jakarta.persistence.Converter;
import java.util.Collections;
import java.util.List;
import lombok.extern.slf4j.Slf4j;

/** JPA converter for persisting conversation history as a JSON array in a TEXT column. */
@Converter
@Slf4j
public class HistoryListConverter implements AttributeConverter<List<HistoryEntry>, String> {

  private static final ObjectMapper MAPPER = new ObjectMapper();
  private static final TypeReference<List<HistoryEntry>> LIST_TYPE = new TypeReference<>() {};

  @Override
  public String convertToDatabaseColumn(List<HistoryEntry> attribute) {
    try {
      return MAPPER.writeValueAsString(attribute == null ? List.of() : attribute);
    } catch (JsonProcessingException e) {
      throw new IllegalArgumentException("Failed to serialize history", e);
    }
  }

  @Override
  public List<HistoryEntry> convertToEntityAttribute(String dbData) {
    if (dbData == null || dbData.isBlank()) {
      return Collections.emptyList();
    }
    try {
      return MAPPER.readValue(dbData, LIST_TYPE);
    } catch (JsonProcessingException e) {
      log.error("Failed to deserialize history: {}", e.getMessage());
      return Collections.emptyList();
    }
  }
}
