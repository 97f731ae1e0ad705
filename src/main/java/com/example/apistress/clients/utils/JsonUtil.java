package com.example.apistress.clients.utils;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.json.JsonMapper;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;

public class JsonUtil {

  private static final ObjectMapper MAPPER;

  static {
    MAPPER =
        JsonMapper.builder()
            .disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES)
            .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS)
            .disable(SerializationFeature.INDENT_OUTPUT)
            .addModule(new JavaTimeModule())
            .build();
  }

  private JsonUtil() {
    // Prevent instantiation
  }

  /** Parses a JSON document into a tree. Fails on trailing content after the first value. */
  public static JsonNode readTree(String json) throws JsonProcessingException {
    return MAPPER.reader().with(DeserializationFeature.FAIL_ON_TRAILING_TOKENS).readTree(json);
  }

  /** Serializes an object to compact single-line JSON. */
  public static String toJsonLine(Object obj) throws JsonProcessingException {
    return MAPPER.writeValueAsString(obj);
  }
}
