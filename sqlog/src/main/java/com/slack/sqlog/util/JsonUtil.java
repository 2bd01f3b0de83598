package com.slack.sqlog.util;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.json.JsonMapper;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;

public class JsonUtil {
  private static final JsonUtil ourInstance = new JsonUtil();
  private final ObjectMapper mapper;

  public static <T> String writeAsString(T obj) throws JsonProcessingException {
    return ourInstance.mapper.writeValueAsString(obj);
  }

  public static <T> T read(String s, Class<T> cls) throws JsonProcessingException {
    return ourInstance.mapper.readValue(s, cls);
  }

  public static <T> T read(String s, TypeReference<T> valueTypeRef) throws JsonProcessingException {
    return ourInstance.mapper.readValue(s, valueTypeRef);
  }

  private JsonUtil() {
    mapper =
        JsonMapper.builder()
            .addModule(new JavaTimeModule())
            .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false)
            .build();
  }
}
