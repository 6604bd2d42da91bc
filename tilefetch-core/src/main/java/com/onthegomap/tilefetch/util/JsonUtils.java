package com.onthegomap.tilefetch.util;

import static com.fasterxml.jackson.annotation.JsonInclude.Include.NON_ABSENT;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.datatype.jdk8.Jdk8Module;

/**
 * Serializes status objects to the snake_case JSON that request handlers hand back to clients.
 */
public class JsonUtils {

  private static final ObjectMapper OBJECT_MAPPER = new ObjectMapper()
    .registerModules(new Jdk8Module())
    .setPropertyNamingStrategy(PropertyNamingStrategies.SNAKE_CASE)
    .setSerializationInclusion(NON_ABSENT);

  private JsonUtils() {}

  public static ObjectMapper mapper() {
    return OBJECT_MAPPER;
  }

  /** Returns {@code o} as a JSON string. */
  public static String toJsonString(Object o) {
    try {
      return OBJECT_MAPPER.writeValueAsString(o);
    } catch (JsonProcessingException e) {
      throw new IllegalStateException("Error converting " + o.getClass().getSimpleName() + " to JSON", e);
    }
  }
}
