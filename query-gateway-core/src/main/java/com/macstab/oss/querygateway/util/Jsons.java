/* (C)2026 Christian Schnapka / Macstab GmbH */
package com.macstab.oss.querygateway.util;

import java.io.IOException;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;

/** Shared Jackson mapper for cache payloads and wire replies. */
public final class Jsons {

  private static final ObjectMapper MAPPER =
      new ObjectMapper()
          .findAndRegisterModules()
          .disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES);

  private Jsons() {
    throw new UnsupportedOperationException("Utility class");
  }

  public static ObjectMapper mapper() {
    return MAPPER;
  }

  public static String toJson(final Object value) {
    try {
      return MAPPER.writeValueAsString(value);
    } catch (final JsonProcessingException e) {
      throw new IllegalStateException("Failed to serialize JSON", e);
    }
  }

  public static <T> T fromJson(final String json, final Class<T> type) throws IOException {
    return MAPPER.readValue(json, type);
  }
}
