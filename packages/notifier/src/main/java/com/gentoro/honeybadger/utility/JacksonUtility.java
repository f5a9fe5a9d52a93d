package com.gentoro.honeybadger.utility;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.gentoro.honeybadger.exception.SerializationException;

public class JacksonUtility {
  // Wire format: compact, explicit nulls, map keys sorted so equal notices encode identically.
  private static final ObjectMapper NOTICE_MAPPER =
      new ObjectMapper()
          .configure(SerializationFeature.ORDER_MAP_ENTRIES_BY_KEYS, true)
          .configure(SerializationFeature.FAIL_ON_EMPTY_BEANS, false);

  private static final ObjectMapper JSON_MAPPER =
      new ObjectMapper()
          .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false)
          .configure(SerializationFeature.FAIL_ON_EMPTY_BEANS, false)
          .enable(SerializationFeature.INDENT_OUTPUT)
          .setSerializationInclusion(JsonInclude.Include.NON_NULL);

  public static ObjectMapper getNoticeMapper() {
    return NOTICE_MAPPER;
  }

  /** Pretty printing mapper, meant for diagnostics only. */
  public static ObjectMapper getJsonMapper() {
    return JSON_MAPPER;
  }

  public static byte[] toNoticeBytes(Object object) {
    try {
      return NOTICE_MAPPER.writeValueAsBytes(object);
    } catch (Exception e) {
      throw new SerializationException("Failed to serialize notice to JSON", e);
    }
  }

  public static String toJson(Object object) {
    try {
      return JSON_MAPPER.writeValueAsString(object);
    } catch (Exception e) {
      throw new SerializationException("Failed to serialize object to JSON", e);
    }
  }
}
