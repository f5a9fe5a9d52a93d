package com.gentoro.honeybadger.notice;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.TreeMap;

/**
 * Caller supplied annotations plus the environment snapshot taken when the notice was built.
 * {@code context} stays {@code null} when the caller passed none.
 */
@JsonPropertyOrder({"context", "cgi_data"})
public record RequestContext(
    @JsonProperty("context") Map<String, String> context,
    @JsonProperty("cgi_data") Map<String, String> cgiData) {

  public RequestContext {
    context = context == null ? null : Collections.unmodifiableMap(new LinkedHashMap<>(context));
    cgiData =
        cgiData == null ? Map.of() : Collections.unmodifiableMap(new TreeMap<>(cgiData));
  }
}
