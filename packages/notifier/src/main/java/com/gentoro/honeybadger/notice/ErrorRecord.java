package com.gentoro.honeybadger.notice;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import java.util.List;
import java.util.Objects;

/**
 * Canonical, serializable form of an application error and its causes.
 *
 * <p>{@code causes} is {@code null} when the source has no notion of causes, and an empty list
 * only when the source supports a chain that turned out to be empty. {@code frames} is never
 * {@code null} and is omitted from the payload when empty.
 */
@JsonPropertyOrder({"class", "message", "causes", "backtrace"})
public record ErrorRecord(
    @JsonProperty("class") String errorClass,
    @JsonProperty("message") String message,
    @JsonProperty("causes") List<ErrorRecord> causes,
    @JsonProperty("backtrace") @JsonInclude(JsonInclude.Include.NON_EMPTY)
        List<StackFrame> frames) {

  public ErrorRecord {
    Objects.requireNonNull(errorClass, "errorClass");
    causes = causes == null ? null : List.copyOf(causes);
    frames = frames == null ? List.of() : List.copyOf(frames);
  }

  public ErrorRecord(String errorClass, String message, List<ErrorRecord> causes) {
    this(errorClass, message, causes, List.of());
  }
}
