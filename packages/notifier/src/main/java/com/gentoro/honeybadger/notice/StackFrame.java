package com.gentoro.honeybadger.notice;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

/** One backtrace line; every field is optional. */
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonPropertyOrder({"number", "file", "method"})
public record StackFrame(
    @JsonProperty("number") String line,
    @JsonProperty("file") String file,
    @JsonProperty("method") String symbol) {

  static StackFrame from(StackTraceElement element) {
    int lineNumber = element.getLineNumber();
    return new StackFrame(
        lineNumber >= 0 ? Integer.toString(lineNumber) : null,
        element.getFileName(),
        element.getClassName() + "." + element.getMethodName());
  }
}
