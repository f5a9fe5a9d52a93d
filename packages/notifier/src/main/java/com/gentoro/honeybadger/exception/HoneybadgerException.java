package com.gentoro.honeybadger.exception;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Unchecked failure raised by the notifier. The {@link HoneybadgerErrorCode} is stable across
 * releases; the context holds the values a caller needs to act on the failure, e.g. the rejected
 * status code of a delivery.
 */
public class HoneybadgerException extends RuntimeException {
  private final HoneybadgerErrorCode code;
  private final Map<String, Object> context;

  public HoneybadgerException(HoneybadgerErrorCode code, String message) {
    this(code, message, null, null);
  }

  public HoneybadgerException(HoneybadgerErrorCode code, String message, Throwable cause) {
    this(code, message, null, cause);
  }

  public HoneybadgerException(
      HoneybadgerErrorCode code, String message, Map<String, ?> context, Throwable cause) {
    super(message, cause);
    this.code = Objects.requireNonNull(code, "code");
    this.context =
        context == null || context.isEmpty()
            ? Map.of()
            : Collections.unmodifiableMap(new LinkedHashMap<>(context));
  }

  public HoneybadgerErrorCode getCode() {
    return code;
  }

  /** Insertion ordered and unmodifiable; empty when no details were attached. */
  public Map<String, Object> getContext() {
    return context;
  }

  /** Renders as {@code DeliveryException[RESOURCE_EXHAUSTED] message {key=value}}. */
  @Override
  public String toString() {
    StringBuilder sb =
        new StringBuilder(getClass().getSimpleName())
            .append('[')
            .append(code)
            .append("] ")
            .append(getMessage());
    if (!context.isEmpty()) sb.append(' ').append(context);
    if (getCause() != null) sb.append(" caused by ").append(getCause());
    return sb.toString();
  }
}
