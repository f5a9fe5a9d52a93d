package com.gentoro.honeybadger.exception;

import java.util.ArrayList;
import java.util.Collections;
import java.util.IdentityHashMap;
import java.util.List;
import java.util.Set;
import java.util.function.Function;

/** Utility helpers for rendering throwables and wrapping unexpected failures. */
public final class ExceptionUtil {
  private ExceptionUtil() {}

  /**
   * Short, user facing rendering of a throwable: its message, or its class name when the message
   * is absent.
   */
  public static String displayString(Throwable t) {
    String message = t.getMessage();
    return message == null ? t.getClass().getName() : message;
  }

  /** Detailed rendering of a throwable, {@code ClassName: message}. */
  public static String debugString(Throwable t) {
    return t.toString();
  }

  /**
   * The throwable followed by each of its causes, outermost first. A cause that was already
   * visited ends the chain.
   */
  public static List<Throwable> causeChain(Throwable t) {
    List<Throwable> chain = new ArrayList<>();
    Set<Throwable> seen = Collections.newSetFromMap(new IdentityHashMap<>());
    Throwable current = t;
    while (current != null && seen.add(current)) {
      chain.add(current);
      current = current.getCause();
    }
    return chain;
  }

  /**
   * Render the whole cause chain, one link per line.
   *
   * <p>Example output:
   *
   * <pre>
   * Error: java.lang.IllegalStateException: cannot load order 42
   * Caused by: java.io.FileNotFoundException: orders/42.json
   * </pre>
   */
  public static String renderChain(Throwable t) {
    StringBuilder sb = new StringBuilder();
    List<Throwable> chain = causeChain(t);
    for (int i = 0; i < chain.size(); i++) {
      if (i > 0) sb.append('\n');
      sb.append(i == 0 ? "Error: " : "Caused by: ").append(debugString(chain.get(i)));
    }
    return sb.toString();
  }

  public static HoneybadgerException rethrowIfUnchecked(
      Throwable t, Function<Throwable, HoneybadgerException> supplier) {
    if (t instanceof HoneybadgerException) {
      return (HoneybadgerException) t;
    } else {
      return supplier.apply(t);
    }
  }
}
