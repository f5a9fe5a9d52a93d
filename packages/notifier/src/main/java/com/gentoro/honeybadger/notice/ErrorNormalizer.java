package com.gentoro.honeybadger.notice;

import com.gentoro.honeybadger.exception.ExceptionUtil;
import java.util.ArrayList;
import java.util.Collections;
import java.util.IdentityHashMap;
import java.util.List;
import java.util.Set;

/**
 * Converts any supported {@link ErrorSource} into an {@link ErrorRecord} tree.
 *
 * <p>Normalization never fails: a missing stack trace, message or cause simply results in an
 * empty or {@code null} field.
 */
public final class ErrorNormalizer {
  private ErrorNormalizer() {}

  public static ErrorRecord normalize(Throwable error) {
    return normalize(ErrorSource.chained(error));
  }

  public static ErrorRecord normalize(ErrorSource source) {
    if (source instanceof ErrorSource.Chained chained) {
      return chained(chained.error());
    } else if (source instanceof ErrorSource.Aggregate aggregate) {
      return aggregate(aggregate);
    }
    ErrorSource.Opaque opaque = (ErrorSource.Opaque) source;
    return new ErrorRecord(opaque.display(), opaque.debug(), null);
  }

  private static ErrorRecord chained(Throwable error) {
    List<ErrorRecord> causes = new ArrayList<>();
    for (Throwable link : ExceptionUtil.causeChain(error)) {
      causes.add(link(link, Collections.newSetFromMap(new IdentityHashMap<>())));
    }
    return new ErrorRecord(
        error.getClass().getName(), ExceptionUtil.renderChain(error), causes, frames(error));
  }

  // A link's own cause becomes a one-element list; the walk stops at an already visited cause.
  private static ErrorRecord link(Throwable error, Set<Throwable> visited) {
    visited.add(error);
    Throwable cause = error.getCause();
    List<ErrorRecord> causes =
        cause == null || visited.contains(cause) ? null : List.of(link(cause, visited));
    return new ErrorRecord(error.getClass().getName(), error.getMessage(), causes);
  }

  private static ErrorRecord aggregate(ErrorSource.Aggregate aggregate) {
    List<ErrorRecord> causes = new ArrayList<>();
    for (ErrorSource.Aggregate.Entry entry : aggregate.entries()) {
      causes.add(new ErrorRecord(entry.display(), entry.debug(), null));
    }
    return new ErrorRecord(aggregate.label(), aggregate.detail(), causes);
  }

  private static List<StackFrame> frames(Throwable error) {
    StackTraceElement[] elements = error.getStackTrace();
    if (elements == null || elements.length == 0) return List.of();
    List<StackFrame> frames = new ArrayList<>(elements.length);
    for (StackTraceElement element : elements) {
      if (element.getMethodName() == null || element.getMethodName().isEmpty()) continue;
      frames.add(StackFrame.from(element));
    }
    return frames;
  }
}
