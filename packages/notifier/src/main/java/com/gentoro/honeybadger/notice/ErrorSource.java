package com.gentoro.honeybadger.notice;

import com.gentoro.honeybadger.exception.ExceptionUtil;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * The error shapes the notifier knows how to report. Exactly three are supported, each with its
 * own mapping in {@link ErrorNormalizer}.
 */
public sealed interface ErrorSource
    permits ErrorSource.Chained, ErrorSource.Aggregate, ErrorSource.Opaque {

  static ErrorSource chained(Throwable error) {
    return new Chained(error);
  }

  /** A throwable with its cause chain and captured stack trace. */
  record Chained(Throwable error) implements ErrorSource {
    public Chained {
      Objects.requireNonNull(error, "error");
    }
  }

  /** A labelled error wrapping a flat list of named sub-errors. */
  record Aggregate(String label, String detail, List<Entry> entries) implements ErrorSource {
    public Aggregate {
      Objects.requireNonNull(label, "label");
      Objects.requireNonNull(detail, "detail");
      entries = entries == null ? List.of() : List.copyOf(entries);
    }

    /**
     * Flatten a throwable: the causes below it come first, outermost to innermost, followed by its
     * suppressed exceptions.
     */
    public static Aggregate of(Throwable error) {
      Objects.requireNonNull(error, "error");
      List<Entry> entries = new ArrayList<>();
      List<Throwable> chain = ExceptionUtil.causeChain(error);
      for (Throwable cause : chain.subList(1, chain.size())) {
        entries.add(Entry.of(cause));
      }
      for (Throwable suppressed : error.getSuppressed()) {
        entries.add(Entry.of(suppressed));
      }
      return new Aggregate(
          ExceptionUtil.displayString(error), ExceptionUtil.debugString(error), entries);
    }

    public record Entry(String display, String debug) {
      public Entry {
        Objects.requireNonNull(display, "display");
        Objects.requireNonNull(debug, "debug");
      }

      public static Entry of(Throwable error) {
        return new Entry(ExceptionUtil.displayString(error), ExceptionUtil.debugString(error));
      }
    }
  }

  /** Anything that can only be rendered as text. */
  record Opaque(String display, String debug) implements ErrorSource {
    public Opaque {
      Objects.requireNonNull(display, "display");
      Objects.requireNonNull(debug, "debug");
    }

    public static Opaque of(Object error) {
      Objects.requireNonNull(error, "error");
      if (error instanceof Throwable t) {
        return new Opaque(ExceptionUtil.displayString(t), ExceptionUtil.debugString(t));
      }
      String text = error.toString();
      return new Opaque(text, error.getClass().getName() + ": " + text);
    }
  }
}
