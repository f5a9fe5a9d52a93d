package com.gentoro.honeybadger.notice;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.*;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.util.List;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

class ErrorNormalizerTest {

  private static Throwable chainOf(int links) {
    Throwable error = new IOException("root cause");
    for (int i = 1; i < links; i++) {
      error = new IllegalStateException("level " + i, error);
    }
    return error;
  }

  @Test
  @DisplayName("Every link of a cause chain becomes one cause, the error itself included")
  void chainLengthIsPreserved() {
    for (int links = 1; links <= 6; links++) {
      ErrorRecord record = ErrorNormalizer.normalize(chainOf(links));
      assertNotNull(record.causes());
      assertEquals(links, record.causes().size(), "links=" + links);
    }
  }

  @Test
  void chainedErrorUsesClassNameAndRenderedChain() {
    IllegalStateException error =
        new IllegalStateException("rate limit exceeded", new IOException("redirected"));

    ErrorRecord record = ErrorNormalizer.normalize(error);

    assertEquals("java.lang.IllegalStateException", record.errorClass());
    assertEquals(
        "Error: java.lang.IllegalStateException: rate limit exceeded\n"
            + "Caused by: java.io.IOException: redirected",
        record.message());
    assertEquals(2, record.causes().size());

    ErrorRecord self = record.causes().get(0);
    assertEquals("java.lang.IllegalStateException", self.errorClass());
    assertEquals("rate limit exceeded", self.message());
    assertEquals(1, self.causes().size());
    assertEquals("java.io.IOException", self.causes().get(0).errorClass());
    assertNull(self.causes().get(0).causes());

    ErrorRecord innermost = record.causes().get(1);
    assertEquals("redirected", innermost.message());
    assertNull(innermost.causes());
  }

  @Test
  void nestedCausesFormSingleElementLists() {
    ErrorRecord record = ErrorNormalizer.normalize(chainOf(3));

    ErrorRecord node = record.causes().get(0);
    int depth = 1;
    while (node.causes() != null) {
      assertEquals(1, node.causes().size());
      node = node.causes().get(0);
      depth++;
    }
    assertEquals(3, depth);
    assertEquals("root cause", node.message());
  }

  @Test
  void framesAreInnermostFirst() {
    ErrorRecord record = ErrorNormalizer.normalize(new RuntimeException("boom"));

    assertThat(record.frames()).isNotEmpty();
    StackFrame top = record.frames().get(0);
    assertEquals(
        "com.gentoro.honeybadger.notice.ErrorNormalizerTest.framesAreInnermostFirst",
        top.symbol());
    assertEquals("ErrorNormalizerTest.java", top.file());
    assertThat(top.line()).matches("\\d+");
  }

  @Test
  void missingStackTraceGivesNoFrames() {
    RuntimeException error = new RuntimeException("no trace");
    error.setStackTrace(new StackTraceElement[0]);

    ErrorRecord record = ErrorNormalizer.normalize(error);

    assertEquals(List.of(), record.frames());
    assertEquals(1, record.causes().size());
  }

  @Test
  void frameWithoutLineNumberKeepsOtherFields() {
    RuntimeException error = new RuntimeException("native");
    error.setStackTrace(
        new StackTraceElement[] {
          new StackTraceElement("java.lang.Thread", "sleep", null, -2),
          new StackTraceElement("com.acme.Worker", "run", "Worker.java", 42)
        });

    List<StackFrame> frames = ErrorNormalizer.normalize(error).frames();

    assertEquals(new StackFrame(null, null, "java.lang.Thread.sleep"), frames.get(0));
    assertEquals(new StackFrame("42", "Worker.java", "com.acme.Worker.run"), frames.get(1));
  }

  @Test
  void cyclicCauseChainTerminates() {
    Exception first = new Exception("first");
    Exception second = new Exception("second", first);
    first.initCause(second);

    ErrorRecord record = ErrorNormalizer.normalize(first);

    assertEquals(2, record.causes().size());
    ErrorRecord self = record.causes().get(0);
    assertEquals("second", self.causes().get(0).message());
    assertNull(self.causes().get(0).causes());
  }

  @Test
  void aggregateFlattensCausesAndSuppressed() {
    IllegalStateException error =
        new IllegalStateException(
            "import failed", new UncheckedIOException(new IOException("disk full")));
    error.addSuppressed(new IllegalArgumentException("close failed"));

    ErrorRecord record = ErrorNormalizer.normalize(ErrorSource.Aggregate.of(error));

    assertEquals("import failed", record.errorClass());
    assertEquals("java.lang.IllegalStateException: import failed", record.message());
    assertThat(record.causes())
        .extracting(ErrorRecord::errorClass)
        .containsExactly("java.io.IOException: disk full", "disk full", "close failed");
    assertThat(record.causes()).allSatisfy(cause -> assertNull(cause.causes()));
    assertEquals(
        "java.lang.IllegalArgumentException: close failed", record.causes().get(2).message());
    assertEquals(List.of(), record.frames());
  }

  @Test
  void aggregateWithoutEntriesHasEmptyCauses() {
    ErrorSource.Aggregate aggregate =
        new ErrorSource.Aggregate("Validation failed", "ValidationError { fields: [] }", null);

    ErrorRecord record = ErrorNormalizer.normalize(aggregate);

    assertEquals("Validation failed", record.errorClass());
    assertEquals(List.of(), record.causes());
  }

  @Test
  void aggregateEntriesKeepDisplayAndDebug() {
    ErrorSource.Aggregate aggregate =
        new ErrorSource.Aggregate(
            "2 fields invalid",
            "ValidationError(2)",
            List.of(
                new ErrorSource.Aggregate.Entry("name is blank", "Field(name)"),
                new ErrorSource.Aggregate.Entry("age is negative", "Field(age)")));

    ErrorRecord record = ErrorNormalizer.normalize(aggregate);

    assertEquals(
        List.of(
            new ErrorRecord("name is blank", "Field(name)", null),
            new ErrorRecord("age is negative", "Field(age)", null)),
        record.causes());
  }

  @Test
  void opaqueErrorAlwaysHasMessage() {
    ErrorRecord fromText = ErrorNormalizer.normalize(ErrorSource.Opaque.of("std error"));
    assertEquals("std error", fromText.errorClass());
    assertEquals("java.lang.String: std error", fromText.message());
    assertNull(fromText.causes());

    ErrorRecord fromThrowable =
        ErrorNormalizer.normalize(ErrorSource.Opaque.of(new UnsupportedOperationException()));
    assertEquals("java.lang.UnsupportedOperationException", fromThrowable.errorClass());
    assertEquals("java.lang.UnsupportedOperationException", fromThrowable.message());
    assertNull(fromThrowable.causes());
  }

  @Test
  void sourcesRejectNullAtConstruction() {
    assertThrows(NullPointerException.class, () -> ErrorSource.chained(null));
    assertThrows(NullPointerException.class, () -> ErrorSource.Opaque.of(null));
    assertThrows(NullPointerException.class, () -> ErrorSource.Aggregate.of(null));
  }

  @Test
  void aggregateRequiresDebugRenderings() {
    assertThrows(
        NullPointerException.class, () -> new ErrorSource.Aggregate("label", null, List.of()));
    assertThrows(
        NullPointerException.class, () -> new ErrorSource.Aggregate.Entry("display", null));
  }
}
