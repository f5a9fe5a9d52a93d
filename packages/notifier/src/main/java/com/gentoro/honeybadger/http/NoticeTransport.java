package com.gentoro.honeybadger.http;

import java.io.IOException;
import java.time.Duration;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import okhttp3.Call;
import okhttp3.Callback;
import okhttp3.Request;
import okhttp3.Response;
import org.jetbrains.annotations.NotNull;

/**
 * Sends a notice request and classifies the result.
 *
 * <p>The call races a timer of the configured duration. When the timer fires first the call is
 * cancelled and the outcome is {@link DeliveryOutcome.TimedOut}; the endpoint may still have
 * received the notice. A response that arrives in time is always classified, and its body is
 * never read.
 */
public final class NoticeTransport {
  private static final org.slf4j.Logger log =
      com.gentoro.honeybadger.logging.LoggingService.getLogger(NoticeTransport.class);

  private NoticeTransport() {}

  /** Blocking variant of {@link #deliverAsync(Call.Factory, Request, Duration)}. */
  public static DeliveryOutcome deliver(Call.Factory client, Request request, Duration timeout) {
    return deliverAsync(client, request, timeout).join();
  }

  /** Enqueue the request; the returned future never completes exceptionally. */
  public static CompletableFuture<DeliveryOutcome> deliverAsync(
      Call.Factory client, Request request, Duration timeout) {
    Call call = client.newCall(request);
    CompletableFuture<Integer> status = new CompletableFuture<>();
    call.enqueue(
        new Callback() {
          @Override
          public void onFailure(@NotNull Call call, @NotNull IOException e) {
            status.completeExceptionally(e);
          }

          @Override
          public void onResponse(@NotNull Call call, @NotNull Response response) {
            try (response) {
              status.complete(response.code());
            }
          }
        });

    return status
        .orTimeout(timeoutMillis(timeout), TimeUnit.MILLISECONDS)
        .handle(
            (code, failure) -> {
              if (failure == null) {
                log.debug("Honeybadger API returned status: {}", code);
                return DeliveryOutcome.classify(code);
              }
              Throwable cause = unwrap(failure);
              if (cause instanceof TimeoutException) {
                call.cancel();
                log.debug("Honeybadger call to {} abandoned after {}", request.url(), timeout);
                return new DeliveryOutcome.TimedOut(timeout.getSeconds());
              }
              if (cause instanceof IOException io) {
                return new DeliveryOutcome.TransportFailed(io);
              }
              return new DeliveryOutcome.TransportFailed(
                  new IOException("Unexpected transport failure", cause));
            });
  }

  /** Milliseconds of {@code timeout}, saturated at {@link Long#MAX_VALUE}. */
  static long timeoutMillis(Duration timeout) {
    try {
      return timeout.toMillis();
    } catch (ArithmeticException e) {
      return Long.MAX_VALUE;
    }
  }

  private static Throwable unwrap(Throwable failure) {
    return failure instanceof CompletionException && failure.getCause() != null
        ? failure.getCause()
        : failure;
  }
}
