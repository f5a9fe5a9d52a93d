package com.gentoro.honeybadger.http;

import java.io.IOException;
import java.util.Objects;

/**
 * Classified result of a single delivery attempt.
 *
 * <p>{@link #classify(int)} is a pure function of the HTTP status code; the remaining variants are
 * produced by {@link NoticeTransport} when no status line was received.
 */
public sealed interface DeliveryOutcome
    permits DeliveryOutcome.Success,
        DeliveryOutcome.Redirected,
        DeliveryOutcome.Unauthorized,
        DeliveryOutcome.RateLimited,
        DeliveryOutcome.Unprocessable,
        DeliveryOutcome.ServerError,
        DeliveryOutcome.TimedOut,
        DeliveryOutcome.TransportFailed,
        DeliveryOutcome.UnknownStatus {

  /** Human readable description, used as the message of a failed delivery. */
  String description();

  default boolean isSuccess() {
    return false;
  }

  /**
   * Map a status code to an outcome. First match wins: 2xx, any 3xx, 401, 422, 429, 500, then
   * everything else as {@link UnknownStatus}.
   */
  static DeliveryOutcome classify(int statusCode) {
    if (statusCode >= 200 && statusCode < 300) return new Success();
    if (statusCode >= 300 && statusCode < 400) return new Redirected();
    switch (statusCode) {
      case 401:
        return new Unauthorized();
      case 422:
        return new Unprocessable();
      case 429:
        return new RateLimited();
      case 500:
        return new ServerError();
      default:
        return new UnknownStatus(statusCode);
    }
  }

  record Success() implements DeliveryOutcome {
    @Override
    public String description() {
      return "Notice accepted by Honeybadger";
    }

    @Override
    public boolean isSuccess() {
      return true;
    }
  }

  record Redirected() implements DeliveryOutcome {
    @Override
    public String description() {
      return "The endpoint replied with a redirect";
    }
  }

  record Unauthorized() implements DeliveryOutcome {
    @Override
    public String description() {
      return "API key is incorrect or the account is deactivated";
    }
  }

  record RateLimited() implements DeliveryOutcome {
    @Override
    public String description() {
      return "Honeybadger rate limit exceeded";
    }
  }

  record Unprocessable() implements DeliveryOutcome {
    @Override
    public String description() {
      return "The payload couldn't be processed";
    }
  }

  record ServerError() implements DeliveryOutcome {
    @Override
    public String description() {
      return "The Honeybadger API replied with a '500 Internal Server Error'";
    }
  }

  record TimedOut(long seconds) implements DeliveryOutcome {
    @Override
    public String description() {
      return "Honeybadger timed out after %d seconds".formatted(seconds);
    }
  }

  record TransportFailed(IOException cause) implements DeliveryOutcome {
    public TransportFailed {
      Objects.requireNonNull(cause, "cause");
    }

    @Override
    public String description() {
      return "Could not deliver the notice to Honeybadger: " + cause.getMessage();
    }
  }

  record UnknownStatus(int code) implements DeliveryOutcome {
    @Override
    public String description() {
      return "Honeybadger responded with an unknown status code: " + code;
    }
  }
}
