package com.gentoro.honeybadger.exception;

import com.gentoro.honeybadger.http.DeliveryOutcome;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * A notice was built but the endpoint did not accept it. The {@link DeliveryOutcome} tells the
 * caller whether retrying, alerting or dropping the report makes sense.
 */
public class DeliveryException extends HoneybadgerException {
  private final transient DeliveryOutcome outcome;

  public DeliveryException(DeliveryOutcome outcome) {
    super(
        codeFor(outcome),
        outcome.description(),
        contextFor(outcome),
        outcome instanceof DeliveryOutcome.TransportFailed failed ? failed.cause() : null);
    this.outcome = outcome;
  }

  public DeliveryOutcome getOutcome() {
    return outcome;
  }

  /** The outcome's name, plus the status code or timeout it carries. */
  static Map<String, Object> contextFor(DeliveryOutcome outcome) {
    Map<String, Object> context = new LinkedHashMap<>();
    context.put("outcome", outcome.getClass().getSimpleName());
    if (outcome instanceof DeliveryOutcome.UnknownStatus unknown) {
      context.put("status", unknown.code());
    } else if (outcome instanceof DeliveryOutcome.TimedOut timedOut) {
      context.put("timeout_seconds", timedOut.seconds());
    }
    return context;
  }

  static HoneybadgerErrorCode codeFor(DeliveryOutcome outcome) {
    Objects.requireNonNull(outcome, "outcome");
    if (outcome.isSuccess()) {
      throw new IllegalArgumentException("A successful delivery is not a failure");
    }
    if (outcome instanceof DeliveryOutcome.Unauthorized) {
      return HoneybadgerErrorCode.UNAUTHENTICATED;
    } else if (outcome instanceof DeliveryOutcome.RateLimited) {
      return HoneybadgerErrorCode.RESOURCE_EXHAUSTED;
    } else if (outcome instanceof DeliveryOutcome.Unprocessable) {
      return HoneybadgerErrorCode.INVALID_ARGUMENT;
    } else if (outcome instanceof DeliveryOutcome.Redirected) {
      return HoneybadgerErrorCode.FAILED_PRECONDITION;
    } else if (outcome instanceof DeliveryOutcome.ServerError) {
      return HoneybadgerErrorCode.UNAVAILABLE;
    } else if (outcome instanceof DeliveryOutcome.TimedOut) {
      return HoneybadgerErrorCode.DEADLINE_EXCEEDED;
    } else if (outcome instanceof DeliveryOutcome.TransportFailed) {
      return HoneybadgerErrorCode.NETWORK_ERROR;
    }
    return HoneybadgerErrorCode.UNKNOWN;
  }
}
