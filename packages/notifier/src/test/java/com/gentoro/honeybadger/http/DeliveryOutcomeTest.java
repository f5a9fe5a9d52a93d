package com.gentoro.honeybadger.http;

import static org.junit.jupiter.api.Assertions.*;

import java.io.IOException;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

class DeliveryOutcomeTest {

  @ParameterizedTest
  @ValueSource(ints = {200, 201, 202, 204, 299})
  void twoHundredsAreSuccess(int status) {
    DeliveryOutcome outcome = DeliveryOutcome.classify(status);
    assertInstanceOf(DeliveryOutcome.Success.class, outcome);
    assertTrue(outcome.isSuccess());
  }

  @ParameterizedTest
  @ValueSource(ints = {300, 301, 302, 307, 399})
  void threeHundredsAreRedirects(int status) {
    assertInstanceOf(DeliveryOutcome.Redirected.class, DeliveryOutcome.classify(status));
  }

  @Test
  void knownFailureStatuses() {
    assertInstanceOf(DeliveryOutcome.Unauthorized.class, DeliveryOutcome.classify(401));
    assertInstanceOf(DeliveryOutcome.Unprocessable.class, DeliveryOutcome.classify(422));
    assertInstanceOf(DeliveryOutcome.RateLimited.class, DeliveryOutcome.classify(429));
    assertInstanceOf(DeliveryOutcome.ServerError.class, DeliveryOutcome.classify(500));
  }

  @ParameterizedTest
  @ValueSource(ints = {100, 400, 403, 404, 418, 502, 503})
  void everythingElseIsUnknown(int status) {
    DeliveryOutcome outcome = DeliveryOutcome.classify(status);
    assertEquals(new DeliveryOutcome.UnknownStatus(status), outcome);
    assertFalse(outcome.isSuccess());
    assertEquals(
        "Honeybadger responded with an unknown status code: " + status, outcome.description());
  }

  @Test
  void descriptions() {
    assertEquals(
        "Honeybadger rate limit exceeded", DeliveryOutcome.classify(429).description());
    assertEquals(
        "API key is incorrect or the account is deactivated",
        DeliveryOutcome.classify(401).description());
    assertEquals(
        "The Honeybadger API replied with a '500 Internal Server Error'",
        DeliveryOutcome.classify(500).description());
    assertEquals(
        "Honeybadger timed out after 5 seconds", new DeliveryOutcome.TimedOut(5).description());
    assertEquals(
        "Could not deliver the notice to Honeybadger: connection reset",
        new DeliveryOutcome.TransportFailed(new IOException("connection reset")).description());
  }

  @Test
  void transportFailureRequiresCause() {
    assertThrows(NullPointerException.class, () -> new DeliveryOutcome.TransportFailed(null));
  }
}
