package com.gentoro.honeybadger.exception;

/**
 * Canonical error codes for the notifier. Codes are stable and suitable for callers deciding
 * whether to retry, alert or drop a failed report. Prefer choosing the most specific code that
 * reflects the failure origin and actionability.
 */
public enum HoneybadgerErrorCode {
  // Generic
  UNKNOWN,
  INVALID_ARGUMENT,
  FAILED_PRECONDITION,
  UNAUTHENTICATED,
  RESOURCE_EXHAUSTED,
  DEADLINE_EXCEEDED,
  UNAVAILABLE,

  // Configuration and encoding
  CONFIGURATION_ERROR,
  SERIALIZATION_ERROR,

  // Transport
  NETWORK_ERROR,
}
