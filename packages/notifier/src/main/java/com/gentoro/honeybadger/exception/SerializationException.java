package com.gentoro.honeybadger.exception;

/** The notice, or a configuration document, could not be encoded or decoded. */
public class SerializationException extends HoneybadgerException {
  public SerializationException(String message) {
    super(HoneybadgerErrorCode.SERIALIZATION_ERROR, message);
  }

  public SerializationException(String message, Throwable cause) {
    super(HoneybadgerErrorCode.SERIALIZATION_ERROR, message, cause);
  }
}
