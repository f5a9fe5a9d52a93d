package com.gentoro.honeybadger.exception;

/** Configuration or transport setup problem detected while constructing the client. */
public class ConfigException extends HoneybadgerException {
  public ConfigException(String message) {
    super(HoneybadgerErrorCode.CONFIGURATION_ERROR, message);
  }

  public ConfigException(String message, Throwable cause) {
    super(HoneybadgerErrorCode.CONFIGURATION_ERROR, message, cause);
  }
}
