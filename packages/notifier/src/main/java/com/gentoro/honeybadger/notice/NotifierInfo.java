package com.gentoro.honeybadger.notice;

import com.fasterxml.jackson.annotation.JsonPropertyOrder;

/** Identifies this client library to the receiving service. */
@JsonPropertyOrder({"name", "url", "version"})
public record NotifierInfo(String name, String url, String version) {
  static final String FALLBACK_VERSION = "0.4.0";

  public static final NotifierInfo CURRENT =
      new NotifierInfo(
          "honeybadger-java", "https://github.com/gentoro/honeybadger-java", packageVersion());

  private static String packageVersion() {
    String version = NotifierInfo.class.getPackage().getImplementationVersion();
    return version == null || version.isBlank() ? FALLBACK_VERSION : version;
  }
}
