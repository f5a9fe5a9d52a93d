package com.gentoro.honeybadger.http;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.gentoro.honeybadger.utility.JacksonUtility;
import java.io.IOException;
import okhttp3.Headers;
import okhttp3.Interceptor;
import okhttp3.Request;
import okhttp3.Response;
import okio.Buffer;
import org.jetbrains.annotations.NotNull;

/** Debug logging of notice requests, with the API key masked in headers and body. */
public class LoggingInterceptor implements Interceptor {
  private static final org.slf4j.Logger log =
      com.gentoro.honeybadger.logging.LoggingService.getLogger(LoggingInterceptor.class);

  static final String API_KEY_HEADER = "X-API-Key";

  @NotNull
  @Override
  public Response intercept(Chain chain) throws IOException {
    Request request = chain.request();
    if (!log.isDebugEnabled()) {
      return chain.proceed(request);
    }

    long startTime = System.nanoTime();
    log.debug("Sending notice to {}\nHeaders:\n{}", request.url(), masked(request.headers()));
    if (log.isTraceEnabled()) {
      log.trace("Notice body:\n{}", bodyToString(request));
    }

    Response response = chain.proceed(request);

    long endTime = System.nanoTime();
    log.debug(
        "Received response for {} in {} ms, status {}",
        response.request().url(),
        String.format("%.1f", (endTime - startTime) / 1e6d),
        response.code());
    return response;
  }

  static Headers masked(Headers headers) {
    if (headers.get(API_KEY_HEADER) == null) return headers;
    return headers.newBuilder().set(API_KEY_HEADER, "****").build();
  }

  static String bodyToString(Request request) {
    try {
      Buffer buffer = new Buffer();
      if (request.body() != null) request.body().writeTo(buffer);
      JsonNode json = JacksonUtility.getJsonMapper().readTree(buffer.readUtf8());
      if (json instanceof ObjectNode object && object.has("api_key")) {
        object.put("api_key", "****");
      }
      return JacksonUtility.getJsonMapper().writeValueAsString(json);
    } catch (IOException e) {
      return "(error reading body)";
    }
  }
}
