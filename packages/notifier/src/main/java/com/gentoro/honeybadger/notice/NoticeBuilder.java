package com.gentoro.honeybadger.notice;

import com.gentoro.honeybadger.ClientConfig;
import com.gentoro.honeybadger.system.SystemInfo;
import com.gentoro.honeybadger.utility.JacksonUtility;
import java.time.Clock;
import java.util.Map;
import java.util.Objects;
import java.util.function.LongSupplier;
import java.util.function.Supplier;
import okhttp3.MediaType;
import okhttp3.Request;
import okhttp3.RequestBody;

/**
 * Assembles a {@link Notice} from a normalized error, the client configuration and optional
 * caller context, and turns it into an HTTP request.
 *
 * <p>Reads the clock, the process id and the environment on every build; holds no mutable state
 * and can be shared between threads.
 */
public final class NoticeBuilder {
  private static final org.slf4j.Logger log =
      com.gentoro.honeybadger.logging.LoggingService.getLogger(NoticeBuilder.class);

  public static final MediaType JSON = MediaType.get("application/json; charset=utf-8");

  private final Clock clock;
  private final LongSupplier pid;
  private final Supplier<Map<String, String>> environment;

  public NoticeBuilder() {
    this(Clock.systemUTC(), SystemInfo::pid, SystemInfo::environment);
  }

  public NoticeBuilder(
      Clock clock, LongSupplier pid, Supplier<Map<String, String>> environment) {
    this.clock = Objects.requireNonNull(clock, "clock");
    this.pid = Objects.requireNonNull(pid, "pid");
    this.environment = Objects.requireNonNull(environment, "environment");
  }

  public Notice assemble(ClientConfig config, ErrorRecord error, Map<String, String> context) {
    Objects.requireNonNull(config, "config");
    Objects.requireNonNull(error, "error");
    RequestContext request = new RequestContext(context, environment.get());
    ServerInfo server =
        new ServerInfo(
            config.projectRoot(),
            config.environmentName(),
            config.hostname(),
            epochSeconds(),
            pid.getAsLong());
    return new Notice(config.apiKey(), NotifierInfo.CURRENT, error, request, server);
  }

  /**
   * Serialize a fresh notice to UTF-8 JSON.
   *
   * @throws com.gentoro.honeybadger.exception.SerializationException when the notice cannot be
   *     encoded
   */
  public byte[] build(ClientConfig config, ErrorRecord error, Map<String, String> context) {
    return JacksonUtility.toNoticeBytes(assemble(config, error, context));
  }

  public Request buildRequest(ClientConfig config, String userAgent, byte[] body) {
    return new Request.Builder()
        .url(config.endpoint().toString())
        .header("Accept", "application/json")
        .header("X-API-Key", config.apiKey())
        .header("User-Agent", userAgent)
        .post(RequestBody.create(body, JSON))
        .build();
  }

  long epochSeconds() {
    try {
      return Math.max(0L, clock.instant().getEpochSecond());
    } catch (RuntimeException e) {
      log.debug("Clock unavailable, stamping notice with epoch 0", e);
      return 0L;
    }
  }
}
