package com.gentoro.honeybadger;

import com.gentoro.honeybadger.exception.ConfigException;
import com.gentoro.honeybadger.exception.DeliveryException;
import com.gentoro.honeybadger.exception.ExceptionUtil;
import com.gentoro.honeybadger.http.DeliveryOutcome;
import com.gentoro.honeybadger.http.NoticeTransport;
import com.gentoro.honeybadger.http.OkHttpFactory;
import com.gentoro.honeybadger.notice.ErrorNormalizer;
import com.gentoro.honeybadger.notice.ErrorSource;
import com.gentoro.honeybadger.notice.NoticeBuilder;
import com.gentoro.honeybadger.notice.NotifierInfo;
import com.gentoro.honeybadger.system.SystemInfo;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import okhttp3.Call;
import okhttp3.Headers;
import okhttp3.OkHttpClient;
import okhttp3.Request;

/**
 * Reports application errors to Honeybadger.
 *
 * <p>An instance is immutable once constructed and is meant to be shared: every {@code notify}
 * call builds a fresh notice and makes exactly one delivery attempt, bounded by {@link
 * ClientConfig#timeout()}. Nothing is retried, batched or stored for later.
 *
 * <pre>{@code
 * ClientConfig config = ClientConfig.builder(apiKey).withEnv("production").build();
 * Honeybadger honeybadger = new Honeybadger(config);
 * try {
 *   process(order);
 * } catch (OrderException e) {
 *   honeybadger.notify(e, Map.of("order_id", order.id()));
 * }
 * }</pre>
 */
public class Honeybadger implements AutoCloseable {
  private static final org.slf4j.Logger log =
      com.gentoro.honeybadger.logging.LoggingService.getLogger(Honeybadger.class);

  private final ClientConfig config;
  private final Call.Factory client;
  private final OkHttpClient ownedClient;
  private final NoticeBuilder noticeBuilder;
  private final String userAgent;

  /**
   * @throws ConfigException when the HTTP transport cannot be initialized for this configuration
   */
  public Honeybadger(ClientConfig config) {
    this(config, createClient(config), true, new NoticeBuilder());
  }

  /**
   * Use a caller supplied transport, e.g. an {@link OkHttpClient} shared with the application.
   * {@link #close()} leaves such a transport untouched.
   */
  public Honeybadger(ClientConfig config, Call.Factory client, NoticeBuilder noticeBuilder) {
    this(config, client, false, noticeBuilder);
  }

  private Honeybadger(
      ClientConfig config, Call.Factory client, boolean owned, NoticeBuilder noticeBuilder) {
    this.config = Objects.requireNonNull(config, "config");
    this.client = Objects.requireNonNull(client, "client");
    this.noticeBuilder = Objects.requireNonNull(noticeBuilder, "noticeBuilder");
    this.ownedClient = owned ? (OkHttpClient) client : null;
    this.userAgent = userAgent();
    checkHeaders(config, userAgent);
    log.debug("Constructed honeybadger instance with configuration: {}", config);
  }

  static String userAgent() {
    return "HB-java %s; %s/%s"
        .formatted(NotifierInfo.CURRENT.version(), SystemInfo.osType(), SystemInfo.osVersion());
  }

  private static OkHttpClient createClient(ClientConfig config) {
    Objects.requireNonNull(config, "config");
    try {
      return OkHttpFactory.create(config);
    } catch (RuntimeException e) {
      throw ExceptionUtil.rethrowIfUnchecked(
          e, ex -> new ConfigException("Failed to initialize the HTTPS transport", ex));
    }
  }

  private static void checkHeaders(ClientConfig config, String userAgent) {
    try {
      Headers.of("X-API-Key", config.apiKey(), "User-Agent", userAgent);
    } catch (IllegalArgumentException e) {
      throw new ConfigException("API key or user agent is not a valid HTTP header value", e);
    }
  }

  public ClientConfig config() {
    return config;
  }

  /**
   * Report a throwable, including its cause chain and stack trace.
   *
   * @param context optional key/value annotations, may be {@code null}
   * @throws DeliveryException when the endpoint did not accept the notice
   * @throws com.gentoro.honeybadger.exception.SerializationException when the notice cannot be
   *     encoded
   */
  public void notify(Throwable error, Map<String, String> context) {
    notify(ErrorSource.chained(error), context);
  }

  public void notify(ErrorSource error, Map<String, String> context) {
    DeliveryOutcome outcome =
        NoticeTransport.deliver(client, request(error, context), config.timeout());
    if (!outcome.isSuccess()) {
      DeliveryException failure = new DeliveryException(outcome);
      log.debug("Notice not accepted: {}", failure.getContext());
      throw failure;
    }
  }

  /**
   * Non-blocking variant of {@link #notify(ErrorSource, Map)}. The future completes with the
   * outcome of the attempt, or exceptionally when the notice could not be serialized.
   */
  public CompletableFuture<DeliveryOutcome> notifyAsync(
      ErrorSource error, Map<String, String> context) {
    Request request;
    try {
      request = request(error, context);
    } catch (RuntimeException e) {
      return CompletableFuture.failedFuture(e);
    }
    return NoticeTransport.deliverAsync(client, request, config.timeout());
  }

  public CompletableFuture<DeliveryOutcome> notifyAsync(
      Throwable error, Map<String, String> context) {
    return notifyAsync(ErrorSource.chained(error), context);
  }

  private Request request(ErrorSource error, Map<String, String> context) {
    Objects.requireNonNull(error, "error");
    byte[] body = noticeBuilder.build(config, ErrorNormalizer.normalize(error), context);
    return noticeBuilder.buildRequest(config, userAgent, body);
  }

  /** Releases the dispatcher threads and pooled connections of a client created here. */
  @Override
  public void close() {
    if (ownedClient != null) {
      ownedClient.dispatcher().executorService().shutdown();
      ownedClient.connectionPool().evictAll();
    }
  }
}
