package com.gentoro.honeybadger.http;

import com.gentoro.honeybadger.ClientConfig;
import java.util.concurrent.TimeUnit;
import okhttp3.ConnectionPool;
import okhttp3.Dispatcher;
import okhttp3.OkHttpClient;

public class OkHttpFactory {

  /**
   * Client shared by all notices of one notifier. Redirects are not followed so that a 3xx reply
   * is reported instead of silently re-posted.
   */
  public static OkHttpClient create(ClientConfig config) {
    Dispatcher dispatcher = new Dispatcher();
    dispatcher.setMaxRequests(config.threads());
    dispatcher.setMaxRequestsPerHost(config.threads());
    long timeoutMs = config.timeout().toMillis();
    return new OkHttpClient.Builder()
        .dispatcher(dispatcher)
        .connectionPool(new ConnectionPool(config.threads(), 5, TimeUnit.MINUTES))
        .connectTimeout(timeoutMs, TimeUnit.MILLISECONDS)
        .readTimeout(timeoutMs, TimeUnit.MILLISECONDS)
        .writeTimeout(timeoutMs, TimeUnit.MILLISECONDS)
        .followRedirects(false)
        .followSslRedirects(false)
        .retryOnConnectionFailure(false)
        .addInterceptor(new LoggingInterceptor())
        .build();
  }
}
