package com.gentoro.honeybadger;

import com.gentoro.honeybadger.exception.ConfigException;
import com.gentoro.honeybadger.system.SystemInfo;
import java.net.URI;
import java.time.Duration;
import java.util.Objects;
import java.util.function.Function;
import java.util.function.Supplier;
import org.apache.commons.configuration2.Configuration;
import org.apache.commons.configuration2.ex.ConversionException;

/**
 * Immutable notifier configuration.
 *
 * <p>Every field is resolved once, at {@link Builder#build()}, with the precedence: explicit
 * builder value, then environment variable, then a computed default, then an empty fallback.
 *
 * <p>Recognized environment variables: {@code HONEYBADGER_ROOT}, {@code ENV}, {@code HOSTNAME},
 * {@code HONEYBADGER_ENDPOINT} and {@code HONEYBADGER_TIMEOUT} (whole seconds).
 */
public final class ClientConfig {
  public static final URI DEFAULT_ENDPOINT = URI.create("https://api.honeybadger.io/v1/notices");
  public static final Duration DEFAULT_TIMEOUT = Duration.ofSeconds(5);
  public static final int DEFAULT_THREADS = 4;
  /** Longest timeout the HTTP client accepts; larger values are clamped to it. */
  public static final Duration MAX_TIMEOUT = Duration.ofMillis(Integer.MAX_VALUE);

  static final String ENV_ROOT = "HONEYBADGER_ROOT";
  static final String ENV_ENVIRONMENT = "ENV";
  static final String ENV_HOSTNAME = "HOSTNAME";
  static final String ENV_ENDPOINT = "HONEYBADGER_ENDPOINT";
  static final String ENV_TIMEOUT = "HONEYBADGER_TIMEOUT";

  private final String apiKey;
  private final String projectRoot;
  private final String environmentName;
  private final String hostname;
  private final URI endpoint;
  private final Duration timeout;
  private final int threads;

  private ClientConfig(Builder builder) {
    Function<String, String> env = builder.environment;
    this.apiKey = Objects.requireNonNull(builder.apiKey, "apiKey");
    this.projectRoot =
        resolve(
            builder.root,
            env.apply(ENV_ROOT),
            () -> SystemInfo.workingDirectory().orElse(null),
            "");
    this.environmentName = resolve(builder.env, env.apply(ENV_ENVIRONMENT), null, "");
    this.hostname =
        resolve(
            builder.hostname,
            env.apply(ENV_HOSTNAME),
            () -> SystemInfo.hostname().orElse(null),
            "");
    this.endpoint =
        checkEndpoint(
            resolve(builder.endpoint, toUri(env.apply(ENV_ENDPOINT)), null, DEFAULT_ENDPOINT));
    this.timeout =
        clamp(
            resolve(builder.timeout, parseSeconds(env.apply(ENV_TIMEOUT)), null, DEFAULT_TIMEOUT));
    this.threads = resolve(builder.threads, null, null, DEFAULT_THREADS);
  }

  public static Builder builder(String apiKey) {
    return new Builder(apiKey, System::getenv);
  }

  /** Builder reading environment variables through {@code environment} instead of the process. */
  public static Builder builder(String apiKey, Function<String, String> environment) {
    return new Builder(apiKey, environment);
  }

  /**
   * Layered lookup: the first non-null of {@code explicit}, {@code environment} and the computed
   * default wins, otherwise {@code fallback}.
   */
  static <T> T resolve(T explicit, T environment, Supplier<T> computedDefault, T fallback) {
    if (explicit != null) return explicit;
    if (environment != null) return environment;
    T computed = computedDefault == null ? null : computedDefault.get();
    return computed != null ? computed : fallback;
  }

  /**
   * Whole seconds as an unsigned 64 bit integer; anything else is ignored. Values beyond {@link
   * #MAX_TIMEOUT} are clamped to it.
   */
  static Duration parseSeconds(String value) {
    if (value == null) return null;
    try {
      long seconds = Long.parseUnsignedLong(value.trim());
      // above Long.MAX_VALUE the unsigned value reads back negative
      return seconds < 0 ? MAX_TIMEOUT : clamp(Duration.ofSeconds(seconds));
    } catch (NumberFormatException e) {
      return null;
    }
  }

  static Duration clamp(Duration timeout) {
    return timeout.compareTo(MAX_TIMEOUT) > 0 ? MAX_TIMEOUT : timeout;
  }

  private static URI toUri(String value) {
    if (value == null) return null;
    try {
      return URI.create(value.trim());
    } catch (IllegalArgumentException e) {
      throw new ConfigException("Invalid " + ENV_ENDPOINT + ": " + value, e);
    }
  }

  private static URI checkEndpoint(URI endpoint) {
    String scheme = endpoint.getScheme();
    if (scheme == null
        || !(scheme.equalsIgnoreCase("https") || scheme.equalsIgnoreCase("http"))
        || endpoint.getHost() == null) {
      throw new ConfigException("Endpoint must be an absolute http(s) URL: " + endpoint);
    }
    return endpoint;
  }

  public String apiKey() {
    return apiKey;
  }

  public String projectRoot() {
    return projectRoot;
  }

  public String environmentName() {
    return environmentName;
  }

  public String hostname() {
    return hostname;
  }

  public URI endpoint() {
    return endpoint;
  }

  public Duration timeout() {
    return timeout;
  }

  /** Maximum number of notices in flight at the same time. */
  public int threads() {
    return threads;
  }

  @Override
  public String toString() {
    return "ClientConfig{"
        + "apiKey="
        + (apiKey.isEmpty() ? "<empty>" : "****")
        + ", projectRoot="
        + projectRoot
        + ", environmentName="
        + environmentName
        + ", hostname="
        + hostname
        + ", endpoint="
        + endpoint
        + ", timeout="
        + timeout
        + ", threads="
        + threads
        + '}';
  }

  public static final class Builder {
    private final Function<String, String> environment;
    private String apiKey;
    private String root;
    private String env;
    private String hostname;
    private URI endpoint;
    private Duration timeout;
    private Integer threads;

    private Builder(String apiKey, Function<String, String> environment) {
      this.apiKey = apiKey;
      this.environment = Objects.requireNonNull(environment, "environment");
    }

    public Builder withApiKey(String apiKey) {
      this.apiKey = Objects.requireNonNull(apiKey, "apiKey");
      return this;
    }

    /** The directory where the application code lives. */
    public Builder withRoot(String projectRoot) {
      this.root = Objects.requireNonNull(projectRoot, "projectRoot");
      return this;
    }

    /** Environment name used to categorize notices, e.g. {@code production}. */
    public Builder withEnv(String environmentName) {
      this.env = Objects.requireNonNull(environmentName, "environmentName");
      return this;
    }

    public Builder withHostname(String hostname) {
      this.hostname = Objects.requireNonNull(hostname, "hostname");
      return this;
    }

    public Builder withEndpoint(String endpoint) {
      try {
        return withEndpoint(URI.create(Objects.requireNonNull(endpoint, "endpoint")));
      } catch (IllegalArgumentException e) {
        throw new ConfigException("Invalid endpoint: " + endpoint, e);
      }
    }

    public Builder withEndpoint(URI endpoint) {
      this.endpoint = Objects.requireNonNull(endpoint, "endpoint");
      return this;
    }

    /** Values beyond {@link ClientConfig#MAX_TIMEOUT} are clamped to it. */
    public Builder withTimeout(Duration timeout) {
      Objects.requireNonNull(timeout, "timeout");
      if (timeout.isNegative() || timeout.isZero()) {
        throw new IllegalArgumentException("Timeout must be positive: " + timeout);
      }
      this.timeout = timeout;
      return this;
    }

    public Builder withThreads(int threads) {
      if (threads <= 0) {
        throw new IllegalArgumentException("Thread count must be positive: " + threads);
      }
      this.threads = threads;
      return this;
    }

    /**
     * Apply the {@code honeybadger.*} keys of an application configuration as explicit values:
     * {@code apiKey}, {@code root}, {@code env}, {@code hostname}, {@code endpoint}, {@code
     * timeout} (seconds) and {@code threads}. Absent keys leave the builder untouched.
     */
    public Builder fromConfiguration(Configuration cfg) {
      if (cfg == null) return this;
      try {
        String value = cfg.getString("honeybadger.apiKey", null);
        if (value != null && !value.isBlank()) withApiKey(value.trim());
        value = cfg.getString("honeybadger.root", null);
        if (value != null) withRoot(value);
        value = cfg.getString("honeybadger.env", null);
        if (value != null) withEnv(value);
        value = cfg.getString("honeybadger.hostname", null);
        if (value != null) withHostname(value);
        value = cfg.getString("honeybadger.endpoint", null);
        if (value != null && !value.isBlank()) withEndpoint(value.trim());
        Long seconds = cfg.getLong("honeybadger.timeout", null);
        if (seconds != null) withTimeout(Duration.ofSeconds(seconds));
        Integer count = cfg.getInteger("honeybadger.threads", null);
        if (count != null) withThreads(count);
      } catch (ConversionException | IllegalArgumentException e) {
        throw new ConfigException("Invalid honeybadger configuration: " + e.getMessage(), e);
      }
      return this;
    }

    public ClientConfig build() {
      return new ClientConfig(this);
    }
  }
}
