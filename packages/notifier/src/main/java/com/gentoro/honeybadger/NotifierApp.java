package com.gentoro.honeybadger;

import com.gentoro.honeybadger.http.DeliveryOutcome;
import com.gentoro.honeybadger.logging.LoggingService;
import com.gentoro.honeybadger.notice.ErrorSource;
import java.util.Map;
import org.apache.commons.configuration2.Configuration;

/**
 * Sends one test notice, to check an API key and endpoint from the command line.
 *
 * <pre>
 * java -jar honeybadger-notifier.jar --api-key KEY [--config-file LOCATION]
 *     [--kind chained|aggregate|opaque] [--message TEXT]
 * </pre>
 */
public class NotifierApp {

  private static final org.slf4j.Logger log = LoggingService.getLogger(NotifierApp.class);

  public static void main(String[] args) {
    int status;
    try {
      status = run(new StartupParameters(args)).isSuccess() ? 0 : 1;
    } catch (Exception e) {
      log.error("Could not send test notice", e);
      status = 1;
    }
    System.exit(status);
  }

  static DeliveryOutcome run(StartupParameters parameters) {
    Configuration configuration = new ConfigurationProvider(parameters.configFile()).config();
    LoggingService.applyConfiguration(configuration);

    ClientConfig.Builder builder = ClientConfig.builder("").fromConfiguration(configuration);
    parameters.apiKey().ifPresent(builder::withApiKey);
    ClientConfig config = builder.build();
    if (config.apiKey().isBlank()) {
      throw new IllegalArgumentException(
          "No API key: pass --api-key or set honeybadger.apiKey in " + parameters.configFile());
    }

    try (Honeybadger honeybadger = new Honeybadger(config)) {
      DeliveryOutcome outcome =
          honeybadger
              .notifyAsync(testError(parameters), Map.of("source", "honeybadger-java cli"))
              .join();
      if (outcome.isSuccess()) {
        log.info("{} ({})", outcome.description(), config.endpoint());
      } else {
        log.error("{} ({})", outcome.description(), config.endpoint());
      }
      return outcome;
    }
  }

  static ErrorSource testError(StartupParameters parameters) {
    IllegalStateException error =
        new IllegalStateException(
            parameters.message(), new RuntimeException("Cause attached to the test notice"));
    switch (parameters.kind()) {
      case "aggregate":
        return ErrorSource.Aggregate.of(error);
      case "opaque":
        return ErrorSource.Opaque.of(parameters.message());
      default:
        return ErrorSource.chained(error);
    }
  }
}
