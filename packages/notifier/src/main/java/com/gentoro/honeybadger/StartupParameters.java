package com.gentoro.honeybadger;

import java.util.HashMap;
import java.util.Map;
import java.util.Optional;

/** {@code --name value} pairs given to {@link NotifierApp}. */
public class StartupParameters {

  final Map<String, Object> parameters = new HashMap<>();

  {
    parameters.put("config-file", ConfigurationProvider.DEFAULT_LOCATION);
    parameters.put("kind", "chained"); // chained, aggregate, opaque
    parameters.put("message", "Test notice from honeybadger-java");
  }

  public StartupParameters(String[] arguments) {
    this.parameters.putAll(parseArguments(arguments));
    this.validate();
  }

  private Map<String, Object> parseArguments(String[] arguments) {
    Map<String, Object> result = new HashMap<>();
    for (int p = 0; p < arguments.length; p++) {

      if (!arguments[p].startsWith("--")) {
        continue;
      }

      String paramName = arguments[p].substring(2);
      String paramValue = null;

      if (p < arguments.length - 1) {
        paramValue = arguments[p + 1];
        p++;
      }

      result.put(paramName, paramValue);
    }
    return result;
  }

  private void validate() {
    Object kind = parameters.get("kind");
    if (!"chained".equals(kind) && !"aggregate".equals(kind) && !"opaque".equals(kind)) {
      throw new IllegalArgumentException("Invalid kind: " + kind);
    }

    if (parameters.get("config-file") == null
        || parameters.get("config-file").toString().isBlank()) {
      throw new IllegalArgumentException("Missing config file location");
    }

    if (parameters.containsKey("api-key")
        && (parameters.get("api-key") == null
            || parameters.get("api-key").toString().isBlank())) {
      throw new IllegalArgumentException("Missing value for --api-key");
    }
  }

  /**
   * Returns the configuration location string. Examples: "classpath:honeybadger.yaml",
   * "/etc/honeybadger.yaml", "config/local.yaml".
   */
  public String configFile() {
    return getParameter("config-file", String.class);
  }

  public String kind() {
    return getParameter("kind", String.class);
  }

  public String message() {
    return getOptionalParameter("message", String.class).orElse("");
  }

  public Optional<String> apiKey() {
    return getOptionalParameter("api-key", String.class);
  }

  public <T> T getParameter(String name, Class<T> type) {
    return type.cast(parameters.get(name));
  }

  public <T> Optional<T> getOptionalParameter(String name, Class<T> type) {
    return Optional.ofNullable(type.cast(parameters.get(name)));
  }

  public boolean isParameterPresent(String name) {
    return parameters.containsKey(name);
  }
}
