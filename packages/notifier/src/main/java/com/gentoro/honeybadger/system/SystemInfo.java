package com.gentoro.honeybadger.system;

import java.net.InetAddress;
import java.net.UnknownHostException;
import java.util.Map;
import java.util.Optional;

/**
 * Read-only access to facts about the running process and host. Every lookup degrades to an empty
 * value instead of failing.
 */
public final class SystemInfo {
  private static final org.slf4j.Logger log =
      com.gentoro.honeybadger.logging.LoggingService.getLogger(SystemInfo.class);

  private SystemInfo() {}

  public static long pid() {
    return ProcessHandle.current().pid();
  }

  /** Snapshot of the process environment. */
  public static Map<String, String> environment() {
    return Map.copyOf(System.getenv());
  }

  public static Optional<String> workingDirectory() {
    return Optional.ofNullable(System.getProperty("user.dir")).filter(s -> !s.isBlank());
  }

  public static Optional<String> hostname() {
    try {
      return Optional.ofNullable(InetAddress.getLocalHost().getHostName())
          .filter(s -> !s.isBlank());
    } catch (UnknownHostException | SecurityException e) {
      log.debug("Unable to resolve local hostname", e);
      return Optional.empty();
    }
  }

  public static String osType() {
    return System.getProperty("os.name", "unknown");
  }

  public static String osVersion() {
    return System.getProperty("os.version", "unknown");
  }
}
