package com.gentoro.honeybadger;

import static org.junit.jupiter.api.Assertions.*;

import com.gentoro.honeybadger.exception.ConfigException;
import com.gentoro.honeybadger.exception.SerializationException;
import java.io.FileNotFoundException;
import java.io.IOException;
import java.net.URI;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import org.apache.commons.configuration2.Configuration;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class ConfigurationProviderTest {

  @TempDir Path tempDir;

  @Test
  void loadsClasspathResource() {
    Configuration cfg = new ConfigurationProvider("classpath:honeybadger-test.yaml").config();

    assertEquals("yaml-key", cfg.getString("honeybadger.apiKey"));
    assertEquals(12, cfg.getInt("honeybadger.timeout"));
    assertEquals("INFO", cfg.getString("logging.level.root"));
  }

  @Test
  void bundledDefaultsLoadWithoutApiKey() {
    Configuration cfg = new ConfigurationProvider(null).config();

    assertNull(cfg.getString("honeybadger.apiKey", null));
    assertEquals(5, cfg.getInt("honeybadger.timeout"));
    assertEquals(4, cfg.getInt("honeybadger.threads"));
  }

  @Test
  void classpathConfigurationFeedsClientConfig() {
    Configuration cfg = new ConfigurationProvider("classpath:honeybadger-test.yaml").config();

    ClientConfig config = ClientConfig.builder("", name -> null).fromConfiguration(cfg).build();

    assertEquals("yaml-key", config.apiKey());
    assertEquals("staging", config.environmentName());
    assertEquals("yaml-host", config.hostname());
    assertEquals(URI.create("https://proxy.example.com/v1/notices"), config.endpoint());
    assertEquals(Duration.ofSeconds(12), config.timeout());
    assertEquals(8, config.threads());
  }

  @Test
  void loadsFileByPathAndUri() throws IOException {
    Path file = tempDir.resolve("notifier.yaml");
    Files.writeString(file, "honeybadger:\n  env: from-file\n");

    assertEquals(
        "from-file",
        new ConfigurationProvider(file.toString()).config().getString("honeybadger.env"));
    assertEquals(
        "from-file",
        new ConfigurationProvider(file.toUri().toString()).config().getString("honeybadger.env"));
  }

  @Test
  void missingClasspathResourceFails() {
    SerializationException e =
        assertThrows(
            SerializationException.class,
            () -> new ConfigurationProvider("classpath:does-not-exist.yaml"));
    assertInstanceOf(FileNotFoundException.class, e.getCause());
  }

  @Test
  void missingFileFails() {
    assertThrows(
        ConfigException.class,
        () -> new ConfigurationProvider(tempDir.resolve("absent.yaml").toString()));
  }
}
