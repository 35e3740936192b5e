package com.gentoro.graphdsl;

import com.gentoro.graphdsl.exception.ConfigException;
import com.gentoro.graphdsl.logging.LoggingService;
import java.io.File;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.io.Reader;
import java.net.URI;
import java.nio.charset.StandardCharsets;
import org.apache.commons.configuration2.Configuration;
import org.apache.commons.configuration2.YAMLConfiguration;
import org.apache.commons.configuration2.builder.FileBasedConfigurationBuilder;
import org.apache.commons.configuration2.builder.fluent.Parameters;
import org.apache.commons.configuration2.ex.ConfigurationException;
import org.slf4j.Logger;

/**
 * Loads YAML configuration and exposes an Apache Commons Configuration instance.
 *
 * <p>Location formats supported:
 *
 * <ul>
 *   <li>{@code classpath:some/path.yaml}, loaded from the application classpath
 *   <li>{@code file:/etc/graphdsl.yaml}
 *   <li>an absolute or relative filesystem path
 * </ul>
 *
 * A blank location means {@code classpath:application.yaml}. Values may reference environment
 * variables as {@code ${env:NAME}}.
 */
public final class ConfigurationProvider {
  public static final String DEFAULT_LOCATION = "classpath:application.yaml";

  private static final Logger log = LoggingService.getLogger(ConfigurationProvider.class);

  private final Configuration configuration;

  public ConfigurationProvider(String location) {
    this.configuration = loadYamlFromLocation(location);
  }

  /** Access to raw Commons Configuration object. */
  public Configuration config() {
    return configuration;
  }

  private static Configuration loadYamlFromLocation(String location) {
    if (location == null || location.isBlank()) {
      return loadYamlFromClasspath("application.yaml");
    }
    String loc = location.trim();
    if (loc.startsWith("classpath:")) {
      return loadYamlFromClasspath(loc.substring("classpath:".length()));
    }
    if (loc.startsWith("file:")) {
      try {
        return loadYamlFromFile(new File(URI.create(loc)));
      } catch (IllegalArgumentException e) {
        throw new ConfigException("Invalid configuration location: " + loc, e);
      }
    }
    return loadYamlFromFile(new File(loc));
  }

  private static Configuration loadYamlFromClasspath(String resourceName) {
    ClassLoader loader = Thread.currentThread().getContextClassLoader();
    try (InputStream input = loader.getResourceAsStream(resourceName)) {
      if (input == null) {
        log.debug("Configuration resource {} not found; using defaults", resourceName);
        return new YAMLConfiguration();
      }
      log.debug("Loading configuration from classpath resource: {}", resourceName);
      YAMLConfiguration config = new YAMLConfiguration();
      try (Reader reader = new InputStreamReader(input, StandardCharsets.UTF_8)) {
        config.read(reader);
      }
      return config;
    } catch (Exception e) {
      throw new ConfigException(
          "Failed to read YAML from classpath resource: " + resourceName, e);
    }
  }

  private static Configuration loadYamlFromFile(File file) {
    if (!file.isFile()) {
      throw new ConfigException("Configuration file not found: " + file);
    }
    try {
      Parameters params = new Parameters();
      FileBasedConfigurationBuilder<YAMLConfiguration> builder =
          new FileBasedConfigurationBuilder<>(YAMLConfiguration.class)
              .configure(params.fileBased().setFile(file));
      log.debug("Loading configuration from file: {}", file);
      return builder.getConfiguration();
    } catch (ConfigurationException e) {
      throw new ConfigException("Failed to load YAML file: " + file, e);
    }
  }
}
