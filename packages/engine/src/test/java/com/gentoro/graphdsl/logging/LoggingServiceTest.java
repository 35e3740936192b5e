package com.gentoro.graphdsl.logging;

import static org.junit.jupiter.api.Assertions.*;

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.Logger;
import com.gentoro.graphdsl.ConfigurationProvider;
import java.nio.file.Files;
import java.nio.file.Path;
import org.apache.commons.configuration2.BaseConfiguration;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.slf4j.LoggerFactory;

class LoggingServiceTest {

  private static Level levelOf(String name) {
    return ((Logger) LoggerFactory.getLogger(name)).getLevel();
  }

  @Test
  @DisplayName("logger levels are read from YAML, dotted logger names included")
  void appliesYamlLevels(@TempDir Path dir) throws Exception {
    Path file = dir.resolve("logging.yaml");
    Files.writeString(
        file,
        "logging:\n"
            + "  level:\n"
            + "    com.gentoro.graphdsl.sample: ERROR\n"
            + "    graphdsl.print: DEBUG\n"
            + "    sample.bogus: LOUD\n");

    int applied =
        LoggingService.applyConfiguration(new ConfigurationProvider(file.toString()).config());

    assertEquals(2, applied);
    assertEquals(Level.ERROR, levelOf("com.gentoro.graphdsl.sample"));
    assertEquals(Level.DEBUG, levelOf(LoggingService.PRINT_LOGGER));
    assertNull(levelOf("sample.bogus"));
  }

  @Test
  @DisplayName("flat configurations and missing configuration")
  void flatAndMissing() {
    BaseConfiguration config = new BaseConfiguration();
    config.setProperty("logging.level.sample.flat", "warn");
    config.setProperty("graphdsl.output.format", "json");

    assertEquals(1, LoggingService.applyConfiguration(config));
    assertEquals(Level.WARN, levelOf("sample.flat"));
    assertEquals(0, LoggingService.applyConfiguration(null));
  }

  @Test
  @DisplayName("print output has its own logger")
  void printLogger() {
    assertEquals(LoggingService.PRINT_LOGGER, LoggingService.printLogger().getName());
  }
}
