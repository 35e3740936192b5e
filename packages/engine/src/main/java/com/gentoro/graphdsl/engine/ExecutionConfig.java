package com.gentoro.graphdsl.engine;

import com.gentoro.graphdsl.exception.ConfigException;
import com.gentoro.graphdsl.logging.LoggingService;
import java.util.List;
import java.util.Objects;
import java.util.function.Consumer;
import org.apache.commons.configuration2.Configuration;
import org.apache.commons.lang3.EnumUtils;
import org.slf4j.Logger;

/** Typed view of the engine settings found under {@code graphdsl.*}. */
public final class ExecutionConfig {
  private static final Logger printLog = LoggingService.printLogger();

  /** Where {@code print} statements write. */
  public enum PrintTarget {
    STDERR,
    STDOUT,
    LOG
  }

  private final PrintTarget printTarget;
  private final Consumer<String> printSink;
  private final List<String> functionLibraries;

  private ExecutionConfig(
      PrintTarget printTarget, Consumer<String> printSink, List<String> functionLibraries) {
    this.printTarget = printTarget;
    this.printSink = printSink;
    this.functionLibraries = List.copyOf(functionLibraries);
  }

  /** Print to stderr, load every discovered function library. */
  public static ExecutionConfig defaults() {
    return new ExecutionConfig(PrintTarget.STDERR, sinkFor(PrintTarget.STDERR), List.of());
  }

  /**
   * Read the engine settings from application configuration.
   *
   * @throws ConfigException if {@code graphdsl.print.target} names an unknown target
   */
  public static ExecutionConfig fromConfiguration(Configuration config) {
    if (config == null) {
      return defaults();
    }
    String target = config.getString("graphdsl.print.target", PrintTarget.STDERR.name());
    PrintTarget printTarget = EnumUtils.getEnumIgnoreCase(PrintTarget.class, target.trim());
    if (printTarget == null) {
      throw new ConfigException(
          "Unsupported graphdsl.print.target '" + target + "'; expected stderr, stdout or log");
    }
    List<String> libraries =
        config.getList(String.class, "graphdsl.functions.libraries", List.of());
    return new ExecutionConfig(printTarget, sinkFor(printTarget), libraries);
  }

  /** A copy of this configuration whose {@code print} output goes to the given sink. */
  public ExecutionConfig withPrintSink(Consumer<String> sink) {
    return new ExecutionConfig(
        printTarget, Objects.requireNonNull(sink, "sink"), functionLibraries);
  }

  public PrintTarget printTarget() {
    return printTarget;
  }

  /** Receives one line per {@code print} statement, without the trailing newline. */
  public Consumer<String> printSink() {
    return printSink;
  }

  /** Function library ids to load; empty means every discovered library. */
  public List<String> functionLibraries() {
    return functionLibraries;
  }

  private static Consumer<String> sinkFor(PrintTarget target) {
    switch (target) {
      case STDOUT:
        return System.out::println;
      case LOG:
        return line -> printLog.info("{}", line);
      case STDERR:
      default:
        return System.err::println;
    }
  }
}
