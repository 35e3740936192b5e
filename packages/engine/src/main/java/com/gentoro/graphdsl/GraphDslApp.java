package com.gentoro.graphdsl;

import com.gentoro.graphdsl.exception.ExceptionUtil;
import com.gentoro.graphdsl.exception.GraphDslErrorCode;
import com.gentoro.graphdsl.exception.GraphDslException;
import com.gentoro.graphdsl.graph.Graph;
import com.gentoro.graphdsl.logging.LoggingService;
import java.io.IOException;
import java.io.PrintStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import org.apache.commons.configuration2.Configuration;
import org.slf4j.Logger;

/** Command line front end: runs one DSL file against one syntax tree and writes the graph. */
public class GraphDslApp {
  private static final Logger log = LoggingService.getLogger(GraphDslApp.class);

  public static void main(String[] args) {
    System.exit(run(args, System.out));
  }

  /**
   * Run with the given arguments, writing the graph to {@code --output} or {@code out}.
   *
   * @return the process exit code: 0 on success, 1 on any failure
   */
  public static int run(String[] args, PrintStream out) {
    try {
      StartupParameters parameters = new StartupParameters(args);
      if (parameters.isHelp()) {
        out.println(StartupParameters.usage());
        return 0;
      }
      Configuration configuration = new ConfigurationProvider(parameters.configFile()).config();
      LoggingService.applyConfiguration(configuration);

      GraphDsl graphDsl = new GraphDsl(configuration);
      OutputFormat format =
          parameters
              .getOptionalParameter("format")
              .map(OutputFormat::parse)
              .orElse(graphDsl.outputFormat());

      Graph graph =
          graphDsl.execute(
              Paths.get(parameters.getParameter("dsl")),
              Paths.get(parameters.getParameter("tree")),
              parameters.getOptionalParameter("globals").map(Paths::get).orElse(null));
      String rendered = GraphDsl.render(graph, format);

      if (parameters.isParameterPresent("output")) {
        Path output = Paths.get(parameters.getParameter("output"));
        write(output, rendered);
        log.info("Graph written to {}", output);
      } else {
        out.println(rendered);
      }
      return 0;
    } catch (IllegalArgumentException e) {
      log.error("{}", e.getMessage());
      log.error("{}", StartupParameters.usage());
      return 1;
    } catch (Exception e) {
      log.error("Graph DSL run failed: {}", ExceptionUtil.describe(e));
      log.debug("Stack: {}", ExceptionUtil.formatCompactStackTrace(e));
      return 1;
    }
  }

  private static void write(Path output, String content) {
    try {
      Path parent = output.toAbsolutePath().getParent();
      if (parent != null) {
        Files.createDirectories(parent);
      }
      Files.writeString(output, content + System.lineSeparator());
    } catch (IOException e) {
      throw new GraphDslException(GraphDslErrorCode.IO_ERROR, "Failed to write " + output, e);
    }
  }
}
