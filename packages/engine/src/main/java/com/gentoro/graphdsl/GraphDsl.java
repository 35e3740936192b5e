package com.gentoro.graphdsl;

import com.gentoro.graphdsl.ast.DslFile;
import com.gentoro.graphdsl.engine.ExecutionConfig;
import com.gentoro.graphdsl.engine.Globals;
import com.gentoro.graphdsl.engine.StanzaExecutor;
import com.gentoro.graphdsl.exception.ConfigException;
import com.gentoro.graphdsl.exception.ExceptionUtil;
import com.gentoro.graphdsl.exception.GraphDslErrorCode;
import com.gentoro.graphdsl.exception.GraphDslException;
import com.gentoro.graphdsl.functions.FunctionRegistry;
import com.gentoro.graphdsl.graph.Graph;
import com.gentoro.graphdsl.graph.GraphSerializer;
import com.gentoro.graphdsl.logging.LoggingService;
import com.gentoro.graphdsl.parser.DslParser;
import com.gentoro.graphdsl.tree.QueryEngine;
import com.gentoro.graphdsl.tree.SyntaxTree;
import com.gentoro.graphdsl.tree.memory.PatternQueryEngine;
import com.gentoro.graphdsl.tree.memory.SyntaxTreeReader;
import com.gentoro.graphdsl.utility.JacksonUtility;
import java.nio.file.Files;
import java.nio.file.Path;
import org.apache.commons.configuration2.Configuration;
import org.slf4j.Logger;

/**
 * Entry point for embedding the engine: wires the parser, the query engine, the configured
 * function libraries and the stanza executor, and renders finished graphs.
 */
public class GraphDsl {
  private static final Logger log = LoggingService.getLogger(GraphDsl.class);

  private final StanzaExecutor executor;
  private final FunctionRegistry functions;
  private final OutputFormat outputFormat;

  public GraphDsl(Configuration configuration) {
    this(configuration, new PatternQueryEngine());
  }

  public GraphDsl(Configuration configuration, QueryEngine queryEngine) {
    this(ExecutionConfig.fromConfiguration(configuration), queryEngine, format(configuration));
  }

  public GraphDsl(ExecutionConfig config, QueryEngine queryEngine, OutputFormat outputFormat) {
    this.functions = FunctionRegistry.withLibraries(config.functionLibraries());
    this.executor = new StanzaExecutor(queryEngine, functions, config);
    this.outputFormat = outputFormat;
    log.debug("Graph DSL ready with functions {}", functions.names());
  }

  private static OutputFormat format(Configuration configuration) {
    String value =
        configuration == null ? "json" : configuration.getString("graphdsl.output.format", "json");
    try {
      return OutputFormat.parse(value);
    } catch (IllegalArgumentException e) {
      throw new ConfigException("Invalid graphdsl.output.format: " + e.getMessage(), e);
    }
  }

  /** The registry used by this instance; host functions may be added before running. */
  public FunctionRegistry functions() {
    return functions;
  }

  public OutputFormat outputFormat() {
    return outputFormat;
  }

  public Graph execute(String dslSource, SyntaxTree tree, Globals globals) {
    DslFile file = DslParser.parse(dslSource);
    return executor.execute(file, tree, globals);
  }

  /**
   * Load a DSL file, a JSON syntax tree and optional JSON globals, then execute.
   *
   * @param globalsFile may be {@code null}
   */
  public Graph execute(Path dslFile, Path treeFile, Path globalsFile) {
    String source = read(dslFile);
    SyntaxTree tree = SyntaxTreeReader.read(treeFile);
    Globals globals =
        globalsFile == null
            ? Globals.empty()
            : Globals.fromJson(JacksonUtility.readTree(globalsFile));
    log.info("Executing {} against {}", dslFile, treeFile);
    try {
      return execute(source, tree, globals);
    } catch (GraphDslException e) {
      throw e.withContext("file", dslFile.toString());
    }
  }

  public String render(Graph graph) {
    return render(graph, outputFormat);
  }

  public static String render(Graph graph, OutputFormat format) {
    return format == OutputFormat.TEXT
        ? GraphSerializer.toText(graph)
        : GraphSerializer.toJsonString(graph);
  }

  private static String read(Path file) {
    try {
      return Files.readString(file);
    } catch (Exception e) {
      throw ExceptionUtil.rethrowIfUnchecked(
          e, t -> new GraphDslException(GraphDslErrorCode.IO_ERROR, "Failed to read " + file, t));
    }
  }
}
