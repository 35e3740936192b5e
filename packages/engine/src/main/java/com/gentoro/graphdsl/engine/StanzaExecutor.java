package com.gentoro.graphdsl.engine;

import com.gentoro.graphdsl.ast.DslFile;
import com.gentoro.graphdsl.ast.Stanza;
import com.gentoro.graphdsl.exception.GraphDslException;
import com.gentoro.graphdsl.functions.FunctionRegistry;
import com.gentoro.graphdsl.graph.Graph;
import com.gentoro.graphdsl.graph.SyntaxNodeRef;
import com.gentoro.graphdsl.logging.LoggingService;
import com.gentoro.graphdsl.tree.Query;
import com.gentoro.graphdsl.tree.QueryEngine;
import com.gentoro.graphdsl.tree.QueryMatch;
import com.gentoro.graphdsl.tree.SyntaxNode;
import com.gentoro.graphdsl.tree.SyntaxTree;
import java.util.List;
import org.slf4j.Logger;

/**
 * Runs a parsed DSL file against a syntax tree and returns the resulting graph.
 *
 * <p>Stanzas run in declaration order and, within a stanza, once per query match in the order the
 * query engine reports matches. Each match gets fresh local variables; scoped variables and the
 * tag-path memo table live for the whole run. The first error aborts the run and no partial graph
 * is returned.
 *
 * <p>The executor holds no run state, so one instance can serve any number of runs, including
 * concurrent ones.
 */
public class StanzaExecutor {
  private static final Logger log = LoggingService.getLogger(StanzaExecutor.class);

  private final QueryEngine queryEngine;
  private final FunctionRegistry functions;
  private final ExecutionConfig config;

  public StanzaExecutor(
      QueryEngine queryEngine, FunctionRegistry functions, ExecutionConfig config) {
    this.queryEngine = queryEngine;
    this.functions = functions;
    this.config = config == null ? ExecutionConfig.defaults() : config;
  }

  /**
   * Execute every stanza of {@code file} against {@code tree}.
   *
   * @param globals read-only variables visible to every stanza
   * @return the constructed graph
   * @throws GraphDslException on the first failure, with stanza and statement locations in its
   *     context
   */
  public Graph execute(DslFile file, SyntaxTree tree, Globals globals) {
    List<CompiledStanza> stanzas = StanzaValidator.validate(file, queryEngine);
    ExecutionContext context = new ExecutionContext(tree, globals, functions, config);
    ExpressionEvaluator evaluator = new ExpressionEvaluator(context);
    StatementInterpreter interpreter = new StatementInterpreter(context, evaluator);
    log.info("Executing {} stanza(s)", stanzas.size());

    int totalMatches = 0;
    for (CompiledStanza compiled : stanzas) {
      totalMatches += executeStanza(compiled, tree, context, interpreter);
    }

    Graph graph = context.graph();
    log.info(
        "Execution finished: {} match(es), {} graph node(s), {} edge(s)",
        totalMatches,
        graph.nodeCount(),
        graph.edgeCount());
    return graph;
  }

  private int executeStanza(
      CompiledStanza compiled,
      SyntaxTree tree,
      ExecutionContext context,
      StatementInterpreter interpreter) {
    Stanza stanza = compiled.stanza();
    Query query = compiled.query();
    List<QueryMatch> matches;
    try {
      matches = query.matches(tree);
    } catch (GraphDslException e) {
      throw withStanza(e, compiled);
    }
    log.debug(
        "Stanza {} at line {}: {} match(es)",
        compiled.index(),
        stanza.location().line(),
        matches.size());

    for (QueryMatch match : matches) {
      SyntaxNodeRef defaultNode = defaultNode(query, match, context.graph());
      VariableEnvironment variables =
          new VariableEnvironment(
              context.globals(), context.scopedVariables(), LocalScope.root(), defaultNode);
      Frame frame = new Frame(match, query.captureNames(), variables);
      try {
        interpreter.execute(stanza.statements(), frame);
      } catch (GraphDslException e) {
        throw withStanza(e, compiled).withContext("captures", describe(match));
      }
    }
    return matches.size();
  }

  // The first declared capture that bound exactly one node.
  private static SyntaxNodeRef defaultNode(Query query, QueryMatch match, Graph graph) {
    for (String name : query.captureNames()) {
      List<SyntaxNode> nodes = match.nodes(name);
      if (nodes.size() == 1) {
        return graph.addSyntaxNode(nodes.get(0));
      }
    }
    return null;
  }

  private static GraphDslException withStanza(GraphDslException e, CompiledStanza compiled) {
    return e.withContext("stanza", compiled.index())
        .withContext("stanzaLine", compiled.stanza().location().line())
        .withContext("stanzaColumn", compiled.stanza().location().column());
  }

  private static String describe(QueryMatch match) {
    StringBuilder sb = new StringBuilder("{");
    match
        .captures()
        .forEach(
            (name, nodes) -> {
              if (sb.length() > 1) sb.append(", ");
              sb.append('@').append(name).append('=');
              for (int i = 0; i < nodes.size(); i++) {
                SyntaxNode node = nodes.get(i);
                if (i > 0) sb.append('|');
                sb.append(node.kind()).append(node.startPosition());
              }
            });
    return sb.append('}').toString();
  }
}
