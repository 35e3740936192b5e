package com.gentoro.graphdsl.tree.memory;

import com.gentoro.graphdsl.exception.QueryException;
import com.gentoro.graphdsl.logging.LoggingService;
import com.gentoro.graphdsl.tree.Query;
import com.gentoro.graphdsl.tree.QueryEngine;
import java.util.List;
import org.slf4j.Logger;

/**
 * Query engine for S-expression patterns over any {@link com.gentoro.graphdsl.tree.SyntaxTree}.
 *
 * <p>Supported syntax: node patterns {@code (kind child...)}, the wildcards {@code (_)} (any named
 * node) and {@code _} (any node), anonymous nodes {@code "("}, fields {@code name: pattern},
 * alternations {@code [a b]}, captures {@code @name}, the predicates {@code #eq?}, {@code
 * #not-eq?}, {@code #match?} and {@code #not-match?}, and {@code ;} comments. Quantifiers, anchors
 * and negated fields are not supported.
 */
public class PatternQueryEngine implements QueryEngine {
  private static final Logger log = LoggingService.getLogger(PatternQueryEngine.class);

  @Override
  public Query compile(String pattern) {
    if (pattern == null || pattern.isBlank()) {
      throw new QueryException("Query pattern is empty");
    }
    PatternParser parser = new PatternParser(pattern);
    List<PatternNode.TopLevel> patterns = parser.parse();
    List<String> captureNames = parser.captureNames();
    log.debug("Compiled query with {} pattern(s) and captures {}", patterns.size(), captureNames);
    return new PatternQuery(pattern, patterns, captureNames);
  }
}
