package com.gentoro.graphdsl.ast;

import java.util.List;

/**
 * A query pattern plus the statements executed for every match of it.
 *
 * @param query raw query pattern text, handed to the query engine as-is
 * @param statements statement block, executed once per match
 * @param location where the stanza starts
 */
public record Stanza(String query, List<Statement> statements, Location location) {
  public Stanza {
    statements = List.copyOf(statements);
  }
}
