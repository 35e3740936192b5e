package com.gentoro.graphdsl.ast;

import java.util.List;

/** A parsed graph DSL file: its stanzas in declaration order. */
public record DslFile(List<Stanza> stanzas) {
  public DslFile {
    stanzas = List.copyOf(stanzas);
  }
}
