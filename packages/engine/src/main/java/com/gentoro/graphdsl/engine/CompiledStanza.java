package com.gentoro.graphdsl.engine;

import com.gentoro.graphdsl.ast.Stanza;
import com.gentoro.graphdsl.tree.Query;

/** A stanza whose query compiled and whose capture references were checked. */
public record CompiledStanza(int index, Stanza stanza, Query query) {}
