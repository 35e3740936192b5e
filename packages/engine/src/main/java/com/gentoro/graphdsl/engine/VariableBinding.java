package com.gentoro.graphdsl.engine;

import com.gentoro.graphdsl.graph.Value;

/** A variable slot: its current value and whether {@code set} may change it. */
final class VariableBinding {
  private Value value;
  private final boolean mutable;

  VariableBinding(Value value, boolean mutable) {
    this.value = value;
    this.mutable = mutable;
  }

  Value value() {
    return value;
  }

  boolean isMutable() {
    return mutable;
  }

  void update(Value newValue) {
    this.value = newValue;
  }
}
