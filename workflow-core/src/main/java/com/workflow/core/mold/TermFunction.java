package com.workflow.core.mold;

import java.util.Locale;
import java.util.function.DoubleUnaryOperator;

/** Inline transforms a formula term may wrap a numeric column in. */
public enum TermFunction {
  LOG(Math::log),
  SQRT(Math::sqrt),
  EXP(Math::exp);

  private final DoubleUnaryOperator op;

  TermFunction(DoubleUnaryOperator op) {
    this.op = op;
  }

  public double apply(double value) {
    return op.applyAsDouble(value);
  }

  public String functionName() {
    return name().toLowerCase(Locale.ROOT);
  }

  static TermFunction byName(String name) {
    for (TermFunction fn : values()) {
      if (fn.functionName().equals(name)) return fn;
    }
    throw new IllegalArgumentException("Unsupported formula function: " + name + "()");
  }
}
