package com.workflow.core.mold;

import java.util.Objects;

/**
 * One right-hand-side term of a {@link Formula}: a column, optionally wrapped in a function,
 * or the {@code .} placeholder for "every other column".
 */
public record Term(String column, TermFunction function) {
  public static final Term DOT = new Term(".", null);

  public Term {
    column = Objects.requireNonNull(column, "column");
  }

  public static Term column(String name) {
    return new Term(name, null);
  }

  public boolean isDot() {
    return function == null && ".".equals(column);
  }

  /** Name of the encoded predictor column this term produces, e.g. {@code log(disp)}. */
  public String label() {
    return function == null ? column : function.functionName() + "(" + column + ")";
  }
}
