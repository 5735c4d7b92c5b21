package com.workflow.core;

import com.workflow.core.mold.Blueprint;

/**
 * The preprocessing action of a workflow. Dispatch on {@link #kind()} with an exhaustive
 * switch so a new kind fails to compile until every site handles it.
 */
public sealed interface Preprocessor permits FormulaPreprocessor, RecipePreprocessor {
  PreprocessorKind kind();

  Blueprint blueprint();

  /** {@code true} when the caller passed the blueprint explicitly; such blueprints are never adjusted. */
  boolean blueprintSupplied();
}
