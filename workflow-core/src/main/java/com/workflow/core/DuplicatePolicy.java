package com.workflow.core;

/** What {@code addFormula}, {@code addRecipe} and {@code addModel} do when the slot is already taken. */
public enum DuplicatePolicy {
  /** Any existing action of the slot is an error. */
  REJECT,
  /** A preprocessor of the same kind (or a model) is replaced; a different preprocessor kind is an error. */
  REPLACE_SAME_KIND,
  /** Always replace. */
  REPLACE
}
