package com.workflow.core;

public final class MissingPreprocessorException extends WorkflowException {
  public MissingPreprocessorException() {
    super("The workflow must have a formula or recipe preprocessor. Provide one with `addFormula()` or `addRecipe()`.");
  }
}
