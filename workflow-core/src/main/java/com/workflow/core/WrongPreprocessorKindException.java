package com.workflow.core;

public final class WrongPreprocessorKindException extends WorkflowException {
  private final PreprocessorKind required;

  public WrongPreprocessorKindException(PreprocessorKind required) {
    super("The workflow must have a " + required.label() + " preprocessor.");
    this.required = required;
  }

  public PreprocessorKind required() { return required; }
}
