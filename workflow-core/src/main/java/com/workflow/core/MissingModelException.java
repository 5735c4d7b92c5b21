package com.workflow.core;

public final class MissingModelException extends WorkflowException {
  public MissingModelException() {
    super("The workflow must have a model. Provide one with `addModel()`.");
  }
}
