package com.workflow.core;

/** The model phase was attempted before the preprocessing phase produced a mold. */
public final class MissingMoldException extends WorkflowException {
  public MissingMoldException() {
    super("The workflow does not have a mold. The preprocessing phase must run before the model is fit.");
  }
}
