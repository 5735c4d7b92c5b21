package com.workflow.core;

/** Raised by a model engine that cannot fit or predict. */
public final class ModelFitException extends WorkflowException {
  public ModelFitException(String message) {
    super(message);
  }

  public ModelFitException(String message, Throwable cause) {
    super(message, cause);
  }
}
