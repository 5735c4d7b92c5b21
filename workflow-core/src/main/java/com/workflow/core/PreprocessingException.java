package com.workflow.core;

/** Raised by a molder when a formula or recipe cannot be applied to a data frame. */
public final class PreprocessingException extends WorkflowException {
  public PreprocessingException(String message) {
    super(message);
  }

  public PreprocessingException(String message, Throwable cause) {
    super(message, cause);
  }
}
