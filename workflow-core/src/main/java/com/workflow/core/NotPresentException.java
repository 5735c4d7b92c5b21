package com.workflow.core;

/** An element was requested from a workflow before the stage that produces it ran. */
public final class NotPresentException extends WorkflowException {
  public NotPresentException(String message) {
    super(message);
  }
}
