package com.workflow.core;

/** An action of the same slot was already added and the duplicate policy refuses to replace it. */
public class DuplicateActionException extends WorkflowException {
  public DuplicateActionException(String message) {
    super(message);
  }
}
