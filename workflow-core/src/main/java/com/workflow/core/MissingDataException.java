package com.workflow.core;

public final class MissingDataException extends WorkflowException {
  public MissingDataException(String message) {
    super(message);
  }
}
