package com.workflow.core;

/** Root of every failure raised by workflow construction, fitting and extraction. */
public class WorkflowException extends RuntimeException {
  public WorkflowException(String message) {
    super(message);
  }

  public WorkflowException(String message, Throwable cause) {
    super(message, cause);
  }
}
