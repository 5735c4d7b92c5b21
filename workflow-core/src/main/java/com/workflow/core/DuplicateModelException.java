package com.workflow.core;

public final class DuplicateModelException extends DuplicateActionException {
  public DuplicateModelException() {
    super("A `model` action has already been added to this workflow.");
  }
}
