package com.workflow.core;

public enum PreprocessorKind {
  FORMULA("formula"),
  RECIPE("recipe");

  private final String label;

  PreprocessorKind(String label) {
    this.label = label;
  }

  public String label() {
    return label;
  }
}
