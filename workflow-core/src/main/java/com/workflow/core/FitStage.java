package com.workflow.core;

public enum FitStage {
  EMPTY,
  PREPROCESSED,
  FITTED
}
