package com.workflow.core.model;

import com.workflow.core.data.DataFrame;

/** A trained model. */
public interface ModelFit {
  ModelSpec spec();

  /** One prediction per row of {@code predictors}, which must be encoded like the training predictors. */
  double[] predict(DataFrame predictors);
}
