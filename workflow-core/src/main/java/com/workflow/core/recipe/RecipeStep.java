package com.workflow.core.recipe;

import com.workflow.core.data.DataFrame;

/**
 * An untrained preprocessing step. {@link #prep} estimates whatever the step needs from the
 * training data and returns the trained form that is applied to training and new data alike.
 */
public interface RecipeStep {
  String name();

  TrainedStep prep(DataFrame training);
}
