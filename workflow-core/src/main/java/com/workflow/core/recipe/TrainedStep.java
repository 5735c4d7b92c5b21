package com.workflow.core.recipe;

import com.workflow.core.data.DataFrame;

@FunctionalInterface
public interface TrainedStep {
  DataFrame bake(DataFrame data);
}
