package com.workflow.core;

import com.workflow.core.recipe.RecipeStep;

import java.util.List;

/** Creates a recipe step by name for the given columns (empty means "all predictors"). */
@FunctionalInterface
public interface StepFactory {
  RecipeStep create(List<String> columns);
}
