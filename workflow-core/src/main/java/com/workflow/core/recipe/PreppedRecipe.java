package com.workflow.core.recipe;

import com.workflow.core.PreprocessingException;
import com.workflow.core.data.DataFrame;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/** A {@link Recipe} whose steps have been trained on a specific data frame. */
public final class PreppedRecipe {
  private final Recipe recipe;
  private final List<String> outcomes;
  private final List<String> predictors;
  private final List<TrainedStep> steps;

  PreppedRecipe(Recipe recipe, List<String> outcomes, List<String> predictors, List<TrainedStep> steps) {
    this.recipe = Objects.requireNonNull(recipe, "recipe");
    this.outcomes = List.copyOf(outcomes);
    this.predictors = List.copyOf(predictors);
    this.steps = List.copyOf(steps);
  }

  public Recipe recipe() { return recipe; }
  public List<String> outcomes() { return outcomes; }
  public List<String> predictors() { return predictors; }
  public List<TrainedStep> steps() { return steps; }

  /**
   * Applies the trained steps to {@code data}. Every predictor must be present; outcomes are
   * carried through when present.
   */
  public DataFrame bake(DataFrame data) {
    Objects.requireNonNull(data, "data");
    for (String predictor : predictors) {
      if (!data.hasColumn(predictor)) {
        throw new PreprocessingException("Column '" + predictor + "' required by the recipe is missing from the data.");
      }
    }
    List<String> keep = new ArrayList<>();
    for (String name : data.names()) {
      if (predictors.contains(name) || outcomes.contains(name)) keep.add(name);
    }
    DataFrame current = data.select(keep);
    for (TrainedStep step : steps) current = step.bake(current);
    return current;
  }

  @Override
  public String toString() {
    return "PreppedRecipe[" + recipe.formula() + ", trainedSteps=" + steps.size() + "]";
  }
}
