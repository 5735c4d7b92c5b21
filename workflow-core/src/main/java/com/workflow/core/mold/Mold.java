package com.workflow.core.mold;

import com.workflow.core.data.DataFrame;
import com.workflow.core.recipe.PreppedRecipe;

import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Output of the preprocessing phase.
 *
 * @param blueprint     the blueprint actually used to encode the predictors
 * @param preppedRecipe trained recipe for recipe preprocessing, {@code null} for formulas
 * @param terms         resolved formula terms ({@code .} expanded); empty for recipes
 * @param factorLevels  training levels of every factor predictor, used to forge new data
 */
public record Mold(
    DataFrame predictors,
    DataFrame outcomes,
    Blueprint blueprint,
    PreppedRecipe preppedRecipe,
    List<Term> terms,
    Map<String, List<String>> factorLevels
) {
  public Mold {
    predictors = Objects.requireNonNull(predictors, "predictors");
    outcomes = Objects.requireNonNull(outcomes, "outcomes");
    blueprint = Objects.requireNonNull(blueprint, "blueprint");
    terms = List.copyOf(Objects.requireNonNull(terms, "terms"));
    factorLevels = Map.copyOf(Objects.requireNonNull(factorLevels, "factorLevels"));
  }

  public Optional<PreppedRecipe> prepped() {
    return Optional.ofNullable(preppedRecipe);
  }
}
