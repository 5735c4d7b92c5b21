package com.workflow.core.mold;

import com.workflow.core.data.DataFrame;
import com.workflow.core.data.NumericColumn;
import com.workflow.core.recipe.PreppedRecipe;
import com.workflow.core.recipe.Recipe;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/** Recipe preprocessing: prep the recipe on the training data, then bake it. */
public final class RecipeMolder {
  private RecipeMolder() {}

  public static Mold mold(Recipe recipe, RecipeBlueprint blueprint, DataFrame data) {
    Objects.requireNonNull(recipe, "recipe");
    Objects.requireNonNull(blueprint, "blueprint");
    Objects.requireNonNull(data, "data");

    PreppedRecipe prepped = recipe.prep(data);
    DataFrame baked = prepped.bake(data);
    DataFrame outcomes = baked.select(prepped.outcomes());
    DataFrame predictors = baked.drop(prepped.outcomes());
    return new Mold(withIntercept(predictors, blueprint), outcomes, blueprint, prepped, List.of(),
        Levels.of(predictors));
  }

  /** Bakes new data with the mold's trained recipe; outcome columns may be absent. */
  public static DataFrame forge(Mold mold, DataFrame data) {
    Objects.requireNonNull(mold, "mold");
    Objects.requireNonNull(data, "data");
    if (!(mold.blueprint() instanceof RecipeBlueprint blueprint) || mold.preppedRecipe() == null) {
      throw new IllegalArgumentException("Mold was not produced by a recipe preprocessor");
    }
    PreppedRecipe prepped = mold.preppedRecipe();
    DataFrame baked = prepped.bake(data);
    List<String> outcomesPresent = new ArrayList<>();
    for (String outcome : prepped.outcomes()) {
      if (baked.hasColumn(outcome)) outcomesPresent.add(outcome);
    }
    DataFrame predictors = Levels.alignAll(baked.drop(outcomesPresent), mold.factorLevels(), blueprint.allowNovelLevels());
    return withIntercept(predictors, blueprint);
  }

  private static DataFrame withIntercept(DataFrame predictors, RecipeBlueprint blueprint) {
    if (!blueprint.intercept()) return predictors;
    return predictors.withFirstColumn(NumericColumn.constant(FormulaMolder.INTERCEPT, predictors.rowCount(), 1.0));
  }
}
