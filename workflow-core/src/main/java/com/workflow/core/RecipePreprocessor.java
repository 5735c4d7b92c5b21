package com.workflow.core;

import com.workflow.core.mold.RecipeBlueprint;
import com.workflow.core.recipe.Recipe;

import java.util.Objects;

public record RecipePreprocessor(Recipe recipe, RecipeBlueprint blueprint, boolean blueprintSupplied)
    implements Preprocessor {

  public RecipePreprocessor {
    recipe = Objects.requireNonNull(recipe, "recipe");
    blueprint = Objects.requireNonNull(blueprint, "blueprint");
  }

  @Override
  public PreprocessorKind kind() {
    return PreprocessorKind.RECIPE;
  }
}
