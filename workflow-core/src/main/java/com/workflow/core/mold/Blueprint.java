package com.workflow.core.mold;

/**
 * Describes how raw columns are encoded into model-ready predictors.
 * Blueprints are immutable; an adjusted blueprint is always a new instance.
 */
public sealed interface Blueprint permits FormulaBlueprint, RecipeBlueprint {
  /** Whether an {@code (Intercept)} column of ones is prepended to the predictors. */
  boolean intercept();

  /** Whether factor levels unseen at fit time are tolerated when forging new data. */
  boolean allowNovelLevels();
}
