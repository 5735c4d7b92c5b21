package com.workflow.core;

import com.workflow.core.mold.Mold;
import com.workflow.core.model.ModelFit;
import com.workflow.core.model.ModelSpec;
import com.workflow.core.recipe.PreppedRecipe;

import java.util.Objects;

/** Read-only accessors that fail with {@link NotPresentException} instead of returning empty. */
public final class WorkflowExtractors {
  private WorkflowExtractors() {}

  /** The formula or recipe action, with the blueprint it currently carries. */
  public static Preprocessor pullPreprocessor(Workflow workflow) {
    Objects.requireNonNull(workflow, "workflow");
    if (!StageValidator.hasPreprocessor(workflow)) {
      throw new NotPresentException("The workflow does not have a preprocessor.");
    }
    return workflow.preprocessor().orElseThrow();
  }

  /** The untrained model spec. */
  public static ModelSpec pullSpec(Workflow workflow) {
    Objects.requireNonNull(workflow, "workflow");
    if (!StageValidator.hasModel(workflow)) {
      throw new NotPresentException("The workflow does not have a model spec.");
    }
    return workflow.model().orElseThrow().spec();
  }

  public static ModelFit pullFit(Workflow workflow) {
    Objects.requireNonNull(workflow, "workflow");
    if (!StageValidator.hasFit(workflow)) {
      throw new NotPresentException("The workflow does not have a model fit. Have you called `fit()` yet?");
    }
    return workflow.modelFit().orElseThrow();
  }

  public static Mold pullMold(Workflow workflow) {
    Objects.requireNonNull(workflow, "workflow");
    if (!StageValidator.hasMold(workflow)) {
      throw new NotPresentException("The workflow does not have a mold. Have you called `fit()` yet?");
    }
    return workflow.mold().orElseThrow();
  }

  /** Shortcut for {@code pullMold(workflow).preppedRecipe()}; recipe workflows only. */
  public static PreppedRecipe pullPreppedRecipe(Workflow workflow) {
    StageValidator.requireRecipePreprocessor(workflow);
    return pullMold(workflow).prepped()
        .orElseThrow(() -> new NotPresentException("The workflow mold does not hold a prepped recipe."));
  }
}
