package com.workflow.core;

import com.workflow.core.data.DataFrame;
import com.workflow.core.mold.Mold;
import com.workflow.core.model.ModelFit;

import java.util.Objects;

/**
 * Shape checks consulted by every fitting and extracting entry point. The {@code has*}
 * predicates are pure; the {@code require*} checks return the element or throw a typed failure.
 */
public final class StageValidator {
  private StageValidator() {}

  public static boolean hasPreprocessorFormula(Workflow workflow) {
    return workflow.hasPreprocessorFormula();
  }

  public static boolean hasPreprocessorRecipe(Workflow workflow) {
    return workflow.hasPreprocessorRecipe();
  }

  public static boolean hasPreprocessor(Workflow workflow) {
    return hasPreprocessorFormula(workflow) || hasPreprocessorRecipe(workflow);
  }

  public static boolean hasModel(Workflow workflow) {
    return workflow.hasModel();
  }

  public static boolean hasMold(Workflow workflow) {
    return workflow.hasMold();
  }

  public static boolean hasFit(Workflow workflow) {
    return workflow.hasFit();
  }

  public static Preprocessor requirePreprocessor(Workflow workflow) {
    Objects.requireNonNull(workflow, "workflow");
    return workflow.preprocessor().orElseThrow(MissingPreprocessorException::new);
  }

  public static ModelAction requireModel(Workflow workflow) {
    Objects.requireNonNull(workflow, "workflow");
    return workflow.model().orElseThrow(MissingModelException::new);
  }

  public static Mold requireMold(Workflow workflow) {
    Objects.requireNonNull(workflow, "workflow");
    return workflow.mold().orElseThrow(MissingMoldException::new);
  }

  public static ModelFit requireFit(Workflow workflow) {
    Objects.requireNonNull(workflow, "workflow");
    return workflow.modelFit()
        .orElseThrow(() -> new NotPresentException("The workflow has not been trained. Have you called `fit()` yet?"));
  }

  public static RecipePreprocessor requireRecipePreprocessor(Workflow workflow) {
    Objects.requireNonNull(workflow, "workflow");
    if (!hasPreprocessorRecipe(workflow)) throw new WrongPreprocessorKindException(PreprocessorKind.RECIPE);
    return (RecipePreprocessor) workflow.preprocessor().orElseThrow();
  }

  public static DataFrame requireData(DataFrame data) {
    if (data == null) throw new MissingDataException("`data` must be provided to fit a workflow.");
    if (data.isEmpty()) throw new MissingDataException("`data` must have at least one row to fit a workflow.");
    return data;
  }
}
