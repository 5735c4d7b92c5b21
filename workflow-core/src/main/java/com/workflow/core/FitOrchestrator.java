package com.workflow.core;

import com.workflow.core.data.DataFrame;
import com.workflow.core.data.NumericColumn;
import com.workflow.core.mold.FormulaBlueprint;
import com.workflow.core.mold.FormulaMolder;
import com.workflow.core.mold.Mold;
import com.workflow.core.mold.RecipeMolder;
import com.workflow.core.model.ModelFit;
import com.workflow.core.model.ModelSpec;
import com.workflow.metrics.Metrics;
import com.workflow.metrics.MetricsRecorder;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;
import java.util.function.Supplier;

/**
 * Two-phase fit: {@link #fitPre} molds the data, {@link #fitModel} fits the model on the mold.
 * Each phase checks its preconditions before doing any work and returns a new workflow;
 * collaborator failures propagate unchanged.
 */
public final class FitOrchestrator {
  private static final Logger log = LoggerFactory.getLogger(FitOrchestrator.class);

  public static final String PHASE_PRE = "fit_pre";
  public static final String PHASE_MODEL = "fit_model";
  public static final String PHASE_PREDICT = "predict";
  public static final String PREDICTION_COLUMN = ".pred";

  private FitOrchestrator() {}

  /** Validates the whole workflow and the data, then runs both phases. */
  public static Workflow fit(Workflow workflow, DataFrame data) {
    Objects.requireNonNull(workflow, "workflow");
    StageValidator.requireData(data);
    StageValidator.requirePreprocessor(workflow);
    StageValidator.requireModel(workflow);
    return fitModel(fitPre(workflow, data));
  }

  public static Workflow fitPre(Workflow workflow, DataFrame data) {
    Objects.requireNonNull(workflow, "workflow");
    Preprocessor preprocessor = StageValidator.requirePreprocessor(workflow);
    StageValidator.requireData(data);
    ModelSpec spec = workflow.model().map(ModelAction::spec).orElse(null);

    return timed(workflow.name(), PHASE_PRE, () -> {
      Workflow molded = switch (preprocessor.kind()) {
        case FORMULA -> {
          FormulaPreprocessor formula = (FormulaPreprocessor) preprocessor;
          FormulaBlueprint blueprint = BlueprintResolver.resolveFormula(formula, spec);
          Mold mold = FormulaMolder.mold(formula.formula(), blueprint, data);
          yield workflow.withMold(formula.withBlueprint(blueprint), mold);
        }
        case RECIPE -> {
          RecipePreprocessor recipe = (RecipePreprocessor) preprocessor;
          Mold mold = RecipeMolder.mold(recipe.recipe(), BlueprintResolver.resolveRecipe(recipe), data);
          yield workflow.withMold(recipe, mold);
        }
      };
      Mold mold = molded.mold().orElseThrow();
      log.debug("workflow '{}': {} preprocessing produced {} predictor columns from {} rows",
          workflow.name(), preprocessor.kind().label(), mold.predictors().columnCount(), data.rowCount());
      return molded;
    });
  }

  public static Workflow fitModel(Workflow workflow) {
    Objects.requireNonNull(workflow, "workflow");
    ModelAction model = StageValidator.requireModel(workflow);
    Mold mold = StageValidator.requireMold(workflow);

    return timed(workflow.name(), PHASE_MODEL, () -> {
      ModelFit fit = model.spec().fit(mold.predictors(), mold.outcomes());
      if (fit == null) throw new IllegalStateException("Model spec returned no fit: " + model.spec().type());
      log.debug("workflow '{}': fit {} (engine={})", workflow.name(), model.spec().type(),
          model.spec().engine().orElse("unset"));
      return workflow.withFit(fit);
    });
  }

  /**
   * Encodes {@code newData} with the blueprint of the fitted mold and predicts with the model fit.
   * Returns a single numeric column named {@value #PREDICTION_COLUMN}.
   */
  public static DataFrame predict(Workflow workflow, DataFrame newData) {
    Objects.requireNonNull(workflow, "workflow");
    ModelFit fit = StageValidator.requireFit(workflow);
    if (newData == null) throw new MissingDataException("`newData` must be provided to predict.");
    Preprocessor preprocessor = StageValidator.requirePreprocessor(workflow);
    Mold mold = StageValidator.requireMold(workflow);

    return timed(workflow.name(), PHASE_PREDICT, () -> {
      DataFrame predictors = switch (preprocessor.kind()) {
        case FORMULA -> FormulaMolder.forge(mold, newData);
        case RECIPE -> RecipeMolder.forge(mold, newData);
      };
      return DataFrame.of(new NumericColumn(PREDICTION_COLUMN, fit.predict(predictors)));
    });
  }

  private static <T> T timed(String workflowName, String phase, Supplier<T> body) {
    MetricsRecorder rec = Metrics.recorder();
    long t0 = System.nanoTime();
    try {
      T out = body.get();
      rec.onPhaseSuccess(workflowName, phase, System.nanoTime() - t0);
      return out;
    } catch (RuntimeException ex) {
      rec.onPhaseError(workflowName, phase, ex);
      log.debug("workflow '{}': phase {} failed", workflowName, phase, ex);
      throw ex;
    }
  }
}
