package com.workflow.core;

import com.workflow.core.data.DataFrame;
import com.workflow.core.mold.Formula;
import com.workflow.core.mold.FormulaBlueprint;
import com.workflow.core.mold.Mold;
import com.workflow.core.mold.RecipeBlueprint;
import com.workflow.core.model.ModelFit;
import com.workflow.core.model.ModelSpec;
import com.workflow.core.recipe.Recipe;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;
import java.util.Optional;

/**
 * Immutable container binding one preprocessor to one model.
 *
 * <p>Every mutator returns a new workflow; fitting goes through {@link FitOrchestrator} and also
 * returns a new workflow, so a template can be fit any number of times without being touched.
 * Replacing the preprocessor drops the mold and the fit; replacing the model drops the fit only.
 */
public final class Workflow {
  private static final Logger log = LoggerFactory.getLogger(Workflow.class);

  public static final String DEFAULT_NAME = "workflow";

  private final String name;
  private final DuplicatePolicy duplicatePolicy;
  private final Preprocessor preprocessor;
  private final ModelAction model;
  private final Mold mold;
  private final ModelFit fit;

  private Workflow(String name, DuplicatePolicy duplicatePolicy, Preprocessor preprocessor, ModelAction model,
                   Mold mold, ModelFit fit) {
    this.name = Objects.requireNonNull(name, "name");
    this.duplicatePolicy = Objects.requireNonNull(duplicatePolicy, "duplicatePolicy");
    if (mold != null && preprocessor == null) throw new IllegalStateException("mold without a preprocessor");
    if (fit != null && (mold == null || model == null)) throw new IllegalStateException("fit without a mold and model");
    this.preprocessor = preprocessor;
    this.model = model;
    this.mold = mold;
    this.fit = fit;
  }

  public static Workflow empty() {
    return named(DEFAULT_NAME);
  }

  public static Workflow named(String name) {
    if (name == null || name.isBlank()) throw new IllegalArgumentException("name must be non-empty");
    return new Workflow(name, DuplicatePolicy.REPLACE_SAME_KIND, null, null, null, null);
  }

  public Workflow withName(String newName) {
    if (newName == null || newName.isBlank()) throw new IllegalArgumentException("name must be non-empty");
    return new Workflow(newName, duplicatePolicy, preprocessor, model, mold, fit);
  }

  public Workflow withDuplicatePolicy(DuplicatePolicy policy) {
    return new Workflow(name, policy, preprocessor, model, mold, fit);
  }

  // --- preprocessor ---

  public Workflow addFormula(String formula) {
    return addFormula(Formula.parse(formula));
  }

  public Workflow addFormula(Formula formula) {
    return addPreprocessor(new FormulaPreprocessor(formula, FormulaBlueprint.defaults(), false));
  }

  public Workflow addFormula(String formula, FormulaBlueprint blueprint) {
    return addFormula(Formula.parse(formula), blueprint);
  }

  public Workflow addFormula(Formula formula, FormulaBlueprint blueprint) {
    return addPreprocessor(new FormulaPreprocessor(formula, Objects.requireNonNull(blueprint, "blueprint"), true));
  }

  public Workflow addRecipe(Recipe recipe) {
    return addPreprocessor(new RecipePreprocessor(recipe, RecipeBlueprint.defaults(), false));
  }

  public Workflow addRecipe(Recipe recipe, RecipeBlueprint blueprint) {
    return addPreprocessor(new RecipePreprocessor(recipe, Objects.requireNonNull(blueprint, "blueprint"), true));
  }

  /** Replaces an existing formula regardless of the duplicate policy. */
  public Workflow updateFormula(String formula) {
    requireKind(PreprocessorKind.FORMULA);
    return replacePreprocessor(new FormulaPreprocessor(Formula.parse(formula), FormulaBlueprint.defaults(), false));
  }

  public Workflow updateFormula(String formula, FormulaBlueprint blueprint) {
    requireKind(PreprocessorKind.FORMULA);
    return replacePreprocessor(new FormulaPreprocessor(Formula.parse(formula), Objects.requireNonNull(blueprint, "blueprint"), true));
  }

  /** Replaces an existing recipe regardless of the duplicate policy. */
  public Workflow updateRecipe(Recipe recipe) {
    requireKind(PreprocessorKind.RECIPE);
    return replacePreprocessor(new RecipePreprocessor(recipe, RecipeBlueprint.defaults(), false));
  }

  public Workflow updateRecipe(Recipe recipe, RecipeBlueprint blueprint) {
    requireKind(PreprocessorKind.RECIPE);
    return replacePreprocessor(new RecipePreprocessor(recipe, Objects.requireNonNull(blueprint, "blueprint"), true));
  }

  public Workflow removePreprocessor() {
    if (preprocessor == null) throw new NotPresentException("The workflow does not have a preprocessor to remove.");
    return new Workflow(name, duplicatePolicy, null, model, null, null);
  }

  private Workflow addPreprocessor(Preprocessor candidate) {
    if (preprocessor != null) {
      switch (duplicatePolicy) {
        case REJECT -> throw new DuplicatePreprocessorException(preprocessor.kind(), candidate.kind());
        case REPLACE_SAME_KIND -> {
          if (preprocessor.kind() != candidate.kind()) {
            throw new DuplicatePreprocessorException(preprocessor.kind(), candidate.kind());
          }
        }
        case REPLACE -> { }
      }
    }
    return replacePreprocessor(candidate);
  }

  private Workflow replacePreprocessor(Preprocessor candidate) {
    if (mold != null) log.debug("workflow '{}': new {} preprocessor drops the mold and fit", name, candidate.kind().label());
    return new Workflow(name, duplicatePolicy, candidate, model, null, null);
  }

  private void requireKind(PreprocessorKind kind) {
    if (preprocessor == null || preprocessor.kind() != kind) {
      throw new NotPresentException("The workflow does not have a " + kind.label() + " to update.");
    }
  }

  // --- model ---

  public Workflow addModel(ModelSpec spec) {
    return addModel(spec, ModelAction.DEFAULT_ROLE);
  }

  public Workflow addModel(ModelSpec spec, String role) {
    if (model != null && duplicatePolicy == DuplicatePolicy.REJECT) throw new DuplicateModelException();
    return replaceModel(new ModelAction(spec, role));
  }

  /** Replaces an existing model regardless of the duplicate policy. */
  public Workflow updateModel(ModelSpec spec) {
    if (model == null) throw new NotPresentException("The workflow does not have a model to update.");
    return replaceModel(new ModelAction(spec, model.role()));
  }

  public Workflow removeModel() {
    if (model == null) throw new NotPresentException("The workflow does not have a model to remove.");
    return new Workflow(name, duplicatePolicy, preprocessor, null, mold, null);
  }

  private Workflow replaceModel(ModelAction action) {
    return new Workflow(name, duplicatePolicy, preprocessor, action, mold, null);
  }

  // --- fitting ---

  /** Shorthand for {@link FitOrchestrator#fit(Workflow, DataFrame)}. */
  public Workflow fit(DataFrame data) {
    return FitOrchestrator.fit(this, data);
  }

  /** Shorthand for {@link FitOrchestrator#predict(Workflow, DataFrame)}. */
  public DataFrame predict(DataFrame newData) {
    return FitOrchestrator.predict(this, newData);
  }

  Workflow withMold(Preprocessor resolved, Mold newMold) {
    if (fit != null) log.debug("workflow '{}': new mold kept the existing fit, which was trained on the previous mold", name);
    return new Workflow(name, duplicatePolicy, resolved, model, Objects.requireNonNull(newMold, "mold"), fit);
  }

  Workflow withFit(ModelFit newFit) {
    return new Workflow(name, duplicatePolicy, preprocessor, model, mold, Objects.requireNonNull(newFit, "fit"));
  }

  // --- state ---

  public String name() { return name; }
  public DuplicatePolicy duplicatePolicy() { return duplicatePolicy; }

  public Optional<Preprocessor> preprocessor() { return Optional.ofNullable(preprocessor); }
  public Optional<ModelAction> model() { return Optional.ofNullable(model); }
  public Optional<Mold> mold() { return Optional.ofNullable(mold); }
  public Optional<ModelFit> modelFit() { return Optional.ofNullable(fit); }

  public boolean hasPreprocessorFormula() {
    return preprocessor != null && preprocessor.kind() == PreprocessorKind.FORMULA;
  }

  public boolean hasPreprocessorRecipe() {
    return preprocessor != null && preprocessor.kind() == PreprocessorKind.RECIPE;
  }

  public boolean hasPreprocessor() { return preprocessor != null; }
  public boolean hasModel() { return model != null; }
  public boolean hasMold() { return mold != null; }
  public boolean hasFit() { return fit != null; }

  public FitStage stage() {
    if (fit != null) return FitStage.FITTED;
    if (mold != null) return FitStage.PREPROCESSED;
    return FitStage.EMPTY;
  }

  @Override
  public String toString() {
    return "Workflow[name=" + name
        + ", preprocessor=" + (preprocessor == null ? "none" : preprocessor.kind().label())
        + ", model=" + (model == null ? "none" : model.spec().type())
        + ", stage=" + stage() + "]";
  }
}
