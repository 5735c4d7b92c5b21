package com.workflow.core.recipe;

import com.workflow.core.PreprocessingException;
import com.workflow.core.data.DataFrame;
import com.workflow.core.mold.Formula;
import com.workflow.core.mold.Term;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Multi-step preprocessing definition. The formula only assigns roles (outcome vs predictor);
 * transformations are expressed as {@link RecipeStep}s, applied in the order they were added.
 */
public final class Recipe {
  private static final Logger log = LoggerFactory.getLogger(Recipe.class);

  private final Formula formula;
  private final List<RecipeStep> steps;

  private Recipe(Formula formula, List<RecipeStep> steps) {
    this.formula = formula;
    this.steps = List.copyOf(steps);
  }

  public static Recipe of(String formula) {
    return of(Formula.parse(formula));
  }

  public static Recipe of(Formula formula) {
    Objects.requireNonNull(formula, "formula");
    for (Term term : formula.terms()) {
      if (term.function() != null) {
        throw new IllegalArgumentException("Recipe formulas only assign roles; use a step instead of '"
            + term.label() + "'");
      }
    }
    return new Recipe(formula, List.of());
  }

  /** Builds a recipe and checks its roles against a template of the training data. */
  public static Recipe of(String formula, DataFrame template) {
    Recipe recipe = of(formula);
    recipe.roles(Objects.requireNonNull(template, "template"));
    return recipe;
  }

  public Recipe addStep(RecipeStep step) {
    List<RecipeStep> next = new ArrayList<>(steps);
    next.add(Objects.requireNonNull(step, "step"));
    return new Recipe(formula, next);
  }

  public Formula formula() { return formula; }
  public List<RecipeStep> steps() { return steps; }

  public PreppedRecipe prep(DataFrame training) {
    Objects.requireNonNull(training, "training");
    Roles roles = roles(training);

    List<String> keep = new ArrayList<>();
    for (String name : training.names()) {
      if (roles.outcomes().contains(name) || roles.predictors().contains(name)) keep.add(name);
    }
    DataFrame current = training.select(keep);
    List<TrainedStep> trained = new ArrayList<>(steps.size());
    for (RecipeStep step : steps) {
      TrainedStep t = Objects.requireNonNull(step.prep(current), "prep() returned null for step " + step.name());
      current = Objects.requireNonNull(t.bake(current), "bake() returned null for step " + step.name());
      trained.add(t);
      log.debug("prepped step '{}' on {} rows", step.name(), current.rowCount());
    }
    return new PreppedRecipe(this, roles.outcomes(), roles.predictors(), trained);
  }

  private Roles roles(DataFrame data) {
    List<String> outcomes = new ArrayList<>();
    for (String name : formula.outcomes()) {
      if (!data.hasColumn(name)) {
        throw new PreprocessingException("Recipe outcome '" + name + "' does not match a column in the data.");
      }
      outcomes.add(name);
    }
    List<String> predictors = new ArrayList<>();
    for (Term term : formula.terms()) {
      if (term.isDot()) {
        for (String name : data.names()) {
          if (!outcomes.contains(name) && !predictors.contains(name)) predictors.add(name);
        }
        continue;
      }
      if (!data.hasColumn(term.column())) {
        throw new PreprocessingException("Recipe predictor '" + term.column() + "' does not match a column in the data.");
      }
      if (!predictors.contains(term.column())) predictors.add(term.column());
    }
    return new Roles(outcomes, predictors);
  }

  @Override
  public String toString() {
    return "Recipe[" + formula + ", steps=" + steps.size() + "]";
  }

  private record Roles(List<String> outcomes, List<String> predictors) {}
}
