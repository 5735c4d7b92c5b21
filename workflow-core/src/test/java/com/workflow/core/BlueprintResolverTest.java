package com.workflow.core;

import com.workflow.core.mold.Formula;
import com.workflow.core.mold.FormulaBlueprint;
import com.workflow.core.mold.RecipeBlueprint;
import com.workflow.core.model.LinearRegressionSpec;
import com.workflow.core.recipe.Recipe;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

final class BlueprintResolverTest {
  private static final Formula FORMULA = Formula.parse("mpg ~ .");

  @Test
  void defaultFormulaFollowsAFactorConsumingEngine() {
    FormulaPreprocessor preprocessor = new FormulaPreprocessor(FORMULA, FormulaBlueprint.defaults(), false);

    FormulaBlueprint resolved = BlueprintResolver.resolveFormula(preprocessor, FactorModelSpec.trees());

    assertEquals(new FormulaBlueprint(false, false, false), resolved);
  }

  @Test
  void defaultFormulaFollowsTheLinearEngine() {
    FormulaPreprocessor preprocessor = new FormulaPreprocessor(FORMULA, FormulaBlueprint.defaults(), false);

    FormulaBlueprint resolved = BlueprintResolver.resolveFormula(preprocessor, LinearRegressionSpec.lm());

    assertTrue(resolved.indicators());
    assertTrue(resolved.intercept());
    assertFalse(resolved.allowNovelLevels());
  }

  @Test
  void suppliedFormulaBlueprintIsReturnedAsIs() {
    FormulaBlueprint supplied = new FormulaBlueprint(false, true, false);
    FormulaPreprocessor preprocessor = new FormulaPreprocessor(FORMULA, supplied, true);

    assertSame(supplied, BlueprintResolver.resolveFormula(preprocessor, FactorModelSpec.trees()));
    assertSame(supplied, BlueprintResolver.resolve(preprocessor, LinearRegressionSpec.lm()));
  }

  @Test
  void unknownEncodingKeepsTheDefault() {
    FormulaPreprocessor preprocessor = new FormulaPreprocessor(FORMULA, FormulaBlueprint.defaults(), false);

    assertSame(FormulaBlueprint.defaults(), BlueprintResolver.resolveFormula(preprocessor, LinearRegressionSpec.create()));
    assertSame(FormulaBlueprint.defaults(), BlueprintResolver.resolveFormula(preprocessor, null));
  }

  @Test
  void previouslyAdjustedBlueprintIsNotTheStartingPoint() {
    FormulaBlueprint adjusted = FormulaBlueprint.defaults().withIndicators(false);
    FormulaPreprocessor preprocessor = new FormulaPreprocessor(FORMULA, adjusted, false);

    assertSame(FormulaBlueprint.defaults(), BlueprintResolver.resolveFormula(preprocessor, FactorModelSpec.withoutEngine()));
    assertSame(FormulaBlueprint.defaults(), BlueprintResolver.resolveFormula(preprocessor, null));
    assertEquals(new FormulaBlueprint(true, true, false),
        BlueprintResolver.resolveFormula(preprocessor, LinearRegressionSpec.lm()));
  }

  @Test
  void recipeBlueprintIsNeverAdjusted() {
    RecipePreprocessor preprocessor = new RecipePreprocessor(Recipe.of("mpg ~ ."), RecipeBlueprint.defaults(), false);

    assertSame(RecipeBlueprint.defaults(), BlueprintResolver.resolve(preprocessor, FactorModelSpec.trees()));
    assertSame(RecipeBlueprint.defaults(), BlueprintResolver.resolve(preprocessor, LinearRegressionSpec.lm()));
  }
}
