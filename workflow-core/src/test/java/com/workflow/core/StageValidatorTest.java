package com.workflow.core;

import com.workflow.core.data.DataFrame;
import com.workflow.core.model.LinearRegressionSpec;
import com.workflow.core.recipe.Recipe;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

final class StageValidatorTest {

  @Test
  void predicatesFollowTheWorkflowState() {
    Workflow formula = Workflow.empty().addFormula("mpg ~ cyl");
    Workflow recipe = Workflow.empty().addRecipe(Recipe.of("mpg ~ cyl"));

    assertTrue(StageValidator.hasPreprocessorFormula(formula));
    assertFalse(StageValidator.hasPreprocessorRecipe(formula));
    assertTrue(StageValidator.hasPreprocessorRecipe(recipe));
    assertTrue(StageValidator.hasPreprocessor(recipe));
    assertFalse(StageValidator.hasPreprocessor(Workflow.empty()));
    assertFalse(StageValidator.hasModel(formula));
    assertFalse(StageValidator.hasMold(formula));
    assertFalse(StageValidator.hasFit(formula));
  }

  @Test
  void requirePreprocessorNamesBothKinds() {
    MissingPreprocessorException ex = assertThrows(MissingPreprocessorException.class,
        () -> StageValidator.requirePreprocessor(Workflow.empty()));

    assertEquals("The workflow must have a formula or recipe preprocessor. "
        + "Provide one with `addFormula()` or `addRecipe()`.", ex.getMessage());
  }

  @Test
  void requireModelPointsAtAddModel() {
    MissingModelException ex = assertThrows(MissingModelException.class,
        () -> StageValidator.requireModel(Workflow.empty()));

    assertEquals("The workflow must have a model. Provide one with `addModel()`.", ex.getMessage());
  }

  @Test
  void requireReturnsTheElement() {
    Workflow workflow = Workflow.empty().addFormula("mpg ~ cyl").addModel(LinearRegressionSpec.lm());

    assertEquals(PreprocessorKind.FORMULA, StageValidator.requirePreprocessor(workflow).kind());
    assertEquals(LinearRegressionSpec.lm(), StageValidator.requireModel(workflow).spec());
  }

  @Test
  void requireRecipeRejectsFormulaWorkflows() {
    WrongPreprocessorKindException ex = assertThrows(WrongPreprocessorKindException.class,
        () -> StageValidator.requireRecipePreprocessor(Workflow.empty().addFormula("mpg ~ cyl")));

    assertEquals(PreprocessorKind.RECIPE, ex.required());
    assertEquals("The workflow must have a recipe preprocessor.", ex.getMessage());
  }

  @Test
  void requireFitAsksWhetherFitWasCalled() {
    Workflow workflow = Workflow.empty().addFormula("mpg ~ cyl").addModel(LinearRegressionSpec.lm());

    NotPresentException ex = assertThrows(NotPresentException.class, () -> StageValidator.requireFit(workflow));
    assertTrue(ex.getMessage().endsWith("Have you called `fit()` yet?"));
    assertNotNull(StageValidator.requireFit(workflow.fit(TestData.mtcars())));
  }

  @Test
  void requireDataRejectsNullAndEmpty() {
    assertThrows(MissingDataException.class, () -> StageValidator.requireData(null));
    assertThrows(MissingDataException.class, () -> StageValidator.requireData(DataFrame.empty()));

    DataFrame mtcars = TestData.mtcars();
    assertSame(mtcars, StageValidator.requireData(mtcars));
  }
}
