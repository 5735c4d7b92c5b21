package com.workflow.core;

import com.workflow.core.data.DataFrame;
import com.workflow.core.model.LinearRegressionSpec;
import com.workflow.core.recipe.CenterStep;
import com.workflow.core.recipe.PreppedRecipe;
import com.workflow.core.recipe.Recipe;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

final class WorkflowExtractorsTest {

  @Test
  void pullingMissingElementsExplainsWhatIsMissing() {
    Workflow empty = Workflow.empty();

    assertEquals("The workflow does not have a preprocessor.",
        assertThrows(NotPresentException.class, () -> WorkflowExtractors.pullPreprocessor(empty)).getMessage());
    assertEquals("The workflow does not have a model spec.",
        assertThrows(NotPresentException.class, () -> WorkflowExtractors.pullSpec(empty)).getMessage());
    assertEquals("The workflow does not have a model fit. Have you called `fit()` yet?",
        assertThrows(NotPresentException.class, () -> WorkflowExtractors.pullFit(empty)).getMessage());
    assertEquals("The workflow does not have a mold. Have you called `fit()` yet?",
        assertThrows(NotPresentException.class, () -> WorkflowExtractors.pullMold(empty)).getMessage());
  }

  @Test
  void pullSpecReturnsTheUntrainedSpec() {
    Workflow workflow = Workflow.empty().addModel(LinearRegressionSpec.lm());

    assertEquals(LinearRegressionSpec.lm(), WorkflowExtractors.pullSpec(workflow));
  }

  @Test
  void preppedRecipeRequiresARecipeWorkflow() {
    Workflow fitted = Workflow.empty().addFormula("mpg ~ cyl").addModel(LinearRegressionSpec.lm()).fit(TestData.mtcars());

    assertThrows(WrongPreprocessorKindException.class, () -> WorkflowExtractors.pullPreppedRecipe(fitted));
  }

  @Test
  void preppedRecipeRequiresAFit() {
    Workflow workflow = Workflow.empty().addRecipe(Recipe.of("mpg ~ cyl"));

    assertThrows(NotPresentException.class, () -> WorkflowExtractors.pullPreppedRecipe(workflow));
  }

  @Test
  void preppedRecipeBakesNewDataWithTrainingMeans() {
    DataFrame mtcars = TestData.mtcars();
    Recipe recipe = Recipe.of("mpg ~ cyl + wt", mtcars).addStep(new CenterStep(List.of("wt")));
    Workflow fitted = Workflow.empty().addRecipe(recipe).addModel(LinearRegressionSpec.lm()).fit(mtcars);

    PreppedRecipe prepped = WorkflowExtractors.pullPreppedRecipe(fitted);

    assertEquals(List.of("mpg"), prepped.outcomes());
    assertEquals(List.of("cyl", "wt"), prepped.predictors());
    DataFrame baked = prepped.bake(mtcars);
    double sum = 0;
    for (double v : baked.numeric("wt").values()) sum += v;
    assertEquals(0.0, sum, 1e-9);
    assertEquals(mtcars.numeric("cyl"), baked.numeric("cyl"));
    assertFalse(baked.hasColumn("disp"));
  }
}
