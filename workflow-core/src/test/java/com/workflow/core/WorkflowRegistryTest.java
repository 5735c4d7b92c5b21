package com.workflow.core;

import com.workflow.core.model.LinearRegressionSpec;
import com.workflow.core.model.ModelSpec;
import com.workflow.core.recipe.CenterStep;
import com.workflow.core.recipe.RecipeStep;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

final class WorkflowRegistryTest {

  @Test
  void linearRegressionIsRegisteredByDefault() {
    WorkflowRegistry registry = new WorkflowRegistry();

    assertTrue(registry.hasModel("linear_reg"));
    assertEquals(LinearRegressionSpec.lm(), registry.createModel("linear_reg", "lm", "regression"));
    assertEquals(LinearRegressionSpec.create(), registry.createModel("linear_reg", null, null));
  }

  @Test
  void wrongModeIsRejected() {
    WorkflowRegistry registry = new WorkflowRegistry();

    assertThrows(IllegalArgumentException.class, () -> registry.createModel("linear_reg", "lm", "classification"));
  }

  @Test
  void unknownNamesAreRejected() {
    WorkflowRegistry registry = new WorkflowRegistry();

    assertEquals("Unknown model type: boost_tree",
        assertThrows(IllegalArgumentException.class, () -> registry.createModel("boost_tree", null, null)).getMessage());
    assertEquals("Unknown recipe step: center",
        assertThrows(IllegalArgumentException.class, () -> registry.createStep("center", List.of())).getMessage());
  }

  @Test
  void customModelsAndStepsCanBeRegistered() {
    WorkflowRegistry registry = new WorkflowRegistry();
    registry.registerModel("rand_forest", (engine, mode) -> engine == null ? FactorModelSpec.withoutEngine() : FactorModelSpec.trees());
    registry.registerStep("center", CenterStep::new);

    ModelSpec spec = registry.createModel("rand_forest", "trees", null);
    RecipeStep step = registry.createStep("center", List.of("wt"));

    assertEquals("trees", spec.engine().orElseThrow());
    assertEquals("center", step.name());
    assertTrue(registry.hasStep("center"));
  }
}
