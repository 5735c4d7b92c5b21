package com.workflow.core;

import com.workflow.core.mold.Formula;
import com.workflow.core.mold.FormulaBlueprint;

import java.util.Objects;

public record FormulaPreprocessor(Formula formula, FormulaBlueprint blueprint, boolean blueprintSupplied)
    implements Preprocessor {

  public FormulaPreprocessor {
    formula = Objects.requireNonNull(formula, "formula");
    blueprint = Objects.requireNonNull(blueprint, "blueprint");
  }

  @Override
  public PreprocessorKind kind() {
    return PreprocessorKind.FORMULA;
  }

  FormulaPreprocessor withBlueprint(FormulaBlueprint resolved) {
    return resolved == blueprint ? this : new FormulaPreprocessor(formula, resolved, blueprintSupplied);
  }
}
