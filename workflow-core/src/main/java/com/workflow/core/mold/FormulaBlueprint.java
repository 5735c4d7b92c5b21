package com.workflow.core.mold;

/**
 * Blueprint for formula preprocessing.
 *
 * @param indicators expand factor predictors into one numeric indicator column per level
 */
public record FormulaBlueprint(boolean intercept, boolean indicators, boolean allowNovelLevels) implements Blueprint {
  private static final FormulaBlueprint DEFAULTS = new FormulaBlueprint(false, true, false);

  public static FormulaBlueprint defaults() {
    return DEFAULTS;
  }

  public FormulaBlueprint withIndicators(boolean value) {
    return value == indicators ? this : new FormulaBlueprint(intercept, value, allowNovelLevels);
  }

  public FormulaBlueprint withIntercept(boolean value) {
    return value == intercept ? this : new FormulaBlueprint(value, indicators, allowNovelLevels);
  }
}
