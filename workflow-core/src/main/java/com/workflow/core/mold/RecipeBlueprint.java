package com.workflow.core.mold;

/** Blueprint for recipe preprocessing. Recipes own their encoding, so there is no indicator switch. */
public record RecipeBlueprint(boolean intercept, boolean allowNovelLevels) implements Blueprint {
  private static final RecipeBlueprint DEFAULTS = new RecipeBlueprint(false, false);

  public static RecipeBlueprint defaults() {
    return DEFAULTS;
  }
}
