package com.workflow.core;

import com.workflow.core.mold.Blueprint;
import com.workflow.core.mold.FormulaBlueprint;
import com.workflow.core.mold.RecipeBlueprint;
import com.workflow.core.model.EncodingInfo;
import com.workflow.core.model.ModelSpec;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;
import java.util.Optional;

/**
 * Picks the blueprint a preprocessor is molded with. Only a default formula blueprint follows
 * the model's encoding preferences; recipes and caller-supplied blueprints come back as the
 * same instance.
 */
public final class BlueprintResolver {
  private static final Logger log = LoggerFactory.getLogger(BlueprintResolver.class);

  private BlueprintResolver() {}

  public static Blueprint resolve(Preprocessor preprocessor, ModelSpec spec) {
    Objects.requireNonNull(preprocessor, "preprocessor");
    return switch (preprocessor.kind()) {
      case FORMULA -> resolveFormula((FormulaPreprocessor) preprocessor, spec);
      case RECIPE -> resolveRecipe((RecipePreprocessor) preprocessor);
    };
  }

  /**
   * A non-supplied blueprint is always resolved from {@link FormulaBlueprint#defaults()}, never
   * from the blueprint an earlier fit left on the preprocessor.
   *
   * @param spec may be {@code null} when the workflow has no model yet
   */
  public static FormulaBlueprint resolveFormula(FormulaPreprocessor preprocessor, ModelSpec spec) {
    if (preprocessor.blueprintSupplied()) return preprocessor.blueprint();
    FormulaBlueprint blueprint = FormulaBlueprint.defaults();
    if (spec == null) return blueprint;

    Optional<EncodingInfo> encoding = spec.encoding();
    if (encoding.isEmpty()) {
      log.debug("no encoding info for {} (engine={}); keeping default blueprint", spec.type(), spec.engine().orElse("unset"));
      return blueprint;
    }
    EncodingInfo info = encoding.get();
    return blueprint.withIndicators(info.predictorIndicators()).withIntercept(info.computeIntercept());
  }

  public static RecipeBlueprint resolveRecipe(RecipePreprocessor preprocessor) {
    return preprocessor.blueprint();
  }
}
