package com.workflow.core.model;

import com.workflow.core.data.DataFrame;

import java.util.Optional;

/** Untrained, engine-tagged description of a model. Implementations must be immutable. */
public interface ModelSpec {
  /** Model family, e.g. {@code linear_reg}. */
  String type();

  String mode();

  Optional<String> engine();

  /**
   * Encoding preferences for the current mode/engine combination, or empty when they are
   * not known yet (typically because no engine has been set).
   */
  default Optional<EncodingInfo> encoding() {
    return Optional.empty();
  }

  /**
   * Fits the model on encoded predictors and outcomes.
   *
   * @throws com.workflow.core.ModelFitException when the engine cannot fit this data
   */
  ModelFit fit(DataFrame predictors, DataFrame outcomes);
}
