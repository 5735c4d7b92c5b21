package com.workflow.core.model;

/**
 * Encoding preferences a model engine declares for formula preprocessing.
 *
 * @param predictorIndicators whether factor predictors must be expanded into indicator columns;
 *                            {@code false} for engines that consume factors directly
 * @param computeIntercept    whether predictors are encoded as if an intercept were present, so
 *                            each factor drops its first level; the engine fits its own intercept
 */
public record EncodingInfo(boolean predictorIndicators, boolean computeIntercept) {
  public static final EncodingInfo INDICATORS_WITH_INTERCEPT = new EncodingInfo(true, true);
  public static final EncodingInfo NO_INDICATORS = new EncodingInfo(false, false);
}
