package com.workflow.core.model;

import com.workflow.core.ModelFitException;
import com.workflow.core.data.DataFrame;
import com.workflow.core.data.NumericColumn;

import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

public final class LinearModelFit implements ModelFit {
  private final LinearRegressionSpec spec;
  private final List<String> terms;
  private final double[] coefficients;

  LinearModelFit(LinearRegressionSpec spec, List<String> terms, double[] coefficients) {
    this.spec = Objects.requireNonNull(spec, "spec");
    this.terms = List.copyOf(terms);
    this.coefficients = coefficients.clone();
  }

  @Override
  public LinearRegressionSpec spec() { return spec; }

  /** Term names, starting with the intercept. */
  public List<String> terms() { return terms; }

  public double coefficient(String term) {
    int idx = terms.indexOf(term);
    if (idx < 0) throw new IllegalArgumentException("Unknown term: " + term);
    return coefficients[idx];
  }

  public Map<String, Double> coefficients() {
    Map<String, Double> out = new LinkedHashMap<>();
    for (int i = 0; i < terms.size(); i++) out.put(terms.get(i), coefficients[i]);
    return out;
  }

  @Override
  public double[] predict(DataFrame predictors) {
    Objects.requireNonNull(predictors, "predictors");
    double[] out = new double[predictors.rowCount()];
    Arrays.fill(out, coefficients[0]);
    for (int t = 1; t < terms.size(); t++) {
      String term = terms.get(t);
      if (!predictors.hasColumn(term) || !(predictors.column(term) instanceof NumericColumn column)) {
        throw new ModelFitException("Predictor '" + term + "' is missing or not numeric.");
      }
      for (int row = 0; row < out.length; row++) out[row] += coefficients[t] * column.get(row);
    }
    return out;
  }

  @Override
  public String toString() {
    return "LinearModelFit" + coefficients();
  }
}
