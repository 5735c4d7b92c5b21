package com.workflow.core.model;

import com.workflow.core.ModelFitException;
import com.workflow.core.data.Column;
import com.workflow.core.data.DataFrame;
import com.workflow.core.data.NumericColumn;
import com.workflow.core.mold.FormulaMolder;
import org.ejml.data.DMatrixRMaj;
import org.ejml.dense.row.factory.LinearSolverFactory_DDRM;
import org.ejml.interfaces.linsol.LinearSolverDense;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

/**
 * Linear regression. The {@code lm} engine fits ordinary least squares with an intercept
 * and needs every predictor numeric, so it asks for indicator columns.
 */
public final class LinearRegressionSpec implements ModelSpec {
  private static final Logger log = LoggerFactory.getLogger(LinearRegressionSpec.class);

  public static final String TYPE = "linear_reg";
  public static final String MODE = "regression";
  public static final Set<String> ENGINES = Set.of("lm");

  private static final double SINGULAR_QUALITY = 1e-12;

  private final String engine;

  private LinearRegressionSpec(String engine) {
    this.engine = engine;
  }

  /** A spec without an engine; its encoding is unknown until {@link #withEngine} is called. */
  public static LinearRegressionSpec create() {
    return new LinearRegressionSpec(null);
  }

  public static LinearRegressionSpec lm() {
    return create().withEngine("lm");
  }

  public LinearRegressionSpec withEngine(String engine) {
    Objects.requireNonNull(engine, "engine");
    if (!ENGINES.contains(engine)) {
      throw new IllegalArgumentException("Engine '" + engine + "' is not available for " + TYPE + "; known engines: " + ENGINES);
    }
    return new LinearRegressionSpec(engine);
  }

  @Override public String type() { return TYPE; }
  @Override public String mode() { return MODE; }
  @Override public Optional<String> engine() { return Optional.ofNullable(engine); }

  @Override
  public Optional<EncodingInfo> encoding() {
    return engine == null ? Optional.empty() : Optional.of(EncodingInfo.INDICATORS_WITH_INTERCEPT);
  }

  @Override
  public LinearModelFit fit(DataFrame predictors, DataFrame outcomes) {
    Objects.requireNonNull(predictors, "predictors");
    Objects.requireNonNull(outcomes, "outcomes");
    if (engine == null) {
      throw new ModelFitException("No engine has been set for " + TYPE + ".");
    }
    if (outcomes.columnCount() != 1 || !(outcomes.columns().get(0) instanceof NumericColumn y)) {
      throw new ModelFitException("The `lm` engine needs exactly one numeric outcome; got " + outcomes.names() + ".");
    }

    List<NumericColumn> columns = new ArrayList<>();
    for (Column column : predictors.columns()) {
      if (FormulaMolder.INTERCEPT.equals(column.name())) continue;
      if (!(column instanceof NumericColumn numeric)) {
        throw new ModelFitException("The `lm` engine needs numeric predictors; column '" + column.name() + "' is a factor.");
      }
      columns.add(numeric);
    }

    requireFinite(y);
    for (NumericColumn column : columns) requireFinite(column);

    int n = y.size();
    int p = columns.size() + 1;
    if (n < p) {
      throw new ModelFitException("The `lm` engine needs at least " + p + " rows; got " + n + ".");
    }

    DMatrixRMaj x = new DMatrixRMaj(n, p);
    DMatrixRMaj b = new DMatrixRMaj(n, 1);
    for (int row = 0; row < n; row++) {
      x.set(row, 0, 1.0);
      for (int c = 0; c < columns.size(); c++) x.set(row, c + 1, columns.get(c).get(row));
      b.set(row, 0, y.get(row));
    }

    LinearSolverDense<DMatrixRMaj> solver = LinearSolverFactory_DDRM.leastSquares(n, p);
    if (!solver.setA(x) || solver.quality() < SINGULAR_QUALITY) {
      throw new ModelFitException("The design matrix is singular; check for constant or collinear predictors.");
    }
    DMatrixRMaj beta = new DMatrixRMaj(p, 1);
    solver.solve(b, beta);

    List<String> terms = new ArrayList<>(p);
    terms.add(FormulaMolder.INTERCEPT);
    double[] coefficients = new double[p];
    coefficients[0] = beta.get(0, 0);
    for (int c = 0; c < columns.size(); c++) {
      terms.add(columns.get(c).name());
      coefficients[c + 1] = beta.get(c + 1, 0);
    }
    log.debug("lm fit on {} rows, {} coefficients", n, p);
    return new LinearModelFit(this, terms, coefficients);
  }

  private static void requireFinite(NumericColumn column) {
    for (int row = 0; row < column.size(); row++) {
      if (!Double.isFinite(column.get(row))) {
        throw new ModelFitException("The `lm` engine needs complete data; column '" + column.name()
            + "' has a missing or non-finite value in row " + (row + 1) + ".");
      }
    }
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) return true;
    if (!(o instanceof LinearRegressionSpec other)) return false;
    return Objects.equals(engine, other.engine);
  }

  @Override
  public int hashCode() {
    return Objects.hash(TYPE, engine);
  }

  @Override
  public String toString() {
    return "LinearRegressionSpec[mode=" + MODE + ", engine=" + engine + "]";
  }
}
