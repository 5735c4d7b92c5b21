package com.workflow.core.mold;

import com.workflow.core.PreprocessingException;
import com.workflow.core.data.Column;
import com.workflow.core.data.DataFrame;
import com.workflow.core.data.FactorColumn;
import com.workflow.core.data.NumericColumn;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Formula preprocessing: selects outcomes, expands the right-hand side into a predictor table
 * and, when the blueprint asks for indicators, one-hot encodes factors.
 *
 * <p>Without an intercept the first factor keeps every level and later factors drop their first
 * level; with an intercept every factor drops its first level.
 */
public final class FormulaMolder {
  public static final String INTERCEPT = "(Intercept)";

  private FormulaMolder() {}

  public static Mold mold(Formula formula, FormulaBlueprint blueprint, DataFrame data) {
    Objects.requireNonNull(formula, "formula");
    Objects.requireNonNull(blueprint, "blueprint");
    Objects.requireNonNull(data, "data");

    DataFrame outcomes = outcomes(formula, data);
    List<Term> terms = resolveTerms(formula, data);

    Map<String, List<String>> levels = new LinkedHashMap<>();
    for (Term term : terms) {
      Column column = lookup(data, term);
      if (term.function() == null && column instanceof FactorColumn factor) {
        levels.put(factor.name(), factor.levels());
      }
    }
    DataFrame predictors = encode(terms, data, blueprint, levels);
    return new Mold(predictors, outcomes, blueprint, null, terms, levels);
  }

  /** Encodes new data exactly as the training data behind {@code mold} was encoded. */
  public static DataFrame forge(Mold mold, DataFrame data) {
    Objects.requireNonNull(mold, "mold");
    Objects.requireNonNull(data, "data");
    if (!(mold.blueprint() instanceof FormulaBlueprint blueprint)) {
      throw new IllegalArgumentException("Mold was not produced by a formula preprocessor");
    }
    return encode(mold.terms(), data, blueprint, mold.factorLevels());
  }

  static DataFrame outcomes(Formula formula, DataFrame data) {
    List<Column> outcomes = new ArrayList<>(formula.outcomes().size());
    for (String name : formula.outcomes()) {
      if (!data.hasColumn(name)) {
        throw new PreprocessingException("Outcome '" + name + "' does not match a column in the data.");
      }
      outcomes.add(data.column(name));
    }
    return outcomes.isEmpty() ? data.select(List.of()) : DataFrame.of(outcomes);
  }

  static List<Term> resolveTerms(Formula formula, DataFrame data) {
    List<Term> resolved = new ArrayList<>();
    for (Term term : formula.terms()) {
      if (term.isDot()) {
        for (String name : data.names()) {
          Term column = Term.column(name);
          if (!formula.outcomes().contains(name) && !resolved.contains(column)) resolved.add(column);
        }
      } else if (!resolved.contains(term)) {
        resolved.add(term);
      }
    }
    return resolved;
  }

  private static DataFrame encode(List<Term> terms, DataFrame data, FormulaBlueprint blueprint,
                                  Map<String, List<String>> trainedLevels) {
    List<Column> out = new ArrayList<>();
    boolean fullRankSpent = blueprint.intercept();
    for (Term term : terms) {
      Column column = lookup(data, term);

      if (term.function() != null) {
        if (!(column instanceof NumericColumn numeric)) {
          throw new PreprocessingException("`" + term.function().functionName() + "()` requires a numeric column; '"
              + term.column() + "' is a factor.");
        }
        double[] values = numeric.values();
        for (int i = 0; i < values.length; i++) values[i] = term.function().apply(values[i]);
        out.add(new NumericColumn(term.label(), values));
        continue;
      }

      List<String> trained = trainedLevels.get(term.column());
      if (column instanceof NumericColumn numeric) {
        if (trained != null) {
          throw new PreprocessingException("Column '" + term.column() + "' was a factor at fit time but is numeric.");
        }
        out.add(numeric);
        continue;
      }

      FactorColumn factor = (FactorColumn) column;
      if (trained == null) {
        throw new PreprocessingException("Column '" + term.column() + "' was numeric at fit time but is a factor.");
      }
      FactorColumn aligned = Levels.align(factor, trained, blueprint.allowNovelLevels());
      if (!blueprint.indicators()) {
        out.add(aligned);
        continue;
      }
      List<String> expanded = fullRankSpent ? trained.subList(1, trained.size()) : trained;
      fullRankSpent = true;
      for (String level : expanded) {
        double[] indicator = new double[aligned.size()];
        for (int row = 0; row < indicator.length; row++) {
          indicator[row] = level.equals(aligned.get(row)) ? 1.0 : 0.0;
        }
        out.add(new NumericColumn(term.column() + level, indicator));
      }
    }

    DataFrame predictors = out.isEmpty() ? data.select(List.of()) : DataFrame.of(out);
    if (blueprint.intercept()) {
      predictors = predictors.withFirstColumn(NumericColumn.constant(INTERCEPT, data.rowCount(), 1.0));
    }
    return predictors;
  }

  private static Column lookup(DataFrame data, Term term) {
    if (!data.hasColumn(term.column())) {
      throw new PreprocessingException("Formula term '" + term.label() + "' does not match a column in the data.");
    }
    return data.column(term.column());
  }
}
