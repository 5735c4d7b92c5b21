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

final class Levels {
  static final String NOVEL_LEVEL = "new";

  private Levels() {}

  static Map<String, List<String>> of(DataFrame predictors) {
    Map<String, List<String>> levels = new LinkedHashMap<>();
    for (Column column : predictors.columns()) {
      if (column instanceof FactorColumn factor) levels.put(factor.name(), factor.levels());
    }
    return levels;
  }

  /** Re-codes {@code factor} against the training levels, routing unseen values to {@value #NOVEL_LEVEL} if allowed. */
  static FactorColumn align(FactorColumn factor, List<String> trained, boolean allowNovelLevels) {
    if (factor.levels().equals(trained)) return factor;
    List<String> values = factor.values();
    List<String> levels = new ArrayList<>(trained);
    List<String> novel = new ArrayList<>();
    for (int i = 0; i < values.size(); i++) {
      String value = values.get(i);
      if (trained.contains(value)) continue;
      if (!novel.contains(value)) novel.add(value);
      values.set(i, NOVEL_LEVEL);
    }
    if (!novel.isEmpty()) {
      if (!allowNovelLevels) {
        throw new PreprocessingException("Novel levels found in column '" + factor.name() + "': " + novel + ".");
      }
      if (!levels.contains(NOVEL_LEVEL)) levels.add(NOVEL_LEVEL);
    }
    return FactorColumn.withLevels(factor.name(), values, levels);
  }

  /** Checks forged predictors against the training factor levels. */
  static DataFrame alignAll(DataFrame predictors, Map<String, List<String>> trained, boolean allowNovelLevels) {
    DataFrame out = predictors;
    for (Map.Entry<String, List<String>> entry : trained.entrySet()) {
      if (!predictors.hasColumn(entry.getKey())) continue;
      Column column = predictors.column(entry.getKey());
      if (column instanceof NumericColumn) {
        throw new PreprocessingException("Column '" + entry.getKey() + "' was a factor at fit time but is numeric.");
      }
      out = out.withColumn(align((FactorColumn) column, entry.getValue(), allowNovelLevels));
    }
    return out;
  }
}
