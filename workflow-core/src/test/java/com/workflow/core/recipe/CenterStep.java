package com.workflow.core.recipe;

import com.workflow.core.data.Column;
import com.workflow.core.data.DataFrame;
import com.workflow.core.data.NumericColumn;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/** Test step: subtracts the training mean from each selected numeric column. */
public final class CenterStep implements RecipeStep {
  private final List<String> columns;

  public CenterStep(List<String> columns) {
    this.columns = List.copyOf(columns);
  }

  @Override
  public String name() {
    return "center";
  }

  @Override
  public TrainedStep prep(DataFrame training) {
    List<String> targets = columns.isEmpty() ? numericNames(training) : columns;
    Map<String, Double> means = new LinkedHashMap<>();
    for (String name : targets) {
      double[] values = training.numeric(name).values();
      double sum = 0;
      for (double v : values) sum += v;
      means.put(name, sum / values.length);
    }
    return data -> {
      DataFrame out = data;
      for (Map.Entry<String, Double> mean : means.entrySet()) {
        double[] values = data.numeric(mean.getKey()).values();
        for (int i = 0; i < values.length; i++) values[i] -= mean.getValue();
        out = out.withColumn(new NumericColumn(mean.getKey(), values));
      }
      return out;
    };
  }

  private static List<String> numericNames(DataFrame data) {
    List<String> names = new ArrayList<>();
    for (Column column : data.columns()) {
      if (column instanceof NumericColumn) names.add(column.name());
    }
    return names;
  }
}
