package com.workflow.core.data;

import java.util.Arrays;
import java.util.Objects;

public final class NumericColumn implements Column {
  private final String name;
  private final double[] values;

  public NumericColumn(String name, double[] values) {
    this.name = Objects.requireNonNull(name, "name");
    this.values = Objects.requireNonNull(values, "values").clone();
  }

  public static NumericColumn constant(String name, int size, double value) {
    double[] filled = new double[size];
    Arrays.fill(filled, value);
    return new NumericColumn(name, filled);
  }

  @Override public String name() { return name; }
  @Override public int size() { return values.length; }

  public double get(int row) { return values[row]; }

  /** Defensive copy of the backing values. */
  public double[] values() { return values.clone(); }

  @Override
  public NumericColumn rename(String newName) {
    return new NumericColumn(newName, values);
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) return true;
    if (!(o instanceof NumericColumn other)) return false;
    return name.equals(other.name) && Arrays.equals(values, other.values);
  }

  @Override
  public int hashCode() {
    return 31 * name.hashCode() + Arrays.hashCode(values);
  }

  @Override
  public String toString() {
    return "NumericColumn[" + name + ", n=" + values.length + "]";
  }
}
