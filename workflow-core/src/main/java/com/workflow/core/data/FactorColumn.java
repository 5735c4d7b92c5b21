package com.workflow.core.data;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Objects;
import java.util.TreeSet;

/**
 * Categorical column: each row holds an index into {@link #levels()}.
 * Levels created by {@link #of(String, List)} are sorted alphabetically.
 */
public final class FactorColumn implements Column {
  private final String name;
  private final List<String> levels;
  private final int[] codes;

  public FactorColumn(String name, List<String> levels, int[] codes) {
    this.name = Objects.requireNonNull(name, "name");
    this.levels = List.copyOf(Objects.requireNonNull(levels, "levels"));
    this.codes = Objects.requireNonNull(codes, "codes").clone();
    for (int code : this.codes) {
      if (code < 0 || code >= this.levels.size()) {
        throw new IllegalArgumentException("Factor code " + code + " out of range for column '" + name + "'");
      }
    }
  }

  public static FactorColumn of(String name, List<String> values) {
    return withLevels(name, values, new ArrayList<>(new TreeSet<>(values)));
  }

  public static FactorColumn withLevels(String name, List<String> values, List<String> levels) {
    int[] codes = new int[values.size()];
    for (int i = 0; i < codes.length; i++) {
      int code = levels.indexOf(values.get(i));
      if (code < 0) {
        throw new IllegalArgumentException("Value '" + values.get(i) + "' is not a level of column '" + name + "'");
      }
      codes[i] = code;
    }
    return new FactorColumn(name, levels, codes);
  }

  @Override public String name() { return name; }
  @Override public int size() { return codes.length; }

  public List<String> levels() { return levels; }

  public int code(int row) { return codes[row]; }

  public String get(int row) { return levels.get(codes[row]); }

  /** Row values as level labels. */
  public List<String> values() {
    List<String> out = new ArrayList<>(codes.length);
    for (int code : codes) out.add(levels.get(code));
    return out;
  }

  @Override
  public FactorColumn rename(String newName) {
    return new FactorColumn(newName, levels, codes);
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) return true;
    if (!(o instanceof FactorColumn other)) return false;
    return name.equals(other.name) && levels.equals(other.levels) && Arrays.equals(codes, other.codes);
  }

  @Override
  public int hashCode() {
    return Objects.hash(name, levels, Arrays.hashCode(codes));
  }

  @Override
  public String toString() {
    return "FactorColumn[" + name + ", levels=" + levels + ", n=" + codes.length + "]";
  }
}
