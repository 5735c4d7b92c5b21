package com.workflow.core.data;

import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Immutable table of equally sized, uniquely named columns. Column order is preserved.
 */
public final class DataFrame {
  private static final DataFrame EMPTY = new DataFrame(new LinkedHashMap<>(), 0);

  private final Map<String, Column> columns;
  private final int rowCount;

  private DataFrame(LinkedHashMap<String, Column> columns, int rowCount) {
    this.columns = columns;
    this.rowCount = rowCount;
  }

  public static DataFrame empty() {
    return EMPTY;
  }

  public static DataFrame of(Column... columns) {
    return of(List.of(columns));
  }

  public static DataFrame of(List<? extends Column> columns) {
    Objects.requireNonNull(columns, "columns");
    if (columns.isEmpty()) return EMPTY;
    LinkedHashMap<String, Column> byName = new LinkedHashMap<>();
    int rows = columns.get(0).size();
    for (Column column : columns) {
      Objects.requireNonNull(column, "column");
      if (column.size() != rows) {
        throw new IllegalArgumentException(
            "Column '" + column.name() + "' has " + column.size() + " rows, expected " + rows);
      }
      if (byName.putIfAbsent(column.name(), column) != null) {
        throw new IllegalArgumentException("Duplicate column name: " + column.name());
      }
    }
    return new DataFrame(byName, rows);
  }

  public int rowCount() { return rowCount; }
  public int columnCount() { return columns.size(); }
  public boolean isEmpty() { return rowCount == 0; }

  public List<String> names() {
    return List.copyOf(columns.keySet());
  }

  public List<Column> columns() {
    return List.copyOf(columns.values());
  }

  public boolean hasColumn(String name) {
    return columns.containsKey(name);
  }

  public Column column(String name) {
    Column column = columns.get(name);
    if (column == null) throw new IllegalArgumentException("Unknown column: " + name);
    return column;
  }

  public NumericColumn numeric(String name) {
    Column column = column(name);
    if (!(column instanceof NumericColumn numeric)) {
      throw new IllegalArgumentException("Column '" + name + "' is not numeric");
    }
    return numeric;
  }

  public DataFrame select(Collection<String> names) {
    List<Column> picked = new ArrayList<>(names.size());
    for (String name : names) picked.add(column(name));
    return picked.isEmpty() ? emptyWithRows() : of(picked);
  }

  public DataFrame drop(Collection<String> names) {
    List<Column> kept = new ArrayList<>();
    for (Column column : columns.values()) {
      if (!names.contains(column.name())) kept.add(column);
    }
    return kept.isEmpty() ? emptyWithRows() : of(kept);
  }

  /** Replaces a column of the same name in place, or appends it. */
  public DataFrame withColumn(Column column) {
    Objects.requireNonNull(column, "column");
    if (!columns.isEmpty() && column.size() != rowCount) {
      throw new IllegalArgumentException(
          "Column '" + column.name() + "' has " + column.size() + " rows, expected " + rowCount);
    }
    LinkedHashMap<String, Column> next = new LinkedHashMap<>(columns);
    next.put(column.name(), column);
    return new DataFrame(next, column.size());
  }

  /** Prepends a column; fails if the name is taken. */
  public DataFrame withFirstColumn(Column column) {
    List<Column> all = new ArrayList<>(columns.size() + 1);
    all.add(column);
    all.addAll(columns.values());
    return of(all);
  }

  private DataFrame emptyWithRows() {
    return new DataFrame(new LinkedHashMap<>(), rowCount);
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) return true;
    if (!(o instanceof DataFrame other)) return false;
    return rowCount == other.rowCount && columns.equals(other.columns);
  }

  @Override
  public int hashCode() {
    return Objects.hash(columns, rowCount);
  }

  @Override
  public String toString() {
    return "DataFrame[rows=" + rowCount + ", columns=" + columns.keySet() + "]";
  }
}
