package com.workflow.core.data;

import com.fasterxml.jackson.databind.MappingIterator;
import com.fasterxml.jackson.dataformat.csv.CsvMapper;
import com.fasterxml.jackson.dataformat.csv.CsvParser;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/** CSV loading for {@link DataFrame}. */
public final class DataFrames {
  private static final CsvMapper CSV_MAPPER = new CsvMapper();

  private DataFrames() {}

  public static DataFrame readCsv(Path filePath) throws IOException {
    Objects.requireNonNull(filePath, "filePath");
    try (InputStream in = Files.newInputStream(filePath)) {
      return readCsv(in);
    }
  }

  /**
   * Reads a headed CSV. A column whose every non-missing cell parses as a number becomes a
   * {@link NumericColumn} (missing cells are NaN); any other column becomes a {@link FactorColumn}.
   */
  public static DataFrame readCsv(InputStream in) throws IOException {
    Objects.requireNonNull(in, "in");
    List<String[]> rows = new ArrayList<>();
    try (MappingIterator<String[]> it = CSV_MAPPER.readerFor(String[].class)
        .with(CsvParser.Feature.WRAP_AS_ARRAY)
        .with(CsvParser.Feature.SKIP_EMPTY_LINES)
        .with(CsvParser.Feature.TRIM_SPACES)
        .readValues(in)) {
      while (it.hasNextValue()) rows.add(it.nextValue());
    }
    if (rows.isEmpty()) throw new IOException("CSV input has no header row");

    String[] header = rows.get(0);
    int rowCount = rows.size() - 1;
    List<Column> columns = new ArrayList<>(header.length);
    for (int c = 0; c < header.length; c++) {
      List<String> cells = new ArrayList<>(rowCount);
      for (int r = 1; r < rows.size(); r++) {
        String[] row = rows.get(r);
        if (row.length != header.length) {
          throw new IOException("CSV row " + r + " has " + row.length + " cells, expected " + header.length);
        }
        cells.add(row[c]);
      }
      columns.add(toColumn(header[c], cells));
    }
    return DataFrame.of(columns);
  }

  private static Column toColumn(String name, List<String> cells) {
    double[] parsed = new double[cells.size()];
    for (int i = 0; i < parsed.length; i++) {
      String cell = cells.get(i);
      if (isMissing(cell)) {
        parsed[i] = Double.NaN;
        continue;
      }
      try {
        parsed[i] = Double.parseDouble(cell);
      } catch (NumberFormatException notNumeric) {
        return FactorColumn.of(name, cells);
      }
    }
    return new NumericColumn(name, parsed);
  }

  private static boolean isMissing(String cell) {
    return cell.isEmpty() || "NA".equals(cell);
  }
}
