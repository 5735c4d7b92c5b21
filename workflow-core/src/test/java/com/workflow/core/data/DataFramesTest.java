package com.workflow.core.data;

import com.workflow.core.TestData;
import org.junit.jupiter.api.Test;

import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

final class DataFramesTest {

  private static InputStream csv(String text) {
    return new ByteArrayInputStream(text.getBytes(StandardCharsets.UTF_8));
  }

  @Test
  void readsNumericAndFactorColumns() throws IOException {
    DataFrame frame = DataFrames.readCsv(csv("a,c,b\n1,2.5,x\n2,NA,y\n3,,x\n"));

    assertEquals(3, frame.rowCount());
    assertEquals(List.of("a", "c", "b"), frame.names());
    assertArrayEquals(new double[] { 1, 2, 3 }, frame.numeric("a").values());
    FactorColumn b = (FactorColumn) frame.column("b");
    assertEquals(List.of("x", "y"), b.levels());
    assertEquals(List.of("x", "y", "x"), b.values());
    assertTrue(Double.isNaN(frame.numeric("c").get(1)));
    assertTrue(Double.isNaN(frame.numeric("c").get(2)));
  }

  @Test
  void raggedRowsAreRejected() {
    IOException ex = assertThrows(IOException.class, () -> DataFrames.readCsv(csv("a,b\n1,2\n3\n")));
    assertTrue(ex.getMessage().contains("CSV row 2"));
  }

  @Test
  void emptyInputIsRejected() {
    assertThrows(IOException.class, () -> DataFrames.readCsv(csv("")));
  }

  @Test
  void fixturesLoad() {
    assertEquals(32, TestData.mtcars().rowCount());
    DataFrame iris = TestData.iris();
    assertEquals(30, iris.rowCount());
    assertEquals(List.of("setosa", "versicolor", "virginica"), ((FactorColumn) iris.column("Species")).levels());
  }

  @Test
  void selectAndDropKeepTheRowCount() {
    DataFrame mtcars = TestData.mtcars();

    assertEquals(32, mtcars.select(List.of()).rowCount());
    assertEquals(List.of("wt", "mpg"), mtcars.select(List.of("wt", "mpg")).names());
    assertEquals(List.of("mpg", "cyl"), mtcars.drop(List.of("disp", "hp", "wt")).names());
    assertThrows(IllegalArgumentException.class, () -> mtcars.select(List.of("gear")));
  }

  @Test
  void columnsMustLineUp() {
    NumericColumn three = new NumericColumn("a", new double[3]);
    NumericColumn two = new NumericColumn("b", new double[2]);

    assertThrows(IllegalArgumentException.class, () -> DataFrame.of(three, two));
    assertThrows(IllegalArgumentException.class, () -> DataFrame.of(three, three));
    assertThrows(IllegalArgumentException.class, () -> DataFrame.of(three).withColumn(two));
  }

  @Test
  void numericValuesAreCopies() {
    NumericColumn column = new NumericColumn("a", new double[] { 1, 2 });
    column.values()[0] = 99;

    assertEquals(1.0, column.get(0));
  }
}
