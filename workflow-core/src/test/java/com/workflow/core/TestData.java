package com.workflow.core;

import com.workflow.core.data.DataFrame;
import com.workflow.core.data.DataFrames;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;

/** Shared fixtures: mtcars and a 30-row iris sample (10 rows per species). */
public final class TestData {
  private TestData() {}

  public static DataFrame mtcars() {
    return load("/mtcars.csv");
  }

  public static DataFrame iris() {
    return load("/iris_sample.csv");
  }

  /** Intercept and slope of the simple regression of {@code y} on {@code x}. */
  public static double[] simpleOls(double[] x, double[] y) {
    double mx = 0, my = 0;
    for (int i = 0; i < x.length; i++) { mx += x[i]; my += y[i]; }
    mx /= x.length;
    my /= y.length;
    double sxy = 0, sxx = 0;
    for (int i = 0; i < x.length; i++) {
      sxy += (x[i] - mx) * (y[i] - my);
      sxx += (x[i] - mx) * (x[i] - mx);
    }
    double slope = sxy / sxx;
    return new double[] { my - slope * mx, slope };
  }

  private static DataFrame load(String resource) {
    try (InputStream in = TestData.class.getResourceAsStream(resource)) {
      if (in == null) throw new IllegalStateException("Missing test resource " + resource);
      return DataFrames.readCsv(in);
    } catch (IOException e) {
      throw new UncheckedIOException(e);
    }
  }
}
