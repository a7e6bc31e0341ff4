package qdot.fitting.utils;

import static org.junit.Assert.assertArrayEquals;
import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertTrue;

import org.apache.commons.math3.exception.NoDataException;
import org.junit.Test;

public class NumericUtilsTest {

  private static double[] range(int length) {
    double[] out = new double[length];
    for (int i = 0; i < length; ++i) {
      out[i] = i;
    }
    return out;
  }

  @Test
  public void percentileInterpolatesBetweenRanks() {
    assertEquals(1.75, NumericUtils.percentile(new double[]{4, 1, 3, 2}, 25), 1E-12);
    assertEquals(5.5, NumericUtils.percentile(new double[]{1, 2, 3, 4, 5, 6, 7, 8, 9, 10}, 50),
        1E-12);
    assertEquals(98., NumericUtils.percentile(range(101), 98), 1E-12);
    assertEquals(0., NumericUtils.percentile(range(101), 0), 1E-12);
  }

  @Test(expected = NoDataException.class)
  public void percentileOfNothingFails() {
    NumericUtils.percentile(new double[]{}, 50);
  }

  @Test
  public void robustRangeIgnoresOutliers() {
    double[] data = range(101);
    assertEquals(96., NumericUtils.robustRange(data), 1E-12);
    data[100] = 1E9;
    data[0] = -1E9;
    assertEquals(96., NumericUtils.robustRange(data), 1E-6);
  }

  @Test
  public void argmaxResolvesTiesToFirst() {
    assertEquals(1, NumericUtils.argmax(new double[]{1, 3, 3, 2}));
    assertEquals(0, NumericUtils.argmax(new double[]{5}));
    assertEquals(3., NumericUtils.max(new double[]{1, 3, 3, 2}), 0.);
    assertEquals(-2., NumericUtils.min(new double[]{1, -2, 3, 2}), 0.);
  }

  @Test
  public void populationStdDevNormalizesByCount() {
    assertEquals(Math.sqrt(1.25), NumericUtils.populationStdDev(new double[]{1, 2, 3, 4}),
        1E-12);
  }

  @Test
  public void trimmedMeanDropsExtremes() {
    double[] data = {100, 1, 2, 3, -100};
    assertEquals(2., NumericUtils.trimmedMean(data, 1), 1E-12);
    assertEquals(1.2, NumericUtils.trimmedMean(data, 0), 1E-12);
    // input untouched
    assertEquals(100., data[0], 0.);
  }

  @Test
  public void movingAverageFullPadsWithZeros() {
    double[] smoothed = NumericUtils.movingAverageFull(new double[]{3, 6, 9}, 3);
    assertArrayEquals(new double[]{1, 3, 6, 5, 3}, smoothed, 1E-12);
  }

  @Test
  public void reflectIndexMirrorsAboutEdges() {
    assertEquals(0, NumericUtils.reflectIndex(-1, 4));
    assertEquals(1, NumericUtils.reflectIndex(-2, 4));
    assertEquals(3, NumericUtils.reflectIndex(4, 4));
    assertEquals(2, NumericUtils.reflectIndex(5, 4));
    assertEquals(2, NumericUtils.reflectIndex(2, 4));
  }

  @Test
  public void derivativeFilterOfRampIsSlope() {
    double[] ramp = new double[100];
    for (int i = 0; i < ramp.length; ++i) {
      ramp[i] = 2. * i;
    }
    double[] filtered = NumericUtils.gaussianDerivativeFilter(ramp, 2.);
    assertEquals(ramp.length, filtered.length);
    assertEquals(2., filtered[50], 0.01);
    assertEquals(2., filtered[20], 0.01);
  }

  @Test
  public void derivativeFilterFindsStep() {
    double[] step = new double[200];
    for (int i = 100; i < step.length; ++i) {
      step[i] = 1.;
    }
    double[] filtered = NumericUtils.gaussianDerivativeFilter(step, 3.);
    int peak = NumericUtils.argmax(filtered);
    assertTrue(Math.abs(peak - 100) <= 1);
    assertTrue(filtered[peak] > 0);
    assertEquals(0., filtered[10], 1E-12);
  }

  @Test
  public void derivativeFilterWithNoWidthIsZero() {
    double[] filtered = NumericUtils.gaussianDerivativeFilter(new double[]{1, 5, 2}, 0.);
    assertArrayEquals(new double[]{0, 0, 0}, filtered, 0.);
  }

  @Test
  public void integralRepeatsLastSpacing() {
    double[] x = {0, 1, 2, 3};
    double[] y = {1, 1, 1, 1};
    assertEquals(4., NumericUtils.integral(x, y), 1E-12);
    double[] x2 = {0, 0.5, 1.5};
    double[] y2 = {2, 4, 6};
    assertEquals(2 * 0.5 + 4 * 1. + 6 * 1., NumericUtils.integral(x2, y2), 1E-12);
  }

}
