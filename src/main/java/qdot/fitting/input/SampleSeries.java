package qdot.fitting.input;

import java.util.Arrays;
import org.apache.commons.math3.exception.DimensionMismatchException;
import org.apache.commons.math3.exception.NoDataException;
import org.apache.commons.math3.exception.NumberIsTooSmallException;
import org.apache.commons.math3.exception.util.LocalizedFormats;
import org.apache.commons.math3.util.MathArrays;
import org.apache.commons.math3.util.MathArrays.OrderDirection;
import org.jfree.data.xy.XYDataItem;
import org.jfree.data.xy.XYSeries;

/**
 * Holds a one-dimensional measurement: the independent variable (i.e., a swept gate voltage or
 * time) and the measured signal at each point. The series is immutable; arrays passed in are
 * copied on construction and accessors return copies, so estimators may freely work on the
 * data they get back.
 *
 * The independent variable must be non-decreasing. Series are checked for consistency when
 * constructed rather than when fit, so that a malformed input fails before any estimate is made.
 */
public class SampleSeries {

  private final String name;
  private final double[] xData;
  private final double[] yData;

  /**
   * Create a new series from x and y data
   *
   * @param name Name of the series, used to label plots
   * @param xData Independent variable, non-decreasing
   * @param yData Dependent variable, same length as xData
   * @throws DimensionMismatchException if the arrays differ in length
   * @throws NoDataException if the arrays are empty
   * @throws org.apache.commons.math3.exception.NonMonotonicSequenceException if x decreases
   */
  public SampleSeries(String name, double[] xData, double[] yData) {
    if (xData.length != yData.length) {
      throw new DimensionMismatchException(yData.length, xData.length);
    }
    if (xData.length == 0) {
      throw new NoDataException();
    }
    MathArrays.checkOrder(xData, OrderDirection.INCREASING, false);
    this.name = name;
    this.xData = xData.clone();
    this.yData = yData.clone();
  }

  public SampleSeries(double[] xData, double[] yData) {
    this("data", xData, yData);
  }

  /**
   * Convert a plottable dataset series (x values in the series' order) into a sample series
   *
   * @param series JFreeChart series; should be sorted by x, as is the default for XYSeries
   * @return New sample series with the same name and data
   */
  public static SampleSeries fromSeries(XYSeries series) {
    int size = series.getItemCount();
    double[] x = new double[size];
    double[] y = new double[size];
    for (int i = 0; i < size; ++i) {
      XYDataItem item = series.getDataItem(i);
      x[i] = item.getXValue();
      y[i] = item.getYValue();
    }
    return new SampleSeries(series.getKey().toString(), x, y);
  }

  public String getName() {
    return name;
  }

  /**
   * @return Copy of the independent variable data
   */
  public double[] getX() {
    return xData.clone();
  }

  /**
   * @return Copy of the dependent variable data
   */
  public double[] getY() {
    return yData.clone();
  }

  public double getX(int idx) {
    return xData[idx];
  }

  public double getY(int idx) {
    return yData[idx];
  }

  public int size() {
    return xData.length;
  }

  /**
   * Smallest value of the independent variable (the first, since x is ordered)
   *
   * @return first x value
   */
  public double getMinX() {
    return xData[0];
  }

  /**
   * Largest value of the independent variable (the last, since x is ordered)
   *
   * @return last x value
   */
  public double getMaxX() {
    return xData[xData.length - 1];
  }

  /**
   * Verify the series has enough points for a given estimator
   *
   * @param minimum Smallest allowed number of samples
   * @throws NumberIsTooSmallException if the series is shorter than the minimum
   */
  public void requireMinimumSize(int minimum) {
    if (xData.length < minimum) {
      throw new NumberIsTooSmallException(LocalizedFormats.INSUFFICIENT_DIMENSION,
          xData.length, minimum, true);
    }
  }

  /**
   * Copy of a contiguous range of the series
   *
   * @param from First index to include
   * @param to Index after the last one to include
   * @return New series over the given range
   */
  public SampleSeries subSeries(int from, int to) {
    return new SampleSeries(name,
        Arrays.copyOfRange(xData, from, to), Arrays.copyOfRange(yData, from, to));
  }

  /**
   * Copy of the series with the same number of points removed from each end
   *
   * @param cut Number of points to remove from the start and from the end
   * @return New, shorter series
   * @throws NumberIsTooSmallException if nothing would be left after trimming
   */
  public SampleSeries trimBorder(int cut) {
    requireMinimumSize(2 * cut + 1);
    return subSeries(cut, xData.length - cut);
  }

}
