package qdot.fitting.utils;

import java.util.Arrays;

/**
 * Contains static methods for basic operations on sampled series: mean removal, first
 * differences, spacing of the independent variable, and slicing/concatenation of windows.
 * None of the methods here modify their inputs unless stated (i.e., demeanInPlace).
 *
 * @author akearns - KBRWyle
 */
public class TimeSeriesUtils {

  /**
   * Merge arrays from multiple series into a single object
   *
   * @param arrs Series of arrays
   * @return All inputted arrays concatenated into a single array (can be specified as a 2D array)
   */
  public static double[] concatAll(double[]... arrs) {

    if (arrs.length == 0) {
      return new double[]{};
    }

    if (arrs.length == 1) {
      return arrs[0].clone();
    }

    int len = 0;
    for (double[] arr : arrs) {
      len += arr.length;
    }

    double[] result = new double[len];
    int start = 0;
    for (double[] arr : arrs) {
      if (arr.length == 0) {
        continue;
      }
      int end = arr.length;
      System.arraycopy(arr, 0, result, start, end);
      start += end;
    }

    return result;
  }

  /**
   * Remove mean (constant value) from a dataset
   *
   * @return series with previous mean subtracted
   */
  public static double[] demean(double[] dataSet) {
    double[] dataOut = dataSet.clone();
    TimeSeriesUtils.demeanInPlace(dataOut);
    return dataOut;
  }

  /**
   * In-place subtraction of mean from each point in an incoming data set.
   *
   * @param dataSet The data to have the mean removed from.
   */
  public static void demeanInPlace(double[] dataSet) {

    if (dataSet.length == 0) {
      return; // shouldn't happen but just in case
    }

    double mean = getMean(dataSet);

    for (int i = 0; i < dataSet.length; ++i) {
      dataSet[i] -= mean;
    }
  }

  /**
   * First differences of a series (output has one fewer point than the input)
   *
   * @param data Series to take differences of
   * @return data[i + 1] - data[i] for each consecutive pair
   */
  public static double[] diff(double[] data) {
    if (data.length < 2) {
      return new double[]{};
    }
    double[] out = new double[data.length - 1];
    for (int i = 0; i < out.length; ++i) {
      out[i] = data[i + 1] - data[i];
    }
    return out;
  }

  /**
   * Return the calculation of the arithmetic mean (using a recursive definition for stability)
   *
   * @param dataSet Range of data to get the mean value from
   * @return the arithmetic mean, or NaN for an empty array
   */
  public static double getMean(double[] dataSet) {
    if (dataSet.length == 0) {
      return Double.NaN;
    }

    double mean = 0.0;
    double inc = 1;

    for (double data : dataSet) {
      mean = mean + ((data - mean) / inc);
      ++inc;
    }
    return mean;
  }

  /**
   * Mean distance between consecutive samples of the independent variable
   *
   * @param x Independent variable values (at least two)
   * @return Mean sample spacing
   */
  public static double getMeanSpacing(double[] x) {
    return getMean(diff(x));
  }

  /**
   * First points of a series (or the whole series, if it is shorter than the count)
   *
   * @param data Series to take data from
   * @param count Number of points to take
   * @return Copy of the first count points
   */
  public static double[] head(double[] data, int count) {
    return Arrays.copyOfRange(data, 0, Math.min(count, data.length));
  }

  /**
   * Last points of a series (or the whole series, if it is shorter than the count)
   *
   * @param data Series to take data from
   * @param count Number of points to take
   * @return Copy of the last count points
   */
  public static double[] tail(double[] data, int count) {
    return Arrays.copyOfRange(data, Math.max(0, data.length - count), data.length);
  }

}
