package qdot.fitting.utils;

import java.text.DecimalFormat;
import java.text.DecimalFormatSymbols;
import java.util.Arrays;
import org.apache.commons.math3.exception.NoDataException;
import org.apache.commons.math3.stat.descriptive.moment.StandardDeviation;
import org.apache.commons.math3.stat.descriptive.rank.Percentile;
import org.apache.commons.math3.stat.descriptive.rank.Percentile.EstimationType;

/**
 * Class containing methods to serve as math functions for the initial-guess heuristics:
 * robust range estimates (percentiles, trimmed means), smoothing, and the discrete integral and
 * derivative operations used to estimate peak widths and step locations.
 *
 * @author akearns
 */
public class NumericUtils {

  /**
   * 2 * Pi, sometimes also referred to as Tau.
   * The number of radians in a full circle.
   */
  public final static double TAU = Math.PI * 2; // radians in full circle

  /**
   * Multiple of the filter width beyond which the Gaussian kernel is cut off
   */
  private static final double KERNEL_TRUNCATE = 4.0;

  public static final ThreadLocal<DecimalFormat> DECIMAL_FORMAT =
      ThreadLocal.withInitial(() -> {
        DecimalFormat format = new DecimalFormat("#.####");
        setInfinityPrintable(format);
        return format;
      });

  /**
   * Get the percentile of a dataset, linearly interpolating between the closest ranks
   * (this is the R-7 estimator, the same one used by numpy's default percentile method).
   *
   * @param data Data to get the percentile value of; not modified
   * @param percent Percentile to get, in the range (0, 100]
   * @return Interpolated percentile value
   */
  public static double percentile(double[] data, double percent) {
    if (data.length == 0) {
      throw new NoDataException();
    }
    if (percent <= 0.) {
      return Arrays.stream(data).min().getAsDouble();
    }
    return new Percentile().withEstimationType(EstimationType.R_7).evaluate(data, percent);
  }

  /**
   * Robust estimate of the range of the data, insensitive to outliers at either extreme
   *
   * @param data Data to get range of
   * @return Difference between 98th and 2nd percentiles
   */
  public static double robustRange(double[] data) {
    return percentile(data, 98) - percentile(data, 2);
  }

  /**
   * Get the index of the (first) largest value in an array
   *
   * @param data Array to search
   * @return Index of the maximum; ties resolve to the lowest index
   */
  public static int argmax(double[] data) {
    if (data.length == 0) {
      throw new NoDataException();
    }
    int maxIdx = 0;
    for (int i = 1; i < data.length; ++i) {
      if (data[i] > data[maxIdx]) {
        maxIdx = i;
      }
    }
    return maxIdx;
  }

  public static double max(double[] data) {
    return data[argmax(data)];
  }

  public static double min(double[] data) {
    if (data.length == 0) {
      throw new NoDataException();
    }
    double min = data[0];
    for (double value : data) {
      min = Math.min(min, value);
    }
    return min;
  }

  /**
   * Population standard deviation (normalized by N, not N - 1)
   *
   * @param data Data to get the deviation of
   * @return standard deviation of the data
   */
  public static double populationStdDev(double[] data) {
    return new StandardDeviation(false).evaluate(data);
  }

  /**
   * Mean of a dataset after sorting and discarding a number of values at each end
   *
   * @param data Data to get the trimmed mean of; not modified
   * @param cut Number of data points to drop from each end of the sorted data
   * @return Mean of the inner portion of the sorted data
   */
  public static double trimmedMean(double[] data, int cut) {
    double[] sorted = data.clone();
    Arrays.sort(sorted);
    return TimeSeriesUtils.getMean(Arrays.copyOfRange(sorted, cut, sorted.length - cut));
  }

  /**
   * Perform a moving average on real-val. data as a full discrete convolution with a flat window.
   * The output is longer than the input by (points - 1) entries; points past either end of the
   * data are treated as zero, which is why the ends of the result taper off.
   *
   * @param nums Numeric data to be smoothed by use of moving average
   * @param points Number of points to include in moving average
   * @return Smoothed data, of length nums.length + points - 1
   */
  public static double[] movingAverageFull(double[] nums, int points) {
    if (nums.length == 0) {
      return new double[]{};
    }
    double[] out = new double[nums.length + points - 1];
    for (int i = 0; i < out.length; ++i) {
      double sum = 0.;
      for (int j = Math.max(0, i - points + 1); j <= Math.min(i, nums.length - 1); ++j) {
        sum += nums[j];
      }
      out[i] = sum / points;
    }
    return out;
  }

  /**
   * Filter data with the first derivative of a Gaussian kernel. The result approximates the
   * derivative (per sample) of a smoothed version of the data. The kernel is truncated at four
   * filter widths and the data is mirrored at both borders (edge sample repeated).
   *
   * @param data Data to be filtered
   * @param sigma Width of the Gaussian in samples; a non-positive width gives a zero result
   * @return Derivative-filtered data of the same length as the input
   */
  public static double[] gaussianDerivativeFilter(double[] data, double sigma) {
    double[] out = new double[data.length];
    if (sigma <= 0 || data.length == 0) {
      return out;
    }
    int radius = (int) (KERNEL_TRUNCATE * sigma + 0.5);
    double[] kernel = new double[2 * radius + 1];
    double norm = 0.;
    for (int k = -radius; k <= radius; ++k) {
      double phi = Math.exp(-0.5 * k * k / (sigma * sigma));
      kernel[k + radius] = phi;
      norm += phi;
    }
    for (int k = -radius; k <= radius; ++k) {
      // d/dk of the normalized Gaussian
      kernel[k + radius] = -k / (sigma * sigma) * kernel[k + radius] / norm;
    }

    for (int i = 0; i < data.length; ++i) {
      double sum = 0.;
      for (int k = -radius; k <= radius; ++k) {
        sum += kernel[k + radius] * data[reflectIndex(i - k, data.length)];
      }
      out[i] = sum;
    }
    return out;
  }

  /**
   * Map an index outside of an array back inside it by mirroring about the array edges,
   * where the edge sample is repeated (i.e., d c b a | a b c d | d c b a)
   *
   * @param idx Index that may be out of bounds
   * @param length Length of the array
   * @return Valid index into the array
   */
  static int reflectIndex(int idx, int length) {
    int period = 2 * length;
    idx = ((idx % period) + period) % period;
    if (idx >= length) {
      idx = period - idx - 1;
    }
    return idx;
  }

  /**
   * Numerical integral of sampled data as the sum of each sample times the spacing to the next
   * sample (the last spacing is repeated for the final sample)
   *
   * @param x Independent variable, at least one sample
   * @param y Dependent variable
   * @return Approximation of the integral of y over x
   */
  public static double integral(double[] x, double[] y) {
    if (x.length < 2) {
      return 0.;
    }
    double sum = 0.;
    for (int i = 0; i < x.length; ++i) {
      double dx;
      if (i < x.length - 1) {
        dx = x[i + 1] - x[i];
      } else {
        dx = x[i] - x[i - 1];
      }
      sum += dx * y[i];
    }
    return sum;
  }

  /**
   * Sets decimalformat object so that infinity can be printed in a report
   *
   * @param df DecimalFormat object to change the infinity symbol value of
   */
  public static void setInfinityPrintable(DecimalFormat df) {
    DecimalFormatSymbols symbols = df.getDecimalFormatSymbols();
    symbols.setInfinity("Inf.");
    df.setDecimalFormatSymbols(symbols);
  }

}
