package qdot.fitting.fit;

import static qdot.fitting.model.DoubleGaussianModel.AMPLITUDE_DN;
import static qdot.fitting.model.DoubleGaussianModel.AMPLITUDE_UP;
import static qdot.fitting.model.DoubleGaussianModel.MEAN_DN;
import static qdot.fitting.model.DoubleGaussianModel.MEAN_UP;

import java.util.Arrays;
import java.util.List;
import org.apache.log4j.Logger;
import qdot.fitting.input.Configuration;
import qdot.fitting.input.SampleSeries;
import qdot.fitting.model.DoubleGaussianModel;
import qdot.fitting.model.GaussianModel;
import qdot.fitting.output.FitResult;
import qdot.fitting.solver.CurveSolver;
import qdot.fitting.solver.LevenbergMarquardtSolver;
import qdot.fitting.solver.ParameterBound;
import qdot.fitting.utils.NumericUtils;
import qdot.fitting.utils.TimeSeriesUtils;

/**
 * Fits the sum of two Gaussians to a bimodal signal (typically a histogram of a readout signal
 * that switches between a low and a high level) and finds the value separating the two levels.
 *
 * The fitted "dn" peak always has the lower mean. Results carry the derived values
 * {@link #SEPARATION} (distance between the means in units of the summed widths) and
 * {@link #SPLIT} (the separating value), as well as both peaks as (mean, sigma, amplitude).
 *
 * @see DoubleGaussianModel
 */
public class DoubleGaussianFitter extends ModelFitter {

  private static final Logger logger = Logger.getLogger(DoubleGaussianFitter.class);

  public static final String SEPARATION = "separation";
  public static final String SPLIT = "split";

  /**
   * Fraction of the x range the peak means may lie outside of the data
   */
  private static final double MEAN_MARGIN = 0.1;

  /**
   * Half-width, in widths of the large peak, of the region excluded when searching for the
   * small peak during a refit
   */
  private static final double EXCLUSION_WIDTHS = 1.5;

  /**
   * Position of the fast-estimate means within the robust x range
   */
  private static final double FAST_MEAN_FRACTION = 0.1;

  private final DoubleGaussianModel model = new DoubleGaussianModel();
  private final GaussianFitter residualFitter;

  public DoubleGaussianFitter() {
    this(Configuration.getInstance());
  }

  public DoubleGaussianFitter(Configuration config) {
    this(config, new LevenbergMarquardtSolver(config));
  }

  public DoubleGaussianFitter(Configuration config, CurveSolver solver) {
    super(config, solver);
    residualFitter = new GaussianFitter(config, solver);
  }

  /**
   * Initial guess using the configured estimate type and an index split
   *
   * @param series Data to estimate parameters of
   * @return [A_dn, A_up, sigma_dn, sigma_up, mean_dn, mean_up]
   */
  public double[] estimate(SampleSeries series) {
    return estimate(series, config.useFastDoubleGaussianEstimate(), SplitPolicy.INDEX);
  }

  /**
   * Initial guess of the parameters of two Gaussians. The series is divided in two halves
   * (see {@link SplitPolicy}), each of which seeds one peak whose amplitude is the maximum of
   * that half.
   *
   * The fast estimate uses a twentieth of the robust x range for both widths and puts the means
   * at 10% and 90% of that range. Otherwise, each width comes from the area of the half divided
   * by amplitude * sqrt(2 pi) and each mean is the signal-weighted centroid of the half. Where
   * the amplitude or the total signal of a half is 0, the fast width or the center of the half
   * is used instead.
   *
   * @param series Data to estimate parameters of
   * @param fastEstimate True to use the fast estimate of widths and means
   * @param policy How to divide the series
   * @return [A_dn, A_up, sigma_dn, sigma_up, mean_dn, mean_up]
   */
  public static double[] estimate(SampleSeries series, boolean fastEstimate,
      SplitPolicy policy) {
    series.requireMinimumSize(4);
    double[] x = series.getX();
    double[] y = series.getY();

    double maxSignal = NumericUtils.percentile(x, 98);
    double minSignal = NumericUtils.percentile(x, 2);
    double fastSigma = (maxSignal - minSignal) / 20;

    int splitIdx = policy.splitIndex(x);
    double[] xLeft = Arrays.copyOfRange(x, 0, splitIdx);
    double[] yLeft = Arrays.copyOfRange(y, 0, splitIdx);
    double[] xRight = Arrays.copyOfRange(x, splitIdx, x.length);
    double[] yRight = Arrays.copyOfRange(y, splitIdx, y.length);

    double[] left;
    double[] right;
    if (fastEstimate) {
      double range = maxSignal - minSignal;
      left = new double[]{minSignal + FAST_MEAN_FRACTION * range, fastSigma,
          NumericUtils.max(yLeft)};
      right = new double[]{minSignal + (1 - FAST_MEAN_FRACTION) * range, fastSigma,
          NumericUtils.max(yRight)};
    } else {
      left = estimatePeak(xLeft, yLeft, fastSigma);
      right = estimatePeak(xRight, yRight, fastSigma);
    }
    return DoubleGaussianModel.fromPeaks(left, right);
  }

  /**
   * Estimate a single peak from its area and centroid
   *
   * @return (mean, sigma, amplitude)
   */
  private static double[] estimatePeak(double[] x, double[] y, double fallbackSigma) {
    double amplitude = NumericUtils.max(y);

    double sigma = fallbackSigma;
    if (amplitude != 0.) {
      sigma = NumericUtils.integral(x, y) / (Math.sqrt(NumericUtils.TAU) * amplitude);
    }

    double weight = 0.;
    double weightedSum = 0.;
    for (int i = 0; i < x.length; ++i) {
      weight += y[i];
      weightedSum += x[i] * y[i];
    }
    double mean = (x[0] + x[x.length - 1]) / 2;
    if (weight != 0.) {
      mean = weightedSum / weight;
    }
    return new double[]{mean, sigma, amplitude};
  }

  @Override
  public int minimumSize() {
    return 4;
  }

  public FitResult fit(SampleSeries series) {
    return fit(series, null);
  }

  /**
   * Fit two Gaussians to the data. Both means are kept within the x range extended by 10% on
   * either side and both amplitudes are kept non-negative. If the fitted peaks come out in the
   * wrong order, they are swapped (amplitude, width and mean together).
   *
   * @param series Data to fit
   * @param initial [A_dn, A_up, sigma_dn, sigma_up, mean_dn, mean_up], or null to estimate
   * @return Fit result with separation, split and both peaks
   */
  public FitResult fit(SampleSeries series, double[] initial) {
    series.requireMinimumSize(minimumSize());
    if (initial == null) {
      initial = estimate(series);
    }

    double deltaX = series.getMaxX() - series.getMinX();
    double lowerMean = series.getMinX() - MEAN_MARGIN * deltaX;
    double upperMean = series.getMaxX() + MEAN_MARGIN * deltaX;
    List<ParameterBound> bounds = Arrays.asList(
        ParameterBound.between(MEAN_UP, lowerMean, upperMean),
        ParameterBound.between(MEAN_DN, lowerMean, upperMean),
        ParameterBound.atLeast(AMPLITUDE_UP, 0.),
        ParameterBound.atLeast(AMPLITUDE_DN, 0.));

    FitResult result = runFit(model, series, initial, bounds);

    double[] fitted = result.getFitted();
    if (fitted[4] > fitted[5]) {
      logger.debug("Swapping fitted peaks into ascending order of mean");
      double[] covariance = result.getCovariance();
      result = result.withFitted(swapPeaks(fitted),
          covariance == null ? null : swapPeaks(covariance));
      fitted = result.getFitted();
    }

    double sigmaDn = Math.abs(fitted[2]);
    double sigmaUp = Math.abs(fitted[3]);
    double separation = (fitted[5] - fitted[4]) / (sigmaDn + sigmaUp);
    double split = fitted[4] + separation * sigmaDn;

    return result.withDerived(SEPARATION, separation).withDerived(SPLIT, split)
        .withPeaks(DoubleGaussianModel.peakDn(fitted), DoubleGaussianModel.peakUp(fitted));
  }

  private static double[] swapPeaks(double[] parameters) {
    return new double[]{parameters[1], parameters[0], parameters[3], parameters[2],
        parameters[5], parameters[4]};
  }

  public FitResult refit(FitResult result, SampleSeries series) {
    return refit(result, series, config.getAmplitudeRatioThreshold());
  }

  /**
   * Try to improve a double Gaussian fit where one peak is much smaller than the other, in which
   * case the small peak is often misplaced. The large peak is subtracted from the data, the
   * region within 1.5 widths of its center is cleared, and a Gaussian with offset is fit to the
   * remainder. The data is then fit again starting from the large peak and the newly found small
   * peak. The new result replaces the given one only if its reduced chi-squared is strictly
   * lower. A small peak of amplitude 0 always triggers the attempt.
   *
   * @param result Existing double Gaussian fit of the series
   * @param series Data that was fit
   * @param ratioThreshold Amplitude ratio above which the small peak is re-estimated
   * @return The better of the existing result and the new fit
   */
  public FitResult refit(FitResult result, SampleSeries series, double ratioThreshold) {
    double[] left = result.getLeft();
    double[] right = result.getRight();
    if (left == null || right == null) {
      throw new IllegalArgumentException("Result of a " + result.getModelName()
          + " fit has no peaks to refit");
    }
    double[] large;
    double[] small;
    if (left[2] > right[2]) {
      large = left;
      small = right;
    } else {
      large = right;
      small = left;
    }

    double ratio = large[2] / small[2];
    if (!(ratio > ratioThreshold)) {
      return result;
    }
    logger.debug("Amplitude ratio " + ratio + " exceeds " + ratioThreshold
        + ", re-estimating smaller peak");

    double[] x = series.getX();
    double[] residual = series.getY();
    double halfWidth = EXCLUSION_WIDTHS * Math.abs(large[1]);
    for (int i = 0; i < x.length; ++i) {
      residual[i] -= GaussianModel.gaussian(x[i], large[0], large[1], large[2]);
      if (x[i] > large[0] - halfWidth && x[i] < large[0] + halfWidth) {
        residual[i] = 0.;
      }
    }

    SampleSeries residualSeries = new SampleSeries(series.getName() + " residual", x, residual);
    double[] smallPeak = TimeSeriesUtils.head(residualFitter.fit(residualSeries).getFitted(), 3);

    FitResult refitted = fit(series, DoubleGaussianModel.fromPeaks(large, smallPeak));
    if (refitted.getReducedChiSquared() < result.getReducedChiSquared()) {
      return refitted;
    }
    logger.debug("Refit did not improve reduced chi-squared ("
        + refitted.getReducedChiSquared() + " vs. " + result.getReducedChiSquared()
        + "), keeping original fit");
    return result;
  }
}
