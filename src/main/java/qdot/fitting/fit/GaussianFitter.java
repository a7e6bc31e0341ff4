package qdot.fitting.fit;

import java.util.Collections;
import java.util.List;
import qdot.fitting.input.Configuration;
import qdot.fitting.input.SampleSeries;
import qdot.fitting.model.GaussianModel;
import qdot.fitting.output.FitResult;
import qdot.fitting.solver.CurveSolver;
import qdot.fitting.solver.LevenbergMarquardtSolver;
import qdot.fitting.solver.ParameterBound;
import qdot.fitting.utils.NumericUtils;

/**
 * Fits a single Gaussian peak, optionally on a constant offset.
 *
 * @see GaussianModel
 */
public class GaussianFitter extends ModelFitter {

  private static final List<ParameterBound> BOUNDS =
      Collections.singletonList(ParameterBound.atLeast(GaussianModel.AMPLITUDE, 0.));

  public GaussianFitter() {
    this(Configuration.getInstance());
  }

  public GaussianFitter(Configuration config) {
    this(config, new LevenbergMarquardtSolver(config));
  }

  public GaussianFitter(Configuration config, CurveSolver solver) {
    super(config, solver);
  }

  /**
   * Initial guess of Gaussian parameters. The width is a twentieth of the robust range of x,
   * the mean is the x value of the (first) highest sample, and the offset is the lowest sample.
   * A constant signal gives an amplitude of 0 when the offset is included.
   *
   * @param x Independent variable
   * @param y Signal
   * @param includeOffset True if the guess should include the offset parameter
   * @return [mean, sigma, amplitude, offset] or [mean, sigma, amplitude]
   */
  public static double[] estimate(double[] x, double[] y, boolean includeOffset) {
    double max = NumericUtils.max(y);
    double min = NumericUtils.min(y);
    double sigma = NumericUtils.robustRange(x) / 20;
    double mean = x[NumericUtils.argmax(y)];
    if (includeOffset) {
      return new double[]{mean, sigma, max - min, min};
    }
    return new double[]{mean, sigma, max};
  }

  public static double[] estimate(SampleSeries series, boolean includeOffset) {
    return estimate(series.getX(), series.getY(), includeOffset);
  }

  @Override
  public int minimumSize() {
    return 4;
  }

  /**
   * Fit a Gaussian with offset from an estimated initial guess
   *
   * @param series Data to fit
   * @return Result of the fit
   */
  public FitResult fit(SampleSeries series) {
    return fit(series, null, true);
  }

  /**
   * Fit a Gaussian from a given initial guess. Whether the offset is fit follows from the
   * length of the guess.
   *
   * @param series Data to fit
   * @param initial [mean, sigma, amplitude, offset] or [mean, sigma, amplitude]
   * @return Result of the fit
   */
  public FitResult fit(SampleSeries series, double[] initial) {
    return fit(series, initial, initial.length == 4);
  }

  /**
   * @param series Data to fit
   * @param initial Initial guess, or null to estimate one
   * @param includeOffset True if a constant offset is part of the model
   * @return Result of the fit
   */
  public FitResult fit(SampleSeries series, double[] initial, boolean includeOffset) {
    series.requireMinimumSize(minimumSize());
    if (initial == null) {
      initial = estimate(series, includeOffset);
    }
    return runFit(new GaussianModel(includeOffset), series, initial, BOUNDS);
  }
}
