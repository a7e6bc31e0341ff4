package qdot.fitting.fit;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import org.apache.commons.math3.stat.regression.SimpleRegression;
import org.apache.log4j.Logger;
import qdot.fitting.input.Configuration;
import qdot.fitting.input.SampleSeries;
import qdot.fitting.model.FermiLinearModel;
import qdot.fitting.output.FitResult;
import qdot.fitting.solver.CurveSolver;
import qdot.fitting.solver.ParameterBound;
import qdot.fitting.utils.NumericUtils;
import qdot.fitting.utils.TimeSeriesUtils;

/**
 * Fits a Fermi step on a linear background, as seen when sweeping a gate voltage across a charge
 * addition line. The result carries the fitted step location as the derived value
 * {@link #CENTER}.
 *
 * @see FermiLinearModel
 */
public class FermiLinearFitter extends ModelFitter {

  private static final Logger logger = Logger.getLogger(FermiLinearFitter.class);

  public static final String CENTER = "center";

  static final String STEP_SIZE_ADVISORY = "step size might be incorrect";

  /**
   * Number of leading samples used for the background when the series is too short for
   * edge windows
   */
  private static final int SHORT_SERIES_SAMPLES = 100;

  private static final int MIN_EDGE_WINDOW = 4;

  /**
   * Smoothed differences are trimmed before averaging when there are more than this many
   */
  private static final int TRIM_MINIMUM = 15;

  private final FermiLinearModel model;
  private final Map<FitStrategy, CurveSolver> solvers = new EnumMap<>(FitStrategy.class);

  public FermiLinearFitter() {
    this(Configuration.getInstance());
  }

  public FermiLinearFitter(Configuration config) {
    this(config, FitStrategy.LEAST_SQUARES.createSolver(config),
        FitStrategy.CURVE_FITTER.createSolver(config));
  }

  /**
   * @param config Configuration giving the lever arm and the default strategy
   * @param leastSquaresSolver Solver used for {@link FitStrategy#LEAST_SQUARES}
   * @param curveFitterSolver Solver used for {@link FitStrategy#CURVE_FITTER}
   */
  public FermiLinearFitter(Configuration config, CurveSolver leastSquaresSolver,
      CurveSolver curveFitterSolver) {
    super(config, config.getFermiLinearStrategy() == FitStrategy.CURVE_FITTER
        ? curveFitterSolver : leastSquaresSolver);
    solvers.put(FitStrategy.LEAST_SQUARES, leastSquaresSolver);
    solvers.put(FitStrategy.CURVE_FITTER, curveFitterSolver);
    model = new FermiLinearModel(config.getLeverArm());
  }

  /**
   * @param strategy Kind of solver
   * @return Solver this fitter uses for the given strategy
   */
  public CurveSolver getSolver(FitStrategy strategy) {
    return solvers.get(strategy);
  }

  public FermiLinearModel getModel() {
    return model;
  }

  /**
   * Initial guess for a Fermi-linear fit, made in two stages.
   *
   * The background slope is the trimmed mean of the smoothed sample-to-sample differences in
   * windows of a fifth of the series at either end, divided by the mean sample spacing there.
   * The intercept makes the line pass through the means of the data. Series too short for
   * windows of at least four samples get an ordinary least-squares line through their first
   * hundred samples and a flat step instead.
   *
   * The step is found in the data with the background removed, at the peak of its
   * Gaussian-smoothed derivative; see {@link #estimateStep(double[], double[], List)}. The
   * intercept is then lowered by half the step amplitude. The temperature is a hundredth of the
   * standard deviation of x.
   *
   * @param series Data to estimate parameters of
   * @return Estimate of the linear and step parameters
   */
  public FermiLinearEstimate estimate(SampleSeries series) {
    series.requireMinimumSize(minimumSize());
    double[] x = series.getX();
    double[] y = series.getY();
    int n = x.length;
    int nx = (int) Math.ceil(n / 5.);
    List<String> advisories = new ArrayList<>();

    if (nx < MIN_EDGE_WINDOW) {
      SimpleRegression regression = new SimpleRegression();
      for (int i = 0; i < Math.min(n, SHORT_SERIES_SAMPLES); ++i) {
        regression.addData(x[i], y[i]);
      }
      double[] linear = {regression.getSlope(), regression.getIntercept()};
      double[] fermi = {TimeSeriesUtils.getMean(x), 0., NumericUtils.populationStdDev(x) / 10};
      return new FermiLinearEstimate(linear, fermi, -1, advisories);
    }

    double dx = TimeSeriesUtils.getMean(TimeSeriesUtils.concatAll(
        TimeSeriesUtils.diff(TimeSeriesUtils.head(x, nx)),
        TimeSeriesUtils.diff(TimeSeriesUtils.tail(x, nx))));
    double[] dd = TimeSeriesUtils.concatAll(
        TimeSeriesUtils.diff(TimeSeriesUtils.head(y, nx)),
        TimeSeriesUtils.diff(TimeSeriesUtils.tail(y, nx)));
    dd = NumericUtils.movingAverageFull(dd, 3);

    double slope;
    if (dd.length > TRIM_MINIMUM) {
      slope = NumericUtils.trimmedMean(dd, dd.length / 10) / dx;
    } else {
      slope = TimeSeriesUtils.getMean(dd) / dx;
    }
    double intercept = TimeSeriesUtils.getMean(y) - slope * TimeSeriesUtils.getMean(x);

    double[] linearized = new double[n];
    for (int i = 0; i < n; ++i) {
      linearized[i] = y[i] - (slope * x[i] + intercept);
    }

    double[] step = estimateStep(x, linearized, advisories);
    double center = step[0];
    double amplitude = step[1];
    int stepIndex = (int) step[2];
    double temperature = NumericUtils.populationStdDev(x) / 100;
    intercept -= amplitude / 2;

    return new FermiLinearEstimate(new double[]{slope, intercept},
        new double[]{center, amplitude, temperature}, stepIndex, advisories);
  }

  /**
   * Locate the step in data with the linear background removed. The data is filtered with the
   * derivative of a Gaussian of width n / 250 samples and the step is put at the sample with the
   * largest absolute filtered value, unless that sample is in the outer 1% of the series, in
   * which case the mean of x is used. The amplitude is the difference between the mean of the
   * data left of the middle and right of it, leaving out a tenth of the samples on either side
   * of the middle. An advisory is added if the direction of the filtered peak disagrees with the
   * sign of the amplitude.
   *
   * @param x Independent variable
   * @param linearized Signal with the background removed
   * @param advisories List to add consistency warnings to
   * @return (center, amplitude, index of the filtered peak)
   */
  private static double[] estimateStep(double[] x, double[] linearized,
      List<String> advisories) {
    int n = x.length;
    double sigma = n / 250.;
    double[] derivative = NumericUtils.gaussianDerivativeFilter(linearized, sigma);
    double[] absDerivative = new double[n];
    for (int i = 0; i < n; ++i) {
      absDerivative[i] = Math.abs(derivative[i]);
    }
    int estimatedIndex = NumericUtils.argmax(absDerivative);

    double center;
    if (estimatedIndex < 0.01 * n || estimatedIndex > 0.99 * n) {
      center = TimeSeriesUtils.getMean(x);
    } else {
      center = x[estimatedIndex];
    }

    int centerIndex = n / 2;
    int splitOffset = n / 10;
    double meanRight = TimeSeriesUtils.getMean(
        Arrays.copyOfRange(linearized, centerIndex + splitOffset, n));
    double meanLeft = TimeSeriesUtils.getMean(
        Arrays.copyOfRange(linearized, 0, centerIndex - splitOffset));
    double amplitude = -(meanRight - meanLeft);

    if (Math.signum(-derivative[estimatedIndex]) != Math.signum(amplitude)) {
      logger.warn(STEP_SIZE_ADVISORY + " (step amplitude " + amplitude
          + ", filtered slope " + derivative[estimatedIndex] + ")");
      advisories.add(STEP_SIZE_ADVISORY);
    }
    return new double[]{center, amplitude, estimatedIndex};
  }

  @Override
  public int minimumSize() {
    return 4;
  }

  /**
   * Fit with the configured strategy
   *
   * @param series Data to fit
   * @return Result of the fit
   */
  public FitResult fit(SampleSeries series) {
    return fit(series, config.getFermiLinearStrategy());
  }

  /**
   * Fit a Fermi-linear model starting from the estimate of {@link #estimate(SampleSeries)}.
   *
   * @param series Data to fit
   * @param strategy Solver to use; the curve fitter keeps the temperature non-negative
   * @return Result of the fit, with the fitted center as a derived value
   */
  public FitResult fit(SampleSeries series, FitStrategy strategy) {
    return fit(series, strategy, estimate(series));
  }

  /**
   * Fit a Fermi-linear model from an estimate already made of the same series. Advisories
   * raised by the estimate are carried on the result.
   *
   * @param series Data to fit
   * @param strategy Solver to use; the curve fitter keeps the temperature non-negative
   * @param estimate Estimate of the series, as given by {@link #estimate(SampleSeries)}
   * @return Result of the fit, with the fitted center as a derived value
   */
  public FitResult fit(SampleSeries series, FitStrategy strategy,
      FermiLinearEstimate estimate) {
    List<ParameterBound> bounds = Collections.emptyList();
    if (strategy == FitStrategy.CURVE_FITTER) {
      bounds = Collections.singletonList(
          ParameterBound.atLeast(FermiLinearModel.TEMPERATURE, 0.));
    }
    FitResult result = runFit(solvers.get(strategy), model, series,
        estimate.getParameters(), bounds);
    return result.withDerived(CENTER, result.getParameter(FermiLinearModel.CENTER))
        .withAdvisories(estimate.getAdvisories());
  }
}
