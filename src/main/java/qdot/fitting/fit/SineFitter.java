package qdot.fitting.fit;

import java.util.Collections;
import java.util.List;
import qdot.fitting.input.Configuration;
import qdot.fitting.input.SampleSeries;
import qdot.fitting.model.DominantFrequencyEstimator;
import qdot.fitting.model.SineModel;
import qdot.fitting.output.FitResult;
import qdot.fitting.solver.CurveSolver;
import qdot.fitting.solver.LevenbergMarquardtSolver;
import qdot.fitting.solver.ParameterBound;
import qdot.fitting.utils.FFTResult;
import qdot.fitting.utils.NumericUtils;
import qdot.fitting.utils.TimeSeriesUtils;

/**
 * Fits a sinusoid with offset. The initial frequency comes from a dominant-frequency estimator
 * (by default the peak of the signal's spectrum).
 *
 * @see SineModel
 */
public class SineFitter extends ModelFitter {

  private final SineModel model = new SineModel();
  private final DominantFrequencyEstimator frequencyEstimator;

  public SineFitter() {
    this(Configuration.getInstance());
  }

  public SineFitter(Configuration config) {
    this(config, new LevenbergMarquardtSolver(config), FFTResult::estimateDominantFrequency);
  }

  public SineFitter(Configuration config, CurveSolver solver,
      DominantFrequencyEstimator frequencyEstimator) {
    super(config, solver);
    this.frequencyEstimator = frequencyEstimator;
  }

  /**
   * Initial guess of the sine parameters: half the peak-to-peak range as amplitude, the mean as
   * offset, the dominant frequency of the demeaned signal, and a phase that puts the maximum of
   * the sine at the highest sample.
   *
   * @param series Data to estimate parameters of
   * @return [amplitude, frequency, phase, offset]
   */
  public double[] estimate(SampleSeries series) {
    series.requireMinimumSize(minimumSize());
    double[] x = series.getX();
    double[] y = series.getY();
    double amplitude = (NumericUtils.max(y) - NumericUtils.min(y)) / 2;
    double offset = TimeSeriesUtils.getMean(y);
    double sampleRate = 1. / TimeSeriesUtils.getMeanSpacing(x);
    double frequency = frequencyEstimator.estimate(y, sampleRate, true);
    double phase = Math.PI / 2 - NumericUtils.TAU * frequency * x[NumericUtils.argmax(y)];
    return new double[]{amplitude, frequency, phase, offset};
  }

  @Override
  public int minimumSize() {
    return 4;
  }

  public FitResult fit(SampleSeries series) {
    return fit(series, null, config.usePositiveSineAmplitude());
  }

  /**
   * @param series Data to fit
   * @param initial [amplitude, frequency, phase, offset], or null to estimate
   * @param positiveAmplitude True if the amplitude should be kept non-negative
   * @return Result of the fit
   */
  public FitResult fit(SampleSeries series, double[] initial, boolean positiveAmplitude) {
    if (initial == null) {
      initial = estimate(series);
    }
    List<ParameterBound> bounds = Collections.emptyList();
    if (positiveAmplitude) {
      bounds = Collections.singletonList(ParameterBound.atLeast(SineModel.AMPLITUDE, 0.));
    }
    return runFit(model, series, initial, bounds);
  }
}
