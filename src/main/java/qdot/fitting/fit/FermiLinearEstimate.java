package qdot.fitting.fit;

import java.util.Collections;
import java.util.List;
import qdot.fitting.utils.TimeSeriesUtils;

/**
 * Initial guess for a Fermi-linear fit, kept in its two parts: the linear background
 * (slope, intercept) and the step (center, amplitude, temperature). Also records where the
 * step was detected and any consistency warnings raised while estimating.
 */
public class FermiLinearEstimate {

  private final double[] linearPart;
  private final double[] fermiPart;
  private final int stepIndex;
  private final List<String> advisories;

  FermiLinearEstimate(double[] linearPart, double[] fermiPart, int stepIndex,
      List<String> advisories) {
    this.linearPart = linearPart.clone();
    this.fermiPart = fermiPart.clone();
    this.stepIndex = stepIndex;
    this.advisories = Collections.unmodifiableList(advisories);
  }

  /**
   * @return [slope, intercept]
   */
  public double[] getLinearPart() {
    return linearPart.clone();
  }

  /**
   * @return [center, amplitude, temperature]
   */
  public double[] getFermiPart() {
    return fermiPart.clone();
  }

  /**
   * @return [slope, intercept, center, amplitude, temperature]
   */
  public double[] getParameters() {
    return TimeSeriesUtils.concatAll(linearPart, fermiPart);
  }

  /**
   * @return Index of the sample with the steepest filtered slope, or -1 if no step search was
   * done (series too short)
   */
  public int getStepIndex() {
    return stepIndex;
  }

  public List<String> getAdvisories() {
    return advisories;
  }
}
