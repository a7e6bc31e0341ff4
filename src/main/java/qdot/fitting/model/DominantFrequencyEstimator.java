package qdot.fitting.model;

/**
 * Estimates the frequency carrying the most power in a uniformly sampled signal.
 */
@FunctionalInterface
public interface DominantFrequencyEstimator {

  /**
   * @param signal Sampled signal
   * @param sampleRate Samples per unit of the independent variable
   * @param removeDC True if the constant component should not be considered
   * @return Estimated dominant frequency, in the units of the sample rate
   */
  double estimate(double[] signal, double sampleRate, boolean removeDC);
}
