package qdot.fitting.model;

/**
 * Sum of two Gaussian peaks without offset. The "dn" peak is the one at the lower level of a
 * bimodal readout signal, the "up" peak the one at the higher level.
 */
public class DoubleGaussianModel implements ModelFunction {

  public static final String AMPLITUDE_DN = "A_dn";
  public static final String AMPLITUDE_UP = "A_up";
  public static final String SIGMA_DN = "sigma_dn";
  public static final String SIGMA_UP = "sigma_up";
  public static final String MEAN_DN = "mean_dn";
  public static final String MEAN_UP = "mean_up";

  private static final ParameterSchema SCHEMA = new ParameterSchema(
      AMPLITUDE_DN, AMPLITUDE_UP, SIGMA_DN, SIGMA_UP, MEAN_DN, MEAN_UP);

  /**
   * Assemble a double Gaussian parameter vector from two single peaks
   *
   * @param dn (mean, sigma, amplitude) of the first peak
   * @param up (mean, sigma, amplitude) of the second peak
   * @return [A_dn, A_up, sigma_dn, sigma_up, mean_dn, mean_up]
   */
  public static double[] fromPeaks(double[] dn, double[] up) {
    return new double[]{dn[2], up[2], dn[1], up[1], dn[0], up[0]};
  }

  /**
   * @param parameters double Gaussian parameter vector
   * @return (mean, sigma, amplitude) of the "dn" peak
   */
  public static double[] peakDn(double[] parameters) {
    return new double[]{parameters[4], parameters[2], parameters[0]};
  }

  /**
   * @param parameters double Gaussian parameter vector
   * @return (mean, sigma, amplitude) of the "up" peak
   */
  public static double[] peakUp(double[] parameters) {
    return new double[]{parameters[5], parameters[3], parameters[1]};
  }

  @Override
  public String getName() {
    return "double gaussian";
  }

  @Override
  public ParameterSchema getSchema() {
    return SCHEMA;
  }

  @Override
  public double value(double x, double[] parameters) {
    return GaussianModel.gaussian(x, parameters[4], parameters[2], parameters[0])
        + GaussianModel.gaussian(x, parameters[5], parameters[3], parameters[1]);
  }
}
