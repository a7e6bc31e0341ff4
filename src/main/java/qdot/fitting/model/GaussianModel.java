package qdot.fitting.model;

/**
 * Gaussian peak, optionally on top of a constant offset:
 * amplitude * exp(-(x - mean)^2 / (2 sigma^2)) + offset
 */
public class GaussianModel implements ModelFunction {

  public static final String MEAN = "mean";
  public static final String SIGMA = "sigma";
  public static final String AMPLITUDE = "amplitude";
  public static final String OFFSET = "offset";

  private static final ParameterSchema WITH_OFFSET =
      new ParameterSchema(MEAN, SIGMA, AMPLITUDE, OFFSET);
  private static final ParameterSchema WITHOUT_OFFSET =
      new ParameterSchema(MEAN, SIGMA, AMPLITUDE);

  private final boolean includeOffset;

  public GaussianModel(boolean includeOffset) {
    this.includeOffset = includeOffset;
  }

  /**
   * Value of a Gaussian peak with no offset
   *
   * @param x Independent variable
   * @param mean Center of the peak
   * @param sigma Standard deviation of the peak (sign is irrelevant)
   * @param amplitude Height of the peak
   * @return Gaussian evaluated at x
   */
  public static double gaussian(double x, double mean, double sigma, double amplitude) {
    double delta = x - mean;
    return amplitude * Math.exp(-(delta * delta) / (2 * sigma * sigma));
  }

  @Override
  public String getName() {
    return "gaussian";
  }

  @Override
  public ParameterSchema getSchema() {
    return includeOffset ? WITH_OFFSET : WITHOUT_OFFSET;
  }

  @Override
  public double value(double x, double[] parameters) {
    double offset = includeOffset ? parameters[3] : 0.;
    return gaussian(x, parameters[0], parameters[1], parameters[2]) + offset;
  }
}
