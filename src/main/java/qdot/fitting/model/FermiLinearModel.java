package qdot.fitting.model;

/**
 * Fermi step on top of a linear background:
 * slope * x + intercept + amplitude / (1 + exp(leverArm * (x - center) / (kB * temperature)))
 *
 * @see FermiModel
 */
public class FermiLinearModel implements ModelFunction {

  public static final String SLOPE = "slope";
  public static final String INTERCEPT = "intercept";
  public static final String CENTER = FermiModel.CENTER;
  public static final String AMPLITUDE = FermiModel.AMPLITUDE;
  public static final String TEMPERATURE = FermiModel.TEMPERATURE;

  private static final ParameterSchema SCHEMA =
      new ParameterSchema(SLOPE, INTERCEPT, CENTER, AMPLITUDE, TEMPERATURE);

  private final double leverArm;

  public FermiLinearModel() {
    this(FermiModel.DEFAULT_LEVER_ARM);
  }

  public FermiLinearModel(double leverArm) {
    this.leverArm = leverArm;
  }

  public double getLeverArm() {
    return leverArm;
  }

  @Override
  public String getName() {
    return "fermi linear";
  }

  @Override
  public ParameterSchema getSchema() {
    return SCHEMA;
  }

  @Override
  public double value(double x, double[] parameters) {
    return parameters[0] * x + parameters[1]
        + FermiModel.fermi(x, parameters[2], parameters[3], parameters[4], leverArm);
  }
}
