package qdot.fitting.model;

/**
 * Fermi-Dirac step: amplitude / (1 + exp(leverArm * (x - center) / (kB * temperature))).
 * The independent variable is a gate voltage (mV), the lever arm converts it to an energy
 * (ueV) and the temperature is in mK, so that the ratio is dimensionless.
 */
public class FermiModel implements ModelFunction {

  /**
   * Boltzmann constant in eV/K
   */
  public static final double BOLTZMANN = 1.380648e-23 / 1.602176e-19;

  /**
   * Default conversion factor from gate voltage to energy
   */
  public static final double DEFAULT_LEVER_ARM = 1.16;

  public static final String CENTER = "center";
  public static final String AMPLITUDE = "amplitude";
  public static final String TEMPERATURE = "temperature";

  private static final ParameterSchema SCHEMA =
      new ParameterSchema(CENTER, AMPLITUDE, TEMPERATURE);

  private final double leverArm;

  public FermiModel() {
    this(DEFAULT_LEVER_ARM);
  }

  public FermiModel(double leverArm) {
    this.leverArm = leverArm;
  }

  /**
   * Evaluate the Fermi step. Arguments of the exponential that overflow give exactly 0 (far
   * above the center) and arguments that underflow give exactly the amplitude.
   *
   * @param x Independent variable
   * @param center Location of the step
   * @param amplitude Size of the step (value far below the center)
   * @param temperature Width of the step
   * @param leverArm Conversion factor of the independent variable
   * @return Value of the step at x
   */
  public static double fermi(double x, double center, double amplitude, double temperature,
      double leverArm) {
    return amplitude / (1 + Math.exp(leverArm * (x - center) / (BOLTZMANN * temperature)));
  }

  public double getLeverArm() {
    return leverArm;
  }

  @Override
  public String getName() {
    return "fermi";
  }

  @Override
  public ParameterSchema getSchema() {
    return SCHEMA;
  }

  @Override
  public double value(double x, double[] parameters) {
    return fermi(x, parameters[0], parameters[1], parameters[2], leverArm);
  }
}
