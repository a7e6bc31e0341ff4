package qdot.fitting.model;

import qdot.fitting.utils.NumericUtils;

/**
 * amplitude * sin(2 pi frequency x + phase) + offset
 */
public class SineModel implements ModelFunction {

  public static final String AMPLITUDE = "amplitude";
  public static final String FREQUENCY = "frequency";
  public static final String PHASE = "phase";
  public static final String OFFSET = "offset";

  private static final ParameterSchema SCHEMA =
      new ParameterSchema(AMPLITUDE, FREQUENCY, PHASE, OFFSET);

  @Override
  public String getName() {
    return "sine";
  }

  @Override
  public ParameterSchema getSchema() {
    return SCHEMA;
  }

  @Override
  public double value(double x, double[] parameters) {
    return parameters[0] * Math.sin(NumericUtils.TAU * parameters[1] * x + parameters[2])
        + parameters[3];
  }
}
