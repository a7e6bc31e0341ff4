package qdot.fitting.solver;

/**
 * Lower and upper limit on a single named model parameter. Either side may be infinite.
 */
public class ParameterBound {

  private final String name;
  private final double lower;
  private final double upper;

  public ParameterBound(String name, double lower, double upper) {
    if (lower > upper) {
      throw new IllegalArgumentException(
          "Lower bound " + lower + " of " + name + " exceeds upper bound " + upper);
    }
    this.name = name;
    this.lower = lower;
    this.upper = upper;
  }

  public static ParameterBound atLeast(String name, double lower) {
    return new ParameterBound(name, lower, Double.POSITIVE_INFINITY);
  }

  public static ParameterBound between(String name, double lower, double upper) {
    return new ParameterBound(name, lower, upper);
  }

  public String getName() {
    return name;
  }

  public double getLower() {
    return lower;
  }

  public double getUpper() {
    return upper;
  }

  /**
   * @param value Value to limit
   * @return The value, moved onto the nearest bound if it was outside of them
   */
  public double clamp(double value) {
    return Math.max(lower, Math.min(upper, value));
  }

  @Override
  public String toString() {
    return lower + " <= " + name + " <= " + upper;
  }
}
