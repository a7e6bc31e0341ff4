package qdot.fitting.model;

/**
 * A parametric curve y = f(x; parameters). Implementations are pure functions: they hold no
 * state that changes between calls, so a single instance can be shared across fits and threads.
 */
public interface ModelFunction {

  /**
   * @return Short name of the model, used to label results and plots
   */
  String getName();

  /**
   * @return Ordered names of the model's parameters
   */
  ParameterSchema getSchema();

  /**
   * Evaluate the model at a single point
   *
   * @param x Independent variable
   * @param parameters Parameter vector ordered as in {@link #getSchema()}
   * @return Model value at x
   */
  double value(double x, double[] parameters);

  /**
   * Evaluate the model over a series of points
   *
   * @param x Independent variable values
   * @param parameters Parameter vector ordered as in {@link #getSchema()}
   * @return Model value at each x
   */
  default double[] values(double[] x, double[] parameters) {
    double[] out = new double[x.length];
    for (int i = 0; i < x.length; ++i) {
      out[i] = value(x[i], parameters);
    }
    return out;
  }
}
