package qdot.fitting.output;

import static qdot.fitting.utils.NumericUtils.DECIMAL_FORMAT;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import qdot.fitting.model.ParameterSchema;

/**
 * Outcome of a single fit: fitted and initial parameter vectors (both ordered by the model's
 * schema), the reduced chi-squared of the fit, the parameter variances if the solver could
 * estimate them, and any model-specific derived values.
 *
 * Instances are never modified. The "with" methods return copies with extra information attached,
 * which is how fitters add derived values, peak assignments and advisory messages after the
 * solver has run.
 */
public class FitResult {

  private final String modelName;
  private final ParameterSchema schema;
  private final double[] fitted;
  private final double[] initial;
  private final double reducedChiSquared;
  private final double[] covariance;
  private final Map<String, Double> derived;
  private final double[] left;
  private final double[] right;
  private final List<String> advisories;

  /**
   * @param modelName Name of the fit model
   * @param schema Parameter names of the fit model
   * @param fitted Best-fit parameters
   * @param initial Initial guess the solver started from
   * @param reducedChiSquared Fit quality; lower is better
   * @param covariance Variance of each fitted parameter, or null if unavailable
   */
  public FitResult(String modelName, ParameterSchema schema, double[] fitted, double[] initial,
      double reducedChiSquared, double[] covariance) {
    this(modelName, schema, fitted, initial, reducedChiSquared, covariance,
        new LinkedHashMap<>(), null, null, new ArrayList<>());
  }

  private FitResult(String modelName, ParameterSchema schema, double[] fitted, double[] initial,
      double reducedChiSquared, double[] covariance, Map<String, Double> derived, double[] left,
      double[] right, List<String> advisories) {
    schema.checkLength(fitted);
    schema.checkLength(initial);
    if (covariance != null) {
      schema.checkLength(covariance);
    }
    this.modelName = modelName;
    this.schema = schema;
    this.fitted = fitted.clone();
    this.initial = initial.clone();
    this.reducedChiSquared = reducedChiSquared;
    this.covariance = covariance == null ? null : covariance.clone();
    this.derived = derived;
    this.left = left;
    this.right = right;
    this.advisories = advisories;
  }

  /**
   * Copy of this result with different fitted values (and matching variances), i.e., after
   * the parameters have been reordered
   *
   * @param newFitted Replacement fitted parameters
   * @param newCovariance Replacement variances, or null
   * @return New result
   */
  public FitResult withFitted(double[] newFitted, double[] newCovariance) {
    return new FitResult(modelName, schema, newFitted, initial, reducedChiSquared, newCovariance,
        new LinkedHashMap<>(derived), left, right, new ArrayList<>(advisories));
  }

  /**
   * @param name Name of the derived quantity
   * @param value Its value
   * @return Copy of this result including the derived value
   */
  public FitResult withDerived(String name, double value) {
    Map<String, Double> newDerived = new LinkedHashMap<>(derived);
    newDerived.put(name, value);
    return new FitResult(modelName, schema, fitted, initial, reducedChiSquared, covariance,
        newDerived, left, right, new ArrayList<>(advisories));
  }

  /**
   * @param leftPeak (mean, sigma, amplitude) of the lower peak
   * @param rightPeak (mean, sigma, amplitude) of the higher peak
   * @return Copy of this result with the peaks assigned
   */
  public FitResult withPeaks(double[] leftPeak, double[] rightPeak) {
    return new FitResult(modelName, schema, fitted, initial, reducedChiSquared, covariance,
        new LinkedHashMap<>(derived), leftPeak.clone(), rightPeak.clone(),
        new ArrayList<>(advisories));
  }

  /**
   * @param messages Advisory messages (non-fatal consistency warnings)
   * @return Copy of this result with the messages appended
   */
  public FitResult withAdvisories(List<String> messages) {
    List<String> newAdvisories = new ArrayList<>(advisories);
    newAdvisories.addAll(messages);
    return new FitResult(modelName, schema, fitted, initial, reducedChiSquared, covariance,
        new LinkedHashMap<>(derived), left, right, newAdvisories);
  }

  public String getModelName() {
    return modelName;
  }

  public ParameterSchema getSchema() {
    return schema;
  }

  public double[] getFitted() {
    return fitted.clone();
  }

  public double[] getInitial() {
    return initial.clone();
  }

  /**
   * Get a fitted value by name
   *
   * @param name Parameter name, as in the model's schema
   * @return Fitted value of that parameter
   */
  public double getParameter(String name) {
    return fitted[schema.indexOf(name)];
  }

  public double getInitialParameter(String name) {
    return initial[schema.indexOf(name)];
  }

  public double getReducedChiSquared() {
    return reducedChiSquared;
  }

  /**
   * @return Variance of each fitted parameter, or null if the solver could not estimate it
   */
  public double[] getCovariance() {
    return covariance == null ? null : covariance.clone();
  }

  /**
   * @return One-sigma uncertainty of each fitted parameter, or null if unavailable
   */
  public double[] getStandardErrors() {
    if (covariance == null) {
      return null;
    }
    double[] errors = new double[covariance.length];
    for (int i = 0; i < errors.length; ++i) {
      errors[i] = Math.sqrt(covariance[i]);
    }
    return errors;
  }

  public boolean hasDerived(String name) {
    return derived.containsKey(name);
  }

  /**
   * @param name Name of a derived quantity (i.e., "separation")
   * @return Value of the quantity
   * @throws IllegalArgumentException if this result has no such value
   */
  public double getDerived(String name) {
    Double value = derived.get(name);
    if (value == null) {
      throw new IllegalArgumentException("No derived value " + name + " for " + modelName);
    }
    return value;
  }

  public Map<String, Double> getDerivedValues() {
    return Collections.unmodifiableMap(derived);
  }

  /**
   * @return (mean, sigma, amplitude) of the lower peak, or null for single-peak models
   */
  public double[] getLeft() {
    return left == null ? null : left.clone();
  }

  /**
   * @return (mean, sigma, amplitude) of the higher peak, or null for single-peak models
   */
  public double[] getRight() {
    return right == null ? null : right.clone();
  }

  public List<String> getAdvisories() {
    return Collections.unmodifiableList(advisories);
  }

  @Override
  public String toString() {
    StringBuilder sb = new StringBuilder(modelName).append(" fit:");
    for (int i = 0; i < fitted.length; ++i) {
      sb.append("\n  ").append(schema.getName(i)).append(": ")
          .append(DECIMAL_FORMAT.get().format(fitted[i]))
          .append(" (initial ").append(DECIMAL_FORMAT.get().format(initial[i])).append(")");
    }
    for (Map.Entry<String, Double> entry : derived.entrySet()) {
      sb.append("\n  ").append(entry.getKey()).append(": ")
          .append(DECIMAL_FORMAT.get().format(entry.getValue()));
    }
    sb.append("\n  reduced chi-squared: ")
        .append(DECIMAL_FORMAT.get().format(reducedChiSquared));
    return sb.toString();
  }
}
