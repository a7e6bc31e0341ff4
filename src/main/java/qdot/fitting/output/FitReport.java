package qdot.fitting.output;

import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Collects the results of a fit in a form external programs (i.e., Python through the Py4J
 * gateway) can easily consume. FitReport contains two maps: one from descriptive names to PNG
 * images of diagnostic plots (stored as byte arrays) and one from descriptive names to numeric
 * results, given as arrays of doubles (single values are arrays of length 1).
 */
public class FitReport {

  /**
   * Get data from a fit result: each fitted and initial parameter, the fit quality, the
   * parameter uncertainties where available, and the derived values and peaks of the fit
   *
   * @param result Result of some fit
   * @param images plots converted to png-format images as byte arrays
   * @return object holding these values in easily-accessed maps with variable descriptions
   */
  public static FitReport buildFitData(FitResult result, byte[]... images) {
    FitReport out = new FitReport();
    List<String> names = result.getSchema().getNames();
    double[] fitted = result.getFitted();
    double[] initial = result.getInitial();
    double[] errors = result.getStandardErrors();
    for (int i = 0; i < names.size(); ++i) {
      out.numerMap.put("Fit_" + names.get(i), new double[]{fitted[i]});
      out.numerMap.put("Initial_" + names.get(i), new double[]{initial[i]});
      if (errors != null) {
        out.numerMap.put("Error_" + names.get(i), new double[]{errors[i]});
      }
    }
    out.numerMap.put("Fit_parameters", fitted);
    out.numerMap.put("Initial_parameters", initial);
    out.numerMap.put("Reduced_chi_squared", new double[]{result.getReducedChiSquared()});
    for (Map.Entry<String, Double> entry : result.getDerivedValues().entrySet()) {
      out.numerMap.put("Derived_" + entry.getKey(), new double[]{entry.getValue()});
    }
    if (result.getLeft() != null) {
      out.numerMap.put("Left_peak", result.getLeft());
      out.numerMap.put("Right_peak", result.getRight());
    }
    out.advisories = result.getAdvisories().toArray(new String[0]);
    for (int i = 0; i < images.length; ++i) {
      out.imageMap.put("Fit_plot" + (i == 0 ? "" : "_" + i), images[i]);
    }
    return out;
  }

  /**
   * Get data from an addition line fit, which reports the step center alongside the full fit
   *
   * @param center Fitted center of the step
   * @param result Full Fermi-linear fit result
   * @param images plots converted to png-format images as byte arrays
   * @return object holding these values in easily-accessed maps with variable descriptions
   */
  public static FitReport buildAdditionLineData(double center, FitResult result,
      byte[]... images) {
    FitReport out = buildFitData(result, images);
    out.numerMap.put("Addition_line_center", new double[]{center});
    return out;
  }

  Map<String, double[]> numerMap;
  Map<String, byte[]> imageMap;
  String[] advisories;

  private FitReport() {
    numerMap = new HashMap<>();
    imageMap = new HashMap<>();
    advisories = new String[]{};
  }

  /**
   * Return the map of images
   * @return map of byte arrays representing images, keyed by strings with image descriptions
   */
  public Map<String, byte[]> getImageMap() {
    return imageMap;
  }

  /**
   * Return the map of numeric data
   * @return map of double arrays representing fit parameters, keyed by strings with
   * descriptions of the given numbers (i.e., fit mean, reduced chi-squared)
   */
  public Map<String, double[]> getNumerMap() {
    return numerMap;
  }

  /**
   * @return Advisory messages produced during estimation or fitting
   */
  public String[] getAdvisories() {
    return advisories.clone();
  }
}
