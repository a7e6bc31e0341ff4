package qdot.fitting.output;

import qdot.fitting.input.SampleSeries;
import qdot.fitting.model.ModelFunction;
import org.jfree.data.xy.XYSeries;
import org.jfree.data.xy.XYSeriesCollection;

/**
 * Packages measured data and model curves as JFreeChart datasets, which are used both for plots
 * and to hand curves back to callers over the independent variable of the measurement.
 */
public class FitDatasets {

  public static final String INITIAL_SUFFIX = " initial guess";
  public static final String FIT_SUFFIX = " fit";

  /**
   * Evaluate a model over the given points
   *
   * @param name Name of the resulting series
   * @param x Points to evaluate the model at
   * @param model Model to evaluate
   * @param parameters Model parameters
   * @return Series of (x, model(x)) pairs
   */
  public static XYSeries curve(String name, double[] x, ModelFunction model,
      double[] parameters) {
    XYSeries out = new XYSeries(name);
    double[] y = model.values(x, parameters);
    for (int i = 0; i < x.length; ++i) {
      out.add(x[i], y[i]);
    }
    return out;
  }

  public static XYSeries data(SampleSeries series) {
    XYSeries out = new XYSeries(series.getName());
    for (int i = 0; i < series.size(); ++i) {
      out.add(series.getX(i), series.getY(i));
    }
    return out;
  }

  /**
   * Collect the data, the initial-guess curve and the fitted curve of a fit
   *
   * @param series Data that was fit
   * @param model Model that was fit
   * @param result Result of the fit
   * @return Collection with the data (index 0), initial guess (1) and fit (2)
   */
  public static XYSeriesCollection of(SampleSeries series, ModelFunction model,
      FitResult result) {
    double[] x = series.getX();
    XYSeriesCollection xysc = new XYSeriesCollection();
    xysc.addSeries(data(series));
    xysc.addSeries(curve(result.getModelName() + INITIAL_SUFFIX, x, model, result.getInitial()));
    xysc.addSeries(curve(result.getModelName() + FIT_SUFFIX, x, model, result.getFitted()));
    return xysc;
  }
}
