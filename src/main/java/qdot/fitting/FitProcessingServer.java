package qdot.fitting;

import java.io.IOException;
import org.apache.log4j.Logger;
import org.jfree.chart.JFreeChart;
import py4j.GatewayServer;
import py4j.Py4JNetworkException;
import qdot.fitting.fit.AdditionLineFitter;
import qdot.fitting.fit.AdditionLineResult;
import qdot.fitting.fit.DoubleGaussianFitter;
import qdot.fitting.fit.FermiLinearEstimate;
import qdot.fitting.fit.FermiLinearFitter;
import qdot.fitting.fit.FitStrategy;
import qdot.fitting.fit.GaussianFitter;
import qdot.fitting.fit.SineFitter;
import qdot.fitting.input.Configuration;
import qdot.fitting.input.SampleSeries;
import qdot.fitting.model.DoubleGaussianModel;
import qdot.fitting.model.GaussianModel;
import qdot.fitting.model.SineModel;
import qdot.fitting.output.FitReport;
import qdot.fitting.output.FitResult;
import qdot.fitting.utils.ReportingUtils;

/**
 * FitProcessingServer allows for running fits from a python environment using Py4J.
 * Each run method takes the x and y data of a measurement and returns a {@link FitReport}
 * holding the fitted values and a PNG plot of the fit.
 *
 * It uses the Py4J default port: 25333 If a process is already using that port it silently
 * terminates.
 */
public class FitProcessingServer {

  private static final Logger logger = Logger.getLogger(FitProcessingServer.class);

  private final Configuration config;

  public FitProcessingServer() {
    this(Configuration.getInstance());
  }

  public FitProcessingServer(Configuration config) {
    this.config = config;
  }

  public static void main(String[] args) {
    GatewayServer gatewayServer = new GatewayServer(new FitProcessingServer());
    try {
      gatewayServer.start();
    } catch (Py4JNetworkException e) {
      logger.warn("Could not start gateway server, port may be in use", e);
      System.exit(0);
    }
    System.out.println("Gateway Server Started");
  }

  private byte[] plot(JFreeChart... charts) throws IOException {
    return ReportingUtils.chartsToPng(config.getPlotWidth(), config.getPlotHeight(), charts);
  }

  /**
   * Fit a single Gaussian to data
   *
   * @param x Independent variable
   * @param y Signal
   * @param includeOffset True if a constant offset should be fit
   * @return Fit parameters and plot
   * @throws IOException if the plot could not be rendered
   */
  public FitReport runGaussian(double[] x, double[] y, boolean includeOffset)
      throws IOException {
    SampleSeries series = new SampleSeries(x, y);
    FitResult result = new GaussianFitter(config).fit(series, null, includeOffset);
    JFreeChart chart = ReportingUtils.createFitChart("Gaussian fit", series,
        new GaussianModel(includeOffset), result);
    return FitReport.buildFitData(result, plot(chart));
  }

  /**
   * Fit two Gaussians to data, optionally refitting if the peaks differ greatly in amplitude
   *
   * @param x Independent variable
   * @param y Signal
   * @param refit True to apply the refit heuristic after the first fit
   * @return Fit parameters, separation, split, and plot
   * @throws IOException if the plot could not be rendered
   */
  public FitReport runDoubleGaussian(double[] x, double[] y, boolean refit) throws IOException {
    SampleSeries series = new SampleSeries(x, y);
    DoubleGaussianFitter fitter = new DoubleGaussianFitter(config);
    FitResult result = fitter.fit(series);
    if (refit) {
      result = fitter.refit(result, series);
    }
    JFreeChart chart = ReportingUtils.createFitChart("Double Gaussian fit", series,
        new DoubleGaussianModel(), result);
    return FitReport.buildFitData(result, plot(chart));
  }

  /**
   * Fit a sine wave to data
   *
   * @param x Independent variable
   * @param y Signal
   * @return Fit parameters and plot
   * @throws IOException if the plot could not be rendered
   */
  public FitReport runSine(double[] x, double[] y) throws IOException {
    SampleSeries series = new SampleSeries(x, y);
    FitResult result = new SineFitter(config).fit(series);
    JFreeChart chart = ReportingUtils.createFitChart("Sine fit", series, new SineModel(),
        result);
    return FitReport.buildFitData(result, plot(chart));
  }

  /**
   * Fit a Fermi step on a linear background to data
   *
   * @param x Independent variable
   * @param y Signal
   * @param strategy Name of the solver strategy ("LEAST_SQUARES" or "CURVE_FITTER"), or null
   * for the configured default
   * @return Fit parameters, plots of the estimate and the fit
   * @throws IOException if the plot could not be rendered
   */
  public FitReport runFermiLinear(double[] x, double[] y, String strategy) throws IOException {
    SampleSeries series = new SampleSeries(x, y);
    FermiLinearFitter fitter = new FermiLinearFitter(config);
    FitStrategy chosen = strategy == null ? config.getFermiLinearStrategy()
        : FitStrategy.valueOf(strategy.trim().toUpperCase());
    FermiLinearEstimate estimate = fitter.estimate(series);
    FitResult result = fitter.fit(series, chosen, estimate);
    JFreeChart fitChart = ReportingUtils.createFitChart("Fermi-linear fit", series,
        fitter.getModel(), result);
    JFreeChart estimateChart = ReportingUtils.createFermiEstimateChart(series, estimate,
        fitter.getModel().getLeverArm());
    return FitReport.buildFitData(result, plot(fitChart), plot(estimateChart));
  }

  /**
   * Locate the addition line in a gate sweep
   *
   * @param x Gate voltages
   * @param y Signal
   * @param trimBorder True to leave out samples at both ends of the sweep
   * @return Center of the addition line, fit parameters and plot
   * @throws IOException if the plot could not be rendered
   */
  public FitReport runAdditionLine(double[] x, double[] y, boolean trimBorder)
      throws IOException {
    SampleSeries series = new SampleSeries("addition line", x, y);
    FermiLinearFitter fermiLinearFitter = new FermiLinearFitter(config);
    AdditionLineResult result =
        new AdditionLineFitter(fermiLinearFitter).fitAdditionLineArray(series, trimBorder);
    JFreeChart chart = ReportingUtils.createFitChart("Addition line", result.getFitData(),
        fermiLinearFitter.getModel(), result.getFit());
    return FitReport.buildAdditionLineData(result.getCenter(), result.getFit(), plot(chart));
  }
}
