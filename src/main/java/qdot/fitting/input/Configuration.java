package qdot.fitting.input;

import java.io.File;
import java.net.MalformedURLException;
import java.net.URL;
import org.apache.commons.configuration.ConfigurationException;
import org.apache.commons.configuration.XMLConfiguration;
import org.apache.log4j.Logger;
import qdot.fitting.fit.FitStrategy;

/**
 * Configuration of the fitting routines: solver limits and tolerances, the thresholds used by
 * the fit heuristics, the Fermi-linear model constants and the size of diagnostic plots.
 * Values not present in the XML file keep their defaults.
 *
 * The file is read from the working directory if present, otherwise the copy bundled in the
 * jar is used.
 */
public class Configuration {

  private static Configuration instance;

  static final String DEFAULT_CONFIG_PATH = "qdot-fitting-config.xml";
  private static final Logger logger = Logger.getLogger(Configuration.class);

  private String loadedConfigPath = "(defaults)";

  private int maxEvaluations = 100000;
  private int maxIterations = 10000;
  private double costRelativeTolerance = 1E-10;
  private double parameterRelativeTolerance = 1E-10;

  private double amplitudeRatioThreshold = 8.;
  private boolean fastDoubleGaussianEstimate = false;

  private double leverArm = 1.16;
  private FitStrategy fermiLinearStrategy = FitStrategy.LEAST_SQUARES;

  private boolean positiveSineAmplitude = true;

  private int plotWidth = 640;
  private int plotHeight = 480;

  /**
   * Configuration holding only default values
   */
  Configuration() {
  }

  Configuration(URL configLocation) {
    logger.info("Attempting reading in config file from " + configLocation);
    try {
      XMLConfiguration config = new XMLConfiguration(configLocation);

      maxEvaluations = config.getInt("Solver.MaxEvaluations", maxEvaluations);
      maxIterations = config.getInt("Solver.MaxIterations", maxIterations);
      costRelativeTolerance =
          config.getDouble("Solver.CostRelativeTolerance", costRelativeTolerance);
      parameterRelativeTolerance =
          config.getDouble("Solver.ParameterRelativeTolerance", parameterRelativeTolerance);

      amplitudeRatioThreshold =
          config.getDouble("DoubleGaussian.AmplitudeRatioThreshold", amplitudeRatioThreshold);
      fastDoubleGaussianEstimate =
          config.getBoolean("DoubleGaussian.FastEstimate", fastDoubleGaussianEstimate);

      leverArm = config.getDouble("FermiLinear.LeverArm", leverArm);
      String strategyParam = config.getString("FermiLinear.Strategy");
      if (strategyParam != null) {
        try {
          fermiLinearStrategy = FitStrategy.valueOf(strategyParam.trim().toUpperCase());
        } catch (IllegalArgumentException e) {
          logger.warn("Unknown fit strategy " + strategyParam + ", using "
              + fermiLinearStrategy, e);
        }
      }

      positiveSineAmplitude = config.getBoolean("Sine.PositiveAmplitude", positiveSineAmplitude);

      plotWidth = config.getInt("Plot.Width", plotWidth);
      plotHeight = config.getInt("Plot.Height", plotHeight);

      loadedConfigPath = configLocation.toString();
      logger.info("Succesfully loaded in configuration: " + loadedConfigPath);
    } catch (ConfigurationException e) {
      logger.error("Error encountered while reading XML file, load failed, using defaults", e);
    }
  }

  /**
   * Gets the current instance of the configuration, or creates one if none exists
   * @return the current configuration instance
   */
  synchronized public static Configuration getInstance() {
    if (instance == null) {
      instance = load(System.getProperty("user.dir") + File.separator + DEFAULT_CONFIG_PATH);
    }
    return instance;
  }

  /**
   * Read a configuration, falling back to the bundled file and then to default values
   *
   * @param configLocation File system path of the preferred configuration file
   * @return configuration with any values found in the file applied
   */
  static Configuration load(String configLocation) {
    File config = new File(configLocation);
    try {
      if (config.exists()) {
        return new Configuration(config.toURI().toURL());
      }
    } catch (MalformedURLException e) {
      logger.warn("Could not read specified config location: " + configLocation, e);
    }
    URL embedded = Configuration.class.getClassLoader().getResource(DEFAULT_CONFIG_PATH);
    if (embedded == null) {
      logger.error("Major error: config XML file not part of resources!!");
      return new Configuration();
    }
    return new Configuration(embedded);
  }

  /**
   * @return Location of the configuration that was read, or "(defaults)" if none could be
   */
  public String getLoadedConfigPath() {
    return loadedConfigPath;
  }

  /**
   * Maximum number of model evaluations allowed to the least-squares solver.
   *
   * The property is defined from Solver.MaxEvaluations
   * @return evaluation limit
   */
  public int getMaxEvaluations() {
    return maxEvaluations;
  }

  /**
   * The property is defined from Solver.MaxIterations
   * @return iteration limit of the least-squares solver
   */
  public int getMaxIterations() {
    return maxIterations;
  }

  /**
   * The property is defined from Solver.CostRelativeTolerance
   * @return relative change in cost below which the solver stops
   */
  public double getCostRelativeTolerance() {
    return costRelativeTolerance;
  }

  /**
   * The property is defined from Solver.ParameterRelativeTolerance
   * @return relative change in parameters below which the solver stops
   */
  public double getParameterRelativeTolerance() {
    return parameterRelativeTolerance;
  }

  /**
   * Ratio of the larger to the smaller double Gaussian amplitude above which the smaller peak
   * is re-estimated by the refit.
   *
   * The property is defined from DoubleGaussian.AmplitudeRatioThreshold
   * @return amplitude ratio threshold (default 8)
   */
  public double getAmplitudeRatioThreshold() {
    return amplitudeRatioThreshold;
  }

  /**
   * The property is defined from DoubleGaussian.FastEstimate
   * @return true if double Gaussian initial widths should come from the data range only
   */
  public boolean useFastDoubleGaussianEstimate() {
    return fastDoubleGaussianEstimate;
  }

  /**
   * The property is defined from FermiLinear.LeverArm
   * @return lever arm used by the Fermi-linear model
   */
  public double getLeverArm() {
    return leverArm;
  }

  /**
   * The property is defined from FermiLinear.Strategy (LEAST_SQUARES or CURVE_FITTER)
   * @return solver strategy for Fermi-linear fits
   */
  public FitStrategy getFermiLinearStrategy() {
    return fermiLinearStrategy;
  }

  /**
   * The property is defined from Sine.PositiveAmplitude
   * @return true if sine fits constrain the amplitude to be non-negative
   */
  public boolean usePositiveSineAmplitude() {
    return positiveSineAmplitude;
  }

  /**
   * The property is defined from Plot.Width
   * @return width in pixels of rendered diagnostic plots
   */
  public int getPlotWidth() {
    return plotWidth;
  }

  /**
   * The property is defined from Plot.Height
   * @return height in pixels of rendered diagnostic plots
   */
  public int getPlotHeight() {
    return plotHeight;
  }
}
