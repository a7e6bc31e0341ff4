package qdot.fitting.fit;

import org.apache.log4j.Logger;
import org.jfree.data.xy.XYSeries;
import qdot.fitting.input.Configuration;
import qdot.fitting.input.SampleSeries;
import qdot.fitting.output.FitResult;

/**
 * Finds the middle of a charge addition line in a one-dimensional gate sweep by fitting a
 * Fermi-linear model and reporting its fitted center.
 */
public class AdditionLineFitter {

  private static final Logger logger = Logger.getLogger(AdditionLineFitter.class);

  private static final int MAX_BORDER = 100;

  private final FermiLinearFitter fermiLinearFitter;

  public AdditionLineFitter() {
    this(new FermiLinearFitter());
  }

  public AdditionLineFitter(Configuration config) {
    this(new FermiLinearFitter(config));
  }

  public AdditionLineFitter(FermiLinearFitter fermiLinearFitter) {
    this.fermiLinearFitter = fermiLinearFitter;
  }

  /**
   * Number of samples removed from each end of a series when trimming the border: a fortieth of
   * the series, but no more than 100 and at least 1
   *
   * @param size Number of samples in the series
   * @return Samples to drop from each end
   */
  public static int borderCut(int size) {
    return Math.max(Math.min(size / 40, MAX_BORDER), 1);
  }

  /**
   * Fit the addition line in a series. Trimming happens before estimation, so the estimate
   * only ever sees the trimmed data.
   *
   * @param series Gate sweep data
   * @param trimBorder True to leave out samples at both ends of the sweep
   * @return Center of the addition line with the full fit
   */
  public AdditionLineResult fitAdditionLineArray(SampleSeries series, boolean trimBorder) {
    SampleSeries toFit = series;
    if (trimBorder) {
      int cut = borderCut(series.size());
      logger.debug("Trimming " + cut + " samples from each end of " + series.getName());
      toFit = series.trimBorder(cut);
    }
    FitResult fit = fermiLinearFitter.fit(toFit);
    return new AdditionLineResult(fit, toFit, fermiLinearFitter.getModel());
  }

  /**
   * Fit the addition line in a plottable dataset. The fitted and initial-guess curves of the
   * result are available from the returned object over the x values of the trimmed data.
   *
   * @param dataset Gate sweep data
   * @param trimBorder True to leave out samples at both ends of the sweep
   * @return Center of the addition line with the full fit
   */
  public AdditionLineResult fitAdditionLine(XYSeries dataset, boolean trimBorder) {
    return fitAdditionLineArray(SampleSeries.fromSeries(dataset), trimBorder);
  }
}
