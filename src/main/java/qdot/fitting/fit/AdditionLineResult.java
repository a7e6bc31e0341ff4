package qdot.fitting.fit;

import org.jfree.data.xy.XYSeries;
import qdot.fitting.input.SampleSeries;
import qdot.fitting.model.FermiLinearModel;
import qdot.fitting.output.FitDatasets;
import qdot.fitting.output.FitResult;

/**
 * Location of an addition line, with the Fermi-linear fit it was taken from and the (possibly
 * trimmed) data that was fit.
 */
public class AdditionLineResult {

  private final double center;
  private final FitResult fit;
  private final SampleSeries fitData;
  private final FermiLinearModel model;

  AdditionLineResult(FitResult fit, SampleSeries fitData, FermiLinearModel model) {
    this.center = fit.getParameter(FermiLinearModel.CENTER);
    this.fit = fit;
    this.fitData = fitData;
    this.model = model;
  }

  /**
   * @return x value of the middle of the addition line
   */
  public double getCenter() {
    return center;
  }

  public FitResult getFit() {
    return fit;
  }

  public double[] getFitParameters() {
    return fit.getFitted();
  }

  public double[] getInitialParameters() {
    return fit.getInitial();
  }

  /**
   * @return The data the fit was made on, after border trimming
   */
  public SampleSeries getFitData() {
    return fitData;
  }

  /**
   * @return Fitted curve over the x values of the trimmed data
   */
  public XYSeries getFitCurve() {
    return FitDatasets.curve(fitData.getName() + FitDatasets.FIT_SUFFIX, fitData.getX(), model,
        fit.getFitted());
  }

  /**
   * @return Initial-guess curve over the x values of the trimmed data
   */
  public XYSeries getInitialGuessCurve() {
    return FitDatasets.curve(fitData.getName() + FitDatasets.INITIAL_SUFFIX, fitData.getX(),
        model, fit.getInitial());
  }
}
