package qdot.fitting.fit;

import static org.junit.Assert.assertArrayEquals;
import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertNotSame;
import static org.junit.Assert.assertSame;
import static org.junit.Assert.assertTrue;

import org.apache.commons.math3.exception.NumberIsTooSmallException;
import org.junit.Test;
import qdot.fitting.input.SampleSeries;
import qdot.fitting.model.DoubleGaussianModel;
import qdot.fitting.model.GaussianModel;
import qdot.fitting.output.FitResult;

public class DoubleGaussianFitterTest {

  private final DoubleGaussianFitter fitter = new DoubleGaussianFitter();
  private final DoubleGaussianModel model = new DoubleGaussianModel();

  private SampleSeries twoPeaks(double[] dn, double[] up) {
    double[] x = FitTestData.linspace(-10., 10., 500);
    double[] y = model.values(x, DoubleGaussianModel.fromPeaks(dn, up));
    return new SampleSeries("histogram", x, y);
  }

  @Test
  public void fitFindsBothLevels() {
    SampleSeries series = twoPeaks(new double[]{-3., 1., 5.}, new double[]{4., 1.5, 5.});
    FitResult result = fitter.fit(series);
    assertEquals(-3., result.getParameter(DoubleGaussianModel.MEAN_DN), 0.2);
    assertEquals(4., result.getParameter(DoubleGaussianModel.MEAN_UP), 0.2);
    assertEquals(-3., result.getLeft()[0], 0.2);
    assertEquals(4., result.getRight()[0], 0.2);
    assertEquals(7. / 2.5, result.getDerived(DoubleGaussianFitter.SEPARATION), 0.05);
    assertEquals(-3. + 2.8, result.getDerived(DoubleGaussianFitter.SPLIT), 0.1);
  }

  @Test
  public void estimateFromHalves() {
    SampleSeries series = twoPeaks(new double[]{-3., 1., 5.}, new double[]{4., 1.5, 5.});
    double[] estimate = DoubleGaussianFitter.estimate(series, false, SplitPolicy.INDEX);
    assertEquals(5., estimate[0], 0.01);
    assertEquals(5., estimate[1], 0.01);
    assertEquals(1., estimate[2], 0.05);
    assertEquals(1.5, estimate[3], 0.05);
    assertEquals(-3., estimate[4], 0.05);
    assertEquals(4., estimate[5], 0.05);
  }

  @Test
  public void fastEstimateUsesRange() {
    SampleSeries series = twoPeaks(new double[]{-3., 1., 5.}, new double[]{4., 1.5, 5.});
    double[] estimate = DoubleGaussianFitter.estimate(series, true, SplitPolicy.INDEX);
    // 2nd and 98th percentiles of x are -9.6 and 9.6
    assertEquals(0.96, estimate[2], 1E-6);
    assertEquals(0.96, estimate[3], 1E-6);
    assertEquals(-9.6 + 0.1 * 19.2, estimate[4], 1E-6);
    assertEquals(-9.6 + 0.9 * 19.2, estimate[5], 1E-6);
  }

  @Test
  public void valueSplitUsesMidpointOfRange() {
    double[] x = {0., 0.1, 0.2, 0.3, 0.4, 5., 10.};
    assertEquals(5, SplitPolicy.VALUE.splitIndex(x));
    assertEquals(3, SplitPolicy.INDEX.splitIndex(x));
    // at least two samples on each side
    assertEquals(2, SplitPolicy.VALUE.splitIndex(new double[]{0., 9., 9.5, 10.}));
  }

  @Test
  public void valueSplitSeparatesUnevenlySampledPeaks() {
    // three quarters of the samples lie below 0, so the middle sample is inside the low peak
    double[] x = new double[400];
    for (int i = 0; i < 300; ++i) {
      x[i] = -10. + 10. * i / 300;
    }
    for (int i = 300; i < 400; ++i) {
      x[i] = 10. * (i - 300) / 99;
    }
    double[] y = model.values(x,
        DoubleGaussianModel.fromPeaks(new double[]{-3., 1., 5.}, new double[]{4., 1.5, 5.}));
    SampleSeries series = new SampleSeries("uneven histogram", x, y);

    double[] byValue = DoubleGaussianFitter.estimate(series, false, SplitPolicy.VALUE);
    assertEquals(5., byValue[0], 0.01);
    assertEquals(5., byValue[1], 0.01);
    assertEquals(1., byValue[2], 0.1);
    assertEquals(1.5, byValue[3], 0.1);
    assertEquals(-3., byValue[4], 0.05);
    assertEquals(4., byValue[5], 0.05);

    double[] byIndex = DoubleGaussianFitter.estimate(series, false, SplitPolicy.INDEX);
    assertTrue(Math.abs(byIndex[5] - 4.) > 0.5);

    FitResult result = fitter.fit(series, byValue);
    assertEquals(-3., result.getParameter(DoubleGaussianModel.MEAN_DN), 0.05);
    assertEquals(4., result.getParameter(DoubleGaussianModel.MEAN_UP), 0.05);
  }

  @Test
  public void peaksReportedInAscendingOrder() {
    SampleSeries series = twoPeaks(new double[]{-3., 1., 5.}, new double[]{4., 1.5, 3.});
    double[] swappedGuess =
        DoubleGaussianModel.fromPeaks(new double[]{4., 1.5, 3.}, new double[]{-3., 1., 5.});
    FitResult result = fitter.fit(series, swappedGuess);
    assertEquals(-3., result.getParameter(DoubleGaussianModel.MEAN_DN), 0.05);
    assertEquals(5., result.getParameter(DoubleGaussianModel.AMPLITUDE_DN), 0.05);
    assertEquals(4., result.getParameter(DoubleGaussianModel.MEAN_UP), 0.05);
    assertEquals(3., result.getParameter(DoubleGaussianModel.AMPLITUDE_UP), 0.05);
    assertArrayEquals(swappedGuess, result.getInitial(), 0.);
    assertTrue(result.getLeft()[0] < result.getRight()[0]);
  }

  @Test
  public void refitKeepsBalancedFit() {
    SampleSeries series = twoPeaks(new double[]{-3., 1., 5.}, new double[]{4., 1.5, 5.});
    FitResult result = fitter.fit(series);
    assertSame(result, fitter.refit(result, series));
  }

  @Test
  public void refitNeverWorsensUnbalancedFit() {
    SampleSeries series = FitTestData.noisy(model,
        DoubleGaussianModel.fromPeaks(new double[]{-2., 1., 10.}, new double[]{5., 1., 1.}),
        FitTestData.linspace(-10., 10., 500), 0.05, 21L);
    FitResult naive = fitter.fit(series);
    FitResult refitted = fitter.refit(naive, series);
    assertTrue(refitted.getReducedChiSquared() <= naive.getReducedChiSquared());
    assertTrue(refitted.getLeft()[0] < refitted.getRight()[0]);
  }

  @Test
  public void refitRecoversMissingPeak() {
    SampleSeries series = twoPeaks(new double[]{-3., 1., 10.}, new double[]{4., 1., 1.});
    FitResult poor = new FitResult(model.getName(), model.getSchema(),
        DoubleGaussianModel.fromPeaks(new double[]{-3., 1., 10.}, new double[]{8., 1., 0.}),
        new double[6], 1E9, null)
        .withPeaks(new double[]{-3., 1., 10.}, new double[]{8., 1., 0.});
    FitResult refitted = fitter.refit(poor, series, 8.);
    assertNotSame(poor, refitted);
    assertEquals(-3., refitted.getParameter(DoubleGaussianModel.MEAN_DN), 0.05);
    assertEquals(4., refitted.getParameter(DoubleGaussianModel.MEAN_UP), 0.05);
    assertEquals(1., refitted.getParameter(DoubleGaussianModel.AMPLITUDE_UP), 0.05);
  }

  @Test
  public void flatSignalGivesZeroAmplitudes() {
    double[] x = FitTestData.linspace(0., 1., 100);
    FitResult result = fitter.fit(new SampleSeries(x, new double[100]));
    assertEquals(0., result.getParameter(DoubleGaussianModel.AMPLITUDE_DN), 0.);
    assertEquals(0., result.getParameter(DoubleGaussianModel.AMPLITUDE_UP), 0.);
    assertTrue(Double.isFinite(result.getDerived(DoubleGaussianFitter.SPLIT)));
  }

  @Test
  public void refittingFromResultDoesNotWorsen() {
    SampleSeries series = FitTestData.noisy(model,
        DoubleGaussianModel.fromPeaks(new double[]{-3., 1., 5.}, new double[]{4., 1.5, 5.}),
        FitTestData.linspace(-10., 10., 500), 0.1, 22L);
    FitResult first = fitter.fit(series);
    FitResult second = fitter.fit(series, first.getFitted());
    assertTrue(second.getReducedChiSquared()
        <= first.getReducedChiSquared() * (1. + 1E-12));
  }

  @Test(expected = IllegalArgumentException.class)
  public void refitNeedsPeaks() {
    GaussianModel gaussian = new GaussianModel(false);
    FitResult single = new FitResult(gaussian.getName(), gaussian.getSchema(),
        new double[3], new double[3], 0., null);
    fitter.refit(single, twoPeaks(new double[]{-3., 1., 5.}, new double[]{4., 1.5, 5.}));
  }

  @Test(expected = NumberIsTooSmallException.class)
  public void tooFewSamples() {
    fitter.fit(new SampleSeries(new double[]{0., 1., 2.}, new double[]{1., 0., 1.}));
  }

}
