package qdot.fitting.fit;

import static org.junit.Assert.assertArrayEquals;
import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertTrue;

import java.util.Arrays;
import org.apache.commons.math3.exception.NumberIsTooSmallException;
import org.junit.Test;
import qdot.fitting.input.SampleSeries;
import qdot.fitting.model.GaussianModel;
import qdot.fitting.output.FitResult;

public class GaussianFitterTest {

  private final GaussianFitter fitter = new GaussianFitter();

  @Test
  public void estimateUsesRobustRangeAndPeak() {
    double[] x = FitTestData.linspace(0., 100., 101);
    double[] y = new GaussianModel(true).values(x, new double[]{40., 5., 2., 1.});
    double[] estimate = GaussianFitter.estimate(x, y, true);
    assertArrayEquals(new double[]{40., 4.8, 2., 1.}, estimate, 1E-9);

    double[] noOffset = GaussianFitter.estimate(x, y, false);
    assertEquals(3, noOffset.length);
    assertEquals(3., noOffset[2], 1E-12);
  }

  @Test
  public void fitRecoversParameters() {
    double[] truth = {1.5, 2., 3., 0.5};
    SampleSeries series = FitTestData.noisy(new GaussianModel(true), truth,
        FitTestData.linspace(-10., 10., 400), 0.05, 11L);
    FitResult result = fitter.fit(series);
    assertEquals(1.5, result.getParameter(GaussianModel.MEAN), 0.1);
    assertEquals(2., Math.abs(result.getParameter(GaussianModel.SIGMA)), 0.1);
    assertEquals(3., result.getParameter(GaussianModel.AMPLITUDE), 0.15);
    assertEquals(0.5, result.getParameter(GaussianModel.OFFSET), 0.05);
    assertEquals(0.05 * 0.05, result.getReducedChiSquared(), 0.001);
  }

  @Test
  public void fitWithoutOffset() {
    double[] truth = {-2., 1., 4.};
    SampleSeries series = FitTestData.noisy(new GaussianModel(false), truth,
        FitTestData.linspace(-10., 10., 300), 0.02, 12L);
    FitResult result = fitter.fit(series, null, false);
    assertEquals(3, result.getFitted().length);
    assertEquals(-2., result.getParameter(GaussianModel.MEAN), 0.05);
    assertEquals(4., result.getParameter(GaussianModel.AMPLITUDE), 0.2);
  }

  @Test
  public void flatSignalGivesZeroAmplitude() {
    double[] x = FitTestData.linspace(0., 1., 50);
    double[] y = new double[50];
    Arrays.fill(y, 2.5);
    FitResult result = fitter.fit(new SampleSeries(x, y));
    assertEquals(0., result.getInitialParameter(GaussianModel.AMPLITUDE), 0.);
    assertEquals(0., result.getParameter(GaussianModel.AMPLITUDE), 1E-12);
    assertEquals(2.5, result.getParameter(GaussianModel.OFFSET), 1E-12);
  }

  @Test
  public void refittingFromResultDoesNotWorsen() {
    SampleSeries series = FitTestData.noisy(new GaussianModel(true),
        new double[]{0., 1., 1., 0.}, FitTestData.linspace(-5., 5., 200), 0.05, 13L);
    FitResult first = fitter.fit(series);
    FitResult second = fitter.fit(series, first.getFitted());
    assertTrue(second.getReducedChiSquared()
        <= first.getReducedChiSquared() * (1. + 1E-12));
  }

  @Test(expected = NumberIsTooSmallException.class)
  public void tooFewSamples() {
    fitter.fit(new SampleSeries(new double[]{0., 1., 2.}, new double[]{0., 1., 0.}));
  }

}
