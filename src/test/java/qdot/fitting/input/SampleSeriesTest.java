package qdot.fitting.input;

import static org.junit.Assert.assertArrayEquals;
import static org.junit.Assert.assertEquals;

import org.apache.commons.math3.exception.DimensionMismatchException;
import org.apache.commons.math3.exception.NoDataException;
import org.apache.commons.math3.exception.NonMonotonicSequenceException;
import org.apache.commons.math3.exception.NumberIsTooSmallException;
import org.jfree.data.xy.XYSeries;
import org.junit.Test;

public class SampleSeriesTest {

  @Test(expected = DimensionMismatchException.class)
  public void mismatchedLengthsRejected() {
    new SampleSeries(new double[]{1, 2, 3}, new double[]{1, 2});
  }

  @Test(expected = NoDataException.class)
  public void emptySeriesRejected() {
    new SampleSeries(new double[]{}, new double[]{});
  }

  @Test(expected = NonMonotonicSequenceException.class)
  public void decreasingXRejected() {
    new SampleSeries(new double[]{1, 3, 2}, new double[]{1, 2, 3});
  }

  @Test
  public void repeatedXAllowed() {
    SampleSeries series = new SampleSeries(new double[]{1, 1, 2}, new double[]{1, 2, 3});
    assertEquals(3, series.size());
    assertEquals(1., series.getMinX(), 0.);
    assertEquals(2., series.getMaxX(), 0.);
  }

  @Test
  public void dataIsCopied() {
    double[] x = {0, 1, 2};
    double[] y = {5, 6, 7};
    SampleSeries series = new SampleSeries(x, y);
    x[0] = 100;
    series.getY()[0] = 100;
    assertEquals(0., series.getX(0), 0.);
    assertEquals(5., series.getY(0), 0.);
  }

  @Test
  public void trimBorderRemovesBothEnds() {
    SampleSeries series =
        new SampleSeries("s", new double[]{0, 1, 2, 3, 4}, new double[]{5, 6, 7, 8, 9});
    SampleSeries trimmed = series.trimBorder(1);
    assertArrayEquals(new double[]{1, 2, 3}, trimmed.getX(), 0.);
    assertArrayEquals(new double[]{6, 7, 8}, trimmed.getY(), 0.);
    assertEquals("s", trimmed.getName());
    assertEquals(5, series.size());
  }

  @Test(expected = NumberIsTooSmallException.class)
  public void trimmingEverythingFails() {
    new SampleSeries(new double[]{0, 1, 2, 3}, new double[]{5, 6, 7, 8}).trimBorder(2);
  }

  @Test(expected = NumberIsTooSmallException.class)
  public void minimumSizeEnforced() {
    new SampleSeries(new double[]{0, 1, 2}, new double[]{5, 6, 7}).requireMinimumSize(4);
  }

  @Test
  public void convertsFromDatasetSeries() {
    XYSeries xys = new XYSeries("sweep");
    xys.add(2., 20.);
    xys.add(1., 10.);
    xys.add(3., 30.);
    SampleSeries series = SampleSeries.fromSeries(xys);
    assertEquals("sweep", series.getName());
    assertArrayEquals(new double[]{1, 2, 3}, series.getX(), 0.);
    assertArrayEquals(new double[]{10, 20, 30}, series.getY(), 0.);
  }

}
