package qdot.fitting.output;

import static org.junit.Assert.assertArrayEquals;
import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertNull;
import static org.junit.Assert.assertTrue;

import java.util.Collections;
import org.junit.Test;
import qdot.fitting.model.SineModel;

public class FitResultTest {

  private final FitResult base = new FitResult("sine", new SineModel().getSchema(),
      new double[]{2., 5., 0.1, 1.}, new double[]{1.9, 4.9, 0., 1.1}, 0.25,
      new double[]{0.04, 0.01, 0.09, 0.16});

  @Test
  public void parametersByName() {
    assertEquals(5., base.getParameter(SineModel.FREQUENCY), 0.);
    assertEquals(1.1, base.getInitialParameter(SineModel.OFFSET), 0.);
    assertArrayEquals(new double[]{0.2, 0.1, 0.3, 0.4}, base.getStandardErrors(), 1E-12);
  }

  @Test(expected = IllegalArgumentException.class)
  public void unknownParameterRejected() {
    base.getParameter("center");
  }

  @Test
  public void copiesLeaveOriginalUnchanged() {
    FitResult derived = base.withDerived("period", 0.2)
        .withAdvisories(Collections.singletonList("note"))
        .withPeaks(new double[]{1, 2, 3}, new double[]{4, 5, 6});
    assertFalse(base.hasDerived("period"));
    assertTrue(base.getAdvisories().isEmpty());
    assertNull(base.getLeft());
    assertEquals(0.2, derived.getDerived("period"), 0.);
    assertEquals("note", derived.getAdvisories().get(0));
    assertArrayEquals(new double[]{4, 5, 6}, derived.getRight(), 0.);
    assertEquals(base.getReducedChiSquared(), derived.getReducedChiSquared(), 0.);
  }

  @Test
  public void returnedArraysAreCopies() {
    base.getFitted()[0] = 100.;
    base.getCovariance()[0] = 100.;
    assertEquals(2., base.getFitted()[0], 0.);
    assertEquals(0.04, base.getCovariance()[0], 0.);
  }

  @Test
  public void withFittedKeepsInitialGuess() {
    FitResult replaced = base.withFitted(new double[]{3., 5., 0.1, 1.}, null);
    assertEquals(3., replaced.getParameter(SineModel.AMPLITUDE), 0.);
    assertArrayEquals(base.getInitial(), replaced.getInitial(), 0.);
    assertNull(replaced.getCovariance());
  }

  @Test(expected = IllegalArgumentException.class)
  public void missingDerivedValueRejected() {
    base.getDerived("split");
  }

  @Test(expected = IllegalArgumentException.class)
  public void wrongLengthRejected() {
    new FitResult("sine", new SineModel().getSchema(), new double[3], new double[4], 0., null);
  }

}
