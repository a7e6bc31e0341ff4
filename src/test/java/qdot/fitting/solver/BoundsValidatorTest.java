package qdot.fitting.solver;

import static org.junit.Assert.assertArrayEquals;
import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertTrue;

import java.util.Arrays;
import java.util.Collections;
import org.apache.commons.math3.linear.MatrixUtils;
import org.apache.commons.math3.linear.RealVector;
import org.junit.Test;
import qdot.fitting.model.GaussianModel;

public class BoundsValidatorTest {

  private final BoundsValidator validator = new BoundsValidator(
      new GaussianModel(true).getSchema(),
      Arrays.asList(ParameterBound.atLeast(GaussianModel.AMPLITUDE, 0.),
          ParameterBound.between(GaussianModel.MEAN, -1., 1.)));

  @Test
  public void clampLeavesFreeParametersAlone() {
    double[] params = {3., -2., -5., -7.};
    assertArrayEquals(new double[]{1., -2., 0., -7.}, validator.clamp(params), 0.);
    assertEquals(3., params[0], 0.);
  }

  @Test
  public void validateClampsInPlace() {
    RealVector vector = MatrixUtils.createRealVector(new double[]{-3., 1., 2., 0.});
    RealVector validated = validator.validate(vector);
    assertArrayEquals(new double[]{-1., 1., 2., 0.}, validated.toArray(), 0.);
  }

  @Test
  public void upperBoundDetection() {
    assertTrue(validator.atUpperBound(0, 1., 1E-8));
    assertFalse(validator.atUpperBound(0, 0., 1E-8));
    assertFalse(validator.atUpperBound(2, 1E300, 1E-8));
  }

  @Test(expected = IllegalArgumentException.class)
  public void unknownParameterRejected() {
    new BoundsValidator(new GaussianModel(false).getSchema(),
        Collections.singletonList(ParameterBound.atLeast(GaussianModel.OFFSET, 0.)));
  }

  @Test(expected = IllegalArgumentException.class)
  public void invertedBoundRejected() {
    new ParameterBound("x", 1., 0.);
  }

  @Test
  public void boundClampsValue() {
    ParameterBound bound = ParameterBound.between("x", -1., 2.);
    assertEquals(2., bound.clamp(5.), 0.);
    assertEquals(-1., bound.clamp(-5.), 0.);
    assertEquals(0.5, bound.clamp(0.5), 0.);
  }

}
