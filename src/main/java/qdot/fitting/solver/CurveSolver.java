package qdot.fitting.solver;

import java.util.List;
import qdot.fitting.input.SampleSeries;
import qdot.fitting.model.ModelFunction;

/**
 * Refines an initial parameter vector of a model to best match measured data in the
 * least-squares sense. Parameters are passed in the order of the model's schema; bounds are
 * matched to parameters by name.
 *
 * Failure to converge within the solver's limits is reported with the optimizer's own
 * exceptions (i.e., {@link org.apache.commons.math3.exception.TooManyEvaluationsException}).
 */
public interface CurveSolver {

  /**
   * @param model Model to fit
   * @param series Data to fit the model to
   * @param initial Starting point, ordered as in the model's schema
   * @param bounds Limits on named parameters (may be empty)
   * @return Best-fit parameters and fit statistics
   */
  SolverResult solve(ModelFunction model, SampleSeries series, double[] initial,
      List<ParameterBound> bounds);
}
