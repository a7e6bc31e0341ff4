package qdot.fitting.fit;

import qdot.fitting.input.Configuration;
import qdot.fitting.solver.CurveSolver;
import qdot.fitting.solver.LevenbergMarquardtSolver;
import qdot.fitting.solver.ModelCurveFitterSolver;

/**
 * Solver used for Fermi-linear fits. Both minimize the same sum of squares from the same
 * starting point and should agree to within the solver tolerance.
 */
public enum FitStrategy {

  /**
   * Least-squares problem built directly from the model, with no parameter bounds
   */
  LEAST_SQUARES {
    @Override
    public CurveSolver createSolver(Configuration config) {
      return new LevenbergMarquardtSolver(config);
    }
  },

  /**
   * Fit through the curve-fitting layer, with the temperature kept non-negative
   */
  CURVE_FITTER {
    @Override
    public CurveSolver createSolver(Configuration config) {
      return new ModelCurveFitterSolver(config);
    }
  };

  /**
   * @param config Solver limits and tolerances
   * @return A new solver of this kind
   */
  public abstract CurveSolver createSolver(Configuration config);

}
