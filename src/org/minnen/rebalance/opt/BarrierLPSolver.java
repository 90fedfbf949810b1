package org.minnen.rebalance.opt;

import java.util.Arrays;

import org.minnen.rebalance.util.Library;

import com.joptimizer.functions.ConvexMultivariateRealFunction;
import com.joptimizer.functions.LinearMultivariateRealFunction;
import com.joptimizer.optimizers.JOptimizer;
import com.joptimizer.optimizers.OptimizationRequest;

/**
 * Solves budget-constrained linear programs with the interior-point optimizer from JOptimizer.
 * 
 * Supports the shape produced by rebalancing: one equality row with positive coefficients, zero lower bounds, and no
 * upper bounds. The feasible region is then bounded, so the problem can't be unbounded. Solutions approach the optimal
 * vertex to within the configured tolerance.
 */
public class BarrierLPSolver implements LinearProgramSolver
{
  public static final double DEFAULT_TOLERANCE = 1.0e-6;

  private final double       tolerance;

  public BarrierLPSolver()
  {
    this(DEFAULT_TOLERANCE);
  }

  public BarrierLPSolver(double tolerance)
  {
    if (!(tolerance > 0.0)) {
      throw new IllegalArgumentException(String.format("tolerance must be positive (%g)", tolerance));
    }
    this.tolerance = tolerance;
  }

  public double getTolerance()
  {
    return tolerance;
  }

  @Override
  public LPResult solve(LinearProgram lp)
  {
    final int n = lp.numVars();
    if (lp.numEqualities() != 1) {
      return LPResult.failure(LPResult.Status.SOLVER_ERROR,
          String.format("expected a single budget row, not %d", lp.numEqualities()));
    }
    for (int i = 0; i < n; ++i) {
      if (lp.lowerBounds[i] != 0.0 || lp.upperBounds[i] != Library.INF) {
        return LPResult.failure(LPResult.Status.SOLVER_ERROR,
            String.format("variable %d must have bounds [0, inf), not [%f, %f]", i, lp.lowerBounds[i],
                lp.upperBounds[i]));
      }
    }
    final double[] a = lp.aEq[0];
    final double b = lp.bEq[0];
    for (int i = 0; i < n; ++i) {
      if (!(a[i] > 0.0)) {
        return LPResult.failure(LPResult.Status.SOLVER_ERROR,
            String.format("budget coefficient %d must be positive (%f)", i, a[i]));
      }
    }

    // Small cases have a single feasible point so there is nothing to optimize.
    if (b < 0.0) {
      return LPResult.failure(LPResult.Status.INFEASIBLE, String.format("negative budget (%f)", b));
    }
    if (b == 0.0) {
      return LPResult.optimal(new double[n]);
    }
    if (n == 1) {
      return LPResult.optimal(new double[] { b / a[0] });
    }

    // Initial guess splits the budget evenly, which is strictly inside the feasible region.
    double[] guess = new double[n];
    for (int i = 0; i < n; ++i) {
      guess[i] = b / (n * a[i]);
    }

    LinearMultivariateRealFunction objective = new LinearMultivariateRealFunction(lp.c, 0.0);

    // Enforce x >= 0 via -x <= 0.
    ConvexMultivariateRealFunction[] inequalities = new ConvexMultivariateRealFunction[n];
    for (int i = 0; i < n; ++i) {
      double[] q = new double[n];
      q[i] = -1.0;
      inequalities[i] = new LinearMultivariateRealFunction(q, 0.0);
    }

    OptimizationRequest or = new OptimizationRequest();
    or.setF0(objective);
    or.setA(new double[][] { Arrays.copyOf(a, n) });
    or.setB(new double[] { b });
    or.setFi(inequalities);
    or.setToleranceFeas(tolerance);
    or.setTolerance(tolerance);
    or.setInitialPoint(guess);

    JOptimizer opt = new JOptimizer();
    opt.setOptimizationRequest(or);
    try {
      opt.optimize();
    } catch (Exception e) {
      return LPResult.failure(LPResult.Status.SOLVER_ERROR, String.valueOf(e.getMessage()));
    }
    double[] x = opt.getOptimizationResponse().getSolution();
    if (x == null || x.length != n || !Library.isFinite(x)) {
      return LPResult.failure(LPResult.Status.SOLVER_ERROR, "optimizer did not return a solution");
    }
    return LPResult.optimal(x);
  }
}
