package org.minnen.rebalance.opt;

import java.util.ArrayList;
import java.util.List;

import org.apache.commons.math3.exception.TooManyIterationsException;
import org.apache.commons.math3.optim.MaxIter;
import org.apache.commons.math3.optim.PointValuePair;
import org.apache.commons.math3.optim.linear.LinearConstraint;
import org.apache.commons.math3.optim.linear.LinearConstraintSet;
import org.apache.commons.math3.optim.linear.LinearObjectiveFunction;
import org.apache.commons.math3.optim.linear.NoFeasibleSolutionException;
import org.apache.commons.math3.optim.linear.NonNegativeConstraint;
import org.apache.commons.math3.optim.linear.Relationship;
import org.apache.commons.math3.optim.linear.SimplexSolver;
import org.apache.commons.math3.optim.linear.UnboundedSolutionException;
import org.apache.commons.math3.optim.nonlinear.scalar.GoalType;

/** Solves linear programs with the simplex method from Apache Commons Math. */
public class SimplexLPSolver implements LinearProgramSolver
{
  public static final int DEFAULT_MAX_ITERATIONS = 1000;

  private final int       maxIterations;

  public SimplexLPSolver()
  {
    this(DEFAULT_MAX_ITERATIONS);
  }

  public SimplexLPSolver(int maxIterations)
  {
    if (maxIterations <= 0) {
      throw new IllegalArgumentException(String.format("maxIterations must be positive (%d)", maxIterations));
    }
    this.maxIterations = maxIterations;
  }

  public int getMaxIterations()
  {
    return maxIterations;
  }

  @Override
  public LPResult solve(LinearProgram lp)
  {
    final int n = lp.numVars();

    List<LinearConstraint> constraints = new ArrayList<>();
    for (int i = 0; i < lp.numEqualities(); ++i) {
      constraints.add(new LinearConstraint(lp.aEq[i], Relationship.EQ, lp.bEq[i]));
    }

    // Zero lower bounds map onto the solver's non-negativity flag; anything else becomes an explicit row.
    boolean bNonNegative = true;
    for (int i = 0; i < n; ++i) {
      if (lp.lowerBounds[i] < 0.0) bNonNegative = false;
    }
    for (int i = 0; i < n; ++i) {
      double lb = lp.lowerBounds[i];
      double ub = lp.upperBounds[i];
      if (Double.isFinite(lb) && (lb > 0.0 || !bNonNegative)) {
        constraints.add(new LinearConstraint(unit(n, i), Relationship.GEQ, lb));
      }
      if (Double.isFinite(ub)) {
        constraints.add(new LinearConstraint(unit(n, i), Relationship.LEQ, ub));
      }
    }

    try {
      SimplexSolver solver = new SimplexSolver();
      PointValuePair result = solver.optimize(new MaxIter(maxIterations), new LinearObjectiveFunction(lp.c, 0.0),
          new LinearConstraintSet(constraints), GoalType.MINIMIZE, new NonNegativeConstraint(bNonNegative));
      return LPResult.optimal(result.getPoint());
    } catch (NoFeasibleSolutionException e) {
      return LPResult.failure(LPResult.Status.INFEASIBLE, "no feasible solution");
    } catch (UnboundedSolutionException e) {
      return LPResult.failure(LPResult.Status.UNBOUNDED, "unbounded solution");
    } catch (TooManyIterationsException e) {
      return LPResult.failure(LPResult.Status.SOLVER_ERROR,
          String.format("no solution after %d iterations", maxIterations));
    }
  }

  private static double[] unit(int n, int i)
  {
    double[] a = new double[n];
    a[i] = 1.0;
    return a;
  }
}
