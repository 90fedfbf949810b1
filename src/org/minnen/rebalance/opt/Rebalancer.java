package org.minnen.rebalance.opt;

import org.minnen.rebalance.DomainException;
import org.minnen.rebalance.OptimizationException;
import org.minnen.rebalance.ValidationException;
import org.minnen.rebalance.portfolio.Allocation;
import org.minnen.rebalance.portfolio.MarketParams;
import org.minnen.rebalance.portfolio.Portfolio;
import org.minnen.rebalance.portfolio.Validate;
import org.minnen.rebalance.util.Library;

/**
 * Adjusts the quantities in a portfolio to optimize an objective while keeping the total value unchanged.
 * 
 * The continuous solution is rounded to whole units per equity. Rounding can move the total value by up to half a
 * share price per equity; that drift is not redistributed. Either every quantity is updated or none are.
 */
public class Rebalancer
{
  private final LinearProgramSolver solver;

  public Rebalancer()
  {
    this(new SimplexLPSolver());
  }

  public Rebalancer(LinearProgramSolver solver)
  {
    this.solver = solver;
  }

  /** Adjust quantities to maximize the portfolio's (approximate) Sharpe ratio. */
  public Portfolio optimizeForSharpe(Portfolio portfolio, MarketParams market)
  {
    return optimize(portfolio, Objective.SHARPE, market);
  }

  /** Adjust quantities to minimize the portfolio's beta. */
  public Portfolio optimizeForMinBeta(Portfolio portfolio)
  {
    return optimize(portfolio, Objective.MIN_BETA, null);
  }

  /**
   * Rebalance `portfolio` in place.
   * 
   * @return the same portfolio with updated quantities
   * @throws ValidationException if the portfolio is malformed
   * @throws DomainException if the objective or budget is undefined for the inputs
   * @throws OptimizationException if the solver fails; the portfolio is unchanged
   */
  public Portfolio optimize(Portfolio portfolio, Objective objective, MarketParams market)
  {
    Allocation allocation = solve(portfolio, objective, market);
    return portfolio.apply(allocation);
  }

  /** @return rebalanced quantities for `portfolio`, which is not modified. */
  public Allocation solve(Portfolio portfolio, Objective objective, MarketParams market)
  {
    LinearProgram lp = formulate(portfolio, objective, market);
    LPResult result = solver.solve(lp);
    if (!result.isOptimal()) {
      throw new OptimizationException(result);
    }
    if (result.solution == null || result.solution.length != lp.numVars() || !Library.isFinite(result.solution)) {
      throw new OptimizationException(
          LPResult.failure(LPResult.Status.SOLVER_ERROR, "solution is missing, the wrong size, or not finite"));
    }
    return new Allocation(result.solution);
  }

  /** @return the linear program that rebalances `portfolio` for the given objective. */
  public static LinearProgram formulate(Portfolio portfolio, Objective objective, MarketParams market)
  {
    Validate.checkHoldings(portfolio);
    Validate.checkPositivePrices(portfolio);

    final int n = portfolio.size();
    double[] c = objective.coefficients(portfolio, market);
    return new LinearProgram(c, BudgetConstraint.buildAeq(portfolio), BudgetConstraint.buildBeq(portfolio),
        BudgetConstraint.lowerBounds(n), BudgetConstraint.upperBounds(n));
  }
}
