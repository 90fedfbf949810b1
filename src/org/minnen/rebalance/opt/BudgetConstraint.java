package org.minnen.rebalance.opt;

import java.util.Arrays;

import org.minnen.rebalance.portfolio.Portfolio;
import org.minnen.rebalance.util.Library;

/**
 * Builds the constraints shared by every rebalancing objective.
 * 
 * The single equality row fixes the total market value: sum(avgPrice[i] * x[i]) = sum(avgPrice[i] * qty[i]). Value
 * may move freely between equities; no position is capped. Each quantity is bounded to [0, inf).
 */
public final class BudgetConstraint
{
  /** @return single-row equality matrix holding each equity's average price. */
  public static double[][] buildAeq(Portfolio portfolio)
  {
    double[] row = new double[portfolio.size()];
    for (int i = 0; i < row.length; ++i) {
      row[i] = portfolio.get(i).avgPrice;
    }
    return new double[][] { row };
  }

  /** @return right-hand side holding the current total value of the portfolio. */
  public static double[] buildBeq(Portfolio portfolio)
  {
    return new double[] { portfolio.getTotalValue() };
  }

  public static double[] lowerBounds(int n)
  {
    return new double[n];
  }

  public static double[] upperBounds(int n)
  {
    double[] ub = new double[n];
    Arrays.fill(ub, Library.INF);
    return ub;
  }
}
