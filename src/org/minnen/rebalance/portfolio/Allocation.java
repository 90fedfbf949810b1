package org.minnen.rebalance.portfolio;

import java.util.Arrays;

import org.minnen.rebalance.util.Library;

/**
 * Quantities produced by rebalancing a portfolio.
 * 
 * Holds both the continuous solution returned by the solver and the integral quantities derived from it. Index `i`
 * corresponds to equity `i` of the portfolio that was rebalanced.
 */
public class Allocation
{
  private final double[] solution;
  private final double[] quantities;

  public Allocation(double[] solution)
  {
    this.solution = Arrays.copyOf(solution, solution.length);
    this.quantities = new double[solution.length];
    for (int i = 0; i < solution.length; ++i) {
      quantities[i] = roundQuantity(solution[i]);
    }
  }

  /**
   * Round a solver value to the nearest whole unit.
   * 
   * Ties go to the even neighbor and tiny negative values produced by the solver's tolerance become zero.
   */
  public static double roundQuantity(double x)
  {
    return Math.max(0.0, Math.rint(x));
  }

  public int size()
  {
    return quantities.length;
  }

  public double getQuantity(int i)
  {
    return quantities[i];
  }

  public double getSolution(int i)
  {
    return solution[i];
  }

  public double[] getQuantities()
  {
    return Arrays.copyOf(quantities, quantities.length);
  }

  public double[] getSolution()
  {
    return Arrays.copyOf(solution, solution.length);
  }

  /** @return market value of the rounded quantities using the prices in `portfolio`. */
  public double getValue(Portfolio portfolio)
  {
    return value(portfolio, quantities);
  }

  /** @return market value of the continuous solution using the prices in `portfolio`. */
  public double getSolutionValue(Portfolio portfolio)
  {
    return value(portfolio, solution);
  }

  private static double value(Portfolio portfolio, double[] x)
  {
    return Library.dot(portfolio.getPrices(), x);
  }

  @Override
  public String toString()
  {
    return Arrays.toString(quantities);
  }
}
