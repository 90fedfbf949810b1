package org.minnen.rebalance.util;

/** Single-factor (CAPM) formulas shared by the optimizer and the portfolio statistics. */
public final class FinLib
{
  /**
   * Calculate the expected return for an equity using CAPM.
   * 
   * @param riskFreeRate return of a risk-free asset (e.g. short-term treasury bills)
   * @param beta sensitivity of the equity to the market
   * @param marketReturn return of the market (e.g. the S&P 500)
   * @return riskFreeRate + beta * (marketReturn - riskFreeRate)
   */
  public static double capmExpectedReturn(double riskFreeRate, double beta, double marketReturn)
  {
    return riskFreeRate + beta * excessReturn(marketReturn, riskFreeRate);
  }

  /** @return amount by which `ret` exceeds the risk-free rate. */
  public static double excessReturn(double ret, double riskFreeRate)
  {
    return ret - riskFreeRate;
  }
}
