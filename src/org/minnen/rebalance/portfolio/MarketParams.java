package org.minnen.rebalance.portfolio;

import org.minnen.rebalance.util.FinLib;

/** Market-wide scalars shared by every equity in a computation. */
public class MarketParams
{
  /** Return of the benchmark, typically the S&P 500. */
  public final double benchmarkReturn;

  /** Risk-free rate, typically a short-term treasury bill rate. */
  public final double riskFreeRate;

  public MarketParams(double benchmarkReturn, double riskFreeRate)
  {
    this.benchmarkReturn = benchmarkReturn;
    this.riskFreeRate = riskFreeRate;
  }

  /** @return benchmark return minus the risk-free rate. */
  public double getExcessReturn()
  {
    return FinLib.excessReturn(benchmarkReturn, riskFreeRate);
  }

  /** @return CAPM expected return for an equity with the given beta. */
  public double getExpectedReturn(double beta)
  {
    return FinLib.capmExpectedReturn(riskFreeRate, beta, benchmarkReturn);
  }

  @Override
  public String toString()
  {
    return String.format("[benchmark=%.4f riskFree=%.4f]", benchmarkReturn, riskFreeRate);
  }
}
