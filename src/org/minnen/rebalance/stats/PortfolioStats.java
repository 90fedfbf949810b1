package org.minnen.rebalance.stats;

import java.util.Arrays;

import org.minnen.rebalance.DomainException;
import org.minnen.rebalance.portfolio.Equity;
import org.minnen.rebalance.portfolio.MarketParams;
import org.minnen.rebalance.portfolio.Portfolio;
import org.minnen.rebalance.portfolio.Validate;
import org.minnen.rebalance.util.FinLib;
import org.minnen.rebalance.util.Library;

/**
 * Value-weighted beta, alpha, and Sharpe ratio for a portfolio under a single-factor market model.
 * 
 * The Sharpe ratio uses sum(weight * beta * marketExcess) as the risk term, which is beta times the market's excess
 * return rather than a true standard deviation.
 */
public class PortfolioStats
{
  public final double   totalInvestment;
  public final double[] weights;
  public final double   beta;
  public final double   ret;
  public final double   alpha;
  public final double   stdDevProxy;
  public final double   sharpe;

  /**
   * Calculate statistics for the given portfolio.
   * 
   * @throws org.minnen.rebalance.ValidationException if the portfolio is malformed or an equity lacks a return
   * @throws DomainException if the total investment or the risk term is zero
   */
  public static PortfolioStats calc(Portfolio portfolio, MarketParams market)
  {
    return new PortfolioStats(portfolio, market);
  }

  private PortfolioStats(Portfolio portfolio, MarketParams market)
  {
    Validate.checkHoldings(portfolio);
    Validate.checkReturns(portfolio);
    Validate.checkMarket(market);

    totalInvestment = portfolio.getTotalValue();
    if (totalInvestment == 0.0) {
      throw new DomainException("Total investment is zero so weights are undefined");
    }

    final int n = portfolio.size();
    final double marketExcess = market.getExcessReturn();
    weights = new double[n];
    double beta = 0.0;
    double ret = 0.0;
    double stdDevProxy = 0.0;
    for (int i = 0; i < n; ++i) {
      Equity equity = portfolio.get(i);
      weights[i] = equity.getValue() / totalInvestment;
      beta += weights[i] * equity.beta;
      ret += weights[i] * equity.ret;
      stdDevProxy += weights[i] * equity.beta * marketExcess;
    }
    assert Library.almostEqual(Library.sum(weights), 1.0, 1e-9);
    this.beta = beta;
    this.ret = ret;
    this.stdDevProxy = stdDevProxy;

    alpha = FinLib.excessReturn(ret, market.riskFreeRate) - beta * marketExcess;

    if (stdDevProxy == 0.0) {
      throw new DomainException("Sharpe ratio is undefined: portfolio beta (%f) or market excess return (%f) is zero",
          beta, marketExcess);
    }
    sharpe = FinLib.excessReturn(ret, market.riskFreeRate) / stdDevProxy;
    if (!Double.isFinite(beta) || !Double.isFinite(alpha) || !Double.isFinite(sharpe)) {
      throw new DomainException("Portfolio statistics are not finite (beta=%f, alpha=%f, sharpe=%f)", beta, alpha,
          sharpe);
    }
  }

  public double getBeta()
  {
    return beta;
  }

  public double getAlpha()
  {
    return alpha;
  }

  public double getSharpe()
  {
    return sharpe;
  }

  public double getWeight(int i)
  {
    return weights[i];
  }

  public double[] getWeights()
  {
    return Arrays.copyOf(weights, weights.length);
  }

  @Override
  public String toString()
  {
    return String.format("beta=%.4f alpha=%.4f sharpe=%.4f", beta, alpha, sharpe);
  }

  public String toLongString()
  {
    return String.format("value=%.2f return=%.4f beta=%.4f alpha=%.4f sharpe=%.4f", totalInvestment, ret, beta, alpha,
        sharpe);
  }
}
