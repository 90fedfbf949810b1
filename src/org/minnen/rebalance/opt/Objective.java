package org.minnen.rebalance.opt;

import org.minnen.rebalance.DomainException;
import org.minnen.rebalance.ValidationException;
import org.minnen.rebalance.portfolio.Equity;
import org.minnen.rebalance.portfolio.MarketParams;
import org.minnen.rebalance.portfolio.Portfolio;
import org.minnen.rebalance.portfolio.Validate;
import org.minnen.rebalance.util.FinLib;

/** Rebalancing goals, each expressed as the coefficient vector of a linear objective that is minimized. */
public enum Objective {
  /**
   * Maximize an approximate Sharpe ratio.
   * 
   * Each equity contributes its CAPM excess-return-to-beta ratio, negated so that minimizing favors high ratios. The
   * true Sharpe ratio isn't linear in the quantities so this is only a proxy.
   */
  SHARPE {
    @Override
    public double[] coefficients(Portfolio portfolio, MarketParams market)
    {
      Validate.checkMarket(market);
      Validate.checkReturns(portfolio);

      final double marketExcess = market.getExcessReturn();
      if (marketExcess == 0.0) {
        throw new DomainException("Benchmark return equals the risk-free rate (%f)", market.riskFreeRate);
      }

      final int n = portfolio.size();
      double[] c = new double[n];
      for (int i = 0; i < n; ++i) {
        Equity equity = portfolio.get(i);
        if (equity.beta == 0.0) {
          throw new DomainException("Equity %d %s: beta is zero", i, equity.getName());
        }
        c[i] = -(FinLib.excessReturn(equity.ret, market.riskFreeRate) / (equity.beta * marketExcess));
        if (!Double.isFinite(c[i])) {
          throw new DomainException("Equity %d %s: excess return ratio is not finite", i, equity.getName());
        }
      }
      return c;
    }
  },

  /** Minimize beta; market parameters are ignored and may be null. */
  MIN_BETA {
    @Override
    public double[] coefficients(Portfolio portfolio, MarketParams market)
    {
      double[] c = new double[portfolio.size()];
      for (int i = 0; i < c.length; ++i) {
        c[i] = portfolio.get(i).beta;
      }
      return c;
    }
  };

  /**
   * Build the objective coefficients for `portfolio`; index `i` matches equity `i`.
   * 
   * @throws DomainException if a coefficient is undefined for the given inputs
   * @throws ValidationException if an equity lacks a field this objective requires
   */
  public abstract double[] coefficients(Portfolio portfolio, MarketParams market);

  /** @return objective matching `name` ("sharpe" or "minbeta", case insensitive). */
  public static Objective fromName(String name)
  {
    String s = (name == null ? "" : name.trim().toLowerCase().replace("_", "").replace("-", ""));
    if (s.equals("sharpe")) return SHARPE;
    if (s.equals("minbeta")) return MIN_BETA;
    throw new ValidationException(String.format("Unknown objective: [%s]", name));
  }
}
