package org.minnen.rebalance.portfolio;

import org.minnen.rebalance.DomainException;
import org.minnen.rebalance.ValidationException;

/** Checks shared by the optimizer and the portfolio statistics. */
public final class Validate
{
  /**
   * Verify that the portfolio is non-empty and every equity has a finite beta, a finite non-negative quantity, and a
   * finite non-negative price.
   * 
   * @throws ValidationException if any check fails
   */
  public static void checkHoldings(Portfolio portfolio)
  {
    if (portfolio == null || portfolio.isEmpty()) {
      throw new ValidationException("Portfolio must contain at least one equity");
    }
    for (int i = 0; i < portfolio.size(); ++i) {
      Equity equity = portfolio.get(i);
      if (!Double.isFinite(equity.beta)) {
        throw new ValidationException(String.format("Equity %d %s: beta must be finite", i, equity.getName()));
      }
      if (!Double.isFinite(equity.qty) || equity.qty < 0.0) {
        throw new ValidationException(
            String.format("Equity %d %s: quantity must be finite and non-negative (%f)", i, equity.getName(), equity.qty));
      }
      if (!Double.isFinite(equity.avgPrice) || equity.avgPrice < 0.0) {
        throw new ValidationException(String.format("Equity %d %s: average price must be finite and non-negative (%f)",
            i, equity.getName(), equity.avgPrice));
      }
    }
  }

  /**
   * Verify that every price is strictly positive.
   * 
   * A zero price leaves that equity's quantity out of the budget constraint.
   * 
   * @throws DomainException if any price is zero
   */
  public static void checkPositivePrices(Portfolio portfolio)
  {
    for (int i = 0; i < portfolio.size(); ++i) {
      Equity equity = portfolio.get(i);
      if (equity.avgPrice <= 0.0) {
        throw new DomainException("Equity %d %s: average price must be positive for the budget constraint", i,
            equity.getName());
      }
    }
  }

  /** @throws ValidationException if any equity lacks a finite return */
  public static void checkReturns(Portfolio portfolio)
  {
    for (int i = 0; i < portfolio.size(); ++i) {
      Equity equity = portfolio.get(i);
      if (!Double.isFinite(equity.ret)) {
        throw new ValidationException(String.format("Equity %d %s: a finite return is required", i, equity.getName()));
      }
    }
  }

  /** @throws ValidationException if the market parameters are missing or not finite */
  public static void checkMarket(MarketParams market)
  {
    if (market == null) {
      throw new ValidationException("Market parameters are required");
    }
    if (!Double.isFinite(market.benchmarkReturn) || !Double.isFinite(market.riskFreeRate)) {
      throw new ValidationException(String.format("Market parameters must be finite: %s", market));
    }
  }
}
