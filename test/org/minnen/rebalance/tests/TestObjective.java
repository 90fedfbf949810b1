package org.minnen.rebalance.tests;

import static org.junit.Assert.*;

import org.junit.Test;
import org.minnen.rebalance.DomainException;
import org.minnen.rebalance.ValidationException;
import org.minnen.rebalance.opt.Objective;
import org.minnen.rebalance.portfolio.Equity;
import org.minnen.rebalance.portfolio.MarketParams;
import org.minnen.rebalance.portfolio.Portfolio;

public class TestObjective
{
  private static final MarketParams market = new MarketParams(0.07, 0.02);

  @Test
  public void testSharpeCoefficients()
  {
    Portfolio portfolio = new Portfolio(new Equity(1.2, 100, 50, 0.08), new Equity(0.9, 150, 30, 0.06));
    double[] c = Objective.SHARPE.coefficients(portfolio, market);
    assertEquals(2, c.length);
    assertEquals(-(0.06 / (1.2 * 0.05)), c[0], 1e-12);
    assertEquals(-(0.04 / (0.9 * 0.05)), c[1], 1e-12);
    assertEquals(-1.0, c[0], 1e-9);
    assertEquals(-8.0 / 9.0, c[1], 1e-9);
  }

  @Test
  public void testSharpeNegativeExcess()
  {
    // Return below the risk-free rate gives a positive (penalized) coefficient.
    Portfolio portfolio = new Portfolio(new Equity(0.5, 10, 10, 0.01));
    double[] c = Objective.SHARPE.coefficients(portfolio, market);
    assertEquals(0.4, c[0], 1e-12);
  }

  @Test
  public void testSharpeDoesNotModify()
  {
    Portfolio portfolio = new Portfolio(new Equity(1.2, 100, 50, 0.08), new Equity(0.9, 150, 30, 0.06));
    Objective.SHARPE.coefficients(portfolio, market);
    assertArrayEquals(new double[] { 100, 150 }, portfolio.getQuantities(), 0.0);
  }

  @Test(expected = DomainException.class)
  public void testSharpeZeroBeta()
  {
    Portfolio portfolio = new Portfolio(new Equity(1.2, 100, 50, 0.08), new Equity(0.0, 150, 30, 0.06));
    Objective.SHARPE.coefficients(portfolio, market);
  }

  @Test(expected = DomainException.class)
  public void testSharpeZeroMarketExcess()
  {
    Portfolio portfolio = new Portfolio(new Equity(1.2, 100, 50, 0.08));
    Objective.SHARPE.coefficients(portfolio, new MarketParams(0.03, 0.03));
  }

  @Test(expected = DomainException.class)
  public void testSharpeOverflow()
  {
    Portfolio portfolio = new Portfolio(new Equity(Double.MIN_VALUE, 100, 50, 0.08));
    Objective.SHARPE.coefficients(portfolio, market);
  }

  @Test(expected = ValidationException.class)
  public void testSharpeMissingReturn()
  {
    Portfolio portfolio = new Portfolio(new Equity(1.2, 100, 50, 0.08), new Equity(0.9, 150, 30));
    Objective.SHARPE.coefficients(portfolio, market);
  }

  @Test(expected = ValidationException.class)
  public void testSharpeMissingMarket()
  {
    Portfolio portfolio = new Portfolio(new Equity(1.2, 100, 50, 0.08));
    Objective.SHARPE.coefficients(portfolio, null);
  }

  @Test
  public void testMinBetaCoefficients()
  {
    Portfolio portfolio = new Portfolio(new Equity(1.2, 100, 50), new Equity(0.9, 150, 30), new Equity(0.0, 1, 1));
    assertArrayEquals(new double[] { 1.2, 0.9, 0.0 }, Objective.MIN_BETA.coefficients(portfolio, null), 0.0);
  }

  @Test
  public void testFromName()
  {
    assertEquals(Objective.SHARPE, Objective.fromName("sharpe"));
    assertEquals(Objective.SHARPE, Objective.fromName(" Sharpe "));
    assertEquals(Objective.MIN_BETA, Objective.fromName("minbeta"));
    assertEquals(Objective.MIN_BETA, Objective.fromName("MIN_BETA"));
    assertEquals(Objective.MIN_BETA, Objective.fromName("min-beta"));
  }

  @Test(expected = ValidationException.class)
  public void testFromNameUnknown()
  {
    Objective.fromName("max-alpha");
  }
}
