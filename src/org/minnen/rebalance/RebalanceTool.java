package org.minnen.rebalance;

import java.io.File;
import java.io.IOException;

import org.apache.commons.configuration2.ex.ConfigurationException;
import org.minnen.rebalance.opt.Rebalancer;
import org.minnen.rebalance.portfolio.Equity;
import org.minnen.rebalance.portfolio.MarketParams;
import org.minnen.rebalance.portfolio.Portfolio;
import org.minnen.rebalance.portfolio.PortfolioIO;
import org.minnen.rebalance.stats.PortfolioStats;

/**
 * Rebalance a portfolio and print metrics before and after.
 * 
 * Usage: RebalanceTool [config.properties] [portfolio.txt]
 */
public class RebalanceTool
{
  /** @return two-equity portfolio used when no portfolio file is given. */
  public static Portfolio examplePortfolio()
  {
    return new Portfolio(new Equity("A", 1.2, 100, 50, 0.08), new Equity("B", 0.9, 150, 30, 0.06));
  }

  public static void printStats(String label, Portfolio portfolio, MarketParams market)
  {
    try {
      PortfolioStats stats = PortfolioStats.calc(portfolio, market);
      System.out.printf("%s: %s\n", label, stats.toLongString());
    } catch (DomainException | ValidationException e) {
      System.out.printf("%s: metrics unavailable (%s)\n", label, e.getMessage());
    }
  }

  public static void main(String[] args) throws IOException, ConfigurationException
  {
    RebalanceConfig config = (args.length > 0 ? RebalanceConfig.load(new File(args[0])) : RebalanceConfig.loadDefault());
    Portfolio portfolio = (args.length > 1 ? PortfolioIO.load(new File(args[1])) : examplePortfolio());
    MarketParams market = config.getMarketParams();
    if (config.bCapmReturns) {
      portfolio = portfolio.withCapmReturns(market);
    }
    System.out.printf("Settings: %s\n", config);
    System.out.printf("Market: %s\n", market);

    System.out.printf("Before (value=%.2f):\n%s", portfolio.getTotalValue(), portfolio);
    printStats("Before", portfolio, market);

    Rebalancer rebalancer = new Rebalancer(config.buildSolver());
    try {
      rebalancer.optimize(portfolio, config.objective, market);
    } catch (OptimizationException | DomainException | ValidationException e) {
      System.err.printf("Rebalancing failed: %s\n", e.getMessage());
      System.exit(1);
    }

    System.out.printf("After (value=%.2f):\n%s", portfolio.getTotalValue(), portfolio);
    printStats("After", portfolio, market);
  }
}
