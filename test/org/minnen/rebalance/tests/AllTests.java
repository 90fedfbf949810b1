package org.minnen.rebalance.tests;

import org.junit.runner.RunWith;
import org.junit.runners.Suite;
import org.junit.runners.Suite.SuiteClasses;

@RunWith(Suite.class)
@SuiteClasses({ TestBarrierLPSolver.class, TestBudgetConstraint.class, TestEquity.class, TestFinLib.class,
    TestObjective.class, TestPortfolio.class, TestPortfolioIO.class, TestPortfolioStats.class, TestRebalanceConfig.class,
    TestRebalancer.class, TestSimplexLPSolver.class })
public class AllTests
{
}
