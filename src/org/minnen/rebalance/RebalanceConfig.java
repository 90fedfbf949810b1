package org.minnen.rebalance;

import java.io.File;
import java.net.URL;

import org.apache.commons.configuration2.Configuration;
import org.apache.commons.configuration2.builder.fluent.Configurations;
import org.apache.commons.configuration2.ex.ConfigurationException;
import org.apache.commons.configuration2.ex.ConversionException;
import org.minnen.rebalance.opt.BarrierLPSolver;
import org.minnen.rebalance.opt.LinearProgramSolver;
import org.minnen.rebalance.opt.Objective;
import org.minnen.rebalance.opt.SimplexLPSolver;
import org.minnen.rebalance.portfolio.MarketParams;

/** Settings for a rebalancing run. */
public class RebalanceConfig
{
  public static final String DEFAULT_RESOURCE  = "/rebalance.properties";

  public static final String KEY_BENCHMARK     = "market.benchmark";
  public static final String KEY_RISK_FREE     = "market.riskfree";
  public static final String KEY_OBJECTIVE     = "rebalance.objective";
  public static final String KEY_SOLVER        = "rebalance.solver";
  public static final String KEY_CAPM_RETURNS  = "rebalance.capm-returns";
  public static final String KEY_MAX_ITERS     = "solver.max-iterations";
  public static final String KEY_TOLERANCE     = "solver.tolerance";

  public double              benchmarkReturn   = 0.07;
  public double              riskFreeRate      = 0.02;
  public Objective           objective         = Objective.SHARPE;
  public String              solverName        = "simplex";
  public boolean             bCapmReturns      = false;
  public int                 maxIterations     = SimplexLPSolver.DEFAULT_MAX_ITERATIONS;
  public double              tolerance         = BarrierLPSolver.DEFAULT_TOLERANCE;

  /** Update settings from the given `config`; keys that are missing keep their current value. */
  public RebalanceConfig configure(Configuration config)
  {
    try {
      benchmarkReturn = config.getDouble(KEY_BENCHMARK, benchmarkReturn);
      riskFreeRate = config.getDouble(KEY_RISK_FREE, riskFreeRate);
      bCapmReturns = config.getBoolean(KEY_CAPM_RETURNS, bCapmReturns);
      maxIterations = config.getInt(KEY_MAX_ITERS, maxIterations);
      tolerance = config.getDouble(KEY_TOLERANCE, tolerance);
    } catch (ConversionException e) {
      throw new ValidationException("Invalid configuration value: " + e.getMessage(), e);
    }
    if (config.containsKey(KEY_OBJECTIVE)) {
      objective = Objective.fromName(config.getString(KEY_OBJECTIVE));
    }
    if (config.containsKey(KEY_SOLVER)) {
      solverName = config.getString(KEY_SOLVER).trim().toLowerCase();
    }
    buildSolver(); // fail early on a bad solver name or setting
    return this;
  }

  public MarketParams getMarketParams()
  {
    return new MarketParams(benchmarkReturn, riskFreeRate);
  }

  public LinearProgramSolver buildSolver()
  {
    try {
      if (solverName.equals("simplex")) return new SimplexLPSolver(maxIterations);
      if (solverName.equals("barrier")) return new BarrierLPSolver(tolerance);
    } catch (IllegalArgumentException e) {
      throw new ValidationException("Invalid solver setting: " + e.getMessage(), e);
    }
    throw new ValidationException(String.format("Unknown solver: [%s]", solverName));
  }

  /** @return settings from the default properties on the classpath. */
  public static RebalanceConfig loadDefault() throws ConfigurationException
  {
    RebalanceConfig settings = new RebalanceConfig();
    URL url = RebalanceConfig.class.getResource(DEFAULT_RESOURCE);
    if (url != null) {
      settings.configure(new Configurations().properties(url));
    }
    return settings;
  }

  /** @return default settings overridden by the properties in `file`. */
  public static RebalanceConfig load(File file) throws ConfigurationException
  {
    RebalanceConfig settings = loadDefault();
    return settings.configure(new Configurations().properties(file));
  }

  @Override
  public String toString()
  {
    return String.format("[%s solver=%s benchmark=%.4f riskFree=%.4f capmReturns=%b]", objective, solverName,
        benchmarkReturn, riskFreeRate, bCapmReturns);
  }
}
