package org.minnen.rebalance;

import org.minnen.rebalance.opt.LPResult;

/** Thrown when the linear program solver fails to find an optimal solution. */
public class OptimizationException extends RuntimeException
{
  private static final long     serialVersionUID = 1L;

  private final LPResult.Status status;

  public OptimizationException(LPResult result)
  {
    super(String.format("Optimization failed (%s): %s", result.status, result.message));
    this.status = result.status;
  }

  public LPResult.Status getStatus()
  {
    return status;
  }
}
