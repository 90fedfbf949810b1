package org.minnen.rebalance.opt;

/** Finds the minimizing solution of a linear program. */
public interface LinearProgramSolver
{
  /**
   * Solve the given linear program.
   * 
   * Implementations report failures through the result status rather than by throwing.
   */
  public LPResult solve(LinearProgram lp);
}
