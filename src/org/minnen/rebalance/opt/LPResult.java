package org.minnen.rebalance.opt;

/** Outcome of solving a linear program. */
public class LPResult
{
  public enum Status {
    OPTIMAL, INFEASIBLE, UNBOUNDED, SOLVER_ERROR
  };

  public final Status   status;
  public final double[] solution;
  public final String   message;

  private LPResult(Status status, double[] solution, String message)
  {
    this.status = status;
    this.solution = solution;
    this.message = message;
  }

  public static LPResult optimal(double[] solution)
  {
    return new LPResult(Status.OPTIMAL, solution, "optimal");
  }

  public static LPResult failure(Status status, String message)
  {
    assert status != Status.OPTIMAL;
    return new LPResult(status, null, message);
  }

  public boolean isOptimal()
  {
    return status == Status.OPTIMAL;
  }

  @Override
  public String toString()
  {
    return String.format("%s: %s", status, message);
  }
}
