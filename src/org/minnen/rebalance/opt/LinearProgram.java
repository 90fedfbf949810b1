package org.minnen.rebalance.opt;

import java.util.Arrays;

/**
 * Linear program in the form: minimize c'x subject to Aeq * x = beq and lower <= x <= upper.
 * 
 * Infinite bounds mean the variable is unbounded in that direction.
 */
public class LinearProgram
{
  public final double[]   c;
  public final double[][] aEq;
  public final double[]   bEq;
  public final double[]   lowerBounds;
  public final double[]   upperBounds;

  public LinearProgram(double[] c, double[][] aEq, double[] bEq, double[] lowerBounds, double[] upperBounds)
  {
    final int n = c.length;
    if (aEq.length != bEq.length) {
      throw new IllegalArgumentException(String.format("Equality rows (%d) vs. right-hand sides (%d)", aEq.length,
          bEq.length));
    }
    for (double[] row : aEq) {
      if (row.length != n) {
        throw new IllegalArgumentException(String.format("Equality row has %d coefficients, expected %d", row.length, n));
      }
    }
    if (lowerBounds.length != n || upperBounds.length != n) {
      throw new IllegalArgumentException(String.format("Bounds (%d, %d) vs. variables (%d)", lowerBounds.length,
          upperBounds.length, n));
    }

    this.c = c;
    this.aEq = aEq;
    this.bEq = bEq;
    this.lowerBounds = lowerBounds;
    this.upperBounds = upperBounds;
  }

  public int numVars()
  {
    return c.length;
  }

  public int numEqualities()
  {
    return aEq.length;
  }

  @Override
  public String toString()
  {
    return String.format("min %s s.t. %s x = %s, x in [%s, %s]", Arrays.toString(c), Arrays.deepToString(aEq),
        Arrays.toString(bEq), Arrays.toString(lowerBounds), Arrays.toString(upperBounds));
  }
}
