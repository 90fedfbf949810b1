package org.minnen.rebalance.util;

public final class Library
{
  public final static double INF = Double.POSITIVE_INFINITY;

  public static double sum(double[] a)
  {
    double sum = 0.0;
    for (int i = 0; i < a.length; ++i) {
      sum += a[i];
    }
    return sum;
  }

  /** @return dot product of `a` and `b`, which must have the same length. */
  public static double dot(double[] a, double[] b)
  {
    assert a.length == b.length : String.format("%d vs. %d", a.length, b.length);
    double x = 0.0;
    for (int i = 0; i < a.length; ++i) {
      x += a[i] * b[i];
    }
    return x;
  }

  /** @return true if every value in `a` is finite (not NaN or infinite). */
  public static boolean isFinite(double[] a)
  {
    for (double x : a) {
      if (!Double.isFinite(x)) return false;
    }
    return true;
  }

  public static boolean almostEqual(double a, double b, double eps)
  {
    return (Math.abs(b - a) < eps);
  }
}
