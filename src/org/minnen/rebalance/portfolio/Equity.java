package org.minnen.rebalance.portfolio;

import org.minnen.rebalance.util.Library;
import org.minnen.rebalance.util.StringSerializable;

/**
 * One position in a portfolio.
 * 
 * Equities are immutable; rebalancing produces copies with new quantities via {@link #withQty}. The return is optional
 * and stored as NaN when unknown.
 */
public class Equity implements StringSerializable
{
  public final String name;
  public final double beta;
  public final double qty;
  public final double avgPrice;
  public final double ret;

  public Equity(double beta, double qty, double avgPrice)
  {
    this(null, beta, qty, avgPrice, Double.NaN);
  }

  public Equity(String name, double beta, double qty, double avgPrice)
  {
    this(name, beta, qty, avgPrice, Double.NaN);
  }

  public Equity(double beta, double qty, double avgPrice, double ret)
  {
    this(null, beta, qty, avgPrice, ret);
  }

  public Equity(String name, double beta, double qty, double avgPrice, double ret)
  {
    this.name = name;
    this.beta = beta;
    this.qty = qty;
    this.avgPrice = avgPrice;
    this.ret = ret;
  }

  /** @return copy of this equity holding `qty` units. */
  public Equity withQty(double qty)
  {
    return new Equity(name, beta, qty, avgPrice, ret);
  }

  /** @return copy of this equity with the given return. */
  public Equity withReturn(double ret)
  {
    return new Equity(name, beta, qty, avgPrice, ret);
  }

  public boolean hasReturn()
  {
    return !Double.isNaN(ret);
  }

  /** @return market value of this position based on the average price. */
  public double getValue()
  {
    return qty * avgPrice;
  }

  public String getName()
  {
    return name == null ? "" : name;
  }

  @Override
  public String toString()
  {
    if (hasReturn()) {
      return String.format("[%-6s beta=%.2f qty=%.1f price=%.2f ret=%.4f]", getName(), beta, qty, avgPrice, ret);
    } else {
      return String.format("[%-6s beta=%.2f qty=%.1f price=%.2f]", getName(), beta, qty, avgPrice);
    }
  }

  @Override
  public String serializeToString()
  {
    return String.format("%s|%s|%s|%s|%s", getName(), beta, qty, avgPrice, hasReturn() ? Double.toString(ret) : "");
  }

  /**
   * Parse an equity from a string created by {@link #serializeToString}.
   * 
   * @return the parsed equity or null if the string is malformed
   */
  public static Equity fromString(String serialized)
  {
    String[] fields = serialized.split("\\|", -1);
    if (fields.length != 5) return null;
    try {
      String name = fields[0].trim();
      double beta = Double.parseDouble(fields[1].trim());
      double qty = Double.parseDouble(fields[2].trim());
      double avgPrice = Double.parseDouble(fields[3].trim());
      double ret = fields[4].trim().isEmpty() ? Double.NaN : Double.parseDouble(fields[4].trim());
      return new Equity(name.isEmpty() ? null : name, beta, qty, avgPrice, ret);
    } catch (NumberFormatException e) {
      return null;
    }
  }

  @Override
  public int hashCode()
  {
    final int prime = 31;
    int result = 1;
    result = prime * result + ((name == null) ? 0 : name.hashCode());
    return result;
  }

  @Override
  public boolean equals(Object obj)
  {
    if (this == obj) return true;
    if (obj == null) return false;
    if (getClass() != obj.getClass()) return false;
    Equity other = (Equity) obj;
    if (name == null) {
      if (other.name != null) return false;
    } else if (!name.equals(other.name)) return false;
    if (hasReturn() != other.hasReturn()) return false;

    final double eps = 1e-9;
    if (!Library.almostEqual(beta, other.beta, eps)) return false;
    if (!Library.almostEqual(qty, other.qty, eps)) return false;
    if (!Library.almostEqual(avgPrice, other.avgPrice, eps)) return false;
    if (hasReturn() && !Library.almostEqual(ret, other.ret, eps)) return false;
    return true;
  }
}
