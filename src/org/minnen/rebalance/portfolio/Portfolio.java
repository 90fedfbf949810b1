package org.minnen.rebalance.portfolio;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.Iterator;
import java.util.List;

import org.minnen.rebalance.util.Library;

/**
 * Ordered list of equities.
 * 
 * Order is insertion order and is preserved by rebalancing. The portfolio is the only mutable piece of the data model:
 * {@link #apply} swaps in new quantities for every equity at once.
 */
public class Portfolio implements Iterable<Equity>
{
  private final List<Equity> equities;

  public Portfolio(Equity... equities)
  {
    this(Arrays.asList(equities));
  }

  public Portfolio(List<Equity> equities)
  {
    this.equities = new ArrayList<>(equities);
  }

  public int size()
  {
    return equities.size();
  }

  public boolean isEmpty()
  {
    return equities.isEmpty();
  }

  public Equity get(int i)
  {
    return equities.get(i);
  }

  public List<Equity> getEquities()
  {
    return Collections.unmodifiableList(equities);
  }

  @Override
  public Iterator<Equity> iterator()
  {
    return getEquities().iterator();
  }

  /** @return total market value: sum(avgPrice * qty). */
  public double getTotalValue()
  {
    return Library.dot(getPrices(), getQuantities());
  }

  public double[] getPrices()
  {
    double[] prices = new double[equities.size()];
    for (int i = 0; i < prices.length; ++i) {
      prices[i] = equities.get(i).avgPrice;
    }
    return prices;
  }

  public double[] getQuantities()
  {
    double[] qty = new double[equities.size()];
    for (int i = 0; i < qty.length; ++i) {
      qty[i] = equities.get(i).qty;
    }
    return qty;
  }

  /** Replace the quantity of every equity with the matching quantity in `allocation`. */
  public Portfolio apply(Allocation allocation)
  {
    if (allocation.size() != equities.size()) {
      throw new IllegalArgumentException(
          String.format("Allocation size (%d) does not match portfolio size (%d)", allocation.size(), equities.size()));
    }
    for (int i = 0; i < equities.size(); ++i) {
      equities.set(i, equities.get(i).withQty(allocation.getQuantity(i)));
    }
    return this;
  }

  /** @return copy of this portfolio; the equities are shared since they are immutable. */
  public Portfolio copy()
  {
    return new Portfolio(equities);
  }

  /** @return copy of this portfolio where equities without a return use the CAPM expected return. */
  public Portfolio withCapmReturns(MarketParams market)
  {
    List<Equity> filled = new ArrayList<>();
    for (Equity equity : equities) {
      if (equity.hasReturn()) {
        filled.add(equity);
      } else {
        filled.add(equity.withReturn(market.getExpectedReturn(equity.beta)));
      }
    }
    return new Portfolio(filled);
  }

  @Override
  public String toString()
  {
    StringBuilder sb = new StringBuilder();
    for (Equity equity : equities) {
      sb.append(equity).append("\n");
    }
    return sb.toString();
  }
}
