package org.minnen.rebalance.tests;

import static org.junit.Assert.*;

import java.util.HashSet;
import java.util.Set;

import org.junit.Test;
import org.minnen.rebalance.portfolio.Equity;

public class TestEquity
{
  @Test
  public void testWithQty()
  {
    Equity a = new Equity("A", 1.2, 100, 50, 0.08);
    Equity b = a.withQty(40);
    assertEquals(100, a.qty, 1e-12);
    assertEquals(40, b.qty, 1e-12);
    assertEquals(a.name, b.name);
    assertEquals(a.beta, b.beta, 1e-12);
    assertEquals(a.avgPrice, b.avgPrice, 1e-12);
    assertEquals(a.ret, b.ret, 1e-12);
    assertEquals(2000.0, b.getValue(), 1e-9);
  }

  @Test
  public void testOptionalReturn()
  {
    Equity a = new Equity(0.9, 150, 30);
    assertFalse(a.hasReturn());
    assertEquals("", a.getName());
    Equity b = a.withReturn(0.06);
    assertTrue(b.hasReturn());
    assertEquals(0.06, b.ret, 1e-12);
  }

  @Test
  public void testSerialize()
  {
    Equity a = new Equity("VTI", 1.05, 12, 210.5, 0.11);
    Equity b = Equity.fromString(a.serializeToString());
    assertNotNull(b);
    assertEquals(a, b);

    Equity c = new Equity(0.4, 3, 99.0);
    Equity d = Equity.fromString(c.serializeToString());
    assertNotNull(d);
    assertNull(d.name);
    assertFalse(d.hasReturn());
    assertEquals(c, d);
  }

  @Test
  public void testParse()
  {
    Equity a = Equity.fromString("BND | 0.1 | 20 | 72.5 | ");
    assertNotNull(a);
    assertEquals("BND", a.name);
    assertEquals(0.1, a.beta, 1e-12);
    assertEquals(20, a.qty, 1e-12);
    assertEquals(72.5, a.avgPrice, 1e-12);
    assertFalse(a.hasReturn());
  }

  @Test
  public void testParseMalformed()
  {
    assertNull(Equity.fromString(""));
    assertNull(Equity.fromString("A|1.0|10|5"));
    assertNull(Equity.fromString("A|1.0|10|5|0.1|extra"));
    assertNull(Equity.fromString("A|beta|10|5|0.1"));
  }

  @Test
  public void testEquals()
  {
    Equity a = new Equity("A", 1.2, 100, 50, 0.08);
    assertEquals(a, new Equity("A", 1.2, 100, 50, 0.08));
    assertEquals(a.hashCode(), new Equity("A", 1.2, 100, 50, 0.08).hashCode());
    assertNotEquals(a, a.withQty(99));
    assertNotEquals(a, new Equity("B", 1.2, 100, 50, 0.08));
    assertNotEquals(a, new Equity("A", 1.2, 100, 50));
  }

  @Test
  public void testEqualsWithinTolerance()
  {
    Equity a = new Equity("A", 1.2, 100, 50, 0.08);
    Equity b = new Equity("A", 1.2 + 1e-12, 100, 50 + 1e-12, 0.08);
    assertEquals(a, b);
    assertEquals(a.hashCode(), b.hashCode());

    Set<Equity> set = new HashSet<>();
    set.add(a);
    assertTrue(set.contains(b));
  }
}
