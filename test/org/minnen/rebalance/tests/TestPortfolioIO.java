package org.minnen.rebalance.tests;

import static org.junit.Assert.*;

import java.io.File;
import java.io.IOException;
import java.net.URISyntaxException;
import java.util.Arrays;

import org.junit.Rule;
import org.junit.Test;
import org.junit.rules.TemporaryFolder;
import org.minnen.rebalance.ValidationException;
import org.minnen.rebalance.portfolio.Equity;
import org.minnen.rebalance.portfolio.Portfolio;
import org.minnen.rebalance.portfolio.PortfolioIO;

public class TestPortfolioIO
{
  @Rule
  public TemporaryFolder folder = new TemporaryFolder();

  @Test
  public void testParse()
  {
    Portfolio portfolio = PortfolioIO.parse(Arrays.asList("# comment", "", "A|1.2|100|50|0.08", "  B|0.9|150|30|  "));
    assertEquals(2, portfolio.size());
    assertEquals(new Equity("A", 1.2, 100, 50, 0.08), portfolio.get(0));
    assertEquals(new Equity("B", 0.9, 150, 30), portfolio.get(1));
  }

  @Test
  public void testParseError()
  {
    try {
      PortfolioIO.parse(Arrays.asList("A|1.2|100|50|0.08", "# ok", "B|0.9|lots|30|0.06"));
      fail("expected ValidationException");
    } catch (ValidationException e) {
      assertTrue(e.getMessage(), e.getMessage().contains("line 3"));
    }
  }

  @Test
  public void testLoadResource() throws IOException, URISyntaxException
  {
    File file = new File(getClass().getResource("/example-portfolio.txt").toURI());
    Portfolio portfolio = PortfolioIO.load(file);
    assertEquals(3, portfolio.size());
    assertEquals("A", portfolio.get(0).name);
    assertEquals("BND", portfolio.get(2).name);
    assertFalse(portfolio.get(2).hasReturn());
    assertEquals(9500.0 + 20 * 72.5, portfolio.getTotalValue(), 1e-9);
  }

  @Test
  public void testSaveLoad() throws IOException
  {
    Portfolio portfolio = new Portfolio(new Equity("A", 1.2, 100, 50, 0.08), new Equity(0.9, 150, 30),
        new Equity("C", -0.3, 2.5, 1234.5678, -0.01));
    File file = folder.newFile("portfolio.txt");
    PortfolioIO.save(file, portfolio);
    Portfolio loaded = PortfolioIO.load(file);
    assertEquals(portfolio.getEquities(), loaded.getEquities());
  }

  @Test(expected = IOException.class)
  public void testLoadMissing() throws IOException
  {
    PortfolioIO.load(new File(folder.getRoot(), "missing.txt"));
  }
}
