package org.minnen.rebalance.portfolio;

import java.io.File;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;

import org.apache.commons.io.FileUtils;
import org.apache.commons.lang3.StringUtils;
import org.minnen.rebalance.ValidationException;
import org.minnen.rebalance.util.Writer;

/**
 * Load and save portfolios as text files.
 * 
 * Each line holds one equity in the form `name|beta|qty|avgPrice|return` where `return` may be empty. Blank lines and
 * lines starting with '#' are ignored.
 */
public class PortfolioIO
{
  public static Portfolio load(File file) throws IOException
  {
    if (!file.canRead()) {
      throw new IOException(String.format("Can't read portfolio file (%s)", file.getPath()));
    }
    return parse(FileUtils.readLines(file, StandardCharsets.UTF_8));
  }

  public static Portfolio parse(List<String> lines)
  {
    List<Equity> equities = new ArrayList<>();
    int lineNum = 0;
    for (String line : lines) {
      ++lineNum;
      line = StringUtils.trim(line);
      if (StringUtils.isEmpty(line) || line.startsWith("#")) continue;

      Equity equity = Equity.fromString(line);
      if (equity == null) {
        throw new ValidationException(String.format("Error parsing portfolio line %d: [%s]", lineNum, line));
      }
      equities.add(equity);
    }
    return new Portfolio(equities);
  }

  public static void save(File file, Portfolio portfolio) throws IOException
  {
    try (Writer writer = new Writer(file)) {
      writer.writef("# name|beta|qty|avgPrice|return\n");
      for (Equity equity : portfolio) {
        writer.writef("%s\n", equity.serializeToString());
      }
    }
  }
}
