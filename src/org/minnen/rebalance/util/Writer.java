package org.minnen.rebalance.util;

import java.io.BufferedWriter;
import java.io.File;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;

/** Buffered UTF-8 file writer that allows printf syntax. */
public class Writer extends BufferedWriter
{
  public Writer(File f) throws IOException
  {
    super(Files.newBufferedWriter(f.toPath(), StandardCharsets.UTF_8));
  }

  public void writef(String format, Object... args) throws IOException
  {
    super.write(String.format(format, args));
  }
}
