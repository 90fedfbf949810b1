package org.minnen.rebalance.util;

/** Marks a class as serializable to a single line of text. */
public interface StringSerializable
{
  public String serializeToString();
}
