package org.minnen.rebalance;

/** Thrown when a formula is undefined for its inputs (division by zero, NaN or infinite results). */
public class DomainException extends ArithmeticException
{
  private static final long serialVersionUID = 1L;

  public DomainException(String message)
  {
    super(message);
  }

  public DomainException(String format, Object... args)
  {
    super(String.format(format, args));
  }
}
