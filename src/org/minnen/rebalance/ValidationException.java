package org.minnen.rebalance;

/** Thrown for malformed portfolio input (empty portfolio, negative prices, missing fields, bad files). */
public class ValidationException extends IllegalArgumentException
{
  private static final long serialVersionUID = 1L;

  public ValidationException(String message)
  {
    super(message);
  }

  public ValidationException(String message, Throwable cause)
  {
    super(message, cause);
  }
}
