package io.streamcount.sketch;

/**
 * Thrown when an estimator is requested with a precision outside of the supported range.
 * The estimator is never clamped to a valid precision.
 */
public class InvalidPrecisionException extends IllegalArgumentException
{
  private final int precision;
  private final int minPrecision;
  private final int maxPrecision;

  public InvalidPrecisionException(int precision, int minPrecision, int maxPrecision)
  {
    super(String.format(
        "invalid precision [%d] : should be in [%d, %d]",
        precision,
        minPrecision,
        maxPrecision
    ));
    this.precision = precision;
    this.minPrecision = minPrecision;
    this.maxPrecision = maxPrecision;
  }

  public int getPrecision()
  {
    return precision;
  }

  public int getMinPrecision()
  {
    return minPrecision;
  }

  public int getMaxPrecision()
  {
    return maxPrecision;
  }
}
