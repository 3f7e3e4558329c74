package io.streamcount.sketch;

/**
 * Correction formulas shared by the HyperLogLog estimate paths.
 */
final class HllFormulas
{
  static final double TWO_TO_THE_THIRTY_TWO = Math.pow(2, 32);
  static final double HIGH_CORRECTION_THRESHOLD = TWO_TO_THE_THIRTY_TWO / 30.0d;
  static final double LINEAR_COUNTING_THRESHOLD = 5.0d;

  private HllFormulas()
  {
  }

  /**
   * @return the bias correction constant (alpha) for {@code m} registers
   */
  static double biasCorrection(int m)
  {
    switch (m) {
      case 16:
        return 0.673;
      case 32:
        return 0.697;
      case 64:
        return 0.709;
      default:
        return 0.7213 / (1 + 1.079 / m);
    }
  }

  /**
   * Linear counting estimate from the number of empty registers. Returns {@code m} when no register
   * is empty, which is a ceiling rather than an estimate.
   */
  static double linearCounting(long zeros, long m)
  {
    if (zeros == 0) { // avoid log(0)
      return m;
    }
    return m * Math.log(m / (double) zeros);
  }

  static double largeRangeCorrection(double e)
  {
    return -TWO_TO_THE_THIRTY_TWO * Math.log(1 - e / TWO_TO_THE_THIRTY_TWO);
  }
}
