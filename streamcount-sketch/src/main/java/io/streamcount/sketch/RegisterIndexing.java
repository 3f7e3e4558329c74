package io.streamcount.sketch;

/**
 * Maps a 64-bit hash to a register index and a rank.
 *
 * <p>The index is taken from the most-significant {@code bits} bits of the hash, the rank is one plus
 * the number of leading zeros of the remaining bits. The lowest bit is forced to 1 so the rank never
 * exceeds {@code Long.SIZE}.
 */
final class RegisterIndexing
{
  /**
   * Width of the register index used by the sparse representation, independent of the precision.
   */
  static final int SPARSE_PRECISION = 25;

  private RegisterIndexing()
  {
  }

  static int index(long hash, int bits)
  {
    return (int) (hash >>> (Long.SIZE - bits));
  }

  static byte rank(long hash, int bits)
  {
    return (byte) (Long.numberOfLeadingZeros((hash << bits) | 1L) + 1);
  }

  static int sparseToDenseIndex(int sparseIndex, int precision)
  {
    return sparseIndex >>> (SPARSE_PRECISION - precision);
  }
}
