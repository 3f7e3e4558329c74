package io.streamcount.sketch;

import com.google.common.base.Supplier;

public final class CardinalityEstimators
{
  static final int DEFAULT_PRECISION = 14;

  private CardinalityEstimators()
  {
  }

  public static CardinalityEstimator get(String name)
  {
    if (name.startsWith("hlldense")) {
      return AdaptiveHyperLogLog.builder()
                                .precision(parsePrecision(name, "hlldense"))
                                .mode(AdaptiveHyperLogLog.Mode.DENSE)
                                .build();
    }
    if (name.startsWith("hllref")) {
      return AdaptiveHyperLogLog.builder()
                                .precision(parsePrecision(name, "hllref"))
                                .sparseEstimation(AdaptiveHyperLogLog.SparseEstimation.REFERENCE)
                                .build();
    }
    if (name.startsWith("hll")) {
      return AdaptiveHyperLogLog.create(parsePrecision(name, "hll"), AdaptiveHyperLogLog.Mode.SPARSE);
    }
    if (name.equals("fm-arithmetic")) {
      return new FlajoletMartin(FlajoletMartin.Mean.ARITHMETIC);
    }
    if (name.equals("fm-harmonic")) {
      return new FlajoletMartin(FlajoletMartin.Mean.HARMONIC);
    }
    throw new IllegalArgumentException("Unknown estimator : " + name);
  }

  public static Supplier<CardinalityEstimator> lazyGet(String name)
  {
    return () -> get(name);
  }

  private static int parsePrecision(String name, String prefix)
  {
    String pStr = name.substring(prefix.length());
    if (pStr.isEmpty()) {
      return DEFAULT_PRECISION;
    }
    try {
      return Integer.parseInt(pStr);
    } catch (NumberFormatException e) {
      throw new IllegalArgumentException("Unknown estimator : " + name, e);
    }
  }
}
