package io.streamcount.sketch;

public interface CardinalityEstimator
{
  void add(byte[] value);
  void add(long value);

  double estimate();

  default long cardinality()
  {
    return Math.round(estimate());
  }

  long memoryFootprint();

  String name();
}
